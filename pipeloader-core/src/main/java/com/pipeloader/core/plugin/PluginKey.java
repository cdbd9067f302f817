package com.pipeloader.core.plugin;

import com.pipeloader.api.exception.InvalidArgumentException;
import lombok.Value;

/**
 * 插件缓存键：(模块名, 版本, 类型全限定名)
 * <p>
 * 序列化形式 {@code moduleName:version:typeName}，区分大小写。
 */
@Value
public class PluginKey {

    String moduleName;
    ModuleVersion version;
    String typeName;

    public PluginKey(String moduleName, ModuleVersion version, String typeName) {
        this.moduleName = InvalidArgumentException.requireNonBlank("moduleName", moduleName);
        this.version = InvalidArgumentException.requireNonNull("version", version);
        this.typeName = InvalidArgumentException.requireNonBlank("typeName", typeName);
    }

    public String toCacheKey() {
        return moduleName + ":" + version + ":" + typeName;
    }

    /**
     * 插件复合键 {@code {version}_{moduleName}}，作为构造参数传给插件
     */
    public String toCompositeKey() {
        return version + "_" + moduleName;
    }

    @Override
    public String toString() {
        return toCacheKey();
    }
}
