package com.pipeloader.core.plugin;

import com.pipeloader.core.classloader.IsolatedLoadUnit;
import com.pipeloader.core.loader.PluginDescriptor;
import lombok.Getter;

import java.nio.file.Path;

/**
 * 已加载的插件模块句柄
 * <p>
 * 只要句柄或由其产生的类型、实例仍可达，所属隔离单元就不会被 GC。
 */
@Getter
public class PluginModule {

    private final String moduleName;
    private final ModuleVersion version;
    private final Path modulePath;
    private final PluginDescriptor descriptor;
    private final IsolatedLoadUnit unit;

    public PluginModule(String moduleName, ModuleVersion version, Path modulePath,
                        PluginDescriptor descriptor, IsolatedLoadUnit unit) {
        this.moduleName = moduleName;
        this.version = version;
        this.modulePath = modulePath;
        this.descriptor = descriptor;
        this.unit = unit;
    }

    /**
     * 在本模块内查找类型（不初始化）
     * <p>
     * 只认由本单元定义的类：插件 JAR 及其声明的依赖。宿主或共享包中的同名类视为不存在。
     *
     * @throws ClassNotFoundException 本模块中不存在该类型
     */
    public Class<?> loadType(String typeName) throws ClassNotFoundException {
        ClassLoader classLoader = unit.getClassLoader();
        Class<?> type = Class.forName(typeName, false, classLoader);
        if (type.getClassLoader() != classLoader) {
            throw new ClassNotFoundException(typeName + " is not defined by module " + moduleName + " v" + version);
        }
        return type;
    }

    @Override
    public String toString() {
        return String.format("PluginModule{%s v%s, unit=%s}", moduleName, version, unit.getUnitId());
    }
}
