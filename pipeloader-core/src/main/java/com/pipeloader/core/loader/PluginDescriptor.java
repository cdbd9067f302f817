package com.pipeloader.core.loader;

import com.pipeloader.api.exception.InvalidArgumentException;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 对应插件 JAR 根目录下的 plugin.yml
 * <p>
 * 所有字段可选；{@code dependencies} 是相对插件 JAR 所在目录的依赖 JAR 路径，
 * 这些 JAR 会加载进插件自己的隔离单元。
 */
@Getter
@Setter
public class PluginDescriptor {

    private String name;
    private String version;
    private String description;
    private List<String> dependencies = new ArrayList<>();

    public static PluginDescriptor empty() {
        return new PluginDescriptor();
    }

    /**
     * 将依赖清单解析为绝对路径
     *
     * @param baseDir 插件 JAR 所在目录
     */
    public List<Path> resolveDependencies(Path baseDir) {
        List<Path> resolved = new ArrayList<>();
        if (dependencies == null) {
            return resolved;
        }
        for (String dependency : dependencies) {
            if (dependency == null || dependency.trim().isEmpty()) {
                throw new InvalidArgumentException("dependencies", "Dependency entry cannot be blank");
            }
            resolved.add(baseDir.resolve(dependency.trim()).normalize());
        }
        return resolved;
    }

    @Override
    public String toString() {
        return String.format("PluginDescriptor{name='%s', version='%s', dependencies=%s}", name, version, dependencies);
    }
}
