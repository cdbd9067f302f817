package com.pipeloader.core.loader;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * plugin.yml 解析器
 */
@Slf4j
public final class PluginDescriptorLoader {

    public static final String DESCRIPTOR_NAME = "plugin.yml";

    private PluginDescriptorLoader() {
    }

    /**
     * 从插件 JAR 中解析模块描述
     *
     * @param jarPath 插件 JAR
     * @return 模块描述；JAR 内没有 plugin.yml 时返回空描述
     * @throws IOException 文件不可读或不是合法 JAR
     * @throws org.yaml.snakeyaml.error.YAMLException plugin.yml 格式错误
     */
    public static PluginDescriptor parse(Path jarPath) throws IOException {
        try (JarFile jar = new JarFile(jarPath.toFile())) {
            JarEntry entry = jar.getJarEntry(DESCRIPTOR_NAME);
            if (entry == null) {
                log.debug("No {} inside {}, using empty descriptor", DESCRIPTOR_NAME, jarPath.getFileName());
                return PluginDescriptor.empty();
            }
            try (InputStream is = jar.getInputStream(entry)) {
                PluginDescriptor descriptor = createYaml().load(is);
                return descriptor != null ? descriptor : PluginDescriptor.empty();
            }
        }
    }

    private static Yaml createYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        return new Yaml(new Constructor(PluginDescriptor.class, loaderOptions));
    }
}
