package com.pipeloader.core.plugin;

import com.pipeloader.api.exception.InvalidArgumentException;
import com.pipeloader.core.spi.DependencyResolver;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 管理器注册表：每个模块仓库根目录对应一个 {@link PluginManager}
 * <p>
 * 路径先转为绝对路径并规范化，{@code /plugins} 与 {@code /plugins/./} 共用同一个管理器。
 */
@Slf4j
public class PluginManagerRegistry implements AutoCloseable {

    private final DependencyResolver dependencyResolver;
    private final PluginManagerConfig config;

    private final Map<Path, PluginManager> managers = new ConcurrentHashMap<>();

    public PluginManagerRegistry(DependencyResolver dependencyResolver, PluginManagerConfig config) {
        this.dependencyResolver = InvalidArgumentException.requireNonNull("dependencyResolver", dependencyResolver);
        this.config = config != null ? config : PluginManagerConfig.defaults();
    }

    public PluginManager getManager(String basePath) {
        InvalidArgumentException.requireNonBlank("basePath", basePath);
        Path normalized = Paths.get(basePath).toAbsolutePath().normalize();
        return managers.computeIfAbsent(normalized, path -> {
            log.info("Creating plugin manager for base path: {}", path);
            return new PluginManager(path.toString(), dependencyResolver, config);
        });
    }

    public int size() {
        return managers.size();
    }

    /**
     * 关闭所有管理器，单个失败不影响其余
     */
    @Override
    public void close() {
        for (Map.Entry<Path, PluginManager> entry : managers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("Failed to close plugin manager for {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
        managers.clear();
    }
}
