package com.pipeloader.core.classloader;

import com.pipeloader.core.exception.ClassLoaderException;
import com.pipeloader.core.plugin.PluginManagerConfig;
import com.pipeloader.core.resource.BasicResourceGuard;
import com.pipeloader.core.spi.LoadUnitFactory;
import com.pipeloader.core.spi.ResourceGuard;
import lombok.extern.slf4j.Slf4j;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;

/**
 * 默认隔离单元工厂
 * <p>
 * 类加载层级：
 * <pre>
 * 宿主 ClassLoader (JDK, SLF4J, pipeloader-api, 宿主业务)
 *         ↑ 白名单委派 / 兜底
 * PluginClassLoader (插件 JAR + 声明的依赖 JAR)
 * </pre>
 */
@Slf4j
public class DefaultLoadUnitFactory implements LoadUnitFactory {

    private final ClassLoader hostClassLoader;
    private final SharedPackages sharedPackages;
    private final ResourceGuard resourceGuard;
    private final boolean leakDetection;

    public DefaultLoadUnitFactory(PluginManagerConfig config) {
        this(config, new BasicResourceGuard());
    }

    public DefaultLoadUnitFactory(PluginManagerConfig config, ResourceGuard resourceGuard) {
        this.hostClassLoader = config.resolveHostClassLoader();
        this.sharedPackages = SharedPackages.withAdditional(config.getAdditionalSharedPackages());
        this.resourceGuard = resourceGuard;
        this.leakDetection = config.isLeakDetection();
    }

    @Override
    public IsolatedLoadUnit create(String unitId, Path modulePath) {
        try {
            URL[] urls = {modulePath.toUri().toURL()};
            PluginClassLoader classLoader = new PluginClassLoader(unitId, urls, hostClassLoader, sharedPackages);
            log.debug("[{}] Creating isolated load unit for {}", unitId, modulePath);
            return new IsolatedLoadUnit(unitId, modulePath, classLoader, resourceGuard, leakDetection);
        } catch (MalformedURLException e) {
            throw new ClassLoaderException(unitId, modulePath.toString(), "Failed to create PluginClassLoader", e);
        }
    }

    @Override
    public void shutdown() {
        if (resourceGuard != null) {
            resourceGuard.shutdown();
        }
    }

    public SharedPackages getSharedPackages() {
        return sharedPackages;
    }
}
