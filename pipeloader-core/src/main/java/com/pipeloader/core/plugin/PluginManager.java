package com.pipeloader.core.plugin;

import com.pipeloader.api.HierarchicalLoggingContext;
import com.pipeloader.api.Plugin;
import com.pipeloader.api.exception.InvalidArgumentException;
import com.pipeloader.core.classloader.DefaultLoadUnitFactory;
import com.pipeloader.core.classloader.IsolatedLoadUnit;
import com.pipeloader.core.exception.InvalidPluginTypeException;
import com.pipeloader.core.exception.ModuleLoadException;
import com.pipeloader.core.exception.ModuleNotFoundException;
import com.pipeloader.core.exception.PluginInstantiationException;
import com.pipeloader.core.exception.PluginTypeNotFoundException;
import com.pipeloader.core.loader.PluginDescriptor;
import com.pipeloader.core.monitor.HierarchicalLogging;
import com.pipeloader.core.spi.DependencyResolver;
import com.pipeloader.core.spi.LoadUnitFactory;
import com.pipeloader.core.spi.ResolutionScope;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 插件管理器
 * <p>
 * 负责一个模块仓库根目录下的插件加载与实例缓存：
 * <ol>
 * <li>模块加载：{basePath}/v{version}/{moduleName}.jar，每次加载都创建全新的隔离单元</li>
 * <li>实例获取：有状态插件按 moduleName:version:typeName 缓存复用；
 * 无状态插件每次新建，并驱逐同键的旧缓存</li>
 * </ol>
 * 管理器没有自己的线程，所有操作在调用方线程上同步执行，可并发调用。
 * <p>
 * 注意：模块加载不做去重。无状态请求每次都会重新加载模块并构造实例，高频调用代价很高。
 * <p>
 * {@link #close()} 不与并发的获取调用同步，调用方需先停止使用管理器再关闭。
 */
@Slf4j
public class PluginManager implements AutoCloseable {

    private final String basePath;
    private final Path baseDirectory;
    private final DependencyResolver dependencyResolver;
    private final PluginManagerConfig config;
    private final LoadUnitFactory loadUnitFactory;

    /**
     * 实例缓存：Key=moduleName:version:typeName，只存有状态插件
     */
    private final ConcurrentHashMap<String, PluginHandle> pluginCache = new ConcurrentHashMap<>();

    private final AtomicLong unitSequence = new AtomicLong();
    private final AtomicLong modulesLoaded = new AtomicLong();
    private final AtomicLong instancesCreated = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public PluginManager(String basePath, DependencyResolver dependencyResolver) {
        this(basePath, dependencyResolver, PluginManagerConfig.defaults());
    }

    public PluginManager(String basePath, DependencyResolver dependencyResolver, PluginManagerConfig config) {
        this(basePath, dependencyResolver, config, null);
    }

    public PluginManager(String basePath,
                         DependencyResolver dependencyResolver,
                         PluginManagerConfig config,
                         LoadUnitFactory loadUnitFactory) {
        this.basePath = InvalidArgumentException.requireNonBlank("basePath", basePath);
        this.dependencyResolver = InvalidArgumentException.requireNonNull("dependencyResolver", dependencyResolver);
        this.config = config != null ? config : PluginManagerConfig.defaults();
        this.loadUnitFactory = loadUnitFactory != null ? loadUnitFactory : new DefaultLoadUnitFactory(this.config);
        this.baseDirectory = Paths.get(basePath);
        log.debug("PluginManager created for {} with {}", basePath, this.config);
    }

    // ==================== 模块加载 ====================

    public PluginModule loadModule(String moduleName, String version, HierarchicalLoggingContext context) {
        return loadModule(moduleName, ModuleVersion.parse(version), context);
    }

    /**
     * 加载指定版本的插件模块
     * <p>
     * 每次调用都会创建新的隔离单元；加载失败时该单元在异常抛出前即被销毁。
     *
     * @throws ModuleNotFoundException 模块文件不存在
     * @throws ModuleLoadException     模块文件存在但加载失败
     */
    public PluginModule loadModule(String moduleName, ModuleVersion version, HierarchicalLoggingContext context) {
        InvalidArgumentException.requireNonBlank("moduleName", moduleName);
        InvalidArgumentException.requireNonNull("version", version);

        Path modulePath = resolveModulePath(moduleName, version);
        if (!Files.isRegularFile(modulePath)) {
            HierarchicalLogging.warn(log, context, "Plugin module not found: {}", modulePath);
            throw new ModuleNotFoundException(moduleName, version.toString(), modulePath.toString());
        }

        String unitId = String.format("%s-v%s#%d", moduleName, version, unitSequence.incrementAndGet());
        IsolatedLoadUnit unit;
        try {
            unit = loadUnitFactory.create(unitId, modulePath);
        } catch (RuntimeException e) {
            HierarchicalLogging.error(log, context, "[{}] Failed to create isolated load unit", unitId, e);
            throw new ModuleLoadException(moduleName, version.toString(),
                    "Failed to create isolated load unit for " + modulePath, e);
        }

        try {
            PluginDescriptor descriptor = unit.open();
            if (descriptor.getVersion() != null && !descriptor.getVersion().equals(version.toString())) {
                HierarchicalLogging.warn(log, context, "[{}] Descriptor declares version {} but module was requested as v{}",
                        unitId, descriptor.getVersion(), version);
            }
            modulesLoaded.incrementAndGet();
            HierarchicalLogging.info(log, context, "[{}] Loaded plugin module {} v{} with isolated load unit",
                    unitId, moduleName, version);
            return new PluginModule(moduleName, version, modulePath, descriptor, unit);
        } catch (Exception e) {
            unit.teardown();
            HierarchicalLogging.error(log, context, "[{}] Failed to load plugin module {} v{}", unitId, moduleName, version, e);
            throw new ModuleLoadException(moduleName, version.toString(), "Failed to load plugin module: " + modulePath, e);
        }
    }

    /**
     * 模块路径：{basePath}/v{version}/{moduleName}.{extension}
     */
    public Path resolveModulePath(String moduleName, ModuleVersion version) {
        return baseDirectory.resolve("v" + version).resolve(moduleName + "." + config.getModuleExtension());
    }

    // ==================== 实例获取 ====================

    public Plugin getPluginInstance(String moduleName, String version, String typeName,
                                    boolean isStateless, HierarchicalLoggingContext context) {
        return getPluginInstance(moduleName, ModuleVersion.parse(version), typeName, isStateless, context);
    }

    /**
     * 获取插件实例
     * <p>
     * 注意：被驱逐的实例在释放后其单元 ClassLoader 随即关闭。无状态请求之后，
     * 其他线程不得再使用先前取得的同键有状态实例，否则延迟加载的类会抛出
     * {@link com.pipeloader.core.exception.ClassLoaderException}。
     *
     * @param isStateless true：驱逐同键缓存并返回新实例（不入缓存，所有权归调用方）；
     *                    false：原子地取出或创建缓存实例，同键并发首次请求只构造一次
     */
    public Plugin getPluginInstance(String moduleName, ModuleVersion version, String typeName,
                                    boolean isStateless, HierarchicalLoggingContext context) {
        PluginKey key = new PluginKey(moduleName, version, typeName);
        String cacheKey = key.toCacheKey();

        if (isStateless) {
            PluginHandle stale = pluginCache.remove(cacheKey);
            if (stale != null) {
                evictions.incrementAndGet();
                HierarchicalLogging.debug(log, context, "Removed stateless plugin from cache: {}", cacheKey);
                disposeQuietly(stale, context);
            }

            PluginHandle fresh = createFreshPluginInstance(key, context);
            HierarchicalLogging.debug(log, context, "Created fresh stateless plugin instance: {}", cacheKey);
            return fresh.getPlugin();
        }

        PluginHandle handle = pluginCache.computeIfAbsent(cacheKey, k -> {
            PluginHandle created = createFreshPluginInstance(key, context);
            HierarchicalLogging.debug(log, context, "Cached new stateful plugin instance: {}", k);
            // 登记持有必须是最后一步，映射函数内不调用任何插件代码
            created.getUnit().retain();
            return created;
        });
        return handle.getPlugin();
    }

    private PluginHandle createFreshPluginInstance(PluginKey key, HierarchicalLoggingContext context) {
        // 每次都重新加载模块，不存在模块级缓存
        PluginModule module = loadModule(key.getModuleName(), key.getVersion(), context);
        IsolatedLoadUnit unit = module.getUnit();
        try {
            Class<? extends Plugin> pluginType = resolvePluginType(module, key.getTypeName());
            HierarchicalLogging.debug(log, context, "Creating fresh plugin instance: {}", pluginType.getSimpleName());

            String compositeKey = key.toCompositeKey();
            HierarchicalLogging.debug(log, context, "Plugin composite key: {}", compositeKey);

            Plugin instance = instantiate(module, pluginType, compositeKey, context);
            instancesCreated.incrementAndGet();
            return new PluginHandle(key, instance, unit);
        } catch (RuntimeException e) {
            // 单元产出的类型/实例均不可达，直接回收
            unit.requestUnload();
            throw e;
        }
    }

    private Class<? extends Plugin> resolvePluginType(PluginModule module, String typeName) {
        String moduleName = module.getModuleName();
        String version = module.getVersion().toString();

        Class<?> type;
        try {
            type = module.loadType(typeName);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new PluginTypeNotFoundException(moduleName, version, typeName, e);
        }

        if (!Plugin.class.isAssignableFrom(type)) {
            throw new InvalidPluginTypeException(moduleName, version, typeName,
                    "does not implement " + Plugin.class.getName());
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new InvalidPluginTypeException(moduleName, version, typeName,
                    "type is abstract or an interface");
        }
        return type.asSubclass(Plugin.class);
    }

    private Plugin instantiate(PluginModule module, Class<? extends Plugin> pluginType,
                               String compositeKey, HierarchicalLoggingContext context) {
        String moduleName = module.getModuleName();
        String version = module.getVersion().toString();

        Object instance;
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        // 作用域在构造返回后立即释放，插件不能持有其中的服务
        try (ResolutionScope scope = dependencyResolver.openScope()) {
            thread.setContextClassLoader(module.getUnit().getClassLoader());
            instance = scope.createInstance(pluginType, compositeKey);
        } catch (Exception | LinkageError e) {
            HierarchicalLogging.error(log, context, "Failed to create fresh plugin instance: {}", pluginType.getName(), e);
            throw new PluginInstantiationException(moduleName, version, pluginType.getName(), e);
        } finally {
            thread.setContextClassLoader(previous);
        }

        if (instance == null) {
            HierarchicalLogging.error(log, context, "Dependency resolver returned no instance for {}", pluginType.getName());
            throw new PluginInstantiationException(moduleName, version, pluginType.getName(),
                    new IllegalStateException("Dependency resolver returned null"));
        }
        HierarchicalLogging.debug(log, context, "Successfully created fresh plugin instance: {}", pluginType.getSimpleName());
        return pluginType.cast(instance);
    }

    private void disposeQuietly(PluginHandle handle, HierarchicalLoggingContext context) {
        Plugin plugin = handle.getPlugin();
        try {
            if (plugin instanceof AutoCloseable) {
                ((AutoCloseable) plugin).close();
            }
        } catch (Exception | LinkageError e) {
            HierarchicalLogging.warn(log, context, "Failed to dispose plugin {}: {}", handle.getKey(), e.getMessage(), e);
        } finally {
            IsolatedLoadUnit unit = handle.getUnit();
            unit.release();
            unit.requestUnload();
        }
    }

    // ==================== 诊断 ====================

    /**
     * 当前缓存的实例数（不含无状态实例）
     */
    public int getCachedPluginCount() {
        return pluginCache.size();
    }

    /**
     * 当前缓存键的快照
     */
    public List<String> getCachedPluginKeys() {
        return Collections.unmodifiableList(new ArrayList<>(pluginCache.keySet()));
    }

    public ManagerStats getStats() {
        return new ManagerStats(pluginCache.size(), modulesLoaded.get(), instancesCreated.get(), evictions.get());
    }

    public String getBasePath() {
        return basePath;
    }

    public PluginManagerConfig getConfig() {
        return config;
    }

    // ==================== 关闭 ====================

    /**
     * 释放所有缓存实例、清空缓存并关闭隔离单元工厂
     * <p>
     * 单个实例释放失败不影响其余实例。调用前必须停止所有获取调用。
     * 传入的 {@link LoadUnitFactory} 归管理器所有，随管理器一起关闭。
     */
    @Override
    public void close() {
        log.info("Disposing plugin manager for {} with {} cached plugin(s)", basePath, pluginCache.size());
        for (PluginHandle handle : pluginCache.values()) {
            disposeQuietly(handle, null);
        }
        pluginCache.clear();

        try {
            loadUnitFactory.shutdown();
        } catch (RuntimeException e) {
            log.error("Error shutting down load unit factory for {}", basePath, e);
        }
        log.info("Plugin manager for {} disposed", basePath);
    }

    @Value
    public static class ManagerStats {
        int cachedCount;
        long modulesLoaded;
        long instancesCreated;
        long evictions;

        @Override
        public String toString() {
            return String.format("ManagerStats{cached=%d, modulesLoaded=%d, created=%d, evictions=%d}",
                    cachedCount, modulesLoaded, instancesCreated, evictions);
        }
    }
}
