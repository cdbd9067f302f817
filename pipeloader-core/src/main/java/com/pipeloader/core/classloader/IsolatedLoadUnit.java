package com.pipeloader.core.classloader;

import com.pipeloader.core.exception.ClassLoaderException;
import com.pipeloader.core.loader.PluginDescriptor;
import com.pipeloader.core.loader.PluginDescriptorLoader;
import com.pipeloader.core.spi.ResourceGuard;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.MalformedURLException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 隔离加载单元
 * <p>
 * 绑定一个 (模块路径, 版本)，持有独立的 {@link PluginClassLoader}。
 * 生命周期：
 * <pre>
 * create -> open ──失败──> teardown (立即关闭)
 *             └─成功─> retain/release ... requestUnload -> 引用归零后回收
 * </pre>
 * 卸载是协作式的：{@link #requestUnload()} 只标记退役，
 * 真正关闭 ClassLoader 要等到所有持有者 {@link #release()}。
 */
@Slf4j
public class IsolatedLoadUnit {

    private final String unitId;
    private final Path modulePath;
    private final PluginClassLoader classLoader;
    private final ResourceGuard resourceGuard;
    private final boolean leakDetection;

    private final AtomicInteger references = new AtomicInteger();
    private final AtomicBoolean opened = new AtomicBoolean(false);
    private final AtomicBoolean retiring = new AtomicBoolean(false);
    private final AtomicBoolean reclaimed = new AtomicBoolean(false);

    public IsolatedLoadUnit(String unitId, Path modulePath, PluginClassLoader classLoader,
                            ResourceGuard resourceGuard, boolean leakDetection) {
        this.unitId = unitId;
        this.modulePath = modulePath;
        this.classLoader = classLoader;
        this.resourceGuard = resourceGuard;
        this.leakDetection = leakDetection;
    }

    /**
     * 打开单元：读取模块描述、解析依赖清单并挂载依赖 JAR
     *
     * @return 模块描述（JAR 内没有 plugin.yml 时为空描述）
     * @throws IOException 模块文件不可读或不是合法 JAR
     */
    public PluginDescriptor open() throws IOException {
        if (reclaimed.get()) {
            throw new ClassLoaderException(unitId, modulePath.toString(), "Unit already reclaimed: " + unitId);
        }
        if (!opened.compareAndSet(false, true)) {
            throw new ClassLoaderException(unitId, modulePath.toString(), "Unit already opened: " + unitId);
        }

        PluginDescriptor descriptor = PluginDescriptorLoader.parse(modulePath);
        Path baseDir = modulePath.toAbsolutePath().getParent();
        for (Path dependency : descriptor.resolveDependencies(baseDir)) {
            if (!Files.isRegularFile(dependency)) {
                throw new ClassLoaderException(unitId, dependency.toString(),
                        "Declared dependency not found: " + dependency);
            }
            try {
                classLoader.addDependency(dependency.toUri().toURL());
            } catch (MalformedURLException e) {
                throw new ClassLoaderException(unitId, dependency.toString(), "Invalid dependency path", e);
            }
        }
        log.debug("[{}] Unit opened with {} dependency jar(s)", unitId, descriptor.getDependencies().size());
        return descriptor;
    }

    /**
     * 登记一个持有者（缓存中的实例）
     */
    public void retain() {
        if (reclaimed.get()) {
            throw new ClassLoaderException(unitId, modulePath.toString(), "Cannot retain reclaimed unit: " + unitId);
        }
        int count = references.incrementAndGet();
        log.debug("[{}] Retained, references={}", unitId, count);
    }

    /**
     * 释放一个持有者；若已退役且引用归零则回收
     */
    public void release() {
        int count = references.updateAndGet(current -> current > 0 ? current - 1 : 0);
        log.debug("[{}] Released, references={}", unitId, count);
        if (count == 0 && retiring.get()) {
            reclaim();
        }
    }

    /**
     * 请求卸载（协作式）：标记退役，引用归零时才真正回收
     */
    public void requestUnload() {
        if (retiring.compareAndSet(false, true)) {
            log.debug("[{}] Unload requested, references={}", unitId, references.get());
        }
        if (references.get() == 0) {
            reclaim();
        }
    }

    /**
     * 立即销毁（加载失败时使用），不等待引用归零
     */
    public void teardown() {
        retiring.set(true);
        reclaim();
    }

    private void reclaim() {
        if (!reclaimed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (resourceGuard != null) {
                resourceGuard.cleanup(unitId, classLoader);
            }
        } catch (RuntimeException e) {
            log.warn("[{}] Resource cleanup failed: {}", unitId, e.getMessage(), e);
        }
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("[{}] Failed to close ClassLoader: {}", unitId, e.getMessage());
        }
        if (leakDetection && resourceGuard != null) {
            resourceGuard.detectLeak(unitId, classLoader);
        }
        log.info("[{}] Isolated load unit reclaimed", unitId);
    }

    public String getUnitId() {
        return unitId;
    }

    public Path getModulePath() {
        return modulePath;
    }

    public PluginClassLoader getClassLoader() {
        return classLoader;
    }

    public int getReferenceCount() {
        return references.get();
    }

    public boolean isRetiring() {
        return retiring.get();
    }

    public boolean isReclaimed() {
        return reclaimed.get();
    }

    @Override
    public String toString() {
        return String.format("IsolatedLoadUnit[%s, references=%d, retiring=%s, reclaimed=%s]",
                unitId, references.get(), retiring.get(), reclaimed.get());
    }
}
