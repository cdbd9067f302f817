package com.pipeloader.core.spi;

/**
 * 资源清理守卫 SPI
 * <p>
 * 隔离单元被回收时调用，防止插件残留的全局注册持有其 ClassLoader。
 */
public interface ResourceGuard {

    /**
     * 单元回收时清理资源，在 ClassLoader 关闭之前调用
     *
     * @param unitId      单元 ID
     * @param classLoader 单元的 ClassLoader
     */
    void cleanup(String unitId, ClassLoader classLoader);

    /**
     * 延迟检测 ClassLoader 是否被 GC 回收，未回收则告警。应在 cleanup() 之后调用。
     *
     * @param unitId      单元 ID
     * @param classLoader 单元的 ClassLoader（将被包装为 WeakReference）
     */
    void detectLeak(String unitId, ClassLoader classLoader);

    /**
     * 停止检测用的后台线程
     */
    default void shutdown() {
    }
}
