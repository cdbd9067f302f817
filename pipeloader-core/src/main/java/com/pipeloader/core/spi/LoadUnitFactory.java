package com.pipeloader.core.spi;

import com.pipeloader.core.classloader.IsolatedLoadUnit;

import java.nio.file.Path;

/**
 * 隔离单元工厂 SPI
 */
public interface LoadUnitFactory {

    /**
     * 为一个模块文件创建全新的隔离单元（尚未打开）
     *
     * @param unitId     单元 ID，用于日志与 ClassLoader 命名
     * @param modulePath 模块 JAR 路径
     */
    IsolatedLoadUnit create(String unitId, Path modulePath);

    /**
     * 管理器关闭时调用，释放工厂持有的后台资源
     */
    default void shutdown() {
    }
}
