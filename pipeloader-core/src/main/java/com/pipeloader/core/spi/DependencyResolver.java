package com.pipeloader.core.spi;

/**
 * 依赖解析器 SPI
 * <p>
 * 持有共享注册表。每次实例化插件时打开一个请求级作用域，
 * 构造完成后立即关闭，插件不得持有作用域内的服务。
 */
public interface DependencyResolver {

    /**
     * 打开请求级作用域
     */
    ResolutionScope openScope();
}
