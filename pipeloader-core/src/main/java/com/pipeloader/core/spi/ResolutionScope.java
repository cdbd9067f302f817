package com.pipeloader.core.spi;

/**
 * 请求级依赖作用域
 */
public interface ResolutionScope extends AutoCloseable {

    /**
     * 按类型构造实例：显式参数优先匹配，其余构造参数从注册表解析
     *
     * @param type         具体类型
     * @param explicitArgs 额外的构造参数（如插件复合键）
     * @return 构造好的实例
     */
    Object createInstance(Class<?> type, Object... explicitArgs);

    /**
     * 释放作用域内创建的服务
     */
    @Override
    void close();
}
