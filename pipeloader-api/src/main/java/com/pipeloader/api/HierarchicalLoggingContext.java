package com.pipeloader.api;

import com.pipeloader.api.exception.InvalidArgumentException;

import java.util.Objects;
import java.util.UUID;

/**
 * 层级日志上下文
 * <p>
 * 调用方传入的关联值，沿调用链原样传递给日志组件。
 * 不可变：{@link #child(String)} 返回新的子上下文，关联 ID 保持不变。
 */
public final class HierarchicalLoggingContext {

    private static final String SCOPE_SEPARATOR = "/";

    private final String correlationId;
    private final String scope;
    private final HierarchicalLoggingContext parent;

    private HierarchicalLoggingContext(String correlationId, String scope, HierarchicalLoggingContext parent) {
        this.correlationId = correlationId;
        this.scope = scope;
        this.parent = parent;
    }

    /**
     * 创建根上下文
     *
     * @param correlationId 关联 ID
     * @param scope         根作用域名称
     */
    public static HierarchicalLoggingContext root(String correlationId, String scope) {
        InvalidArgumentException.requireNonBlank("correlationId", correlationId);
        InvalidArgumentException.requireNonBlank("scope", scope);
        return new HierarchicalLoggingContext(correlationId, scope, null);
    }

    /**
     * 使用随机关联 ID 创建根上下文
     */
    public static HierarchicalLoggingContext newRoot(String scope) {
        return root(UUID.randomUUID().toString().replace("-", ""), scope);
    }

    public HierarchicalLoggingContext child(String childScope) {
        InvalidArgumentException.requireNonBlank("childScope", childScope);
        return new HierarchicalLoggingContext(correlationId, childScope, this);
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getScope() {
        return scope;
    }

    public HierarchicalLoggingContext getParent() {
        return parent;
    }

    public int getDepth() {
        return parent == null ? 0 : parent.getDepth() + 1;
    }

    /**
     * 从根到当前的作用域路径，如 {@code orchestrator/step-2/plugin}
     */
    public String getScopePath() {
        return parent == null ? scope : parent.getScopePath() + SCOPE_SEPARATOR + scope;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HierarchicalLoggingContext)) return false;
        HierarchicalLoggingContext that = (HierarchicalLoggingContext) o;
        return correlationId.equals(that.correlationId) && getScopePath().equals(that.getScopePath());
    }

    @Override
    public int hashCode() {
        return Objects.hash(correlationId, getScopePath());
    }

    @Override
    public String toString() {
        return String.format("HierarchicalLoggingContext{correlationId=%s, scope=%s}", correlationId, getScopePath());
    }
}
