package com.pipeloader.core.monitor;

import com.pipeloader.api.HierarchicalLoggingContext;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * 带层级上下文的日志输出
 * <p>
 * 在单次日志调用期间把上下文写入 MDC（{@value #CORRELATION_ID_KEY}、{@value #SCOPE_KEY}），
 * 调用结束后恢复原值。上下文为 null 时直接输出。
 */
public final class HierarchicalLogging {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String SCOPE_KEY = "loggingScope";

    private HierarchicalLogging() {
    }

    public static void debug(Logger log, HierarchicalLoggingContext context, String format, Object... args) {
        if (log.isDebugEnabled()) {
            withContext(context, () -> log.debug(format, args));
        }
    }

    public static void info(Logger log, HierarchicalLoggingContext context, String format, Object... args) {
        if (log.isInfoEnabled()) {
            withContext(context, () -> log.info(format, args));
        }
    }

    public static void warn(Logger log, HierarchicalLoggingContext context, String format, Object... args) {
        withContext(context, () -> log.warn(format, args));
    }

    /**
     * 异常作为最后一个参数传入，与 SLF4J 约定一致
     */
    public static void error(Logger log, HierarchicalLoggingContext context, String format, Object... args) {
        withContext(context, () -> log.error(format, args));
    }

    static void withContext(HierarchicalLoggingContext context, Runnable logCall) {
        if (context == null) {
            logCall.run();
            return;
        }
        String previousCorrelationId = MDC.get(CORRELATION_ID_KEY);
        String previousScope = MDC.get(SCOPE_KEY);
        MDC.put(CORRELATION_ID_KEY, context.getCorrelationId());
        MDC.put(SCOPE_KEY, context.getScopePath());
        try {
            logCall.run();
        } finally {
            restore(CORRELATION_ID_KEY, previousCorrelationId);
            restore(SCOPE_KEY, previousScope);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
