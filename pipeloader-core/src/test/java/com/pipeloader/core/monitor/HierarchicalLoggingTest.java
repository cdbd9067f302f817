package com.pipeloader.core.monitor;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import com.pipeloader.api.HierarchicalLoggingContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HierarchicalLogging MDC 测试")
class HierarchicalLoggingTest {

    private Logger logger;
    private CapturingAppender appender;

    /**
     * 在 append 时立即复制 MDC，避免事件延迟读取到恢复后的值
     */
    private static class CapturingAppender extends AppenderBase<ILoggingEvent> {
        final List<String> messages = new CopyOnWriteArrayList<>();
        final List<Map<String, String>> mdcSnapshots = new CopyOnWriteArrayList<>();

        @Override
        protected void append(ILoggingEvent event) {
            messages.add(event.getFormattedMessage());
            mdcSnapshots.add(new HashMap<>(event.getMDCPropertyMap()));
        }
    }

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger("com.pipeloader.test.hierarchical");
        logger.setLevel(Level.DEBUG);
        appender = new CapturingAppender();
        appender.setContext(logger.getLoggerContext());
        appender.start();
        logger.addAppender(appender);
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        appender.stop();
        MDC.clear();
    }

    @Test
    @DisplayName("日志调用期间写入关联 ID 与作用域路径")
    void contextShouldBeVisibleDuringLogCall() {
        HierarchicalLoggingContext context = HierarchicalLoggingContext.root("corr-1", "pipeline").child("step-2");

        HierarchicalLogging.info(logger, context, "Loaded {} v{}", "audioPlugin", "1.0");

        assertEquals(List.of("Loaded audioPlugin v1.0"), appender.messages);
        Map<String, String> mdc = appender.mdcSnapshots.get(0);
        assertEquals("corr-1", mdc.get(HierarchicalLogging.CORRELATION_ID_KEY));
        assertEquals("pipeline/step-2", mdc.get(HierarchicalLogging.SCOPE_KEY));
    }

    @Test
    @DisplayName("调用结束后恢复原有 MDC")
    void previousMdcShouldBeRestored() {
        MDC.put(HierarchicalLogging.CORRELATION_ID_KEY, "outer");

        HierarchicalLogging.warn(logger, HierarchicalLoggingContext.root("inner", "scope"), "warned");

        assertEquals("inner", appender.mdcSnapshots.get(0).get(HierarchicalLogging.CORRELATION_ID_KEY));
        assertEquals("outer", MDC.get(HierarchicalLogging.CORRELATION_ID_KEY));
        assertNull(MDC.get(HierarchicalLogging.SCOPE_KEY));
    }

    @Test
    @DisplayName("上下文为 null 时照常输出")
    void nullContextShouldStillLog() {
        HierarchicalLogging.debug(logger, null, "plain {}", "message");

        assertEquals(List.of("plain message"), appender.messages);
        assertFalse(appender.mdcSnapshots.get(0).containsKey(HierarchicalLogging.CORRELATION_ID_KEY));
    }

    @Test
    @DisplayName("低于日志级别时不输出")
    void disabledLevelShouldSkip() {
        logger.setLevel(Level.WARN);

        HierarchicalLogging.debug(logger, HierarchicalLoggingContext.newRoot("quiet"), "hidden");
        HierarchicalLogging.info(logger, HierarchicalLoggingContext.newRoot("quiet"), "hidden");

        assertTrue(appender.messages.isEmpty());
    }

    @Test
    @DisplayName("异常作为最后一个参数输出")
    void errorShouldCarryThrowable() {
        List<ILoggingEvent> events = new CopyOnWriteArrayList<>();
        AppenderBase<ILoggingEvent> throwableAppender = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent event) {
                events.add(event);
            }
        };
        throwableAppender.setContext(logger.getLoggerContext());
        throwableAppender.start();
        logger.addAppender(throwableAppender);
        try {
            HierarchicalLogging.error(logger, HierarchicalLoggingContext.newRoot("failing"),
                    "Failed to load {}", "audioPlugin", new IllegalStateException("broken"));

            assertEquals("Failed to load audioPlugin", events.get(0).getFormattedMessage());
            assertEquals("broken", events.get(0).getThrowableProxy().getMessage());
        } finally {
            logger.detachAppender(throwableAppender);
        }
    }
}
