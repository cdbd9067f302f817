package com.pipeloader.core.resource;

import com.pipeloader.core.spi.ResourceGuard;
import lombok.extern.slf4j.Slf4j;

import java.lang.ref.WeakReference;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Enumeration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 基础资源守卫
 * <ul>
 * <li>反注册由单元加载的 JDBC 驱动（DriverManager 静态持有驱动，会钉住 ClassLoader）</li>
 * <li>泄漏检测：延迟检查单元 ClassLoader 是否已被回收</li>
 * </ul>
 */
@Slf4j
public class BasicResourceGuard implements ResourceGuard {

    private static final int DEFAULT_LEAK_DETECTION_DELAY_SECONDS = 5;

    private final long leakDetectionDelaySeconds;

    // 首次检测时才创建
    private ScheduledExecutorService scheduler;

    public BasicResourceGuard() {
        this(DEFAULT_LEAK_DETECTION_DELAY_SECONDS);
    }

    public BasicResourceGuard(long leakDetectionDelaySeconds) {
        this.leakDetectionDelaySeconds = leakDetectionDelaySeconds;
    }

    @Override
    public void cleanup(String unitId, ClassLoader classLoader) {
        int driverCount = deregisterJdbcDrivers(classLoader);
        if (driverCount > 0) {
            log.info("[{}] Deregistered {} JDBC driver(s)", unitId, driverCount);
        }
    }

    @Override
    public void detectLeak(String unitId, ClassLoader classLoader) {
        WeakReference<ClassLoader> ref = new WeakReference<>(classLoader);

        scheduler().schedule(() -> {
            System.gc();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }

            if (ref.get() != null) {
                log.warn("[{}] ClassLoader not collected yet, a plugin instance or type may still be referenced", unitId);
            } else {
                log.debug("[{}] ClassLoader collected", unitId);
            }
        }, leakDetectionDelaySeconds, TimeUnit.SECONDS);
    }

    private int deregisterJdbcDrivers(ClassLoader classLoader) {
        int count = 0;
        Enumeration<Driver> drivers = DriverManager.getDrivers();
        while (drivers.hasMoreElements()) {
            Driver driver = drivers.nextElement();
            if (driver.getClass().getClassLoader() != classLoader) {
                continue;
            }
            try {
                DriverManager.deregisterDriver(driver);
                count++;
            } catch (SQLException e) {
                log.warn("Failed to deregister JDBC driver {}: {}", driver.getClass().getName(), e.getMessage());
            }
        }
        return count;
    }

    private synchronized ScheduledExecutorService scheduler() {
        if (scheduler == null) {
            // 守护线程，不阻止 JVM 退出
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "pipeloader-leak-detector");
                t.setDaemon(true);
                return t;
            });
        }
        return scheduler;
    }

    @Override
    public synchronized void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * 泄漏检测线程是否在运行
     */
    public synchronized boolean isDetectorRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }
}
