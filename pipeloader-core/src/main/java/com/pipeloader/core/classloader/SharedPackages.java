package com.pipeloader.core.classloader;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 共享包白名单
 * <p>
 * 命中白名单的类只从宿主 ClassLoader 加载，所有隔离单元与宿主共用同一份类型，
 * 跨边界按引用传递这些类型的值不会出现 ClassCastException。
 * 其余类一律在单元内部私有加载。
 * <p>
 * 匹配规则：包名前缀，忽略大小写。
 */
@Slf4j
public final class SharedPackages {

    /**
     * 内置白名单（进程级常量，不可缩减）
     */
    public static final List<String> BUILT_IN = Collections.unmodifiableList(Arrays.asList(
            // JDK：集合、并发等基础类型
            "java.", "javax.", "jdk.", "sun.", "com.sun.",
            // 依赖注入抽象
            "jakarta.inject.", "javax.inject.",
            // 日志
            "org.slf4j.", "ch.qos.logback.",
            // 消息
            "jakarta.jms.",
            // 配置
            "org.yaml.snakeyaml.",
            // 插件契约、关联上下文与共享模型
            "com.pipeloader.api."
    ));

    private static final SharedPackages DEFAULTS = new SharedPackages(Collections.emptyList());

    private final List<String> prefixes;

    private SharedPackages(Collection<String> additional) {
        List<String> all = new ArrayList<>(BUILT_IN);
        for (String prefix : additional) {
            if (prefix == null || prefix.trim().isEmpty()) {
                continue;
            }
            String normalized = prefix.trim().endsWith(".") ? prefix.trim() : prefix.trim() + ".";
            if (!all.contains(normalized)) {
                all.add(normalized);
            }
        }
        this.prefixes = Collections.unmodifiableList(all);
    }

    public static SharedPackages defaults() {
        return DEFAULTS;
    }

    /**
     * 在内置白名单之上追加宿主自定义的共享包
     */
    public static SharedPackages withAdditional(Collection<String> additional) {
        if (additional == null || additional.isEmpty()) {
            return DEFAULTS;
        }
        SharedPackages shared = new SharedPackages(additional);
        log.info("Shared packages extended with: {}", additional);
        return shared;
    }

    public boolean isShared(String className) {
        if (className == null) {
            return false;
        }
        for (String prefix : prefixes) {
            if (className.regionMatches(true, 0, prefix, 0, prefix.length())) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    @Override
    public String toString() {
        return "SharedPackages" + prefixes;
    }
}
