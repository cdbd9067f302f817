package com.pipeloader.core.classloader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SharedPackages 白名单测试")
class SharedPackagesTest {

    @Test
    @DisplayName("内置白名单覆盖 JDK、日志、配置与插件契约")
    void builtInPrefixesShouldBeShared() {
        SharedPackages shared = SharedPackages.defaults();

        assertTrue(shared.isShared("java.util.List"));
        assertTrue(shared.isShared("javax.sql.DataSource"));
        assertTrue(shared.isShared("org.slf4j.Logger"));
        assertTrue(shared.isShared("org.yaml.snakeyaml.Yaml"));
        assertTrue(shared.isShared("jakarta.inject.Inject"));
        assertTrue(shared.isShared("com.pipeloader.api.Plugin"));
        assertTrue(shared.isShared("com.pipeloader.api.HierarchicalLoggingContext"));
    }

    @Test
    @DisplayName("匹配忽略大小写")
    void matchingShouldIgnoreCase() {
        SharedPackages shared = SharedPackages.defaults();

        assertTrue(shared.isShared("COM.PipeLoader.API.Plugin"));
        assertTrue(shared.isShared("Org.Slf4j.Logger"));
    }

    @Test
    @DisplayName("白名单外的类不共享")
    void otherPackagesShouldBePrivate() {
        SharedPackages shared = SharedPackages.defaults();

        assertFalse(shared.isShared("com.pipeloader.core.plugin.PluginManager"));
        assertFalse(shared.isShared("com.example.audio.AudioPlugin"));
        // 前缀按包边界匹配
        assertFalse(shared.isShared("javafoo.Bar"));
        assertFalse(shared.isShared(null));
    }

    @Test
    @DisplayName("追加的前缀自动补齐包分隔符并去重")
    void additionalPrefixesShouldBeNormalized() {
        SharedPackages shared = SharedPackages.withAdditional(
                Arrays.asList("com.example.shared", " com.example.model. ", "", null, "org.slf4j."));

        assertTrue(shared.isShared("com.example.shared.Event"));
        assertTrue(shared.isShared("com.example.model.Track"));
        assertFalse(shared.isShared("com.example.sharedx.Event"));
        assertEquals(SharedPackages.BUILT_IN.size() + 2, shared.getPrefixes().size());
    }

    @Test
    @DisplayName("没有追加项时复用默认实例")
    void emptyAdditionalShouldReturnDefaults() {
        assertSame(SharedPackages.defaults(), SharedPackages.withAdditional(Collections.emptyList()));
        assertSame(SharedPackages.defaults(), SharedPackages.withAdditional(null));
    }

    @Test
    @DisplayName("前缀列表不可修改")
    void prefixesShouldBeUnmodifiable() {
        assertThrows(UnsupportedOperationException.class,
                () -> SharedPackages.defaults().getPrefixes().add("com.evil."));
    }
}
