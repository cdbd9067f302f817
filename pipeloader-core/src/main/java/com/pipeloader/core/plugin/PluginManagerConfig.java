package com.pipeloader.core.plugin;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 插件管理器配置
 */
@Getter
@Builder
public class PluginManagerConfig {

    /**
     * 模块文件扩展名，模块路径为 {basePath}/v{version}/{moduleName}.{moduleExtension}
     */
    @Builder.Default
    private String moduleExtension = "jar";

    /**
     * 在内置白名单之外追加的共享包前缀
     */
    @Builder.Default
    private List<String> additionalSharedPackages = Collections.emptyList();

    /**
     * 宿主 ClassLoader，为 null 时使用加载 PluginManager 的 ClassLoader
     */
    private ClassLoader hostClassLoader;

    /**
     * 单元回收后是否做 ClassLoader 泄漏检测
     */
    @Builder.Default
    private boolean leakDetection = false;

    public static PluginManagerConfig defaults() {
        return PluginManagerConfig.builder().build();
    }

    public ClassLoader resolveHostClassLoader() {
        return hostClassLoader != null ? hostClassLoader : PluginManager.class.getClassLoader();
    }

    @Override
    public String toString() {
        return String.format("PluginManagerConfig{extension=%s, additionalShared=%s, leakDetection=%s}",
                moduleExtension, additionalSharedPackages, leakDetection);
    }
}
