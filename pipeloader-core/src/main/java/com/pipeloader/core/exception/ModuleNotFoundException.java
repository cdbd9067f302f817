package com.pipeloader.core.exception;

/**
 * 模块文件不存在
 */
public class ModuleNotFoundException extends PluginModuleException {

    private final String expectedPath;

    public ModuleNotFoundException(String moduleName, String version, String expectedPath) {
        super(moduleName, version, "Plugin module not found: " + expectedPath);
        this.expectedPath = expectedPath;
    }

    public String getExpectedPath() {
        return expectedPath;
    }
}
