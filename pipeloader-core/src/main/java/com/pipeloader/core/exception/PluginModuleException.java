package com.pipeloader.core.exception;

import com.pipeloader.api.exception.PipeLoaderException;

/**
 * 插件模块异常基类
 * <p>
 * 携带出错模块的名称与版本，便于调用方定位。
 */
public abstract class PluginModuleException extends PipeLoaderException {

    private final String moduleName;
    private final String version;

    protected PluginModuleException(String moduleName, String version, String message) {
        super(message);
        this.moduleName = moduleName;
        this.version = version;
    }

    protected PluginModuleException(String moduleName, String version, String message, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
        this.version = version;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getVersion() {
        return version;
    }
}
