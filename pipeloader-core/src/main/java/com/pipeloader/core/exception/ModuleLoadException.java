package com.pipeloader.core.exception;

/**
 * 模块加载失败
 * <p>
 * 抛出前，本次加载创建的隔离单元已被销毁。
 */
public class ModuleLoadException extends PluginModuleException {

    public ModuleLoadException(String moduleName, String version, String message, Throwable cause) {
        super(moduleName, version, message, cause);
    }
}
