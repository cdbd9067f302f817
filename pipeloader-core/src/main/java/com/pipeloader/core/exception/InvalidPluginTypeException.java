package com.pipeloader.core.exception;

/**
 * 类型不满足插件能力契约（未实现 Plugin，或不可实例化）
 */
public class InvalidPluginTypeException extends PluginModuleException {

    private final String typeName;

    public InvalidPluginTypeException(String moduleName, String version, String typeName, String reason) {
        super(moduleName, version,
                String.format("Plugin type %s in %s v%s is invalid: %s", typeName, moduleName, version, reason));
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
