package com.pipeloader.core.exception;

/**
 * 模块中不存在请求的类型
 */
public class PluginTypeNotFoundException extends PluginModuleException {

    private final String typeName;

    public PluginTypeNotFoundException(String moduleName, String version, String typeName, Throwable cause) {
        super(moduleName, version,
                String.format("Plugin type %s not found in %s v%s", typeName, moduleName, version), cause);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
