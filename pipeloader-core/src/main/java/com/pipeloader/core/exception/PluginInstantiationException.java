package com.pipeloader.core.exception;

/**
 * 插件实例化失败
 * <p>
 * 构造器抛出异常，或依赖解析器没有返回实例。
 */
public class PluginInstantiationException extends PluginModuleException {

    private final String typeName;

    public PluginInstantiationException(String moduleName, String version, String typeName, Throwable cause) {
        super(moduleName, version,
                String.format("Unable to create instance of plugin %s (%s v%s). "
                        + "Ensure it implements Plugin and has a constructor the dependency resolver can satisfy.",
                        typeName, moduleName, version),
                cause);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
