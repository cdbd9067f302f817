package com.pipeloader.api;

/**
 * 插件能力契约
 * <p>
 * 所有可被 PluginManager 实例化的插件类型必须实现此接口。
 * 插件如需在驱逐或管理器关闭时释放资源，可同时实现 {@link AutoCloseable}。
 * <p>
 * 插件类型需要一个可被依赖解析器满足的公共构造器，其中一个 {@code String} 参数
 * 接收复合键 {@code {version}_{moduleName}}，用于自我标识（如打标日志、指标）。
 */
public interface Plugin {
}
