package com.pipeloader.core.plugin;

import com.pipeloader.api.Plugin;
import com.pipeloader.core.classloader.IsolatedLoadUnit;
import lombok.Value;

/**
 * 插件实例及其来源单元
 */
@Value
class PluginHandle {
    PluginKey key;
    Plugin plugin;
    IsolatedLoadUnit unit;
}
