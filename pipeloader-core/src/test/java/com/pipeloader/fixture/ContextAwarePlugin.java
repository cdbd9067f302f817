package com.pipeloader.fixture;

import com.pipeloader.api.HierarchicalLoggingContext;
import com.pipeloader.api.Plugin;
import com.pipeloader.fixture.shared.PluginProbe;

/**
 * 构造时接收宿主创建的共享类型实例
 */
public class ContextAwarePlugin implements Plugin, PluginProbe {

    private final String compositeKey;
    private final HierarchicalLoggingContext hostContext;

    public ContextAwarePlugin(String compositeKey, HierarchicalLoggingContext hostContext) {
        this.compositeKey = compositeKey;
        this.hostContext = hostContext;
    }

    @Override
    public String getCompositeKey() {
        return compositeKey;
    }

    @Override
    public boolean isClosed() {
        return false;
    }

    @Override
    public Object getInjectedDependency() {
        return hostContext;
    }
}
