package com.pipeloader.fixture;

import com.pipeloader.api.Plugin;

public class ScopedConsumerPlugin implements Plugin {

    public ScopedConsumerPlugin(String compositeKey, ScopedResource resource) {
        if (resource.isClosed()) {
            throw new IllegalStateException("scoped resource closed before construction finished");
        }
    }
}
