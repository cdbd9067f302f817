package com.pipeloader.fixture;

import com.pipeloader.api.Plugin;

/**
 * 不接收复合键的插件，违反构造契约
 */
public class NoKeyPlugin implements Plugin {

    public NoKeyPlugin() {
    }
}
