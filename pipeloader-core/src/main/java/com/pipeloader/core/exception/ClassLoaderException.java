package com.pipeloader.core.exception;

import com.pipeloader.api.exception.PipeLoaderException;

/**
 * 类加载器异常
 * 用于隔离单元已关闭、依赖路径无效等场景。
 */
public class ClassLoaderException extends PipeLoaderException {

    private final String unitId;
    private final String resource;

    public ClassLoaderException(String unitId, String resource, String message) {
        super(message);
        this.unitId = unitId;
        this.resource = resource;
    }

    public ClassLoaderException(String unitId, String resource, String message, Throwable cause) {
        super(message, cause);
        this.unitId = unitId;
        this.resource = resource;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getResource() {
        return resource;
    }
}
