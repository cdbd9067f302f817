package com.pipeloader.core.exception;

import com.pipeloader.api.exception.PipeLoaderException;

/**
 * 依赖解析失败：没有可被满足的构造器
 */
public class DependencyResolutionException extends PipeLoaderException {

    private final Class<?> targetType;

    public DependencyResolutionException(Class<?> targetType, String message) {
        super(message);
        this.targetType = targetType;
    }

    public DependencyResolutionException(Class<?> targetType, String message, Throwable cause) {
        super(message, cause);
        this.targetType = targetType;
    }

    public Class<?> getTargetType() {
        return targetType;
    }
}
