package com.pipeloader.api.exception;

/**
 * PipeLoader 基础异常
 * <p>
 * 所有运行时错误的根类型，宿主与插件共享此类型。
 */
public class PipeLoaderException extends RuntimeException {

    public PipeLoaderException(String message) {
        super(message);
    }

    public PipeLoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
