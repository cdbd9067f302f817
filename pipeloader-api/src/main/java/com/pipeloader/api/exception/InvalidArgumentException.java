package com.pipeloader.api.exception;

/**
 * 无效参数异常
 * 当传入的参数不满足要求时抛出此异常。
 */
public class InvalidArgumentException extends PipeLoaderException {

    private final String paramName;
    private final Object invalidValue;

    public InvalidArgumentException(String paramName, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public InvalidArgumentException(String paramName, Object invalidValue, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    public InvalidArgumentException(String paramName, String message, Throwable cause) {
        super(message, cause);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public String getParamName() {
        return paramName;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }

    /**
     * 校验字符串非空白
     */
    public static String requireNonBlank(String paramName, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidArgumentException(paramName, value, paramName + " cannot be blank");
        }
        return value;
    }

    /**
     * 校验对象非空
     */
    public static <T> T requireNonNull(String paramName, T value) {
        if (value == null) {
            throw new InvalidArgumentException(paramName, paramName + " cannot be null");
        }
        return value;
    }
}
