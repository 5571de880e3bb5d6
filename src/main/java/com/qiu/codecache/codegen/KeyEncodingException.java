package com.qiu.codecache.codegen;

/**
 * 编译产物无法生成自身规范键时抛出
 */
public class KeyEncodingException extends Exception {
    public KeyEncodingException(String message) {
        super(message);
    }

    public KeyEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
