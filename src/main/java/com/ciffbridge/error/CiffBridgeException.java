package com.ciffbridge.error;

/**
 * 转换过程中所有不可恢复错误的基类。
 */
public class CiffBridgeException extends RuntimeException {
    public CiffBridgeException(String message) {
        super(message);
    }

    public CiffBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
