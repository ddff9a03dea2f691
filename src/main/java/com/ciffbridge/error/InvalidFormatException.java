package com.ciffbridge.error;

/**
 * 二进制集合或词典字节布局非法。
 */
public class InvalidFormatException extends CiffBridgeException {
    private static final String PREFIX = "Invalid binary collection format";

    public InvalidFormatException() {
        super(PREFIX);
    }

    public InvalidFormatException(String message) {
        super(PREFIX + ": " + message);
    }
}
