package com.ciffbridge.error;

public class QuantizationException extends CiffBridgeException {
    public QuantizationException(String message) {
        super(message);
    }
}
