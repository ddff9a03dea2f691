package com.ciffbridge.error;

/**
 * CIFF 中的有符号计数无法表示为所需的无符号宽度。
 */
public class CountOverflowException extends CiffBridgeException {
    private final String field;
    private final long value;

    public CountOverflowException(String field, long value) {
        super("计数无法转换为无符号32位整数: " + field + "=" + value);
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public long getValue() {
        return value;
    }
}
