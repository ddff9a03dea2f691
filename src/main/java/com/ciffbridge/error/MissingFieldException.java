package com.ciffbridge.error;

/**
 * 转换配置缺少必填字段。
 */
public class MissingFieldException extends CiffBridgeException {
    private final String field;

    public MissingFieldException(String field) {
        super("缺少必填配置项: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
