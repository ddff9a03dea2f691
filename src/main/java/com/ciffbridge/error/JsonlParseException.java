package com.ciffbridge.error;

/**
 * JSONL 输入行无法解析，携带行号与原始内容便于定位。
 */
public class JsonlParseException extends CiffBridgeException {
    private final long lineNumber;
    private final String line;

    public JsonlParseException(String message, long lineNumber, String line) {
        super(buildMessage(message, lineNumber, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public JsonlParseException(String message, long lineNumber, String line, Throwable cause) {
        super(buildMessage(message, lineNumber, line), cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    private static String buildMessage(String message, long lineNumber, String line) {
        return "Parse error at line " + lineNumber + ": " + message + System.lineSeparator() + line;
    }
}
