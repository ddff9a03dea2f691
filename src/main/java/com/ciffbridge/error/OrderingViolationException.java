package com.ciffbridge.error;

/**
 * DocRecord 的内部 docid 与期望的稠密递增计数不一致。
 */
public class OrderingViolationException extends CiffBridgeException {
    private final long expectedDocId;
    private final long actualDocId;

    public OrderingViolationException(long expectedDocId, long actualDocId) {
        super("Document records must come in order: expected docid=" + expectedDocId + ", actual=" + actualDocId);
        this.expectedDocId = expectedDocId;
        this.actualDocId = actualDocId;
    }

    public long getExpectedDocId() {
        return expectedDocId;
    }

    public long getActualDocId() {
        return actualDocId;
    }
}
