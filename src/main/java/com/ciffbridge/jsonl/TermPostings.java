package com.ciffbridge.jsonl;

import java.util.Arrays;

/**
 * 单个词项在内存中累积的 (docid, tf) 列表，docid 按追加顺序递增。
 */
final class TermPostings {
    private static final int INITIAL_CAPACITY = 4;

    private int[] docIds = new int[INITIAL_CAPACITY];
    private int[] termFreqs = new int[INITIAL_CAPACITY];
    private int size;

    void add(int docId, int termFreq) {
        if (size == docIds.length) {
            int capacity = docIds.length * 2;
            docIds = Arrays.copyOf(docIds, capacity);
            termFreqs = Arrays.copyOf(termFreqs, capacity);
        }
        docIds[size] = docId;
        termFreqs[size] = termFreq;
        size++;
    }

    int size() {
        return size;
    }

    int[] docIds() {
        return Arrays.copyOf(docIds, size);
    }

    int[] termFreqs() {
        return Arrays.copyOf(termFreqs, size);
    }
}
