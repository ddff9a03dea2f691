package com.ciffbridge.reorder;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

/**
 * 词项字典序：按 UTF-8 字节逐个无符号比较。
 *
 * 与 {@link String#compareTo(String)} 的 UTF-16 码元序在增补平面字符上不同。
 */
public final class TermOrder {
    public static final Comparator<String> COMPARATOR = TermOrder::compare;

    private TermOrder() {
    }

    public static int compare(String left, String right) {
        return compareBytes(left.getBytes(StandardCharsets.UTF_8), right.getBytes(StandardCharsets.UTF_8));
    }

    public static int compareBytes(byte[] left, byte[] right) {
        return Arrays.compareUnsigned(left, right);
    }
}
