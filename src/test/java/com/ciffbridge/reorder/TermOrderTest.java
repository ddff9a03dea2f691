package com.ciffbridge.reorder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermOrderTest {

    @Test
    @DisplayName("按 UTF-8 字节无符号比较")
    void testUnsignedByteOrder() {
        assertTrue(TermOrder.compare("a", "b") < 0);
        assertTrue(TermOrder.compare("ab", "a") > 0);
        assertTrue(TermOrder.compare("z", "é") < 0);
        assertEquals(0, TermOrder.compare("head", "head"));
    }

    @Test
    @DisplayName("增补平面字符排在 U+FF5E 之后，与 UTF-16 顺序不同")
    void testSupplementaryCharacters() {
        String fullwidthTilde = "～";
        String emoji = "😀";

        assertTrue(fullwidthTilde.compareTo(emoji) > 0);
        assertTrue(TermOrder.compare(fullwidthTilde, emoji) < 0);
    }

    @Test
    @DisplayName("比较器可直接用于排序")
    void testComparatorSorts() {
        List<String> terms = new ArrayList<>(List.of("text", "01", "Zeta", "content"));

        terms.sort(TermOrder.COMPARATOR);

        assertEquals(List.of("01", "Zeta", "content", "text"), terms);
    }
}
