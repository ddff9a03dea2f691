package com.ciffbridge.storage;

import com.ciffbridge.error.InvalidFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PayloadVectorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("字符串往返，含空串与多字节字符")
    void testStringsRoundTrip() {
        List<String> items = List.of("alpha", "", "搜索", "z");

        PayloadSlice slice = PayloadVector.fromStrings(items).asSlice();

        assertEquals(4, slice.size());
        for (int index = 0; index < items.size(); index++) {
            assertEquals(Optional.of(items.get(index)), slice.getString(index));
        }
        assertEquals(items, slice.strings().collect(Collectors.toList()));
        assertTrue(slice.get(items.size()).isEmpty());
        assertTrue(slice.get(-1).isEmpty());
    }

    @Test
    @DisplayName("空列表只有长度头与一个偏移")
    void testEmptyVector() {
        PayloadVector vector = PayloadVector.fromStrings(List.of());

        assertEquals(0, vector.size());
        assertEquals(16, vector.byteSize());
        assertTrue(vector.asSlice().isEmpty());
        assertTrue(vector.asSlice().get(0).isEmpty());
    }

    @Test
    @DisplayName("字节布局: 长度、偏移表、payload")
    void testByteLayout() throws IOException {
        PayloadVector vector = PayloadVector.fromStrings(List.of("ab", "c"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        vector.write(out);

        ByteBuffer bytes = ByteBuffer.wrap(out.toByteArray()).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(2, bytes.getLong(0));
        assertEquals(0, bytes.getLong(8));
        assertEquals(2, bytes.getLong(16));
        assertEquals(3, bytes.getLong(24));
        assertEquals('a', bytes.get(32));
        assertEquals('c', bytes.get(34));
        assertEquals(35, out.size());
    }

    @Test
    @DisplayName("长度头超过偏移表容量时拒绝")
    void testCorruptLengthRejected() {
        ByteBuffer bytes = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        bytes.putLong(0, 5);

        assertThrows(InvalidFormatException.class, () -> PayloadSlice.wrap(bytes));
        assertThrows(InvalidFormatException.class, () -> PayloadSlice.wrap(ByteBuffer.allocate(4)));
    }

    @Test
    @DisplayName("偏移越过 payload 区时 get 抛格式异常")
    void testCorruptOffsetRejected() {
        ByteBuffer bytes = ByteBuffer.allocate(24).order(ByteOrder.LITTLE_ENDIAN);
        bytes.putLong(0, 1);
        bytes.putLong(8, 0);
        bytes.putLong(16, 100);

        PayloadSlice slice = PayloadSlice.wrap(bytes);

        assertThrows(InvalidFormatException.class, () -> slice.get(0));
    }

    @Test
    @DisplayName("由文本文件构建词典并映射读取")
    void testBuildLexiconFromFile() throws IOException {
        Path terms = tempDir.resolve("toy.terms");
        Path lexicon = tempDir.resolve("toy.termlex");
        Files.writeString(terms, "01\n03\ncontent\n", StandardCharsets.UTF_8);

        PayloadVector.buildLexicon(terms, lexicon);
        PayloadSlice slice = PayloadSlice.open(lexicon);

        assertEquals(3, slice.size());
        assertEquals("content", slice.getString(2).orElseThrow());
        assertArrayEquals("03".getBytes(StandardCharsets.UTF_8), slice.bytesAt(1));
        assertTrue(slice.get(3).isEmpty());
    }
}
