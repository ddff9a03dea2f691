package com.ciffbridge.jsonl;

import com.ciffbridge.error.JsonlParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonlVectorReaderTest {

    @TempDir
    Path tempDir;

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("input.jsonl");
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("读取字符串与整数ID，跳过空行，忽略多余字段")
    void testReadDocuments() throws IOException {
        Path file = write("{\"id\":\"a\",\"vector\":{\"x\":1.5,\"y\":2},\"extra\":true}\n\n{\"id\":42,\"vector\":{}}\n");

        try (JsonlVectorReader reader = new JsonlVectorReader(file)) {
            JsonlDocument first = reader.next();
            assertEquals("a", first.id());
            assertEquals(List.of("x", "y"), List.copyOf(first.vector().keySet()));
            assertEquals(2.0, first.vector().get("y").doubleValue());
            assertEquals(1, first.lineNumber());

            JsonlDocument second = reader.next();
            assertEquals("42", second.id());
            assertTrue(second.vector().isEmpty());
            assertEquals(3, second.lineNumber());

            assertNull(reader.next());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"id\":true,\"vector\":{}}",
        "{\"id\":1.5,\"vector\":{}}",
        "{\"id\":[1],\"vector\":{}}",
        "{\"vector\":{}}",
        "{\"id\":\"a\"}",
        "{\"id\":\"a\",\"vector\":{\"x\":\"high\"}}",
        "[1,2]",
        "{not json"
    })
    @DisplayName("非法行报告行号与原文")
    void testInvalidLines(String line) throws IOException {
        Path file = write("{\"id\":\"ok\",\"vector\":{}}\n" + line + "\n");

        try (JsonlVectorReader reader = new JsonlVectorReader(file)) {
            reader.next();
            JsonlParseException exception = assertThrows(JsonlParseException.class, reader::next);
            assertEquals(2, exception.getLineNumber());
            assertEquals(line, exception.getLine());
        }
    }

    @Test
    @DisplayName("未配对代理字符的词项被拒绝，合法代理对照常接受")
    void testRejectsLoneSurrogateTerms() throws IOException {
        String lone = "{\"id\":\"d1\",\"vector\":{\"\\udc00\":4}}";
        Path file = write("{\"id\":\"d0\",\"vector\":{\"\\ud83d\\ude00\":3}}\n" + lone + "\n");

        try (JsonlVectorReader reader = new JsonlVectorReader(file)) {
            assertEquals(List.of("\ud83d\ude00"), List.copyOf(reader.next().vector().keySet()));
            JsonlParseException exception = assertThrows(JsonlParseException.class, reader::next);
            assertEquals(2, exception.getLineNumber());
            assertEquals(lone, exception.getLine());
        }
    }

    @Test
    @DisplayName("判断词项是否为合法 UTF-16")
    void testIsWellFormed() {
        assertTrue(JsonlVectorReader.isWellFormed("term"));
        assertTrue(JsonlVectorReader.isWellFormed("\ud83d\ude00x"));
        assertFalse(JsonlVectorReader.isWellFormed("\ud800"));
        assertFalse(JsonlVectorReader.isWellFormed("a\udc00"));
        assertFalse(JsonlVectorReader.isWellFormed("\ud800a"));
    }
}
