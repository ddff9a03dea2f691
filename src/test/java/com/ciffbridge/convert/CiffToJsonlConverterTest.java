package com.ciffbridge.convert;

import com.ciffbridge.config.CiffToJsonlOptions;
import com.ciffbridge.config.JsonlToCiffOptions;
import com.ciffbridge.jsonl.JsonlToCiffConverter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CiffToJsonlConverterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("每个文档输出一行向量，按 docid 排列")
    void testToyCollectionToJsonl() throws IOException {
        Path ciff = ToyCollection.writeCiff(tempDir.resolve("toy.ciff"));
        Path output = tempDir.resolve("toy.jsonl");

        ConversionSummary summary = new CiffToJsonlConverter(ProgressListener.NONE)
            .convert(new CiffToJsonlOptions(ciff, output));

        assertEquals(3, summary.documents());
        assertEquals(16, summary.totalTerms());
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());

        JsonNode first = objectMapper.readTree(lines.get(0));
        assertEquals("WSJ_1", first.get("id").asText());
        assertEquals(6, first.get("vector").size());
        assertEquals(1, first.get("vector").get("content").asInt());

        JsonNode last = objectMapper.readTree(lines.get(2));
        assertEquals("DOC222", last.get("id").asText());
        assertEquals(3, last.get("vector").get("text").asInt());
        assertFalse(last.get("vector").has("01"));
    }

    @Test
    @DisplayName("CIFF → JSONL → CIFF 保持倒排内容")
    void testJsonlRoundTrip() throws IOException {
        Path ciff = ToyCollection.writeCiff(tempDir.resolve("toy.ciff"));
        Path jsonl = tempDir.resolve("toy.jsonl");
        Path back = tempDir.resolve("back.ciff");

        new CiffToJsonlConverter(ProgressListener.NONE).convert(new CiffToJsonlOptions(ciff, jsonl));
        new JsonlToCiffConverter(ProgressListener.NONE).convert(JsonlToCiffOptions.of(jsonl, back, false));

        assertArrayEquals(Files.readAllBytes(ciff), Files.readAllBytes(back));
    }
}
