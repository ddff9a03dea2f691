package com.ciffbridge.jsonl;

import com.ciffbridge.ciff.CiffReader;
import com.ciffbridge.ciff.proto.DocRecord;
import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.ciff.proto.PostingsList;
import com.ciffbridge.config.JsonlToCiffOptions;
import com.ciffbridge.convert.ConversionSummary;
import com.ciffbridge.convert.ProgressListener;
import com.ciffbridge.error.CountOverflowException;
import com.ciffbridge.error.JsonlParseException;
import com.ciffbridge.error.QuantizationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonlToCiffConverterTest {

    @TempDir
    Path tempDir;

    private final JsonlToCiffConverter converter = new JsonlToCiffConverter(ProgressListener.NONE);

    private Path input(String... lines) throws IOException {
        Path file = tempDir.resolve("input.jsonl");
        Files.writeString(file, String.join("\n", lines) + "\n");
        return file;
    }

    @Test
    @DisplayName("量化: 最小正分数为1，最大为255，非正分数丢弃")
    void testQuantize() throws IOException {
        Path input = input(
            "{\"id\":\"a\",\"vector\":{\"y\":2.0,\"x\":0.5}}",
            "{\"id\":7,\"vector\":{\"x\":1.25,\"z\":-1.0,\"w\":0}}");
        Path output = tempDir.resolve("out.ciff");

        ConversionSummary summary = converter.convert(JsonlToCiffOptions.of(input, output, true));

        assertEquals(new ConversionSummary(2, 2, 384, false), summary);
        try (CiffReader reader = new CiffReader(output)) {
            Header header = reader.readHeader();
            assertEquals(2, header.getNumDocs());
            assertEquals(2, header.getNumPostingsLists());

            PostingsList x = reader.readPostingsList();
            assertEquals("x", x.getTerm());
            assertEquals(2, x.getDf());
            assertEquals(1, x.getPostings(0).getTf());
            assertEquals(1, x.getPostings(1).getDocid());
            assertEquals(128, x.getPostings(1).getTf());

            PostingsList y = reader.readPostingsList();
            assertEquals("y", y.getTerm());
            assertEquals(255, y.getPostings(0).getTf());

            DocRecord first = reader.readDocRecord();
            assertEquals("a", first.getCollectionDocid());
            assertEquals(256, first.getDoclength());
            DocRecord second = reader.readDocRecord();
            assertEquals(1, second.getDocid());
            assertEquals("7", second.getCollectionDocid());
            assertEquals(128, second.getDoclength());
        }
    }

    @Test
    @DisplayName("直通模式截断分数，结果非正时丢弃")
    void testPassThrough() throws IOException {
        Path input = input(
            "{\"id\":\"d0\",\"vector\":{\"b\":3.7,\"a\":0.4}}",
            "{\"id\":\"d1\",\"vector\":{\"b\":1}}");
        Path output = tempDir.resolve("out.ciff");

        ConversionSummary summary = converter.convert(JsonlToCiffOptions.of(input, output, false));

        assertEquals(new ConversionSummary(2, 1, 4, false), summary);
        try (CiffReader reader = new CiffReader(output)) {
            reader.readHeader();
            PostingsList b = reader.readPostingsList();
            assertEquals("b", b.getTerm());
            assertEquals(3, b.getPostings(0).getTf());
            assertEquals(4, b.getCf());
            assertEquals(3, reader.readDocRecord().getDoclength());
        }
    }

    @Test
    @DisplayName("没有正分数时量化失败")
    void testNoPositiveScores() throws IOException {
        Path input = input("{\"id\":\"a\",\"vector\":{\"x\":0,\"y\":-2}}");

        assertThrows(QuantizationException.class,
            () -> converter.convert(JsonlToCiffOptions.of(input, tempDir.resolve("out.ciff"), true)));
    }

    @Test
    @DisplayName("不支持的 id 类型报告行号")
    void testBadIdType() throws IOException {
        Path input = input(
            "{\"id\":\"a\",\"vector\":{\"x\":1}}",
            "{\"id\":{\"nested\":1},\"vector\":{\"x\":1}}");

        JsonlParseException exception = assertThrows(JsonlParseException.class,
            () -> converter.convert(JsonlToCiffOptions.of(input, tempDir.resolve("out.ciff"), false)));
        assertEquals(2, exception.getLineNumber());
    }

    @Test
    @DisplayName("重复文档ID报错")
    void testDuplicateId() throws IOException {
        Path input = input(
            "{\"id\":\"a\",\"vector\":{\"x\":1}}",
            "{\"id\":\"a\",\"vector\":{\"y\":1}}");

        assertThrows(JsonlParseException.class,
            () -> converter.convert(JsonlToCiffOptions.of(input, tempDir.resolve("out.ciff"), false)));
    }

    @Test
    @DisplayName("超出 int32 的词频报溢出")
    void testTermFrequencyOverflow() throws IOException {
        Path input = input("{\"id\":\"a\",\"vector\":{\"x\":1e12}}");

        assertThrows(CountOverflowException.class,
            () -> converter.convert(JsonlToCiffOptions.of(input, tempDir.resolve("out.ciff"), false)));
    }

    @Test
    @DisplayName("空输入生成零文档的 CIFF")
    void testEmptyInput() throws IOException {
        Path input = tempDir.resolve("empty.jsonl");
        Files.writeString(input, "");
        Path output = tempDir.resolve("out.ciff");

        ConversionSummary summary = converter.convert(JsonlToCiffOptions.of(input, output, false));

        assertEquals(new ConversionSummary(0, 0, 0, false), summary);
        try (CiffReader reader = new CiffReader(output)) {
            assertEquals(0.0, reader.readHeader().getAverageDoclength());
        }
    }

    @Test
    @DisplayName("量化位数越界时拒绝")
    void testInvalidBits() throws IOException {
        Path input = input("{\"id\":\"a\",\"vector\":{\"x\":1}}");

        assertThrows(IllegalArgumentException.class, () -> converter.convert(
            new JsonlToCiffOptions(input, tempDir.resolve("out.ciff"), true, 17, null)));
    }

    @Test
    @DisplayName("不同的未配对代理字符词项不会合并到同一倒排列表")
    void testLoneSurrogateTermsRejected() throws IOException {
        Path input = input(
            "{\"id\":\"d0\",\"vector\":{\"\\ud800\":3}}",
            "{\"id\":\"d1\",\"vector\":{\"\\udc00\":4}}");

        JsonlParseException exception = assertThrows(JsonlParseException.class,
            () -> converter.convert(JsonlToCiffOptions.of(input, tempDir.resolve("out.ciff"), false)));
        assertEquals(1, exception.getLineNumber());
    }
}
