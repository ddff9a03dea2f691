package com.ciffbridge.convert;

import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.ciff.proto.Posting;
import com.ciffbridge.ciff.proto.PostingsList;
import com.ciffbridge.error.CountOverflowException;
import com.ciffbridge.error.InvalidFormatException;
import com.ciffbridge.storage.BinaryCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostingsTranslatorTest {

    private static PostingsList postingsList(String term, long df, int[] deltas, int[] tfs) {
        PostingsList.Builder builder = PostingsList.newBuilder().setTerm(term).setDf(df).setCf(0);
        for (int index = 0; index < deltas.length; index++) {
            builder.addPostings(Posting.newBuilder().setDocid(deltas[index]).setTf(tfs[index]));
        }
        return builder.build();
    }

    @Test
    @DisplayName("CIFF 差值展开为绝对 docid 写出")
    void testWritePostingsListExpandsDeltas() throws IOException {
        ByteArrayOutputStream documents = new ByteArrayOutputStream();
        ByteArrayOutputStream frequencies = new ByteArrayOutputStream();
        StringWriter terms = new StringWriter();

        PostingsTranslator.writePostingsList(
            postingsList("text", 3, new int[] {0, 1, 1}, new int[] {1, 1, 3}), documents, frequencies, terms);

        List<int[]> docs = BinaryCollection.of(documents.toByteArray()).readAll();
        List<int[]> freqs = BinaryCollection.of(frequencies.toByteArray()).readAll();
        assertArrayEquals(new int[] {0, 1, 2}, docs.get(0));
        assertArrayEquals(new int[] {1, 1, 3}, freqs.get(0));
        assertEquals("text\n", terms.toString());
    }

    @Test
    @DisplayName("df 与 posting 数不一致时拒绝")
    void testDfMismatchRejected() {
        PostingsList list = postingsList("head", 2, new int[] {0}, new int[] {1});

        assertThrows(InvalidFormatException.class, () -> PostingsTranslator.writePostingsList(
            list, new ByteArrayOutputStream(), new ByteArrayOutputStream(), new StringWriter()));
    }

    @Test
    @DisplayName("含换行的词项无法写入文本文件")
    void testTermWithNewlineRejected() {
        PostingsList list = postingsList("a\nb", 1, new int[] {0}, new int[] {1});

        assertThrows(InvalidFormatException.class, () -> PostingsTranslator.writePostingsList(
            list, new ByteArrayOutputStream(), new ByteArrayOutputStream(), new StringWriter()));
    }

    @ParameterizedTest
    @ValueSource(longs = {-1L, 1L << 31, Long.MAX_VALUE})
    @DisplayName("无法表示为非负 int 的计数抛出溢出异常")
    void testCountOverflow(long value) {
        CountOverflowException exception = assertThrows(CountOverflowException.class,
            () -> PostingsTranslator.toUnsignedCount(value, "num_docs"));
        assertEquals("num_docs", exception.getField());
        assertEquals(value, exception.getValue());
    }

    @Test
    @DisplayName("由绝对 docid 构造倒排列表，cf 为词频和")
    void testToPostingsList() {
        PostingsList list = PostingsTranslator.toPostingsList("text", new int[] {0, 1, 2}, new int[] {1, 1, 3});

        assertEquals("text", list.getTerm());
        assertEquals(3, list.getDf());
        assertEquals(5, list.getCf());
        assertEquals(0, list.getPostings(0).getDocid());
        assertEquals(1, list.getPostings(1).getDocid());
        assertEquals(1, list.getPostings(2).getDocid());
        assertEquals(3, list.getPostings(2).getTf());
    }

    @Test
    @DisplayName("超出 int32 的 docid 或词频无法写入 CIFF")
    void testToPostingsListOverflow() {
        assertThrows(CountOverflowException.class,
            () -> PostingsTranslator.toPostingsList("x", new int[] {-1}, new int[] {1}));
        assertThrows(CountOverflowException.class,
            () -> PostingsTranslator.toPostingsList("x", new int[] {0}, new int[] {-5}));
    }

    @Test
    @DisplayName("头部本文件计数与全局计数相同")
    void testBuildHeader() {
        Header header = PostingsTranslator.buildHeader(3, 9, 16, "toy");

        assertEquals(1, header.getVersion());
        assertEquals(3, header.getNumDocs());
        assertEquals(3, header.getTotalDocs());
        assertEquals(9, header.getNumPostingsLists());
        assertEquals(9, header.getTotalPostingsLists());
        assertEquals(16, header.getTotalTermsInCollection());
        assertEquals(16.0 / 3, header.getAverageDoclength(), 1e-9);
        assertEquals("toy", header.getDescription());
    }

    @Test
    @DisplayName("零文档时平均长度为0")
    void testAverageDocLengthWithoutDocuments() {
        assertEquals(0.0, PostingsTranslator.averageDocLength(0, 0));
        assertEquals(0.0, PostingsTranslator.buildHeader(0, 0, 0, null).getAverageDoclength());
    }
}
