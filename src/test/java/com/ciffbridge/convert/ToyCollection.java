package com.ciffbridge.convert;

import com.ciffbridge.ciff.CiffWriter;
import com.ciffbridge.storage.SequenceCodec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 三文档、九词项的小型测试集合，以及它对应的 PISA 字节内容。
 */
public final class ToyCollection {
    public static final List<String> TITLES = List.of("WSJ_1", "TREC_DOC_1", "DOC222");
    public static final int[] SIZES = {6, 4, 6};
    public static final List<String> TERMS = List.of(
        "01", "03", "30", "content", "enough", "head", "simpl", "text", "veri");
    public static final int[][] DOCS = {
        {0}, {0}, {0}, {0}, {2}, {0, 1, 2}, {1, 2}, {0, 1, 2}, {1}
    };
    public static final int[][] FREQS = {
        {1}, {1}, {1}, {1}, {1}, {1, 1, 1}, {1, 1}, {1, 1, 3}, {1}
    };
    public static final long TOTAL_TERMS = 16;

    private ToyCollection() {
        // 工具类，禁止实例化
    }

    /**
     * 写出测试集合的 CIFF 文件。
     */
    public static Path writeCiff(Path file) throws IOException {
        try (CiffWriter writer = new CiffWriter(file)) {
            writer.writeHeader(PostingsTranslator.buildHeader(TITLES.size(), TERMS.size(), TOTAL_TERMS, ""));
            for (int index = 0; index < TERMS.size(); index++) {
                writer.writePostingsList(PostingsTranslator.toPostingsList(TERMS.get(index), DOCS[index], FREQS[index]));
            }
            for (int docId = 0; docId < TITLES.size(); docId++) {
                writer.writeDocRecord(PostingsTranslator.toDocRecord(docId, TITLES.get(docId), SIZES[docId]));
            }
        }
        return file;
    }

    public static byte[] expectedDocs() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        SequenceCodec.writeSequence(out, new int[] {TITLES.size()});
        for (int[] docs : DOCS) {
            SequenceCodec.writeSequence(out, docs);
        }
        return out.toByteArray();
    }

    public static byte[] expectedFreqs() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int[] freqs : FREQS) {
            SequenceCodec.writeSequence(out, freqs);
        }
        return out.toByteArray();
    }

    public static byte[] expectedSizes() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        SequenceCodec.writeSequence(out, SIZES);
        return out.toByteArray();
    }

    public static String lines(List<String> values) {
        StringBuilder builder = new StringBuilder();
        for (String value : values) {
            builder.append(value).append('\n');
        }
        return builder.toString();
    }
}
