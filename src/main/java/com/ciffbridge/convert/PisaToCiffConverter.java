package com.ciffbridge.convert;

import com.ciffbridge.ciff.CiffHeaders;
import com.ciffbridge.ciff.CiffWriter;
import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.config.PisaPaths;
import com.ciffbridge.config.PisaToCiffOptions;
import com.ciffbridge.error.InvalidFormatException;
import com.ciffbridge.storage.BinaryCollection;
import com.ciffbridge.storage.BinarySequence;
import com.ciffbridge.storage.SequenceCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * PISA 非压缩二进制集合 → CIFF。
 *
 * 三个二进制文件只读映射；第一遍只数 .docs 中的序列条数以填写头部，第二遍与 .freqs、.terms
 * 逐条对齐输出倒排列表，最后按 .sizes 与文档ID文本输出文档记录。
 */
public final class PisaToCiffConverter {
    private static final Logger logger = LoggerFactory.getLogger(PisaToCiffConverter.class);
    private static final String POSTINGS_STAGE = "写出倒排列表";
    private static final String DOCUMENTS_STAGE = "写出文档记录";

    private final ProgressListener progress;

    public PisaToCiffConverter() {
        this(new LoggingProgressListener());
    }

    public PisaToCiffConverter(ProgressListener progress) {
        this.progress = progress == null ? ProgressListener.NONE : progress;
    }

    /**
     * 执行转换。
     *
     * @param options 转换配置
     * @return 转换统计
     * @throws IOException 读写失败时抛出
     * @throws InvalidFormatException 集合结构损坏或与文本文件不一致时抛出
     */
    public ConversionSummary convert(PisaToCiffOptions options) throws IOException {
        options.validate();
        PisaPaths paths = new PisaPaths(options.collectionBasename());
        ByteBuffer documents = SequenceCodec.map(paths.docs());
        ByteBuffer frequencies = SequenceCodec.map(paths.freqs());
        ByteBuffer sizes = SequenceCodec.map(paths.sizes());

        int documentCount = readDocumentCount(BinaryCollection.of(documents));
        int postingsListCount = countPostingsLists(BinaryCollection.of(documents));
        BinarySequence documentLengths = readDocumentLengths(BinaryCollection.of(sizes), documentCount);
        long totalTerms = documentLengths.sum();

        Header header = PostingsTranslator.buildHeader(
            documentCount, postingsListCount, totalTerms, options.descriptionOrEmpty());
        logger.info("{}{}", System.lineSeparator(), CiffHeaders.describe(header));

        try (CiffWriter writer = new CiffWriter(options.output())) {
            writer.writeHeader(header);
            writePostings(writer, BinaryCollection.of(documents), BinaryCollection.of(frequencies),
                options.termsPath(), postingsListCount);
            writeDocRecords(writer, documentLengths, options.titlesPath());
        }
        return new ConversionSummary(documentCount, postingsListCount, totalTerms, false);
    }

    /**
     * .docs 以单元素序列 [文档数] 开头。
     */
    private static int readDocumentCount(BinaryCollection documents) {
        if (!documents.hasNext()) {
            throw new InvalidFormatException("文档集合为空，缺少文档数序列");
        }
        BinarySequence first = documents.next();
        if (first.length() != 1) {
            throw new InvalidFormatException("文档数序列长度应为1，实际为 " + Integer.toUnsignedString(first.length()));
        }
        return PostingsTranslator.toUnsignedCount(Integer.toUnsignedLong(first.at(0)), "num_docs");
    }

    private static int countPostingsLists(BinaryCollection documents) {
        documents.next();
        long count = 0;
        while (documents.hasNext()) {
            documents.next();
            count++;
        }
        return PostingsTranslator.toUnsignedCount(count, "num_postings_lists");
    }

    private static BinarySequence readDocumentLengths(BinaryCollection sizes, int documentCount) {
        if (!sizes.hasNext()) {
            throw new InvalidFormatException("文档长度集合为空");
        }
        BinarySequence lengths = sizes.next();
        if (lengths.length() != documentCount) {
            throw new InvalidFormatException(
                "文档长度序列与文档数不一致: sizes=" + Integer.toUnsignedString(lengths.length()) + ", docs=" + documentCount);
        }
        return lengths;
    }

    private void writePostings(
        CiffWriter writer,
        BinaryCollection documents,
        BinaryCollection frequencies,
        Path termsPath,
        int postingsListCount
    ) throws IOException {
        documents.next();
        progress.onStart(POSTINGS_STAGE, postingsListCount);
        try (BufferedReader terms = Files.newBufferedReader(termsPath, StandardCharsets.UTF_8)) {
            for (int index = 0; index < postingsListCount; index++) {
                if (!frequencies.hasNext()) {
                    throw new InvalidFormatException("词频集合的序列少于文档集合: 缺少第 " + index + " 条");
                }
                String term = terms.readLine();
                if (term == null) {
                    throw new InvalidFormatException("词项文件行数少于倒排列表数: " + termsPath + ", 行号=" + (index + 1));
                }
                writer.writePostingsList(PostingsTranslator.toPostingsList(term, documents.next(), frequencies.next()));
                progress.onAdvance(POSTINGS_STAGE, index + 1L);
            }
            if (frequencies.hasNext()) {
                throw new InvalidFormatException("词频集合的序列多于文档集合");
            }
            if (terms.readLine() != null) {
                throw new InvalidFormatException("词项文件行数多于倒排列表数: " + termsPath);
            }
        }
        progress.onFinish(POSTINGS_STAGE, postingsListCount);
    }

    private void writeDocRecords(CiffWriter writer, BinarySequence documentLengths, Path titlesPath)
        throws IOException {
        int documentCount = documentLengths.length();
        progress.onStart(DOCUMENTS_STAGE, documentCount);
        try (BufferedReader titles = Files.newBufferedReader(titlesPath, StandardCharsets.UTF_8)) {
            for (int docId = 0; docId < documentCount; docId++) {
                String title = titles.readLine();
                if (title == null) {
                    throw new InvalidFormatException("文档ID文件行数少于文档数: " + titlesPath + ", 行号=" + (docId + 1));
                }
                writer.writeDocRecord(PostingsTranslator.toDocRecord(docId, title, documentLengths.at(docId)));
                progress.onAdvance(DOCUMENTS_STAGE, docId + 1L);
            }
            if (titles.readLine() != null) {
                throw new InvalidFormatException("文档ID文件行数多于文档数: " + titlesPath);
            }
        }
        progress.onFinish(DOCUMENTS_STAGE, documentCount);
    }
}
