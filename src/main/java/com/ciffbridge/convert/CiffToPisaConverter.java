package com.ciffbridge.convert;

import com.ciffbridge.ciff.CiffHeaders;
import com.ciffbridge.ciff.CiffReader;
import com.ciffbridge.ciff.proto.DocRecord;
import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.config.CiffToPisaOptions;
import com.ciffbridge.config.Constants;
import com.ciffbridge.config.PisaPaths;
import com.ciffbridge.error.OrderingViolationException;
import com.ciffbridge.reorder.TermReorderer;
import com.ciffbridge.storage.PayloadVector;
import com.ciffbridge.storage.SequenceCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CIFF → PISA 非压缩二进制集合。
 *
 * 文档总数在写任何文件前从头部取得，因此 .docs 的首条单元素序列一次写定，无需回填。
 * 写完后若 .terms 未按字典序排列则调用 {@link TermReorderer} 重排。
 */
public final class CiffToPisaConverter {
    private static final Logger logger = LoggerFactory.getLogger(CiffToPisaConverter.class);
    private static final String POSTINGS_STAGE = "处理倒排列表";
    private static final String DOCUMENTS_STAGE = "处理文档长度";

    private final ProgressListener progress;

    public CiffToPisaConverter() {
        this(new LoggingProgressListener());
    }

    public CiffToPisaConverter(ProgressListener progress) {
        this.progress = progress == null ? ProgressListener.NONE : progress;
    }

    /**
     * 执行转换。失败时已写出的文件不可用。
     *
     * @param options 转换配置
     * @return 转换统计
     * @throws IOException 读写失败时抛出
     */
    public ConversionSummary convert(CiffToPisaOptions options) throws IOException {
        options.validate();
        PisaPaths paths = new PisaPaths(options.outputBasename());

        int documentCount;
        int postingsListCount;
        long totalTerms = 0;
        try (CiffReader reader = new CiffReader(options.input())) {
            Header header = reader.readHeader();
            logger.info("{}{}", System.lineSeparator(), CiffHeaders.describe(header));
            documentCount = PostingsTranslator.toUnsignedCount(header.getNumDocs(), "num_docs");
            postingsListCount = PostingsTranslator.toUnsignedCount(header.getNumPostingsLists(), "num_postings_lists");

            writePostings(reader, paths, documentCount, postingsListCount);
            totalTerms = writeDocuments(reader, paths, documentCount);
        }

        boolean reordered = false;
        if (!TermReorderer.isSorted(paths.terms())) {
            logger.warn("词项未按字典序排列，开始重排: {}", paths.terms());
            new TermReorderer(progress).reorder(paths);
            reordered = true;
        }

        if (options.generateLexicons()) {
            PayloadVector.buildLexicon(paths.terms(), paths.termLexicon());
            PayloadVector.buildLexicon(paths.documents(), paths.docLexicon());
            logger.info("已生成词典: {}, {}", paths.termLexicon(), paths.docLexicon());
        }
        return new ConversionSummary(documentCount, postingsListCount, totalTerms, reordered);
    }

    private void writePostings(CiffReader reader, PisaPaths paths, int documentCount, int postingsListCount)
        throws IOException {
        try (OutputStream documents = openBinary(paths.docs());
             OutputStream frequencies = openBinary(paths.freqs());
             BufferedWriter terms = Files.newBufferedWriter(paths.terms(), StandardCharsets.UTF_8)) {
            SequenceCodec.writeSequence(documents, new int[] {documentCount});
            progress.onStart(POSTINGS_STAGE, postingsListCount);
            for (int index = 0; index < postingsListCount; index++) {
                PostingsTranslator.writePostingsList(reader.readPostingsList(), documents, frequencies, terms);
                progress.onAdvance(POSTINGS_STAGE, index + 1L);
            }
            progress.onFinish(POSTINGS_STAGE, postingsListCount);
        }
    }

    /**
     * 写出 .sizes 与 .documents，返回文档长度总和。
     */
    private long writeDocuments(CiffReader reader, PisaPaths paths, int documentCount) throws IOException {
        long totalTerms = 0;
        try (OutputStream sizes = openBinary(paths.sizes());
             BufferedWriter titles = Files.newBufferedWriter(paths.documents(), StandardCharsets.UTF_8)) {
            SequenceCodec.writeIntLE(sizes, documentCount);
            progress.onStart(DOCUMENTS_STAGE, documentCount);
            for (int docsSeen = 0; docsSeen < documentCount; docsSeen++) {
                DocRecord docRecord = reader.readDocRecord();
                if (docRecord.getDocid() != docsSeen) {
                    throw new OrderingViolationException(docsSeen, docRecord.getDocid());
                }
                int length = PostingsTranslator.toUnsignedCount(docRecord.getDoclength(), "doclength");
                PostingsTranslator.requireSingleLine(docRecord.getCollectionDocid(), "collection_docid");
                SequenceCodec.writeIntLE(sizes, length);
                titles.write(docRecord.getCollectionDocid());
                titles.write('\n');
                totalTerms += length;
                progress.onAdvance(DOCUMENTS_STAGE, docsSeen + 1L);
            }
            progress.onFinish(DOCUMENTS_STAGE, documentCount);
        }
        return totalTerms;
    }

    private static OutputStream openBinary(Path file) throws IOException {
        try {
            return new BufferedOutputStream(Files.newOutputStream(file), Constants.WRITE_BUFFER_SIZE);
        } catch (IOException exception) {
            throw new IOException("无法创建输出文件: " + file, exception);
        }
    }
}
