package com.ciffbridge.jsonl;

import com.ciffbridge.ciff.CiffHeaders;
import com.ciffbridge.ciff.CiffWriter;
import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.config.JsonlToCiffOptions;
import com.ciffbridge.convert.ConversionSummary;
import com.ciffbridge.convert.LoggingProgressListener;
import com.ciffbridge.convert.PostingsTranslator;
import com.ciffbridge.convert.ProgressListener;
import com.ciffbridge.error.CountOverflowException;
import com.ciffbridge.error.JsonlParseException;
import com.ciffbridge.reorder.TermOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSONL 文档向量 → CIFF。
 *
 * 文档按首次出现顺序分配连续内部ID，倒排在内存中按词项聚合，输出时词项按 UTF-8 字节序排列，
 * 文档记录按内部ID排列。量化模式需要先扫描一遍输入统计正分数范围。
 */
public final class JsonlToCiffConverter {
    private static final Logger logger = LoggerFactory.getLogger(JsonlToCiffConverter.class);
    private static final String RANGE_STAGE = "统计分数范围";
    private static final String READ_STAGE = "读取文档向量";
    private static final String POSTINGS_STAGE = "写出倒排列表";

    private final ProgressListener progress;

    public JsonlToCiffConverter() {
        this(new LoggingProgressListener());
    }

    public JsonlToCiffConverter(ProgressListener progress) {
        this.progress = progress == null ? ProgressListener.NONE : progress;
    }

    /**
     * 执行转换。
     *
     * @param options 转换配置
     * @return 转换统计
     * @throws IOException 读写失败时抛出
     * @throws JsonlParseException 输入行非法或文档ID重复时抛出
     */
    public ConversionSummary convert(JsonlToCiffOptions options) throws IOException {
        options.validate();
        ScoreQuantizer quantizer = null;
        if (options.quantize()) {
            quantizer = ScoreQuantizer.fromRange(scanRange(options.input()), options.quantizationBits());
            logger.info("量化到 [1, {}]", quantizer.maxLevel());
        }

        Map<String, TermPostings> postings = new TreeMap<>(TermOrder.COMPARATOR);
        List<String> collectionDocIds = new ArrayList<>();
        List<Integer> documentLengths = new ArrayList<>();
        long totalTerms = readDocuments(options.input(), quantizer, postings, collectionDocIds, documentLengths);

        int documentCount = collectionDocIds.size();
        Header header = PostingsTranslator.buildHeader(
            documentCount, postings.size(), totalTerms, options.descriptionOrEmpty());
        logger.info("{}{}", System.lineSeparator(), CiffHeaders.describe(header));

        try (CiffWriter writer = new CiffWriter(options.output())) {
            writer.writeHeader(header);
            progress.onStart(POSTINGS_STAGE, postings.size());
            long written = 0;
            for (Map.Entry<String, TermPostings> entry : postings.entrySet()) {
                TermPostings termPostings = entry.getValue();
                writer.writePostingsList(PostingsTranslator.toPostingsList(
                    entry.getKey(), termPostings.docIds(), termPostings.termFreqs()));
                progress.onAdvance(POSTINGS_STAGE, ++written);
            }
            progress.onFinish(POSTINGS_STAGE, written);
            for (int docId = 0; docId < documentCount; docId++) {
                writer.writeDocRecord(PostingsTranslator.toDocRecord(
                    docId, collectionDocIds.get(docId), documentLengths.get(docId)));
            }
        }
        return new ConversionSummary(documentCount, postings.size(), totalTerms, false);
    }

    private ScoreQuantizer.ScoreRange scanRange(Path input) throws IOException {
        ScoreQuantizer.ScoreRange range = new ScoreQuantizer.ScoreRange();
        progress.onStart(RANGE_STAGE, -1);
        long documents = 0;
        try (JsonlVectorReader reader = new JsonlVectorReader(input)) {
            JsonlDocument document;
            while ((document = reader.next()) != null) {
                document.vector().values().forEach(range::accept);
                progress.onAdvance(RANGE_STAGE, ++documents);
            }
        }
        progress.onFinish(RANGE_STAGE, documents);
        logger.info("正分数范围: min={}, max={}, count={}", range.min(), range.max(), range.count());
        return range;
    }

    /**
     * 读取全部文档并按词项聚合倒排。文档长度为保留词项的词频之和，返回全部文档长度之和。
     */
    private long readDocuments(
        Path input,
        ScoreQuantizer quantizer,
        Map<String, TermPostings> postings,
        List<String> collectionDocIds,
        List<Integer> documentLengths
    ) throws IOException {
        Map<String, Integer> seenIds = new HashMap<>();
        long totalTerms = 0;
        progress.onStart(READ_STAGE, -1);
        try (JsonlVectorReader reader = new JsonlVectorReader(input)) {
            JsonlDocument document;
            while ((document = reader.next()) != null) {
                int docId = collectionDocIds.size();
                Integer previous = seenIds.putIfAbsent(document.id(), docId);
                if (previous != null) {
                    throw new JsonlParseException(
                        "文档ID重复: id=" + document.id() + ", 首次内部ID=" + previous, document.lineNumber(), document.line());
                }
                long length = 0;
                for (Map.Entry<String, Double> entry : document.vector().entrySet()) {
                    int termFreq = toTermFreq(entry.getValue(), quantizer);
                    if (termFreq <= 0) {
                        continue;
                    }
                    postings.computeIfAbsent(entry.getKey(), term -> new TermPostings()).add(docId, termFreq);
                    length += termFreq;
                }
                collectionDocIds.add(document.id());
                documentLengths.add(PostingsTranslator.toUnsignedCount(length, "doclength"));
                totalTerms += length;
                progress.onAdvance(READ_STAGE, docId + 1L);
            }
        }
        progress.onFinish(READ_STAGE, collectionDocIds.size());
        return totalTerms;
    }

    /**
     * 量化模式按区间映射；直通模式截断为整数，非正结果返回0表示丢弃。
     */
    static int toTermFreq(double score, ScoreQuantizer quantizer) {
        if (quantizer != null) {
            return quantizer.quantize(score);
        }
        long truncated = (long) score;
        if (truncated <= 0) {
            return 0;
        }
        if (truncated > Integer.MAX_VALUE) {
            throw new CountOverflowException("tf", truncated);
        }
        return (int) truncated;
    }
}
