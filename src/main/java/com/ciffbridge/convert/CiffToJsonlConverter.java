package com.ciffbridge.convert;

import com.ciffbridge.ciff.CiffHeaders;
import com.ciffbridge.ciff.CiffReader;
import com.ciffbridge.ciff.proto.DocRecord;
import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.ciff.proto.Posting;
import com.ciffbridge.ciff.proto.PostingsList;
import com.ciffbridge.config.CiffToJsonlOptions;
import com.ciffbridge.error.InvalidFormatException;
import com.ciffbridge.error.OrderingViolationException;
import com.ciffbridge.storage.DeltaCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CIFF → JSONL：每个文档一行 {"id": 外部ID, "vector": {词项: 词频}}。
 *
 * 倒排按词项组织，需在内存中重建每个文档的词项表，适合中小规模集合。
 */
public final class CiffToJsonlConverter {
    private static final Logger logger = LoggerFactory.getLogger(CiffToJsonlConverter.class);
    private static final String POSTINGS_STAGE = "读取倒排列表";
    private static final String DOCUMENTS_STAGE = "写出文档向量";

    private final ObjectMapper objectMapper;
    private final ProgressListener progress;

    public CiffToJsonlConverter() {
        this(new LoggingProgressListener());
    }

    public CiffToJsonlConverter(ProgressListener progress) {
        this.objectMapper = new ObjectMapper();
        this.progress = progress == null ? ProgressListener.NONE : progress;
    }

    /**
     * 执行转换。
     *
     * @param options 转换配置
     * @return 转换统计
     * @throws IOException 读写失败时抛出
     */
    public ConversionSummary convert(CiffToJsonlOptions options) throws IOException {
        options.validate();
        try (CiffReader reader = new CiffReader(options.input())) {
            Header header = reader.readHeader();
            logger.info("{}{}", System.lineSeparator(), CiffHeaders.describe(header));
            int documentCount = PostingsTranslator.toUnsignedCount(header.getNumDocs(), "num_docs");
            int postingsListCount = PostingsTranslator.toUnsignedCount(header.getNumPostingsLists(), "num_postings_lists");

            List<Map<String, Integer>> vectors = readVectors(reader, documentCount, postingsListCount);
            long totalTerms = writeDocuments(reader, vectors, options);
            return new ConversionSummary(documentCount, postingsListCount, totalTerms, false);
        }
    }

    private List<Map<String, Integer>> readVectors(CiffReader reader, int documentCount, int postingsListCount)
        throws IOException {
        List<Map<String, Integer>> vectors = new ArrayList<>(documentCount);
        for (int docId = 0; docId < documentCount; docId++) {
            vectors.add(new LinkedHashMap<>());
        }
        progress.onStart(POSTINGS_STAGE, postingsListCount);
        for (int index = 0; index < postingsListCount; index++) {
            PostingsList postingsList = reader.readPostingsList();
            long docId = 0;
            for (int position = 0; position < postingsList.getPostingsCount(); position++) {
                Posting posting = postingsList.getPostings(position);
                docId = DeltaCodec.accumulate(docId, posting.getDocid(), position);
                if (docId >= documentCount) {
                    throw new InvalidFormatException(
                        "posting 的 docid 超出文档数: term=" + postingsList.getTerm() + ", docid=" + docId + ", docs=" + documentCount);
                }
                vectors.get((int) docId).put(postingsList.getTerm(), posting.getTf());
            }
            progress.onAdvance(POSTINGS_STAGE, index + 1L);
        }
        progress.onFinish(POSTINGS_STAGE, postingsListCount);
        return vectors;
    }

    private long writeDocuments(CiffReader reader, List<Map<String, Integer>> vectors, CiffToJsonlOptions options)
        throws IOException {
        long totalTerms = 0;
        int documentCount = vectors.size();
        progress.onStart(DOCUMENTS_STAGE, documentCount);
        try (BufferedWriter writer = Files.newBufferedWriter(options.output(), StandardCharsets.UTF_8)) {
            for (int docsSeen = 0; docsSeen < documentCount; docsSeen++) {
                DocRecord docRecord = reader.readDocRecord();
                if (docRecord.getDocid() != docsSeen) {
                    throw new OrderingViolationException(docsSeen, docRecord.getDocid());
                }
                totalTerms += PostingsTranslator.toUnsignedCount(docRecord.getDoclength(), "doclength");

                ObjectNode line = objectMapper.createObjectNode();
                line.put("id", docRecord.getCollectionDocid());
                ObjectNode vector = line.putObject("vector");
                vectors.get(docsSeen).forEach((term, tf) -> vector.put(term, tf.intValue()));
                writer.write(objectMapper.writeValueAsString(line));
                writer.write('\n');
                // 已写出的文档向量不再需要
                vectors.set(docsSeen, null);
                progress.onAdvance(DOCUMENTS_STAGE, docsSeen + 1L);
            }
        }
        progress.onFinish(DOCUMENTS_STAGE, documentCount);
        return totalTerms;
    }
}
