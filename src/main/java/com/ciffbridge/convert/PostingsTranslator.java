package com.ciffbridge.convert;

import com.ciffbridge.ciff.proto.DocRecord;
import com.ciffbridge.ciff.proto.Header;
import com.ciffbridge.ciff.proto.Posting;
import com.ciffbridge.ciff.proto.PostingsList;
import com.ciffbridge.config.Constants;
import com.ciffbridge.error.CountOverflowException;
import com.ciffbridge.error.InvalidFormatException;
import com.ciffbridge.storage.BinarySequence;
import com.ciffbridge.storage.DeltaCodec;
import com.ciffbridge.storage.SequenceCodec;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;

/**
 * CIFF 消息与 PISA 二进制集合之间的倒排翻译。
 *
 * CIFF 侧每个 posting 存 docid 差值（首个为绝对值），PISA 侧 .docs 存绝对 docid，
 * .freqs 存与之逐位对齐的词频。
 */
public final class PostingsTranslator {
    private PostingsTranslator() {
    }

    // ==================== CIFF → PISA ====================

    /**
     * 将 CIFF 中的有符号计数转换为引擎使用的非负计数。
     *
     * @param value 原始值
     * @param field 字段名，用于错误消息
     * @return 非负 int 计数
     * @throws CountOverflowException 值为负或超出可寻址范围时抛出
     */
    public static int toUnsignedCount(long value, String field) {
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new CountOverflowException(field, value);
        }
        return (int) value;
    }

    /**
     * 写出一条倒排列表：.docs 与 .freqs 各一条序列，.terms 一行。
     *
     * @param postingsList CIFF 倒排列表
     * @param documents .docs 输出
     * @param frequencies .freqs 输出
     * @param terms .terms 输出
     * @throws IOException 写入失败时抛出
     * @throws InvalidFormatException df 与 posting 数不一致、差值为负或词频为负时抛出
     */
    public static void writePostingsList(
        PostingsList postingsList,
        OutputStream documents,
        OutputStream frequencies,
        Writer terms
    ) throws IOException {
        String term = postingsList.getTerm();
        int length = toUnsignedCount(postingsList.getDf(), "df");
        if (length != postingsList.getPostingsCount()) {
            throw new InvalidFormatException(
                "df 与 posting 数不一致: term=" + term + ", df=" + length + ", postings=" + postingsList.getPostingsCount());
        }
        requireSingleLine(term, "term");

        int[] docIds = new int[length];
        int[] termFreqs = new int[length];
        long current = 0;
        for (int index = 0; index < length; index++) {
            Posting posting = postingsList.getPostings(index);
            current = DeltaCodec.accumulate(current, posting.getDocid(), index);
            docIds[index] = (int) current;
            if (posting.getTf() < 0) {
                throw new InvalidFormatException("Negative frequency: term=" + term + ", position=" + index + ", tf=" + posting.getTf());
            }
            termFreqs[index] = posting.getTf();
        }

        SequenceCodec.writeSequence(documents, docIds);
        SequenceCodec.writeSequence(frequencies, termFreqs);
        terms.write(term);
        terms.write('\n');
    }

    /**
     * 校验文本侧文件中的一行内容不含换行。
     */
    static void requireSingleLine(String value, String field) {
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new InvalidFormatException(field + " 不能包含换行符: " + value.replace("\n", "\\n").replace("\r", "\\r"));
        }
    }

    // ==================== PISA → CIFF ====================

    /**
     * 由 .docs 与 .freqs 的对齐序列构造 CIFF 倒排列表。
     *
     * @param term 词项
     * @param documents 绝对 docid 序列
     * @param frequencies 词频序列
     * @return CIFF 倒排列表，df 为元素个数，cf 为词频和
     * @throws InvalidFormatException 两条序列长度不一致或 docid 非严格递增时抛出
     */
    public static PostingsList toPostingsList(String term, BinarySequence documents, BinarySequence frequencies) {
        if (documents.length() != frequencies.length()) {
            throw new InvalidFormatException(
                "docs 与 freqs 序列长度不一致: term=" + term + ", docs=" + documents.length() + ", freqs=" + frequencies.length());
        }
        return toPostingsList(term, documents.toArray(), frequencies.toArray());
    }

    /**
     * 由绝对 docid 与词频数组构造 CIFF 倒排列表。
     *
     * @param term 词项
     * @param docIds 严格递增的绝对 docid（无符号解释）
     * @param termFreqs 与 docIds 对齐的词频（无符号解释）
     * @return CIFF 倒排列表
     */
    public static PostingsList toPostingsList(String term, int[] docIds, int[] termFreqs) {
        if (docIds.length != termFreqs.length) {
            throw new IllegalArgumentException("docIds 与 termFreqs 长度不一致: " + docIds.length + " vs " + termFreqs.length);
        }
        int[] deltas = DeltaCodec.encode(docIds);
        PostingsList.Builder builder = PostingsList.newBuilder()
            .setTerm(term)
            .setDf(docIds.length);
        long collectionFrequency = 0;
        for (int index = 0; index < deltas.length; index++) {
            if (docIds[index] < 0) {
                throw new CountOverflowException("docid", Integer.toUnsignedLong(docIds[index]));
            }
            if (termFreqs[index] < 0) {
                throw new CountOverflowException("tf", Integer.toUnsignedLong(termFreqs[index]));
            }
            collectionFrequency += termFreqs[index];
            builder.addPostings(Posting.newBuilder()
                .setDocid(deltas[index])
                .setTf(termFreqs[index]));
        }
        return builder.setCf(collectionFrequency).build();
    }

    /**
     * 构造文档记录。
     *
     * @param docId 内部 docid
     * @param collectionDocId 外部文档ID
     * @param length 文档长度（无符号解释）
     * @return CIFF 文档记录
     */
    public static DocRecord toDocRecord(int docId, String collectionDocId, int length) {
        if (length < 0) {
            throw new CountOverflowException("doclength", Integer.toUnsignedLong(length));
        }
        return DocRecord.newBuilder()
            .setDocid(docId)
            .setCollectionDocid(collectionDocId)
            .setDoclength(length)
            .build();
    }

    /**
     * 构造描述整个索引的头部：本文件计数与全局计数相同。
     *
     * @param documentCount 文档数
     * @param postingsListCount 倒排列表数
     * @param totalTerms 全集合词项总数
     * @param description 描述
     * @return CIFF 头部
     */
    public static Header buildHeader(int documentCount, int postingsListCount, long totalTerms, String description) {
        return Header.newBuilder()
            .setVersion(Constants.CIFF_FORMAT_VERSION)
            .setNumPostingsLists(postingsListCount)
            .setTotalPostingsLists(postingsListCount)
            .setNumDocs(documentCount)
            .setTotalDocs(documentCount)
            .setTotalTermsInCollection(totalTerms)
            .setAverageDoclength(averageDocLength(totalTerms, documentCount))
            .setDescription(description == null ? "" : description)
            .build();
    }

    /**
     * 平均文档长度，文档数为0时返回0.0。
     */
    public static double averageDocLength(long totalTerms, long documentCount) {
        if (documentCount == 0) {
            return 0.0;
        }
        return (double) totalTerms / documentCount;
    }
}
