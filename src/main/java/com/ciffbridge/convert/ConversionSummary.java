package com.ciffbridge.convert;

/**
 * 一次转换的统计结果。
 *
 * @param documents 文档数
 * @param postingsLists 倒排列表（词项）数
 * @param totalTerms 全集合词项总数
 * @param reordered 是否执行了词项重排
 */
public record ConversionSummary(int documents, int postingsLists, long totalTerms, boolean reordered) {
}
