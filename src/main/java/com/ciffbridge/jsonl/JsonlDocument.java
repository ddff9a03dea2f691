package com.ciffbridge.jsonl;

import java.util.Map;

/**
 * JSONL 中的一行文档向量。
 *
 * @param id 外部文档ID（整数ID已转为字符串）
 * @param vector 词项到分数的映射，保持输入顺序
 * @param lineNumber 所在行号，从1开始
 * @param line 原始行内容，用于错误诊断
 */
public record JsonlDocument(String id, Map<String, Double> vector, long lineNumber, String line) {
}
