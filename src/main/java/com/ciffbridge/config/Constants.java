package com.ciffbridge.config;

/**
 * 全局常量定义
 * 
 * 包含文件后缀、CIFF格式版本、量化参数和进度上报参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== PISA 文件后缀 ====================
    /** 文档ID序列文件 */
    public static final String DOCS_SUFFIX = ".docs";
    /** 词频序列文件 */
    public static final String FREQS_SUFFIX = ".freqs";
    /** 文档长度序列文件 */
    public static final String SIZES_SUFFIX = ".sizes";
    /** 词项文本文件，每行一个词项 */
    public static final String TERMS_SUFFIX = ".terms";
    /** 外部文档ID文本文件，每行一个 */
    public static final String DOCUMENTS_SUFFIX = ".documents";
    /** 词项词典（PayloadVector） */
    public static final String TERMLEX_SUFFIX = ".termlex";
    /** 文档标题词典（PayloadVector） */
    public static final String DOCLEX_SUFFIX = ".doclex";
    /** 重排时原文件的临时后缀 */
    public static final String TEMP_SUFFIX = ".tmp";
    
    // ==================== CIFF 参数 ====================
    /** 写出的 CIFF 头部版本号 */
    public static final int CIFF_FORMAT_VERSION = 1;
    
    // ==================== 量化参数 ====================
    /** 默认量化位数，对应区间 [1, 255] */
    public static final int DEFAULT_QUANTIZATION_BITS = 8;
    /** 量化位数上限 */
    public static final int MAX_QUANTIZATION_BITS = 16;
    
    // ==================== 进度参数 ====================
    /** 默认进度日志间隔（条） */
    public static final long PROGRESS_LOG_INTERVAL = 100_000L;
    
    // ==================== 写入参数 ====================
    /** 顺序写出缓冲区大小（1MB） */
    public static final int WRITE_BUFFER_SIZE = 1 << 20;
}
