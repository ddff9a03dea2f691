package com.ciffbridge.config;

import com.ciffbridge.error.MissingFieldException;

import java.nio.file.Path;

/**
 * PISA → CIFF 转换配置。
 *
 * @param collectionBasename 二进制集合（.docs/.freqs/.sizes）的公共前缀
 * @param termsPath 词项文本文件
 * @param titlesPath 外部文档ID文本文件
 * @param output CIFF 输出文件
 * @param description 写入头部的描述，可为空
 */
public record PisaToCiffOptions(
    Path collectionBasename,
    Path termsPath,
    Path titlesPath,
    Path output,
    String description
) {

    /**
     * 以集合前缀推导 .terms 与 .documents 路径。
     */
    public static PisaToCiffOptions forBasename(Path basename, Path output, String description) {
        return new PisaToCiffOptions(
            basename,
            PisaPaths.withSuffix(basename, Constants.TERMS_SUFFIX),
            PisaPaths.withSuffix(basename, Constants.DOCUMENTS_SUFFIX),
            output,
            description
        );
    }

    /**
     * 未设置描述时返回空串。
     */
    public String descriptionOrEmpty() {
        return description == null ? "" : description;
    }

    /**
     * 校验必填字段，缺失时报告第一个未设置的字段。
     *
     * @return 当前实例
     * @throws MissingFieldException 存在未设置字段时抛出
     */
    public PisaToCiffOptions validate() {
        if (collectionBasename == null) {
            throw new MissingFieldException("collectionBasename");
        }
        if (termsPath == null) {
            throw new MissingFieldException("termsPath");
        }
        if (titlesPath == null) {
            throw new MissingFieldException("titlesPath");
        }
        if (output == null) {
            throw new MissingFieldException("output");
        }
        return this;
    }
}
