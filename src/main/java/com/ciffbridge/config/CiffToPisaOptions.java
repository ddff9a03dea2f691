package com.ciffbridge.config;

import com.ciffbridge.error.MissingFieldException;

import java.nio.file.Path;

/**
 * CIFF → PISA 转换配置。
 *
 * @param input CIFF 输入文件
 * @param outputBasename PISA 输出文件的公共前缀
 * @param generateLexicons 是否额外生成 .termlex/.doclex 词典
 */
public record CiffToPisaOptions(Path input, Path outputBasename, boolean generateLexicons) {

    /**
     * 默认生成词典的配置。
     */
    public static CiffToPisaOptions of(Path input, Path outputBasename) {
        return new CiffToPisaOptions(input, outputBasename, true);
    }

    /**
     * 校验必填字段，缺失时报告第一个未设置的字段。
     *
     * @return 当前实例
     * @throws MissingFieldException 存在未设置字段时抛出
     */
    public CiffToPisaOptions validate() {
        if (input == null) {
            throw new MissingFieldException("input");
        }
        if (outputBasename == null) {
            throw new MissingFieldException("outputBasename");
        }
        return this;
    }
}
