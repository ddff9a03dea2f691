package com.ciffbridge.config;

import com.ciffbridge.error.MissingFieldException;

import java.nio.file.Path;

/**
 * JSONL → CIFF 转换配置。
 *
 * @param input JSONL 输入文件
 * @param output CIFF 输出文件
 * @param quantize 是否将分数线性量化到 [1, 2^bits - 1]
 * @param quantizationBits 量化位数
 * @param description 写入头部的描述，可为空
 */
public record JsonlToCiffOptions(Path input, Path output, boolean quantize, int quantizationBits, String description) {

    public static JsonlToCiffOptions of(Path input, Path output, boolean quantize) {
        return new JsonlToCiffOptions(input, output, quantize, Constants.DEFAULT_QUANTIZATION_BITS, null);
    }

    public String descriptionOrEmpty() {
        return description == null ? "" : description;
    }

    /**
     * 校验必填字段与量化位数。
     *
     * @return 当前实例
     * @throws MissingFieldException 存在未设置字段时抛出
     * @throws IllegalArgumentException 量化位数越界时抛出
     */
    public JsonlToCiffOptions validate() {
        if (input == null) {
            throw new MissingFieldException("input");
        }
        if (output == null) {
            throw new MissingFieldException("output");
        }
        if (quantize && (quantizationBits < 1 || quantizationBits > Constants.MAX_QUANTIZATION_BITS)) {
            throw new IllegalArgumentException(
                "量化位数必须在 [1, " + Constants.MAX_QUANTIZATION_BITS + "] 之间: " + quantizationBits);
        }
        return this;
    }
}
