package com.ciffbridge.jsonl;

import com.ciffbridge.error.QuantizationException;

/**
 * 将正分数线性映射到整数等级 [1, 2^bits - 1]。
 *
 * 区间端点来自全部正分数的最小值与最大值；最小值映射为1，最大值映射为最高等级。
 * 所有正分数相同时统一映射为最高等级。
 */
public final class ScoreQuantizer {
    private final double min;
    private final double max;
    private final int maxLevel;

    private ScoreQuantizer(double min, double max, int bits) {
        this.min = min;
        this.max = max;
        this.maxLevel = (1 << bits) - 1;
    }

    /**
     * 由已统计的分数范围构造量化器。
     *
     * @param range 正分数范围
     * @param bits 量化位数
     * @return 量化器
     * @throws QuantizationException 范围为空（不存在正分数）时抛出
     */
    public static ScoreQuantizer fromRange(ScoreRange range, int bits) {
        if (range.isEmpty()) {
            throw new QuantizationException("没有任何正分数，无法量化");
        }
        return new ScoreQuantizer(range.min(), range.max(), bits);
    }

    public int maxLevel() {
        return maxLevel;
    }

    /**
     * 量化一个分数。
     *
     * @param score 原始分数
     * @return 量化等级，非正分数返回0表示丢弃
     */
    public int quantize(double score) {
        if (!(score > 0)) {
            return 0;
        }
        if (max == min) {
            return maxLevel;
        }
        double ratio = (score - min) / (max - min);
        long level = 1 + Math.round(ratio * (maxLevel - 1));
        return (int) Math.max(1, Math.min(maxLevel, level));
    }

    /**
     * 正分数的最小值与最大值累加器。
     */
    public static final class ScoreRange {
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;
        private long count;

        /**
         * 记录一个分数，非正分数与 NaN 忽略。
         */
        public void accept(double score) {
            if (!(score > 0)) {
                return;
            }
            min = Math.min(min, score);
            max = Math.max(max, score);
            count++;
        }

        public boolean isEmpty() {
            return count == 0;
        }

        public double min() {
            return min;
        }

        public double max() {
            return max;
        }

        public long count() {
            return count;
        }
    }
}
