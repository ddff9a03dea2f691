package com.ciffbridge.convert;

/**
 * 转换进度观察者，核心逻辑只在固定检查点回调，不直接输出到控制台。
 */
public interface ProgressListener {

    /** 不做任何上报 */
    ProgressListener NONE = new ProgressListener() {
    };

    /**
     * 阶段开始。
     *
     * @param stage 阶段名
     * @param total 预计处理条数，未知时为 -1
     */
    default void onStart(String stage, long total) {
    }

    /**
     * 阶段内已处理 processed 条。
     */
    default void onAdvance(String stage, long processed) {
    }

    /**
     * 阶段结束。
     */
    default void onFinish(String stage, long processed) {
    }
}
