package com.ciffbridge.convert;

import com.ciffbridge.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 按固定间隔把进度写入日志。
 */
public final class LoggingProgressListener implements ProgressListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final long interval;
    private long total = -1;

    public LoggingProgressListener() {
        this(Constants.PROGRESS_LOG_INTERVAL);
    }

    public LoggingProgressListener(long interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("进度间隔必须为正数: " + interval);
        }
        this.interval = interval;
    }

    @Override
    public void onStart(String stage, long total) {
        this.total = total;
        if (total >= 0) {
            logger.info("开始{}: 共 {} 项", stage, total);
        } else {
            logger.info("开始{}", stage);
        }
    }

    @Override
    public void onAdvance(String stage, long processed) {
        if (processed % interval != 0) {
            return;
        }
        if (total > 0) {
            logger.info("{}: {}/{} ({}%)", stage, processed, total, processed * 100 / total);
        } else {
            logger.info("{}: {}", stage, processed);
        }
    }

    @Override
    public void onFinish(String stage, long processed) {
        logger.info("完成{}: {} 项", stage, processed);
    }
}
