package com.ddm.mnemosyne.utils;

import com.ddm.mnemosyne.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 轻量重试工具：仅用于只读查询。
 * <p>
 * 只有 {@link ConfigException#code()} 标记为可重试的异常才会重试，
 * 用尽次数后抛出最后一次的异常。写操作不得使用，以免重复追加历史。
 */
public final class Retry {

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    public static <T> T read(Supplier<T> s, int attempts, long sleepMs) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        ConfigException last = null;
        for (int i = 1; i <= attempts; i++) {
            try {
                return s.get();
            } catch (ConfigException e) {
                if (!e.code().isRetryable()) {
                    throw e;
                }
                last = e;
                log.debug("Read attempt {}/{} failed: {}", i, attempts, e.getMessage());
            }
            if (i < attempts) {
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        throw last;
    }


    private Retry() {
    }
}
