package com.ddm.mnemosyne.event;

import java.time.Instant;

/**
 * 配置变更监听器，由外部注入（审计日志、重载通知等）。
 * <p>
 * 回调在写操作提交且缓存失效之后同步执行；监听器抛出的异常会被记录，
 * 不影响已提交的变更，也不影响其他监听器。
 *
 * @author liyifei
 * @since 1.0
 */
@FunctionalInterface
public interface ConfigChangeListener {

    void onChange(ConfigChangeEvent event);

    /**
     * 缓存被整体重载后调用。
     *
     * @param at 重载时间
     */
    default void onReload(Instant at) {
    }
}
