package com.ddm.mnemosyne.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * 将每次变更写成一行审计日志。
 *
 * @author liyifei
 * @since 1.0
 */
public class LoggingChangeListener implements ConfigChangeListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingChangeListener.class);

    @Override
    public void onChange(ConfigChangeEvent event) {
        log.info("[config-audit] {} key={} version={} actor={} effect={} history={}",
                event.kind(), event.key(), event.version(), event.actor(), event.effectType(), event.historyId());
    }

    @Override
    public void onReload(Instant at) {
        log.info("[config-audit] RELOAD at={}", at);
    }
}
