package com.ddm.mnemosyne.service;

import com.ddm.mnemosyne.defined.HistoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 历史链校验：同一配置按时间相邻的两条记录，前一条的 newValue 必须等于后一条的 previousValue。
 * <p>
 * 带外写入（SEED）的记录视为链的重新开始，不与前一条比较。
 *
 * @author liyifei
 * @since 1.0
 */
public final class HistoryChain {

    private static final Logger log = LoggerFactory.getLogger(HistoryChain.class);

    private HistoryChain() {
    }

    /**
     * @param ascending 按时间正序排列的历史
     * @return 历史链连续时返回 true
     */
    public static boolean verify(List<HistoryRecord> ascending) {
        return firstBreak(ascending).isEmpty();
    }

    /**
     * 找到第一条与前一条不衔接的记录。
     */
    public static Optional<HistoryRecord> firstBreak(List<HistoryRecord> ascending) {
        for (int i = 1; i < ascending.size(); i++) {
            HistoryRecord prev = ascending.get(i - 1);
            HistoryRecord cur = ascending.get(i);
            if (cur.isChainReset()) {
                continue;
            }
            if (!Objects.equals(prev.newValue(), cur.previousValue())) {
                log.warn("History chain broken for {} at record {} (version {})",
                        cur.configKey(), cur.id(), cur.version());
                return Optional.of(cur);
            }
        }
        return Optional.empty();
    }
}
