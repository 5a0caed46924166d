package com.ddm.mnemosyne.defined;

import java.util.List;

/**
 * 分页的历史记录，按时间倒序。
 *
 * @param records 当前页记录
 * @param total   该配置的历史总数
 */
public record HistoryPage(List<HistoryRecord> records, long total) {

    public HistoryPage {
        records = List.copyOf(records);
    }
}
