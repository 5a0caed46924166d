package com.ddm.mnemosyne.event;

import com.ddm.mnemosyne.defined.ChangeKind;
import com.ddm.mnemosyne.defined.EffectType;

import java.time.Instant;

/**
 * 配置变更事件，每次成功提交的变更发出一次。
 * <p>
 * 不携带配置值，监听方需要时自行通过 ConfigService 读取（加密配置只能读到遮蔽值）。
 *
 * @param key        配置键
 * @param effectType 生效方式
 * @param actor      操作者
 * @param timestamp  提交时间
 * @param kind       变更来源
 * @param version    变更后的版本号
 * @param historyId  对应的历史记录 ID
 * @author liyifei
 * @since 1.0
 */
public record ConfigChangeEvent(String key,
                                EffectType effectType,
                                String actor,
                                Instant timestamp,
                                ChangeKind kind,
                                long version,
                                String historyId) {
}
