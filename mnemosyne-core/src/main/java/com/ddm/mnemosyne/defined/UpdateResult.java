package com.ddm.mnemosyne.defined;

/**
 * 写操作结果。
 *
 * @param entry      变更后的配置视图
 * @param effectType 生效方式，调用方据此提示重启或排期
 * @param changed    是否实际发生变更（幂等重置时为 false）
 * @param historyId  本次追加的历史记录 ID；未变更时为 null
 * @author liyifei
 * @since 1.0
 */
public record UpdateResult(ConfigView entry, EffectType effectType, boolean changed, String historyId) {

    public boolean requiresRestart() {
        return changed && effectType == EffectType.RESTART_REQUIRED;
    }
}
