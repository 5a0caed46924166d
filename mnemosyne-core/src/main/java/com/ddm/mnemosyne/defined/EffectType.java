package com.ddm.mnemosyne.defined;

/**
 * 配置变更的生效方式。
 * <p>
 * 引擎只负责分类与上报，不负责执行生效动作：调用方据此决定是否提示重启或排期。
 *
 * @author liyifei
 * @since 1.0
 */
public enum EffectType {

    /** 写入后立即生效 */
    IMMEDIATE,

    /** 需要重启服务后生效 */
    RESTART_REQUIRED,

    /** 由外部调度在指定时间生效 */
    SCHEDULED
}
