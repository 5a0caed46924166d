package com.ddm.mnemosyne.defined;

/**
 * 配置分类，用于列表分组与筛选。
 *
 * @author liyifei
 * @since 1.0
 */
public enum ConfigCategory {
    PROCESSING,
    INTEGRATION,
    SECURITY,
    NOTIFICATION,
    SYSTEM,
    DISPLAY,
    AI_MODEL,
    THRESHOLD
}
