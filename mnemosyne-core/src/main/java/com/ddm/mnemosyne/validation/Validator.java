package com.ddm.mnemosyne.validation;

import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.defined.ValidationRules;
import com.ddm.mnemosyne.defined.ValueType;

/**
 * 写入前的候选值校验。
 * <p>
 * 只返回第一条未通过的规则，不尝试修正输入。
 *
 * @author liyifei
 * @since 1.0
 */
public interface Validator {

    /**
     * 按类型与约束校验候选值。
     *
     * @param value     候选值，可以为 null
     * @param valueType 配置值类型
     * @param rules     约束，可以为 null
     */
    Validation validate(Object value, ValueType valueType, ValidationRules rules);

    /**
     * 针对具体配置项校验：只读配置在任何类型规则之前直接失败。
     */
    default Validation validate(ConfigEntry entry, Object value) {
        if (entry.readOnly()) {
            return Validation.readOnly();
        }
        return validate(value, entry.valueType(), entry.validation());
    }
}
