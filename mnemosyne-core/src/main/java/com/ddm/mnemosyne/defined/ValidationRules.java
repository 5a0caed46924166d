package com.ddm.mnemosyne.defined;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

/**
 * 配置值的约束集合，所有字段均可为 null（表示不约束）。
 * <p>
 * 以 JSON 形式保存在存储层，例如：
 * <pre>{@code
 * {"min":0,"max":1,"required":true}
 * {"minLength":8,"pattern":"^sk-.*"}
 * {"options":["LOW","MEDIUM","HIGH"]}
 * }</pre>
 *
 * @param min       数值下限（含）
 * @param max       数值上限（含）
 * @param minLength 字符串最小长度
 * @param maxLength 字符串最大长度
 * @param pattern   正则表达式，在值中任意位置匹配即通过；整体匹配需自行加 ^ 与 $
 * @param options   允许的枚举选项
 * @param required  是否必填；为 null 或 false 时允许空值
 * @author liyifei
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationRules(BigDecimal min,
                              BigDecimal max,
                              Integer minLength,
                              Integer maxLength,
                              String pattern,
                              List<String> options,
                              Boolean required) {

    private static final ValidationRules NONE = new ValidationRules(null, null, null, null, null, null, null);

    public ValidationRules {
        options = options == null ? null : List.copyOf(options);
    }

    public static ValidationRules none() {
        return NONE;
    }

    public static ValidationRules range(BigDecimal min, BigDecimal max) {
        return new ValidationRules(min, max, null, null, null, null, null);
    }

    public static ValidationRules range(double min, double max) {
        return range(BigDecimal.valueOf(min).stripTrailingZeros(), BigDecimal.valueOf(max).stripTrailingZeros());
    }

    public static ValidationRules options(String... options) {
        return new ValidationRules(null, null, null, null, null, List.of(options), null);
    }

    public static ValidationRules length(Integer minLength, Integer maxLength) {
        return new ValidationRules(null, null, minLength, maxLength, null, null, null);
    }

    public ValidationRules withPattern(String regex) {
        return new ValidationRules(min, max, minLength, maxLength, regex, options, required);
    }

    public ValidationRules asRequired() {
        return new ValidationRules(min, max, minLength, maxLength, pattern, options, Boolean.TRUE);
    }

    public boolean requiresValue() {
        return Boolean.TRUE.equals(required);
    }

    public boolean unconstrained() {
        return this.equals(NONE);
    }
}
