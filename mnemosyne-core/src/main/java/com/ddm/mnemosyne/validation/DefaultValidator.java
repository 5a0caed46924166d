package com.ddm.mnemosyne.validation;

import com.ddm.mnemosyne.defined.ValidationRules;
import com.ddm.mnemosyne.defined.ValueType;
import com.ddm.mnemosyne.utils.Json;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 默认校验器。
 *
 * <p>规则按以下顺序执行，遇到第一条失败即返回：
 * <ol>
 *   <li>必填：{@code required=true} 时拒绝 null / 空字符串；非必填时空值直接通过</li>
 *   <li>NUMBER：必须可解析为数值，并满足闭区间 {@code [min, max]}</li>
 *   <li>BOOLEAN：布尔值或 {@code true/false/1/0}</li>
 *   <li>STRING / SECRET：长度上下限与正则（值中任意位置匹配即可，需要整体匹配时在规则中使用 ^ 与 $）</li>
 *   <li>ENUM（或声明了 options 的任意类型）：必须是选项之一</li>
 *   <li>JSON：以文本传入时必须是合法 JSON</li>
 * </ol>
 *
 * @author liyifei
 * @since 1.0
 */
public class DefaultValidator implements Validator {

    /**
     * 已编译的正则，规则集合有限，按文本缓存。
     */
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    @Override
    public Validation validate(Object value, ValueType valueType, ValidationRules rules) {
        ValidationRules r = rules == null ? ValidationRules.none() : rules;

        if (isEmpty(value)) {
            return r.requiresValue() ? Validation.violation("Value is required") : Validation.ok();
        }

        Validation typed = switch (valueType) {
            case NUMBER -> checkNumber(value, r);
            case BOOLEAN -> checkBoolean(value);
            case STRING, SECRET -> checkString(String.valueOf(value), r);
            case JSON -> checkJson(value);
            case ENUM -> Validation.ok();
        };
        if (!typed.isOk()) {
            return typed;
        }

        if (valueType == ValueType.ENUM || r.options() != null) {
            return checkOptions(value, valueType, r);
        }
        return Validation.ok();
    }

    private Validation checkNumber(Object value, ValidationRules r) {
        BigDecimal number = toNumber(value);
        if (number == null) {
            return Validation.violation("Must be a valid number");
        }
        if (r.min() != null && number.compareTo(r.min()) < 0) {
            return Validation.violation("Minimum value is " + r.min().toPlainString());
        }
        if (r.max() != null && number.compareTo(r.max()) > 0) {
            return Validation.violation("Maximum value is " + r.max().toPlainString());
        }
        return Validation.ok();
    }

    private Validation checkBoolean(Object value) {
        if (value instanceof Boolean) {
            return Validation.ok();
        }
        String s = String.valueOf(value).trim().toLowerCase();
        return switch (s) {
            case "true", "false", "1", "0" -> Validation.ok();
            default -> Validation.violation("Must be true or false");
        };
    }

    private Validation checkString(String s, ValidationRules r) {
        if (r.minLength() != null && s.length() < r.minLength()) {
            return Validation.violation("Minimum length is " + r.minLength());
        }
        if (r.maxLength() != null && s.length() > r.maxLength()) {
            return Validation.violation("Maximum length is " + r.maxLength());
        }
        if (r.pattern() != null && !r.pattern().isEmpty()) {
            Pattern p;
            try {
                p = patterns.computeIfAbsent(r.pattern(), Pattern::compile);
            } catch (PatternSyntaxException e) {
                return Validation.violation("Invalid pattern rule: " + r.pattern());
            }
            if (!p.matcher(s).find()) {
                return Validation.violation("Value does not match the required format");
            }
        }
        return Validation.ok();
    }

    private Validation checkJson(Object value) {
        if (value instanceof String s && !Json.isWellFormed(s)) {
            return Validation.violation("Malformed JSON");
        }
        return Validation.ok();
    }

    private Validation checkOptions(Object value, ValueType valueType, ValidationRules r) {
        if (r.options() == null || r.options().isEmpty()) {
            return valueType == ValueType.ENUM
                    ? Validation.violation("No options declared for enum config")
                    : Validation.ok();
        }
        String candidate = valueType == ValueType.NUMBER
                ? valueType.serialize(value)
                : String.valueOf(value);
        if (!r.options().contains(candidate)) {
            return Validation.violation("Must be one of: " + String.join(", ", r.options()));
        }
        return Validation.ok();
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal d) {
            return d;
        }
        if (value instanceof Number n) {
            double dv = n.doubleValue();
            if (Double.isNaN(dv) || Double.isInfinite(dv)) {
                return null;
            }
            return new BigDecimal(n.toString());
        }
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof String s && s.isEmpty());
    }
}
