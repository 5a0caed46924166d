package com.ddm.mnemosyne.defined;

import com.ddm.mnemosyne.utils.Json;

import java.math.BigDecimal;

/**
 * 配置值类型。
 * <p>
 * 每个常量自带"序列化 / 解析"逻辑，新增类型时编译器会要求补齐实现。
 * 存储层统一保存字符串形式：
 * <ul>
 *   <li>{@link #NUMBER}：十进制文本，解析为 {@link BigDecimal}</li>
 *   <li>{@link #BOOLEAN}：{@code true} / {@code false}，解析为 {@link Boolean}</li>
 *   <li>{@link #JSON}：JSON 文本，解析为 Map / List / 标量</li>
 *   <li>{@link #STRING}、{@link #SECRET}、{@link #ENUM}：原样字符串</li>
 * </ul>
 * 空字符串与 null 一律解析为 null。
 *
 * @author liyifei
 * @since 1.0
 */
public enum ValueType {

    STRING {
        @Override
        protected Object parseText(String raw) {
            return raw;
        }

        @Override
        protected String serializeValue(Object value) {
            return String.valueOf(value);
        }
    },

    NUMBER {
        @Override
        protected Object parseText(String raw) {
            try {
                return new BigDecimal(raw.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        @Override
        protected String serializeValue(Object value) {
            BigDecimal d = value instanceof BigDecimal bd ? bd : new BigDecimal(String.valueOf(value).trim());
            return d.toPlainString();
        }
    },

    BOOLEAN {
        @Override
        protected Object parseText(String raw) {
            String v = raw.trim();
            return "true".equalsIgnoreCase(v) || "1".equals(v);
        }

        @Override
        protected String serializeValue(Object value) {
            return String.valueOf(parseText(String.valueOf(value)));
        }
    },

    JSON {
        @Override
        protected Object parseText(String raw) {
            return Json.readLoose(raw);
        }

        @Override
        protected String serializeValue(Object value) {
            return value instanceof String s ? s : Json.write(value);
        }
    },

    SECRET {
        @Override
        protected Object parseText(String raw) {
            return raw;
        }

        @Override
        protected String serializeValue(Object value) {
            return String.valueOf(value);
        }
    },

    ENUM {
        @Override
        protected Object parseText(String raw) {
            return raw;
        }

        @Override
        protected String serializeValue(Object value) {
            return String.valueOf(value);
        }
    };

    /**
     * 将存储形式解析为运行时值。
     *
     * @param raw 存储的字符串（明文），可以为 null
     * @return 解析结果；空值或无法解析时返回 null
     */
    public final Object parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return parseText(raw);
    }

    /**
     * 将调用方传入的值序列化为存储形式。调用前应已通过校验。
     *
     * @param value 候选值，可以为 null
     * @return 存储字符串；null 序列化为空字符串
     */
    public final String serialize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s && s.isEmpty()) {
            return "";
        }
        return serializeValue(value);
    }

    protected abstract Object parseText(String raw);

    protected abstract String serializeValue(Object value);
}
