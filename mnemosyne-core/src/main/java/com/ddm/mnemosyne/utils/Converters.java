package com.ddm.mnemosyne.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

/**
 * 运行时读取配置时的目标类型转换。
 * <p>
 * 缓存里保存的是按 {@code ValueType} 解析后的值（String / BigDecimal / Boolean /
 * Map / List），调用方可按需要的 Java 类型取用。
 *
 * @author liyifei
 * @since 1.0
 */
public final class Converters {

    private Converters() {
    }

    /**
     * 智能类型转换；无法转换时抛出 {@link IllegalArgumentException}，null 原样返回。
     */
    public static <T> T cast(Object raw, Class<T> type) {
        if (raw == null) return null;
        if (type.isInstance(raw)) return type.cast(raw);

        // --- 数值 ---
        if (raw instanceof Number n) {
            BigDecimal d = raw instanceof BigDecimal bd ? bd : new BigDecimal(n.toString());
            if (type == Integer.class || type == int.class) return boxed(type, d.intValueExact());
            if (type == Long.class || type == long.class) return boxed(type, d.longValueExact());
            if (type == Double.class || type == double.class) return boxed(type, d.doubleValue());
            if (type == Float.class || type == float.class) return boxed(type, d.floatValue());
            if (type == BigInteger.class) return type.cast(d.toBigIntegerExact());
            if (type == BigDecimal.class) return type.cast(d);
            if (type == Duration.class) return type.cast(Duration.ofMillis(d.multiply(BigDecimal.valueOf(1000)).longValue()));
            if (type == String.class) return type.cast(d.toPlainString());
        }

        if (type == Boolean.class || type == boolean.class) {
            String s = String.valueOf(raw).trim();
            return boxed(type, "true".equalsIgnoreCase(s) || "1".equals(s));
        }

        if (raw instanceof String s) {
            String v = s.trim();
            if (type == Duration.class) return type.cast(Duration.parse(v));
            if (Number.class.isAssignableFrom(type) || type.isPrimitive()) {
                return cast(new BigDecimal(v), type);
            }
        }

        if (type == String.class) {
            // Map / List 以 JSON 文本返回
            return type.cast(raw instanceof String ? raw : Json.write(raw));
        }

        // --- JSON 结构映射到 POJO/record ---
        try {
            return Json.mapper().convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Cannot convert " + raw.getClass().getSimpleName() + " to " + type.getSimpleName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T boxed(Class<T> type, Object value) {
        return (T) value;
    }
}
