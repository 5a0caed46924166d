package com.ddm.mnemosyne.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 共享的 Jackson 工具。
 *
 * @author liyifei
 * @since 1.0
 */
public final class Json {

    /**
     * 线程安全的单例 ObjectMapper
     */
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * 判断文本是否为合法 JSON（对象、数组或标量）。
     */
    public static boolean isWellFormed(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        try {
            MAPPER.readTree(text);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    /**
     * 解析为通用 Java 结构（Map / List / String / Number / Boolean）；失败返回 null。
     */
    public static Object readLoose(String text) {
        try {
            return MAPPER.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static <T> T read(String text, Class<T> type) {
        try {
            return MAPPER.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON for " + type.getSimpleName(), e);
        }
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON: " + value.getClass().getName(), e);
        }
    }
}
