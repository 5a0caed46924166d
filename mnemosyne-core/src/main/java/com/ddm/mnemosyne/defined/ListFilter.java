package com.ddm.mnemosyne.defined;

import java.util.Locale;

/**
 * 配置列表筛选条件。
 *
 * @param category        分类，null 表示全部
 * @param search          关键字，对 key / name / description 做不区分大小写的包含匹配
 * @param includeReadOnly 是否包含只读配置
 * @author liyifei
 * @since 1.0
 */
public record ListFilter(ConfigCategory category, String search, boolean includeReadOnly) {

    private static final ListFilter ALL = new ListFilter(null, null, true);

    public static ListFilter all() {
        return ALL;
    }

    public static ListFilter byCategory(ConfigCategory category) {
        return new ListFilter(category, null, true);
    }

    public static ListFilter search(String text) {
        return new ListFilter(null, text, true);
    }

    public boolean matches(ConfigEntry entry) {
        if (category != null && entry.category() != category) {
            return false;
        }
        if (!includeReadOnly && entry.readOnly()) {
            return false;
        }
        if (search == null || search.isBlank()) {
            return true;
        }
        String needle = search.trim().toLowerCase(Locale.ROOT);
        return contains(entry.key(), needle)
                || contains(entry.name(), needle)
                || contains(entry.description(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
