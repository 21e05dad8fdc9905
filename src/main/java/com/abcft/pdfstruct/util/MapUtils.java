package com.abcft.pdfstruct.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.Map;

/**
 * Typed lookups over string parameter maps.
 */
public final class MapUtils {

    private MapUtils() {}

    public static int getInt(Map<String, String> params, String key, int defaultValue) {
        if (params == null) {
            return defaultValue;
        }
        return NumberUtils.toInt(StringUtils.trim(params.get(key)), defaultValue);
    }

    public static double getDouble(Map<String, String> params, String key, double defaultValue) {
        if (params == null) {
            return defaultValue;
        }
        return NumberUtils.toDouble(StringUtils.trim(params.get(key)), defaultValue);
    }

    public static boolean getBoolean(Map<String, String> params, String key, boolean defaultValue) {
        if (params == null) {
            return defaultValue;
        }
        String value = StringUtils.trim(params.get(key));
        if (StringUtils.isEmpty(value)) {
            return defaultValue;
        }
        // "1"/"0" 也作为布尔值
        if ("1".equals(value)) {
            return true;
        } else if ("0".equals(value)) {
            return false;
        }
        return Boolean.parseBoolean(value);
    }

    public static <E extends Enum<E>> E getEnum(Map<String, String> params, String key, Class<E> enumClass, E defaultValue) {
        if (params == null) {
            return defaultValue;
        }
        String value = StringUtils.trim(params.get(key));
        if (StringUtils.isEmpty(value)) {
            return defaultValue;
        }
        for (E e : enumClass.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(value)) {
                return e;
            }
        }
        return defaultValue;
    }

}
