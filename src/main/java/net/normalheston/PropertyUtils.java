/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston;

import java.util.Map;

/**
 * Typed access to the values of a property map. Values may be given as numbers or as strings.
 *
 * @author normalheston-lib authors
 */
public class PropertyUtils {

    private PropertyUtils() {
    }

    public static double getRequiredDouble(Map<String, ?> properties, String key) {
        return toDouble(key, getRequired(properties, key));
    }

    public static double getDouble(Map<String, ?> properties, String key, double defaultValue) {
        if(properties == null || !properties.containsKey(key)) return defaultValue;
        return toDouble(key, properties.get(key));
    }

    public static int getRequiredInt(Map<String, ?> properties, String key) {
        return toInt(key, getRequired(properties, key));
    }

    public static int getInt(Map<String, ?> properties, String key, int defaultValue) {
        if(properties == null || !properties.containsKey(key)) return defaultValue;
        return toInt(key, properties.get(key));
    }

    public static long getLong(Map<String, ?> properties, String key, long defaultValue) {
        if(properties == null || !properties.containsKey(key)) return defaultValue;
        Object value = properties.get(key);
        if(value instanceof Number) return ((Number)value).longValue();
        try {
            return Long.parseLong(String.valueOf(value).trim());
        }
        catch(NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not an integer: " + value, e);
        }
    }

    public static String getString(Map<String, ?> properties, String key, String defaultValue) {
        if(properties == null || !properties.containsKey(key) || properties.get(key) == null) return defaultValue;
        return properties.get(key).toString().trim();
    }

    private static Object getRequired(Map<String, ?> properties, String key) {
        if(properties == null || !properties.containsKey(key) || properties.get(key) == null) {
            throw new IllegalArgumentException("Missing required property '" + key + "'.");
        }
        return properties.get(key);
    }

    private static double toDouble(String key, Object value) {
        if(value instanceof Number) return ((Number)value).doubleValue();
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        }
        catch(NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not a number: " + value, e);
        }
    }

    private static int toInt(String key, Object value) {
        if(value instanceof Integer || value instanceof Short) return ((Number)value).intValue();
        try {
            if(value instanceof Long) return Math.toIntExact((Long)value);
            return Integer.parseInt(String.valueOf(value).trim());
        }
        catch(ArithmeticException e) {
            throw new IllegalArgumentException("Property '" + key + "' is outside the range of an int: " + value, e);
        }
        catch(NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not an integer: " + value, e);
        }
    }
}
