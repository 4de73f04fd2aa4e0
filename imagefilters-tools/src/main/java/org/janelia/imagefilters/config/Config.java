package org.janelia.imagefilters.config;

import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    public String getStringPropertyValue(String name) {
        return StringUtils.trimToNull(properties.getProperty(name));
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        return StringUtils.defaultIfBlank(getStringPropertyValue(name), defaultValue);
    }

    public int getIntegerPropertyValue(String name, int defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + value, e);
        }
    }

    public long getLongPropertyValue(String name, long defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid long value for " + name + ": " + value, e);
        }
    }

    public float getFloatPropertyValue(String name, float defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Float.parseFloat(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid float value for " + name + ": " + value, e);
        }
    }
}
