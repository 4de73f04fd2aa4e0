package org.janelia.imagefilters.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} from layered property sources; later sources override earlier ones.
 */
public class ConfigProvider {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/imagefilters.properties";

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private final Properties properties = new Properties();

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream resourceStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (resourceStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
            } else {
                properties.load(resourceStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading config resource " + resourceName, e);
        }
        return this;
    }

    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configPath = Paths.get(fileName);
        try (InputStream configStream = Files.newInputStream(configPath)) {
            LOG.info("Load config from {}", configPath);
            properties.load(configStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading config from " + fileName, e);
        }
        return this;
    }

    public ConfigProvider fromMap(Map<String, String> values) {
        if (values != null) {
            properties.putAll(values);
        }
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
