package com.example.punchsync.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Loads the YAML configuration file into {@link ApplicationConfig}.
 */
public class ConfigLoader {
    public static final String CONFIG_PROPERTY = "config";
    public static final String CONFIG_ENV = "PUNCHSYNC_CONFIG";
    public static final String DEFAULT_PATH = "config/application.yaml";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Location of the configuration file: the {@code config} system property, then the
     * {@code PUNCHSYNC_CONFIG} environment variable, then {@value #DEFAULT_PATH}.
     */
    public static Path resolvePath() {
        String configured = System.getProperty(CONFIG_PROPERTY);
        if (configured == null || configured.trim().isEmpty()) {
            configured = System.getenv(CONFIG_ENV);
        }
        if (configured == null || configured.trim().isEmpty()) {
            configured = DEFAULT_PATH;
        }
        return Paths.get(configured.trim());
    }

    public ApplicationConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Configuration file " + path.toAbsolutePath() + " not found");
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return afterRead(readValue(reader));
        }
    }

    public ApplicationConfig load(InputStream inputStream) throws IOException {
        Objects.requireNonNull(inputStream, "inputStream");
        try {
            return afterRead(mapper.readValue(inputStream, ApplicationConfig.class));
        } catch (JsonProcessingException ex) {
            throw new ConfigException("Malformed configuration: " + ex.getOriginalMessage(), ex);
        }
    }

    private ApplicationConfig readValue(Reader reader) throws IOException {
        try {
            return mapper.readValue(reader, ApplicationConfig.class);
        } catch (JsonProcessingException ex) {
            throw new ConfigException("Malformed configuration: " + ex.getOriginalMessage(), ex);
        }
    }

    private ApplicationConfig afterRead(ApplicationConfig config) {
        if (config == null) {
            config = new ApplicationConfig();
        }
        config.applyDefaults();
        return config;
    }
}
