package com.meshgate.gateway.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meshgate.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the JSON services file (a top-level array of {@link ServiceDefinition}).
 */
public final class ServiceDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(ServiceDefinitionLoader.class);

    private ServiceDefinitionLoader() {
    }

    public static List<ServiceConfig> load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            List<ServiceConfig> services = load(in);
            log.info("Loaded {} service definitions from {}", services.size(), file);
            return services;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read services file " + file, e);
        }
    }

    public static List<ServiceConfig> load(InputStream in) {
        List<ServiceDefinition> definitions = JsonUtils.readValue(in, new TypeReference<List<ServiceDefinition>>() {
        });
        return definitions.stream()
            .map(ServiceDefinition::toServiceConfig)
            .collect(Collectors.toList());
    }
}
