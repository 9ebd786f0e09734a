package com.evently.service.core.config;

import com.evently.service.core.convert.EventDefinitionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

/**
 * Reads the event definitions document. YAML unless the resource name ends in {@code .json}; the document must be a
 * list of definitions. A missing resource yields an empty list.
 */
public class EventDefinitionsLoader {

    private static final Logger log = LoggerFactory.getLogger(EventDefinitionsLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Object> ANY = new TypeReference<>() {};

    private final String location;

    public EventDefinitionsLoader(String location) {
        this.location = location;
    }

    public List<Map<String, Object>> load() {
        Optional<Resource> resource = resolve();
        if (resource.isEmpty()) {
            log.debug("No event definitions file found for '{}'; using default config.", location);
            return List.of();
        }
        Resource r = resource.get();
        log.debug("Event definitions configuration file: {}", r.getDescription());

        String text;
        try (InputStream in = r.getInputStream()) {
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read event definitions from " + r.getDescription(), ex);
        }
        return parse(text, location);
    }

    Optional<Resource> resolve() {
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        Resource file = new FileSystemResource(location);
        if (file.exists() && file.isReadable()) {
            return Optional.of(file);
        }
        Resource classpath = new ClassPathResource(location.startsWith("/") ? location.substring(1) : location);
        if (classpath.exists()) {
            return Optional.of(classpath);
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> parse(String text, String fileNameHint) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Object root;
        try {
            root = chooseMapper(fileNameHint).readValue(text, ANY);
        } catch (JsonProcessingException ex) {
            throw new EventDefinitionException(
                    "Unparsable event definitions document " + fileNameHint + ": " + ex.getOriginalMessage(), null, ex);
        }
        if (root == null) {
            return List.of();
        }
        if (!(root instanceof List<?> list)) {
            throw new EventDefinitionException(
                    "Event definitions document " + fileNameHint + " must be a list of definitions", null);
        }
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?>)) {
                throw new EventDefinitionException("Event definition must be a mapping, got: " + entry, null);
            }
        }
        return List.copyOf((List<Map<String, Object>>) list);
    }

    private static ObjectMapper chooseMapper(String fileNameHint) {
        String n = Optional.ofNullable(fileNameHint).orElse("").toLowerCase(Locale.ROOT);
        return n.endsWith(".json") ? JSON : YAML;
    }
}
