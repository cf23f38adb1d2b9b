package com.fieldlink.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldlink.model.LinkConfigFile;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Reads the YAML link schema.
 *
 * <p>SnakeYAML parses the document into plain maps which Jackson then binds onto the snake_case
 * model, rejecting unknown keys so that a misspelled option fails the startup instead of being ignored.
 */
@Slf4j
public class LinkConfigLoader {

    private final ObjectMapper objectMapper;
    private final LinkConfigValidator validator;

    public LinkConfigLoader() {
        this(new LinkConfigValidator());
    }

    /**
     * Create a loader.
     *
     * @param validator schema validator applied after binding
     */
    public LinkConfigLoader(LinkConfigValidator validator) {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.validator = validator;
    }

    /**
     * Load and validate a schema file.
     *
     * @param path YAML file
     * @return validated schema
     * @throws ConfigException when the file cannot be read, parsed or validated
     */
    public LinkConfigFile load(Path path) {
        Object document;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (IOException e) {
            throw new ConfigException("failed to read config file " + path + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ConfigException("failed to decode config file " + path + ": " + e.getMessage(), e);
        }

        LinkConfigFile config = bind(document, path);
        validator.validate(config);
        log.info("Loaded link schema from {}: {} fields, {} relations",
                path, config.getFields().size(), config.getRelations().size());
        return config;
    }

    private LinkConfigFile bind(Object document, Path path) {
        if (document == null) {
            throw new ConfigException("config file " + path + " is empty");
        }
        try {
            LinkConfigFile config = objectMapper.convertValue(document, LinkConfigFile.class);
            if (config.getRelations() == null) {
                config.setRelations(new ArrayList<>());
            }
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigException("failed to decode config file " + path + ": " + e.getMessage(), e);
        }
    }
}
