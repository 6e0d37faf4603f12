// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.model.Endpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * The {@code JsonFileEndpointStore} keeps the registry as a pretty-printed JSON array in a single file.
 * Writes go to a temporary sibling file first which then replaces the target.
 */
@Slf4j
@Component
public class JsonFileEndpointStore implements EndpointStore {

    private static final TypeReference<List<Endpoint>> ENDPOINT_LIST = new TypeReference<>() {};

    private final Path file;

    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileEndpointStore(RelayConfig relayConfig, ObjectMapper objectMapper) {
        this(Path.of(relayConfig.getRegistryFile()), objectMapper);
    }

    public JsonFileEndpointStore(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Endpoint> load() throws IOException {
        if (!Files.exists(file)) {
            log.info("No endpoint file found at {}, starting with an empty registry", file);
            return List.of();
        }

        List<Endpoint> endpoints = objectMapper.readValue(file.toFile(), ENDPOINT_LIST);
        log.info("Loaded {} endpoints from {}", endpoints.size(), file);
        return endpoints;
    }

    @Override
    public void save(List<Endpoint> endpoints) throws IOException {
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        var tmp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), endpoints);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
}
