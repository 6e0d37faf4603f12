// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.registry;

import de.telekom.horizon.relay.exception.EndpointNotFoundException;
import de.telekom.horizon.relay.exception.ValidationException;
import de.telekom.horizon.relay.model.Endpoint;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The {@code EndpointRegistry} owns the set of registered endpoints.
 * All access goes through one read/write lock. Every mutation is written to the {@link EndpointStore};
 * a failing write is logged and the in-memory state stays authoritative.
 */
@Slf4j
@Component
public class EndpointRegistry {

    private final EndpointStore endpointStore;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<Endpoint> endpoints;

    private volatile boolean lastSaveSucceeded = true;

    public EndpointRegistry(EndpointStore endpointStore) {
        this.endpointStore = endpointStore;
        this.endpoints = new ArrayList<>(loadEndpoints());
    }

    /**
     * @return all endpoints in registration order
     */
    public List<Endpoint> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(endpoints);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Captures the currently active endpoints. The returned list is immutable and is not affected
     * by later registry changes.
     *
     * @return active endpoints in registration order
     */
    public List<Endpoint> listActive() {
        lock.readLock().lock();
        try {
            return endpoints.stream().filter(Endpoint::isActive).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Registers a new endpoint under a freshly generated id.
     *
     * @param name   display name, must not be blank
     * @param url    absolute http(s) URL
     * @param active initial status
     * @return all endpoints after the registration
     * @throws ValidationException if name or url are rejected
     */
    public List<Endpoint> create(String name, String url, boolean active) throws ValidationException {
        validateName(name);
        validateUrl(url);

        var endpoint = new Endpoint(UUID.randomUUID().toString(), name.trim(), url.trim(), active);

        lock.writeLock().lock();
        try {
            endpoints.add(endpoint);
            persist();
            log.info("Registered endpoint '{}' ({}) at {}, active: {}", endpoint.getName(), endpoint.getId(), endpoint.getUrl(), active);
            return List.copyOf(endpoints);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Sets the active flag of an endpoint. Setting the current value again is a no-op that still succeeds.
     *
     * @param id     endpoint id
     * @param active new status
     * @return the updated endpoint
     * @throws EndpointNotFoundException if no endpoint has the given id
     */
    public Endpoint updateStatus(String id, boolean active) throws EndpointNotFoundException {
        lock.writeLock().lock();
        try {
            var index = indexOf(id);
            var current = endpoints.get(index);
            if (current.isActive() == active) {
                return current;
            }

            var updated = current.withActive(active);
            endpoints.set(index, updated);
            persist();
            log.info("Endpoint '{}' ({}) is now {}", updated.getName(), id, active ? "active" : "inactive");
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes an endpoint. Dispatches that already captured a snapshot still deliver to it.
     *
     * @param id endpoint id
     * @return all endpoints after the removal
     * @throws EndpointNotFoundException if no endpoint has the given id
     */
    public List<Endpoint> delete(String id) throws EndpointNotFoundException {
        lock.writeLock().lock();
        try {
            var removed = endpoints.remove(indexOf(id));
            persist();
            log.info("Deleted endpoint '{}' ({})", removed.getName(), id);
            return List.copyOf(endpoints);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isLastSaveSucceeded() {
        return lastSaveSucceeded;
    }

    private int indexOf(String id) throws EndpointNotFoundException {
        for (int i = 0; i < endpoints.size(); i++) {
            if (endpoints.get(i).getId().equals(id)) {
                return i;
            }
        }
        throw new EndpointNotFoundException(String.format("Endpoint with id '%s' not found", id));
    }

    // caller holds the write lock
    private void persist() {
        try {
            endpointStore.save(List.copyOf(endpoints));
            lastSaveSucceeded = true;
        } catch (IOException e) {
            lastSaveSucceeded = false;
            log.error("Error saving endpoints", e);
        }
    }

    private List<Endpoint> loadEndpoints() {
        try {
            return endpointStore.load();
        } catch (IOException e) {
            log.error("Error loading endpoints, starting with an empty registry", e);
            return List.of();
        }
    }

    private void validateName(String name) throws ValidationException {
        if (StringUtils.isBlank(name)) {
            throw new ValidationException("Name cannot be empty");
        }
    }

    private void validateUrl(String url) throws ValidationException {
        if (StringUtils.isBlank(url)) {
            throw new ValidationException("URL cannot be empty");
        }

        try {
            var uri = new URI(url.trim());
            var scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new ValidationException("Invalid URL format", "URL scheme must be http or https");
            }
            if (StringUtils.isBlank(uri.getHost())) {
                throw new ValidationException("Invalid URL format", "URL has no host");
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL format", e.getMessage());
        }
    }
}
