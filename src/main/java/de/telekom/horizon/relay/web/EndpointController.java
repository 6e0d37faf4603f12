// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.web;

import de.telekom.horizon.relay.exception.EndpointNotFoundException;
import de.telekom.horizon.relay.exception.ValidationException;
import de.telekom.horizon.relay.model.CreateEndpointRequest;
import de.telekom.horizon.relay.model.Endpoint;
import de.telekom.horizon.relay.model.EndpointStatusUpdate;
import de.telekom.horizon.relay.registry.EndpointRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/endpoints")
public class EndpointController {

    private final EndpointRegistry endpointRegistry;

    public EndpointController(EndpointRegistry endpointRegistry) {
        this.endpointRegistry = endpointRegistry;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Endpoint> list() {
        return endpointRegistry.list();
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Endpoint> create(@RequestBody CreateEndpointRequest request) throws ValidationException {
        log.debug("[REST] POST /endpoints name={} url={} is_active={}", request.name(), request.url(), request.active());
        return endpointRegistry.create(request.name(), request.url(), request.active());
    }

    @PutMapping(value = "/{id}/status", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Endpoint updateStatus(@PathVariable("id") String id, @RequestBody EndpointStatusUpdate update) throws ValidationException, EndpointNotFoundException {
        if (update.active() == null) {
            throw new ValidationException("is_active is required");
        }
        log.debug("[REST] PUT /endpoints/{}/status is_active={}", id, update.active());
        return endpointRegistry.updateStatus(id, update.active());
    }

    @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Endpoint> delete(@PathVariable("id") String id) throws EndpointNotFoundException {
        log.debug("[REST] DELETE /endpoints/{}", id);
        return endpointRegistry.delete(id);
    }
}
