// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.web;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.exception.EndpointNotFoundException;
import de.telekom.horizon.relay.exception.InvalidPayloadException;
import de.telekom.horizon.relay.model.DispatchSummary;
import de.telekom.horizon.relay.model.Endpoint;
import de.telekom.horizon.relay.model.InboundEvent;
import de.telekom.horizon.relay.service.DispatchService;
import de.telekom.horizon.relay.service.ResultAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Inbound side of the relay. Accepts any well-formed JSON body and answers with the dispatch summary;
 * failed deliveries never turn into an error response.
 */
@Slf4j
@RestController
public class WebhookController {

    private final DispatchService dispatchService;

    private final ResultAggregator resultAggregator;

    private final RelayConfig relayConfig;

    private final ObjectReader jsonReader;

    public WebhookController(DispatchService dispatchService, ResultAggregator resultAggregator, RelayConfig relayConfig, ObjectMapper objectMapper) {
        this.dispatchService = dispatchService;
        this.resultAggregator = resultAggregator;
        this.relayConfig = relayConfig;
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @PostMapping(value = "/webhook", produces = MediaType.APPLICATION_JSON_VALUE)
    public DispatchSummary receive(@RequestBody byte[] body, @RequestHeader HttpHeaders headers) throws InvalidPayloadException {
        var event = toEvent(body, headers);

        var result = dispatchService.dispatch(event);
        return resultAggregator.toSummary(result, relayConfig.isIncludeOutcomes());
    }

    @PostMapping(value = "/webhook/{service}", produces = MediaType.APPLICATION_JSON_VALUE)
    public DispatchSummary receiveForRoute(@PathVariable("service") String service, @RequestBody byte[] body, @RequestHeader HttpHeaders headers) throws InvalidPayloadException, EndpointNotFoundException {
        var url = relayConfig.getRoutes().get(service);
        if (url == null) {
            throw new EndpointNotFoundException(String.format("No route configured for service '%s'", service));
        }

        var event = toEvent(body, headers);
        var route = new Endpoint(service, "Route " + service, url, true);

        var result = dispatchService.dispatchTo(event, List.of(route));
        return resultAggregator.toSummary(result, relayConfig.isIncludeOutcomes());
    }

    private InboundEvent toEvent(byte[] body, HttpHeaders headers) throws InvalidPayloadException {
        try {
            var tree = jsonReader.readTree(body);
            if (tree == null || tree.isMissingNode()) {
                throw new InvalidPayloadException("Request body is empty", null);
            }
        } catch (IOException e) {
            throw new InvalidPayloadException("Request body is not valid JSON", e);
        }

        return new InboundEvent(body, new LinkedHashMap<>(headers), Instant.now());
    }
}
