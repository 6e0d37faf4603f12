// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Result of a single delivery attempt to one endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryOutcome(
        @JsonProperty("endpoint_id") String endpointId,
        @JsonProperty("endpoint_name") String endpointName,
        boolean success,
        @JsonProperty("http_status") Integer httpStatus,
        String error,
        @JsonIgnore Duration latency) {

    public static DeliveryOutcome succeeded(Endpoint endpoint, int httpStatus, Duration latency) {
        return new DeliveryOutcome(endpoint.getId(), endpoint.getName(), true, httpStatus, null, latency);
    }

    public static DeliveryOutcome failed(Endpoint endpoint, Integer httpStatus, String error, Duration latency) {
        return new DeliveryOutcome(endpoint.getId(), endpoint.getName(), false, httpStatus, error, latency);
    }

    @JsonProperty("latency_ms")
    public long latencyMillis() {
        return latency == null ? 0 : latency.toMillis();
    }
}
