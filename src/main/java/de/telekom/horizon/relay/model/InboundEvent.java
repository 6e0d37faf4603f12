// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A received webhook event. The payload is the request body exactly as received and is forwarded verbatim.
 *
 * @param payload    raw JSON body
 * @param headers    inbound request headers that are candidates for propagation
 * @param receivedAt time the event was accepted by the relay
 */
public record InboundEvent(
        byte[] payload,
        Map<String, List<String>> headers,
        Instant receivedAt) {

    public InboundEvent {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static InboundEvent of(byte[] payload) {
        return new InboundEvent(payload, Map.of(), Instant.now());
    }
}
