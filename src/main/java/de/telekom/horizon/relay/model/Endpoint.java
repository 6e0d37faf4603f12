// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The {@code Endpoint} class represents a registered destination of relayed webhook events.
 * Instances are immutable, a status change produces a new instance via {@link #withActive(boolean)}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Endpoint {

    private final String id;

    private final String name;

    private final String url;

    /**
     * Only active endpoints are part of a dispatch snapshot.
     */
    @JsonProperty("is_active")
    private final boolean active;

    @JsonCreator
    public Endpoint(@JsonProperty("id") String id,
                    @JsonProperty("name") String name,
                    @JsonProperty("url") String url,
                    @JsonProperty("is_active") boolean active) {
        this.id = id;
        this.name = name;
        this.url = url;
        this.active = active;
    }

    public Endpoint withActive(boolean active) {
        return new Endpoint(id, name, url, active);
    }
}
