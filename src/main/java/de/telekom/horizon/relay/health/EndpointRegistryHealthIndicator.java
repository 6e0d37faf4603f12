// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.health;

import de.telekom.horizon.relay.registry.EndpointRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * The {@code EndpointRegistryHealthIndicator} reports the size of the endpoint registry and
 * goes down when the last write to the endpoint store failed.
 */
@Component
public class EndpointRegistryHealthIndicator implements HealthIndicator {

    private final EndpointRegistry endpointRegistry;

    public EndpointRegistryHealthIndicator(EndpointRegistry endpointRegistry) {
        this.endpointRegistry = endpointRegistry;
    }

    @Override
    public Health health() {
        Health.Builder status = Health.up();

        if (!endpointRegistry.isLastSaveSucceeded()) {
            status = Health.down().withDetail("store", "last save failed");
        }

        return status
                .withDetail("endpoints", endpointRegistry.list().size())
                .withDetail("active", endpointRegistry.listActive().size())
                .build();
    }
}
