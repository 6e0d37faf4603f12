// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.client.RestClient;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.model.DeliveryAttemptRecord;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;

/**
 * The {@code DeliveryAttemptFactory} class for creating instances of {@link DeliveryAttempt}.
 * It holds the shared collaborators every attempt needs.
 */
@Getter
@Component
public class DeliveryAttemptFactory {

    private final RestClient restClient;

    private final ScheduledExecutorService deliveryTimeoutScheduler;

    private final RelayMetrics relayMetrics;

    /**
     * Constructs a DeliveryAttemptFactory with necessary dependencies.
     *
     * @param restClient               The RestClient instance for making HTTP requests.
     * @param deliveryTimeoutScheduler The scheduler that aborts requests exceeding their deadline.
     * @param relayMetrics             The RelayMetrics instance for recording metrics.
     */
    public DeliveryAttemptFactory(RestClient restClient,
                                  @Qualifier("deliveryTimeoutScheduler") ScheduledExecutorService deliveryTimeoutScheduler,
                                  RelayMetrics relayMetrics) {
        this.restClient = restClient;
        this.deliveryTimeoutScheduler = deliveryTimeoutScheduler;
        this.relayMetrics = relayMetrics;
    }

    /**
     * Creates a new instance of {@link DeliveryAttempt} with the provided {@link DeliveryAttemptRecord}.
     *
     * @param deliveryAttemptRecord The record describing endpoint, event and timeout of the attempt.
     * @return A new instance of DeliveryAttempt.
     */
    public DeliveryAttempt createNew(DeliveryAttemptRecord deliveryAttemptRecord) {
        return new DeliveryAttempt(deliveryAttemptRecord);
    }
}
