// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config;

import de.telekom.horizon.relay.model.DeliveryOutcome;
import de.telekom.horizon.relay.model.DispatchResult;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * The {@code RelayMetrics} class is responsible for recording delivery and dispatch metrics.
 */
@Component
public class RelayMetrics {

    public static final String METRIC_DELIVERY = "relay.delivery";
    public static final String METRIC_DISPATCH_ENDPOINTS = "relay.dispatch.endpoints";
    public static final String METRIC_DISPATCH_FAILED = "relay.dispatch.failed.deliveries";

    private final MeterRegistry meterRegistry;

    private final DistributionSummary dispatchEndpoints;

    private final DistributionSummary dispatchFailures;

    /**
     * Constructor for RelayMetrics.
     *
     * @param meterRegistry The Micrometer registry for recording metrics.
     */
    public RelayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.dispatchEndpoints = DistributionSummary.builder(METRIC_DISPATCH_ENDPOINTS)
                .description("Number of endpoints a dispatch fanned out to")
                .register(meterRegistry);
        this.dispatchFailures = DistributionSummary.builder(METRIC_DISPATCH_FAILED)
                .description("Number of failed deliveries per dispatch")
                .register(meterRegistry);
    }

    /**
     * Records the latency of one delivery attempt, tagged with its result, error class and HTTP status.
     *
     * @param outcome The outcome of the attempt.
     */
    public void recordDelivery(DeliveryOutcome outcome) {
        var latency = outcome.latency() == null ? Duration.ZERO : outcome.latency();

        Timer.builder(METRIC_DELIVERY)
                .tag("result", outcome.success() ? "success" : "failure")
                .tag("error", outcome.error() == null ? "none" : StringUtils.substringBefore(outcome.error(), ":"))
                .tag("http_code", outcome.httpStatus() == null ? "none" : String.valueOf(outcome.httpStatus()))
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofMinutes(1))
                .register(meterRegistry)
                .record(latency);
    }

    /**
     * Records the fan-out size and the number of failed deliveries of a finished dispatch.
     *
     * @param result The aggregated dispatch result.
     */
    public void recordDispatch(DispatchResult result) {
        dispatchEndpoints.record(result.total());
        dispatchFailures.record(result.failed());
    }
}
