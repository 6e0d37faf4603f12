// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.model.DeliveryAttemptRecord;
import de.telekom.horizon.relay.model.DeliveryErrorType;
import de.telekom.horizon.relay.model.DeliveryOutcome;
import de.telekom.horizon.relay.model.DispatchResult;
import de.telekom.horizon.relay.model.Endpoint;
import de.telekom.horizon.relay.model.InboundEvent;
import de.telekom.horizon.relay.registry.EndpointRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The {@code DispatchService} fans one inbound event out to a snapshot of endpoints.
 *
 * All delivery attempts are submitted before the first one is awaited, so the wall-clock time of a dispatch
 * is bounded by the attempt timeout rather than by the sum of all attempts. A failing or slow endpoint only
 * affects its own outcome; the join never short-circuits and never cancels siblings.
 */
@Slf4j
@Service
public class DispatchService {

    private final RelayConfig relayConfig;

    private final EndpointRegistry endpointRegistry;

    private final DeliveryAttemptFactory deliveryAttemptFactory;

    private final ResultAggregator resultAggregator;

    private final RelayMetrics relayMetrics;

    private final ThreadPoolTaskExecutor dispatchTaskExecutor;

    /**
     * Constructs a {@code DispatchService} with necessary dependencies.
     *
     * @param relayConfig            The {@code RelayConfig} instance for configuration.
     * @param endpointRegistry       The {@code EndpointRegistry} the snapshots are taken from.
     * @param deliveryAttemptFactory The {@code DeliveryAttemptFactory} instance for creating delivery attempts.
     * @param resultAggregator       The {@code ResultAggregator} merging the outcomes.
     * @param relayMetrics           The {@code RelayMetrics} instance for recording dispatch metrics.
     * @param meterRegistry          The {@code MeterRegistry} for monitoring thread pool metrics.
     */
    @Autowired
    public DispatchService(RelayConfig relayConfig, EndpointRegistry endpointRegistry, DeliveryAttemptFactory deliveryAttemptFactory, ResultAggregator resultAggregator, RelayMetrics relayMetrics, MeterRegistry meterRegistry) {
        this.relayConfig = relayConfig;
        this.endpointRegistry = endpointRegistry;
        this.deliveryAttemptFactory = deliveryAttemptFactory;
        this.resultAggregator = resultAggregator;
        this.relayMetrics = relayMetrics;

        this.dispatchTaskExecutor = new ThreadPoolTaskExecutor();

        this.dispatchTaskExecutor.setAwaitTerminationSeconds(20);
        this.dispatchTaskExecutor.setThreadNamePrefix("dispatch-");
        this.dispatchTaskExecutor.setCorePoolSize(relayConfig.getDispatchCorePoolSize());
        // hand-off without queueing: every attempt gets its own thread, idle threads above core expire
        this.dispatchTaskExecutor.setMaxPoolSize(Integer.MAX_VALUE);
        this.dispatchTaskExecutor.setQueueCapacity(0);
        this.dispatchTaskExecutor.setKeepAliveSeconds(60);
        this.dispatchTaskExecutor.afterPropertiesSet();
        ExecutorServiceMetrics.monitor(meterRegistry, this.dispatchTaskExecutor.getThreadPoolExecutor(), "dispatchTaskExecutor", Collections.emptyList());
    }

    /**
     * Shuts down the dispatch task executor, giving running attempts time to finish.
     */
    @PreDestroy
    void stopTaskExecutorWithTimeout() {
        dispatchTaskExecutor.shutdown();
    }

    /**
     * Relays the event to every endpoint that is active at the time of the call.
     * The registry is read exactly once; later registry changes do not affect this dispatch.
     *
     * @param event The inbound event.
     * @return The aggregated result, {@code total == 0} if no endpoint is active.
     */
    public DispatchResult dispatch(InboundEvent event) {
        var snapshot = endpointRegistry.listActive();

        if (snapshot.isEmpty()) {
            log.info("No active endpoints configured, event received at {} is not relayed", event.receivedAt());
        }

        return dispatchTo(event, snapshot);
    }

    /**
     * Relays the event to the given endpoints, independent of their registration or status.
     *
     * @param event     The inbound event.
     * @param endpoints The endpoints to deliver to.
     * @return The aggregated result.
     */
    public DispatchResult dispatchTo(InboundEvent event, List<Endpoint> endpoints) {
        if (endpoints.isEmpty()) {
            var result = DispatchResult.empty();
            relayMetrics.recordDispatch(result);
            return result;
        }

        var timeoutMs = relayConfig.getDeliveryTimeoutMs();

        List<Future<DeliveryOutcome>> futures = new ArrayList<>(endpoints.size());
        for (Endpoint endpoint : endpoints) {
            var deliveryAttempt = deliveryAttemptFactory.createNew(new DeliveryAttemptRecord(endpoint, event, timeoutMs, deliveryAttemptFactory));
            futures.add(dispatchTaskExecutor.submit(deliveryAttempt));
        }

        var joinBudget = Duration.ofMillis((long) timeoutMs + relayConfig.getDeliveryTimeoutGraceMs());
        var joinDeadline = System.nanoTime() + joinBudget.toNanos();

        List<DeliveryOutcome> outcomes = new ArrayList<>(endpoints.size());
        for (int i = 0; i < endpoints.size(); i++) {
            outcomes.add(awaitOutcome(endpoints.get(i), futures.get(i), joinDeadline, joinBudget));
        }

        var result = resultAggregator.aggregate(endpoints, outcomes);
        relayMetrics.recordDispatch(result);

        if (result.failed() > 0) {
            log.warn(resultAggregator.summaryLine(result));
        } else {
            log.info(resultAggregator.summaryLine(result));
        }
        return result;
    }

    /**
     * Waits for one attempt until the shared join deadline. An attempt that is still running then is
     * cancelled and reported as timeout; the remaining attempts are not affected.
     */
    private DeliveryOutcome awaitOutcome(Endpoint endpoint, Future<DeliveryOutcome> future, long joinDeadline, Duration joinBudget) {
        try {
            var remaining = Math.max(0, joinDeadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            log.warn("Delivery to endpoint '{}' did not finish within {} ms and was cancelled", endpoint.getName(), joinBudget.toMillis());
            return DeliveryOutcome.failed(endpoint, null, DeliveryErrorType.TIMEOUT.describe(null), joinBudget);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.error("Interrupted while waiting for delivery to endpoint '{}'", endpoint.getName());
            return DeliveryOutcome.failed(endpoint, null, DeliveryErrorType.OTHER.describe(null), Duration.ZERO);
        } catch (ExecutionException | CancellationException exception) {
            log.error("Delivery to endpoint '{}' failed unexpectedly", endpoint.getName(), exception);
            return DeliveryOutcome.failed(endpoint, null, DeliveryErrorType.OTHER.describe(null), Duration.ZERO);
        }
    }
}
