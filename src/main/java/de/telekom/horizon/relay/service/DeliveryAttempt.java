// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.client.RestClient;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.exception.EndpointResponseException;
import de.telekom.horizon.relay.model.DeliveryAttemptRecord;
import de.telekom.horizon.relay.model.DeliveryErrorType;
import de.telekom.horizon.relay.model.DeliveryOutcome;
import de.telekom.horizon.relay.model.Endpoint;
import de.telekom.horizon.relay.model.InboundEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.conn.ConnectTimeoutException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The {@code DeliveryAttempt} class performs exactly one POST of an event to one endpoint.
 *
 * Every failure mode (non-2xx status, transport error, timeout, invalid URL, unexpected runtime error) is
 * caught and turned into a failed {@link DeliveryOutcome}; {@link #call()} never throws. Besides the
 * socket and connect timeouts of the request, a deadline is scheduled that aborts the request once
 * the attempt timeout has elapsed, so a slowly trickling response cannot exceed it either.
 */
@Slf4j
public class DeliveryAttempt implements Callable<DeliveryOutcome> {

    private final Endpoint endpoint;

    private final InboundEvent event;

    private final int timeoutMs;

    private final RestClient restClient;

    private final ScheduledExecutorService deliveryTimeoutScheduler;

    private final RelayMetrics relayMetrics;

    private final AtomicBoolean deadlineExpired = new AtomicBoolean(false);

    /**
     * Creates a new DeliveryAttempt instance.
     *
     * @param deliveryAttemptRecord The record describing endpoint, event and timeout of the attempt.
     */
    public DeliveryAttempt(DeliveryAttemptRecord deliveryAttemptRecord) {
        this.endpoint = deliveryAttemptRecord.endpoint();
        this.event = deliveryAttemptRecord.event();
        this.timeoutMs = deliveryAttemptRecord.timeoutMs();

        this.restClient = deliveryAttemptRecord.deliveryAttemptFactory().getRestClient();
        this.deliveryTimeoutScheduler = deliveryAttemptRecord.deliveryAttemptFactory().getDeliveryTimeoutScheduler();
        this.relayMetrics = deliveryAttemptRecord.deliveryAttemptFactory().getRelayMetrics();
    }

    @Override
    public DeliveryOutcome call() {
        var start = System.nanoTime();
        Integer httpStatus = null;
        String error = null;
        ScheduledFuture<?> deadline = null;

        try {
            log.debug("Start relaying event received at {} to endpoint '{}' ({})", event.receivedAt(), endpoint.getName(), endpoint.getId());

            HttpPost request = restClient.createRequest(endpoint.getUrl(), event, timeoutMs);
            deadline = deliveryTimeoutScheduler.schedule(() -> abort(request), timeoutMs, TimeUnit.MILLISECONDS);

            httpStatus = restClient.execute(request);
        } catch (EndpointResponseException endpointResponseException) { // -> Could send request, but status code is not 2xx
            httpStatus = endpointResponseException.getStatusCode();
            error = DeliveryErrorType.HTTP_ERROR.describe(httpStatus);
            log.info("Endpoint '{}' did not accept relayed event: HTTP {}", endpoint.getName(), httpStatus);
        } catch (IOException ioException) {
            error = classify(ioException).describe(null);
            log.info("Error while relaying event to endpoint '{}' at '{}': {} ({})", endpoint.getName(), endpoint.getUrl(), error, buildCauseDescription(ioException));
        } catch (Exception unknownException) {
            error = DeliveryErrorType.OTHER.describe(null);
            log.error("Unknown exception occurred while relaying event to endpoint '{}': {}", endpoint.getName(), buildCauseDescription(unknownException));
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
        }

        var latency = Duration.ofNanos(System.nanoTime() - start);
        var outcome = error == null
                ? DeliveryOutcome.succeeded(endpoint, httpStatus, latency)
                : DeliveryOutcome.failed(endpoint, httpStatus, error, latency);

        relayMetrics.recordDelivery(outcome);
        log.debug("Finished relaying event to endpoint '{}' in {} ms", endpoint.getName(), latency.toMillis());
        return outcome;
    }

    private void abort(HttpPost request) {
        deadlineExpired.set(true);
        request.abort();
    }

    /**
     * Maps a transport failure to its error type. An aborted request whose deadline expired counts as timeout.
     *
     * @param ioException The exception raised by the HTTP client.
     * @return The error type.
     */
    DeliveryErrorType classify(IOException ioException) {
        if (deadlineExpired.get() || ioException instanceof SocketTimeoutException || ioException instanceof ConnectTimeoutException) {
            return DeliveryErrorType.TIMEOUT;
        }
        if (ioException instanceof ClientProtocolException) {
            return DeliveryErrorType.OTHER;
        }
        return DeliveryErrorType.CONNECTION_ERROR;
    }

    /**
     * Builds a description for an exception cause, including information about the cause's class and message.
     *
     * @param exceptionCause The Throwable representing the cause of the exception.
     * @return A human-readable description of the exception cause.
     */
    private String buildCauseDescription(Throwable exceptionCause) {
        return String.format("cause %s with Type %s", exceptionCause.getMessage(), exceptionCause.getClass().getName());
    }
}
