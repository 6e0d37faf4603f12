// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.model.DeliveryOutcome;
import de.telekom.horizon.relay.model.DispatchResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static de.telekom.horizon.relay.test.utils.ObjectGenerator.generateEndpoint;
import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    private final ResultAggregator resultAggregator = new ResultAggregator();

    private final DeliveryOutcome okA = DeliveryOutcome.succeeded(generateEndpoint("a", "http://a"), 200, Duration.ofMillis(12));
    private final DeliveryOutcome timeoutB = DeliveryOutcome.failed(generateEndpoint("b", "http://b"), null, "timeout", Duration.ofMillis(5000));
    private final DeliveryOutcome errorC = DeliveryOutcome.failed(generateEndpoint("c", "http://c"), 503, "http_error:503", Duration.ofMillis(3));

    @Test
    void countOutcomes() {
        var result = resultAggregator.aggregate(List.of(okA, timeoutB, errorC));

        assertEquals(3, result.total());
        assertEquals(1, result.succeeded());
        assertEquals(2, result.failed());
        assertEquals(List.of(okA, timeoutB, errorC), result.outcomes());
    }

    @Test
    void aggregateNothing() {
        var result = resultAggregator.aggregate(List.of());

        assertEquals(DispatchResult.empty(), result);
        assertEquals("dispatched event to 0 endpoints", resultAggregator.summaryLine(result));
    }

    @Test
    void orderOutcomesLikeSnapshot() {
        var snapshot = List.of(generateEndpoint("a", "http://a"), generateEndpoint("b", "http://b"), generateEndpoint("c", "http://c"));

        // completion order differs from snapshot order
        var result = resultAggregator.aggregate(snapshot, List.of(errorC, okA, timeoutB));

        assertEquals(List.of("a", "b", "c"), result.outcomes().stream().map(DeliveryOutcome::endpointId).toList());
    }

    @Test
    void renderSummaryLine() {
        var line = resultAggregator.summaryLine(resultAggregator.aggregate(List.of(okA, timeoutB, errorC)));

        assertEquals("dispatched event to 3 endpoint(s): 1 succeeded, 2 failed [endpoint-a=ok(200), endpoint-b=timeout, endpoint-c=http_error:503]", line);
    }

    @Test
    void omitOutcomesFromSummaryIfDisabled() {
        var result = resultAggregator.aggregate(List.of(okA, timeoutB));

        var withOutcomes = resultAggregator.toSummary(result, true);
        assertEquals(2, withOutcomes.outcomes().size());

        var withoutOutcomes = resultAggregator.toSummary(result, false);
        assertEquals(2, withoutOutcomes.total());
        assertEquals(1, withoutOutcomes.succeeded());
        assertEquals(1, withoutOutcomes.failed());
        assertNull(withoutOutcomes.outcomes());
    }

    @Test
    void rejectInconsistentCounts() {
        var outcomes = List.of(okA);
        assertThrows(IllegalArgumentException.class, () -> new DispatchResult(1, 1, 1, outcomes));
        assertThrows(IllegalArgumentException.class, () -> new DispatchResult(2, 1, 1, outcomes));
    }
}
