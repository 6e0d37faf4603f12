// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import de.telekom.horizon.relay.model.DeliveryOutcome;
import de.telekom.horizon.relay.model.DispatchResult;
import de.telekom.horizon.relay.model.DispatchSummary;
import de.telekom.horizon.relay.model.Endpoint;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges delivery outcomes into a {@link DispatchResult} and renders it for logs and HTTP responses.
 * Holds no state and performs no I/O.
 */
@Component
public class ResultAggregator {

    /**
     * Counts the outcomes, keeping them in the given order.
     *
     * @param outcomes outcomes of one dispatch
     * @return the aggregated result
     */
    public DispatchResult aggregate(List<DeliveryOutcome> outcomes) {
        var succeeded = (int) outcomes.stream().filter(DeliveryOutcome::success).count();
        return new DispatchResult(outcomes.size(), succeeded, outcomes.size() - succeeded, outcomes);
    }

    /**
     * Orders the outcomes like the snapshot they were produced for, regardless of completion order, then counts them.
     *
     * @param snapshot endpoints the dispatch was started with
     * @param outcomes outcomes in any order
     * @return the aggregated result
     */
    public DispatchResult aggregate(List<Endpoint> snapshot, Collection<DeliveryOutcome> outcomes) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < snapshot.size(); i++) {
            positions.putIfAbsent(snapshot.get(i).getId(), i);
        }

        var ordered = outcomes.stream()
                .sorted(Comparator.comparingInt(outcome -> positions.getOrDefault(outcome.endpointId(), Integer.MAX_VALUE)))
                .toList();
        return aggregate(ordered);
    }

    /**
     * Renders a single log line, e.g. {@code dispatched event to 2 endpoint(s): 1 succeeded, 1 failed [a=ok(200), b=timeout]}.
     */
    public String summaryLine(DispatchResult result) {
        if (result.total() == 0) {
            return "dispatched event to 0 endpoints";
        }

        var details = result.outcomes().stream()
                .map(outcome -> outcome.endpointName() + "=" + (outcome.success() ? "ok(" + outcome.httpStatus() + ")" : outcome.error()))
                .collect(Collectors.joining(", ", "[", "]"));

        return String.format("dispatched event to %d endpoint(s): %d succeeded, %d failed %s",
                result.total(), result.succeeded(), result.failed(), details);
    }

    public DispatchSummary toSummary(DispatchResult result, boolean includeOutcomes) {
        return new DispatchSummary(result.total(), result.succeeded(), result.failed(), includeOutcomes ? result.outcomes() : null);
    }
}
