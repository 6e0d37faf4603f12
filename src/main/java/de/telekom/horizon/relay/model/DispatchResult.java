// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import java.util.List;

/**
 * Aggregate outcome of one dispatch. Outcomes are ordered like the endpoint snapshot the dispatch was started with.
 */
public record DispatchResult(
        int total,
        int succeeded,
        int failed,
        List<DeliveryOutcome> outcomes) {

    public DispatchResult {
        outcomes = List.copyOf(outcomes);
        if (total != succeeded + failed || total != outcomes.size()) {
            throw new IllegalArgumentException(String.format("Inconsistent dispatch result: total=%d, succeeded=%d, failed=%d, outcomes=%d",
                    total, succeeded, failed, outcomes.size()));
        }
    }

    public static DispatchResult empty() {
        return new DispatchResult(0, 0, 0, List.of());
    }
}
