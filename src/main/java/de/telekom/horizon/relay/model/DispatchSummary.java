// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response body returned to the poster of a webhook.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchSummary(
        int total,
        int succeeded,
        int failed,
        List<DeliveryOutcome> outcomes) {
}
