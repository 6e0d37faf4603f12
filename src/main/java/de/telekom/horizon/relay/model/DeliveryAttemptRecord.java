// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import de.telekom.horizon.relay.service.DeliveryAttemptFactory;

public record DeliveryAttemptRecord(
        Endpoint endpoint,
        InboundEvent event,
        int timeoutMs,
        DeliveryAttemptFactory deliveryAttemptFactory
) {
}
