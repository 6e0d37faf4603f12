// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EndpointStatusUpdate(@JsonProperty("is_active") Boolean active) {
}
