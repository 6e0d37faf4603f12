// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.model;

import lombok.Getter;

/**
 * Classification of a failed delivery attempt.
 */
@Getter
public enum DeliveryErrorType {

    TIMEOUT("timeout"),
    CONNECTION_ERROR("connection_error"),
    HTTP_ERROR("http_error"),
    OTHER("other");

    private final String value;

    DeliveryErrorType(String value) {
        this.value = value;
    }

    /**
     * Renders the error description stored in a {@link DeliveryOutcome}, e.g. {@code http_error:503}.
     *
     * @param httpStatus status code of the response, only used for {@link #HTTP_ERROR}
     * @return the error description
     */
    public String describe(Integer httpStatus) {
        if (this == HTTP_ERROR) {
            return value + ":" + httpStatus;
        }
        return value;
    }
}
