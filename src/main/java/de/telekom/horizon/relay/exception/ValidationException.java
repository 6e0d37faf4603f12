// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.exception;

import lombok.Getter;

/**
 * Thrown when registry input is rejected. The optional details describe the underlying parse problem.
 */
@Getter
public class ValidationException extends Exception {

    private final String details;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String details) {
        super(message);
        this.details = details;
    }
}
