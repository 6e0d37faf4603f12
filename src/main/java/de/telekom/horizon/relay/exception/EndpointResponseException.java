// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.exception;

import lombok.Getter;

@Getter
public class EndpointResponseException extends Exception {

    private final int statusCode;


    public EndpointResponseException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
