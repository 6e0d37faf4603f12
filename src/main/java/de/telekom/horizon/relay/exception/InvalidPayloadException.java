// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.exception;

public class InvalidPayloadException extends Exception {

    public InvalidPayloadException(String message, Throwable cause) { super(message, cause); }

}
