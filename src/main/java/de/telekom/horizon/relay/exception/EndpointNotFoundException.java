// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.exception;

public class EndpointNotFoundException extends Exception {

    public EndpointNotFoundException(String message) { super(message); }

}
