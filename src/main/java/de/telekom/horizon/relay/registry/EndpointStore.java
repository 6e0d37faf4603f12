// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.registry;

import de.telekom.horizon.relay.model.Endpoint;

import java.io.IOException;
import java.util.List;

/**
 * Durable storage of the endpoint registry. Implementations replace the whole stored collection on every save.
 */
public interface EndpointStore {

    List<Endpoint> load() throws IOException;

    void save(List<Endpoint> endpoints) throws IOException;
}
