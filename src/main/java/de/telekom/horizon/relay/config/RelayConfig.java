// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

@Configuration
@Getter
public class RelayConfig {

    @Value("${relay.delivery.timeout-ms:5000}")
    private int deliveryTimeoutMs;

    @Value("${relay.delivery.timeout-grace-ms:1000}")
    private long deliveryTimeoutGraceMs;

    @Value("${relay.delivery.max-connections:1000}")
    private int maxConnections;

    @Value("#{'${relay.delivery.header-propagation-blacklist}'.split(',')}")
    private List<String> headerPropagationBlacklist;

    @Value("${relay.dispatch.core-pool-size:16}")
    private int dispatchCorePoolSize;

    @Value("${relay.registry.file:endpoints.json}")
    private String registryFile;

    @Value("${relay.webhook.include-outcomes:true}")
    private boolean includeOutcomes;

    @Value("#{${relay.webhook.routes:{:}}}")
    private Map<String, String> routes;

    @Value("#{'${relay.cors.allowed-origins:*}'.split(',')}")
    private List<String> corsAllowedOrigins;
}
