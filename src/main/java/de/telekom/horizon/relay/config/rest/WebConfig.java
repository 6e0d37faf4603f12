// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config.rest;

import de.telekom.horizon.relay.config.RelayConfig;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Allows the management UI to call the registry API from the configured origins.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RelayConfig relayConfig;

    public WebConfig(RelayConfig relayConfig) {
        this.relayConfig = relayConfig;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(relayConfig.getCorsAllowedOrigins().stream().map(String::trim).toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*");
    }
}
