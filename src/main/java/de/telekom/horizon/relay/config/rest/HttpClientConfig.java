// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config.rest;

import de.telekom.horizon.relay.config.RelayConfig;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;


/**
 * The {@code HttpClientConfig} class for creating and configuring the HTTP client used to deliver events to endpoints.
 */
@Configuration
public class HttpClientConfig {

    private final RelayConfig relayConfig;

    /**
     * Construct of a new {@code HttpClientConfig} with the specified RelayConfig.
     * @param relayConfig The RelayConfig instance for retrieving configuration parameters.
     */
    @Autowired
    public HttpClientConfig(RelayConfig relayConfig) {
        this.relayConfig = relayConfig;
    }

    /**
     * Creates the {@code PoolingHttpClientConnectionManager} shared by all delivery attempts.
     *
     * @return The configured {@code PoolingHttpClientConnectionManager} bean.
     */
    @Bean
    public PoolingHttpClientConnectionManager poolingHttpClientConnectionManager() {
        var connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(relayConfig.getMaxConnections());
        connectionManager.setDefaultMaxPerRoute(relayConfig.getMaxConnections());
        return connectionManager;
    }

    /**
     * Creates the default {@code RequestConfig}. Every delivery attempt derives its own copy of it
     * with the timeout of the current dispatch.
     *
     * @return The configured {@code RequestConfig} bean.
     */
    @Bean
    public RequestConfig requestConfig() {
        return RequestConfig.custom()
                .setConnectionRequestTimeout(relayConfig.getDeliveryTimeoutMs())
                .setConnectTimeout(relayConfig.getDeliveryTimeoutMs())
                .setSocketTimeout(relayConfig.getDeliveryTimeoutMs())
                .setRedirectsEnabled(false)
                .build();
    }

    /**
     * Creates the {@code CloseableHttpClient}. Automatic retries and redirects are disabled, so each
     * delivery attempt results in exactly one outbound request.
     *
     * @param poolingHttpClientConnectionManager The PoolingHttpClientConnectionManager bean.
     * @param requestConfig                      The RequestConfig bean.
     * @return The configured CloseableHttpClient bean.
     */
    @Bean
    public CloseableHttpClient httpClient(PoolingHttpClientConnectionManager poolingHttpClientConnectionManager, RequestConfig requestConfig) {
        return HttpClientBuilder
                .create()
                .setConnectionManager(poolingHttpClientConnectionManager)
                .setDefaultRequestConfig(requestConfig)
                .disableCookieManagement()
                .disableAutomaticRetries()
                .disableRedirectHandling()
                .build();
    }
}
