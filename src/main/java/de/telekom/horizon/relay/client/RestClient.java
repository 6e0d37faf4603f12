// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.client;

import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.exception.EndpointResponseException;
import de.telekom.horizon.relay.model.InboundEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicHeader;
import org.apache.http.util.EntityUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The {@code RestClient} class is responsible for sending relayed webhook events to endpoint URLs.
 * It builds the outbound POST request, propagates the allowed inbound headers and validates the response status.
 */
@Component
@Slf4j
public class RestClient {

    // set by the client or derived from the relayed payload, independent of the configured blacklist
    private static final Set<String> NON_PROPAGATED_HEADERS = Set.of("host", "content-length", "transfer-encoding", "content-type");

    private final RelayConfig relayConfig;
    private final CloseableHttpClient httpClient;
    private final RequestConfig requestConfig;

    /**
     * Construct of a new {@code RestClient} with the specified params.
     *
     * @param relayConfig   The RelayConfig instance for retrieving configuration parameters.
     * @param httpClient    The CloseableHttpClient instance for making HTTP requests.
     * @param requestConfig The default RequestConfig that per-request timeouts are derived from.
     */
    @Autowired
    public RestClient(RelayConfig relayConfig, CloseableHttpClient httpClient, RequestConfig requestConfig) {
        this.relayConfig = relayConfig;
        this.httpClient = httpClient;
        this.requestConfig = requestConfig;
    }

    /**
     * Builds the POST request that relays the event to the given URL.
     * The request is returned unsent so the caller can abort it from another thread.
     *
     * @param url       The endpoint URL.
     * @param event     The event to relay.
     * @param timeoutMs Connect, socket and connection-pool timeout for this request.
     * @return The prepared request.
     * @throws IllegalArgumentException If the URL is not a valid URI.
     */
    public HttpPost createRequest(String url, InboundEvent event, int timeoutMs) {
        var request = new HttpPost(url);

        request.setConfig(RequestConfig.copy(requestConfig)
                .setConnectTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .setConnectionRequestTimeout(timeoutMs)
                .build());

        addHeaderToRequest(request, event.headers());

        request.setEntity(new ByteArrayEntity(event.payload(), ContentType.APPLICATION_JSON));
        return request;
    }

    /**
     * Executes the request and validates the response status code.
     *
     * @param request The request created by {@link #createRequest(String, InboundEvent, int)}.
     * @return The response status code, always in the 2xx range.
     * @throws IOException                If an IO error occurs during the HTTP request.
     * @throws EndpointResponseException If the response status code is not in the 2xx range.
     */
    public int execute(HttpPost request) throws IOException, EndpointResponseException {
        try (var response = httpClient.execute(request)) {
            var statusCode = response.getStatusLine().getStatusCode();

            if (statusCode < 200 || statusCode >= 300) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new EndpointResponseException(String.format("Error while relaying event to '%s': %s", request.getURI(), response.getStatusLine().getReasonPhrase()), statusCode);
            }

            // the delivery only counts once the complete response has been read
            EntityUtils.consume(response.getEntity());
            return statusCode;
        }
    }

    /**
     * Overrides a header in the HTTP request.
     *
     * @param request The HTTP request to be modified.
     * @param key     The header key to be overridden.
     * @param value   The new value for the header.
     */
    private void overrideHeader(HttpRequestBase request, String key, String value) {
        request.removeHeaders(key);
        request.setHeader(new BasicHeader(key, value));
    }

    /**
     * Copies the inbound headers to the request unless their lower-cased name is one of the
     * {@link #NON_PROPAGATED_HEADERS} or matches an entry of the header propagation blacklist.
     * The content type is always set to JSON.
     *
     * @param request     The HTTP request to which headers are added.
     * @param httpHeaders The inbound headers.
     */
    private void addHeaderToRequest(HttpPost request, Map<String, List<String>> httpHeaders) {
        var blacklist = relayConfig.getHeaderPropagationBlacklist();

        httpHeaders.forEach((k, v) -> {
            var name = k.toLowerCase(Locale.ROOT);
            if (!NON_PROPAGATED_HEADERS.contains(name) && blacklist.stream().map(String::trim).noneMatch(name::matches)) {
                v.forEach(e -> request.addHeader(k, e));
            }
        });

        overrideHeader(request, HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
    }
}
