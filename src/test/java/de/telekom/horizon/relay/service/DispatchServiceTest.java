// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.service;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import de.telekom.horizon.relay.client.RestClient;
import de.telekom.horizon.relay.config.RelayConfig;
import de.telekom.horizon.relay.config.RelayMetrics;
import de.telekom.horizon.relay.model.DeliveryOutcome;
import de.telekom.horizon.relay.model.Endpoint;
import de.telekom.horizon.relay.model.InboundEvent;
import de.telekom.horizon.relay.registry.EndpointRegistry;
import de.telekom.horizon.relay.registry.EndpointStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static de.telekom.horizon.relay.test.utils.ObjectGenerator.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DispatchServiceTest {

    @RegisterExtension
    static WireMockExtension wireMockServer = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort().containerThreads(64))
            .build();

    @Mock
    RelayConfig relayConfig;

    @Mock
    EndpointRegistry endpointRegistry;

    private CloseableHttpClient httpClient;

    private ScheduledExecutorService timeoutScheduler;

    private SimpleMeterRegistry meterRegistry;

    private DeliveryAttemptFactory deliveryAttemptFactory;

    private DispatchService dispatchService;

    @BeforeEach
    void setUp() {
        lenient().when(relayConfig.getHeaderPropagationBlacklist()).thenReturn(List.of("host", "content-length", "content-type"));
        lenient().when(relayConfig.getDeliveryTimeoutMs()).thenReturn(2000);
        lenient().when(relayConfig.getDeliveryTimeoutGraceMs()).thenReturn(1000L);
        lenient().when(relayConfig.getDispatchCorePoolSize()).thenReturn(2);

        httpClient = HttpClientBuilder.create().disableAutomaticRetries().disableRedirectHandling().setMaxConnPerRoute(32).setMaxConnTotal(32).build();
        timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
        meterRegistry = new SimpleMeterRegistry();

        var relayMetrics = new RelayMetrics(meterRegistry);
        deliveryAttemptFactory = new DeliveryAttemptFactory(new RestClient(relayConfig, httpClient, RequestConfig.DEFAULT), timeoutScheduler, relayMetrics);
        dispatchService = createDispatchService(endpointRegistry);
    }

    @AfterEach
    void tearDown() throws IOException {
        dispatchService.stopTaskExecutorWithTimeout();
        timeoutScheduler.shutdownNow();
        httpClient.close();
    }

    @Test
    void returnEmptyResultWithoutActiveEndpoints() {
        when(endpointRegistry.listActive()).thenReturn(List.of());

        var result = assertDoesNotThrow(() -> dispatchService.dispatch(generateInboundEvent()));

        assertEquals(0, result.total());
        assertEquals(0, result.succeeded());
        assertEquals(0, result.failed());
        assertTrue(result.outcomes().isEmpty());
        assertEquals(0, wireMockServer.getAllServeEvents().size());
    }

    @Test
    void deliverToAllActiveEndpoints() {
        wireMockServer.stubFor(post(urlPathMatching("/hook/.*")).willReturn(aResponse().withStatus(200)));
        var endpoints = List.of(
                generateEndpoint("a", wireMockServer.baseUrl() + "/hook/a"),
                generateEndpoint("b", wireMockServer.baseUrl() + "/hook/b"),
                generateEndpoint("c", wireMockServer.baseUrl() + "/hook/c"));
        when(endpointRegistry.listActive()).thenReturn(endpoints);

        var result = dispatchService.dispatch(generateInboundEvent());

        assertEquals(3, result.total());
        assertEquals(3, result.succeeded());
        assertEquals(0, result.failed());
        assertEquals(List.of("a", "b", "c"), result.outcomes().stream().map(DeliveryOutcome::endpointId).toList());

        verify(endpointRegistry, times(1)).listActive();
        wireMockServer.verify(exactly(3), postRequestedFor(urlPathMatching("/hook/.*")).withRequestBody(equalToJson(TEST_PAYLOAD)));
    }

    @Test
    void isolateTimeoutOfSingleEndpoint() {
        when(relayConfig.getDeliveryTimeoutMs()).thenReturn(500);
        wireMockServer.stubFor(post("/fast").willReturn(aResponse().withStatus(200)));
        wireMockServer.stubFor(post("/slow").willReturn(aResponse().withStatus(200).withFixedDelay(3000)));
        when(endpointRegistry.listActive()).thenReturn(List.of(
                generateEndpoint("a", wireMockServer.baseUrl() + "/fast"),
                generateEndpoint("b", wireMockServer.baseUrl() + "/slow"),
                generateEndpoint("c", wireMockServer.baseUrl() + "/fast")));

        var start = System.currentTimeMillis();
        var result = dispatchService.dispatch(generateInboundEvent());
        var elapsed = System.currentTimeMillis() - start;

        assertEquals(3, result.total());
        assertEquals(2, result.succeeded());
        assertEquals(1, result.failed());

        var slow = result.outcomes().get(1);
        assertEquals("b", slow.endpointId());
        assertFalse(slow.success());
        assertEquals("timeout", slow.error());

        assertTrue(result.outcomes().get(0).success());
        assertTrue(result.outcomes().get(2).success());

        assertTrue(elapsed < 2000, "dispatch took " + elapsed + " ms");
    }

    @Test
    void runAttemptsConcurrently() {
        wireMockServer.stubFor(post(urlPathMatching("/delayed/.*")).willReturn(aResponse().withStatus(202).withFixedDelay(500)));
        when(endpointRegistry.listActive()).thenReturn(List.of(
                generateEndpoint("a", wireMockServer.baseUrl() + "/delayed/a"),
                generateEndpoint("b", wireMockServer.baseUrl() + "/delayed/b"),
                generateEndpoint("c", wireMockServer.baseUrl() + "/delayed/c"),
                generateEndpoint("d", wireMockServer.baseUrl() + "/delayed/d")));

        var start = System.currentTimeMillis();
        var result = dispatchService.dispatch(generateInboundEvent());
        var elapsed = System.currentTimeMillis() - start;

        assertEquals(4, result.succeeded());
        // sequential delivery would take at least 2000 ms
        assertTrue(elapsed < 1600, "dispatch took " + elapsed + " ms");
    }

    @Test
    void startAllAttemptsEvenIfSnapshotExceedsCorePoolSize() {
        wireMockServer.stubFor(post(urlPathMatching("/delayed/.*")).willReturn(aResponse().withStatus(200).withFixedDelay(500)));
        var endpoints = IntStream.range(0, 12)
                .mapToObj(i -> generateEndpoint("e" + i, wireMockServer.baseUrl() + "/delayed/" + i))
                .toList();
        when(endpointRegistry.listActive()).thenReturn(endpoints);

        var start = System.currentTimeMillis();
        var result = dispatchService.dispatch(generateInboundEvent());
        var elapsed = System.currentTimeMillis() - start;

        assertEquals(12, result.total());
        assertEquals(12, result.succeeded());
        // 12 attempts on 2 core threads, one after another this would take at least 3000 ms
        assertTrue(elapsed < 1500, "dispatch took " + elapsed + " ms");
    }

    @Test
    void runConcurrentDispatchesSideBySide() throws Exception {
        wireMockServer.stubFor(post(urlPathMatching("/delayed/.*")).willReturn(aResponse().withStatus(200).withFixedDelay(500)));
        var endpoints = IntStream.range(0, 8)
                .mapToObj(i -> generateEndpoint("e" + i, wireMockServer.baseUrl() + "/delayed/" + i))
                .toList();
        when(endpointRegistry.listActive()).thenReturn(endpoints);

        var webhookThreads = Executors.newFixedThreadPool(2);
        try {
            var start = System.currentTimeMillis();
            var first = webhookThreads.submit(() -> dispatchService.dispatch(generateInboundEvent()));
            var second = webhookThreads.submit(() -> dispatchService.dispatch(generateInboundEvent()));

            assertEquals(8, first.get(5, TimeUnit.SECONDS).succeeded());
            assertEquals(8, second.get(5, TimeUnit.SECONDS).succeeded());
            var elapsed = System.currentTimeMillis() - start;

            assertTrue(elapsed < 1500, "dispatches took " + elapsed + " ms");
        } finally {
            webhookThreads.shutdownNow();
        }

        wireMockServer.verify(exactly(16), postRequestedFor(urlPathMatching("/delayed/.*")));
    }

    @Test
    void reportEachFailureOnlyForItsEndpoint() {
        wireMockServer.stubFor(post("/ok").willReturn(aResponse().withStatus(200)));
        wireMockServer.stubFor(post("/error").willReturn(aResponse().withStatus(500)));
        when(endpointRegistry.listActive()).thenReturn(List.of(
                generateEndpoint("a", wireMockServer.baseUrl() + "/error"),
                generateEndpoint("b", "http://localhost:1/unreachable"),
                generateEndpoint("c", wireMockServer.baseUrl() + "/ok")));

        var result = dispatchService.dispatch(generateInboundEvent());

        assertEquals(3, result.total());
        assertEquals(1, result.succeeded());
        assertEquals(2, result.failed());
        assertEquals("http_error:500", result.outcomes().get(0).error());
        assertEquals(500, result.outcomes().get(0).httpStatus());
        assertEquals("connection_error", result.outcomes().get(1).error());
        assertTrue(result.outcomes().get(2).success());
    }

    @Test
    void treatDuplicateUrlsAsIndependentDeliveries() {
        wireMockServer.stubFor(post("/shared").willReturn(aResponse().withStatus(200)));
        var url = wireMockServer.baseUrl() + "/shared";
        when(endpointRegistry.listActive()).thenReturn(List.of(generateEndpoint("a", url), generateEndpoint("b", url)));

        var result = dispatchService.dispatch(generateInboundEvent());

        assertEquals(2, result.total());
        assertEquals(2, result.succeeded());
        wireMockServer.verify(exactly(2), postRequestedFor(urlPathEqualTo("/shared")));
    }

    @Test
    void forwardEmptyObjectVerbatim() {
        wireMockServer.stubFor(post("/hook").willReturn(aResponse().withStatus(204)));
        when(endpointRegistry.listActive()).thenReturn(List.of(generateEndpoint("a", wireMockServer.baseUrl() + "/hook")));

        var result = dispatchService.dispatch(InboundEvent.of("{}".getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, result.succeeded());
        wireMockServer.verify(exactly(1), postRequestedFor(urlPathEqualTo("/hook")).withRequestBody(equalTo("{}")));
    }

    @Test
    void deliverToSnapshotEvenIfEndpointIsDeletedMeanwhile() throws Exception {
        wireMockServer.stubFor(post("/hook").willReturn(aResponse().withStatus(200)));

        var endpointStore = mock(EndpointStore.class);
        var registry = spy(new EndpointRegistry(endpointStore));
        var endpointId = registry.create("a", wireMockServer.baseUrl() + "/hook", true).get(0).getId();

        // the endpoint is deleted right after the snapshot was taken, before any attempt started
        doAnswer(invocation -> {
            @SuppressWarnings("unchecked")
            var snapshot = (List<Endpoint>) invocation.callRealMethod();
            registry.delete(endpointId);
            return snapshot;
        }).doCallRealMethod().when(registry).listActive();

        var snapshotService = createDispatchService(registry);
        try {
            var inFlight = snapshotService.dispatch(generateInboundEvent());
            assertEquals(1, inFlight.total());
            assertEquals(1, inFlight.succeeded());
            assertTrue(registry.list().isEmpty());

            var next = snapshotService.dispatch(generateInboundEvent());
            assertEquals(0, next.total());
        } finally {
            snapshotService.stopTaskExecutorWithTimeout();
        }

        wireMockServer.verify(exactly(1), postRequestedFor(urlPathEqualTo("/hook")));
    }

    @Test
    void dispatchToExplicitEndpointsWithoutRegistry() {
        wireMockServer.stubFor(post("/route").willReturn(aResponse().withStatus(200)));

        var result = dispatchService.dispatchTo(generateInboundEvent(), List.of(generateEndpoint("route", wireMockServer.baseUrl() + "/route")));

        assertEquals(1, result.succeeded());
        verifyNoInteractions(endpointRegistry);
    }

    private DispatchService createDispatchService(EndpointRegistry registry) {
        return new DispatchService(relayConfig, registry, deliveryAttemptFactory, new ResultAggregator(), new RelayMetrics(meterRegistry), meterRegistry);
    }
}
