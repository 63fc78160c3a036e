package dev.leaddispatch.lookup;

import dev.leaddispatch.config.LookupConfig;
import dev.leaddispatch.exception.LookupTimeoutException;
import dev.leaddispatch.metrics.DispatchMetrics;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NominatimClientTest {

    private MockWebServer mockWebServer;
    private LookupConfig lookupConfig;

    @Mock
    private DispatchMetrics metrics;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        lookupConfig = new LookupConfig();
        String url = mockWebServer.url("/").toString();
        lookupConfig.setBaseUrl(url.substring(0, url.length() - 1));
        lookupConfig.setUserAgent("LeadDispatch-Test/1.0");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private NominatimClient client() {
        return new NominatimClient(WebClient.builder(), lookupConfig, metrics);
    }

    @Test
    void shouldSendSearchParametersAndReturnRawBody() throws InterruptedException {
        String body = "[{\"display_name\":\"Sharma Plumbing\",\"lat\":\"19.07\",\"lon\":\"72.87\"}]";
        mockWebServer.enqueue(new MockResponse()
                .setBody(body)
                .addHeader("Content-Type", "application/json"));

        StepVerifier.create(client().search("Mumbai", "plumber", 20))
                .assertNext(response -> assertThat(response).isEqualTo(body))
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/search");
        assertThat(request.getRequestUrl().queryParameter("q")).isEqualTo("plumber, Mumbai");
        assertThat(request.getRequestUrl().queryParameter("format")).isEqualTo("jsonv2");
        assertThat(request.getRequestUrl().queryParameter("limit")).isEqualTo("20");
        assertThat(request.getRequestUrl().queryParameter("extratags")).isEqualTo("1");
        assertThat(request.getHeader("User-Agent")).isEqualTo("LeadDispatch-Test/1.0");
        verify(metrics).recordLookupLatency(any(Duration.class));
    }

    @Test
    void shouldCapLimitAtProviderMaximum() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse().setBody("[]"));

        StepVerifier.create(client().search("Mumbai", "plumber", 500))
                .expectNext("[]")
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getRequestUrl().queryParameter("limit")).isEqualTo("50");
    }

    @Test
    void shouldSurfaceHttpErrors() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503));

        StepVerifier.create(client().search("Mumbai", "plumber", 20))
                .expectError(WebClientResponseException.class)
                .verify();
    }

    @Test
    void shouldMapSlowResponsesToTimeout() {
        lookupConfig.setTimeout(Duration.ofMillis(200));
        mockWebServer.enqueue(new MockResponse()
                .setBody("[]")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        StepVerifier.create(client().search("Mumbai", "plumber", 20))
                .expectError(LookupTimeoutException.class)
                .verify(Duration.ofSeconds(5));
    }
}
