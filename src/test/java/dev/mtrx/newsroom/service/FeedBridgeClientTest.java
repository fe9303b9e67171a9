package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.entity.Feed;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class FeedBridgeClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private final Feed feed = Feed.builder().id(3L).name("G1").url("https://g1.globo.com/rss/g1/").language("portuguese").build();

    private FeedBridgeClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new FeedBridgeClient(builder, "http://bridge:8085");
    }

    @Test
    @DisplayName("Should request the feed URL and map every item")
    void shouldMapItems() {
        FeedBridgeClient client = client(HttpStatus.OK, """
                [
                  {"title": "Primeira", "url": "https://g1.globo.com/a/1", "author": "Redação",
                   "publishedAt": "2026-03-01T08:30:00", "unknownField": 1},
                  {"title": "Segunda", "url": "https://g1.globo.com/a/2", "content": "<p>Texto</p>"}
                ]
                """);

        StepVerifier.create(client.fetchRaw(feed))
                .assertNext(raw -> {
                    assertThat(raw.title()).isEqualTo("Primeira");
                    assertThat(raw.author()).isEqualTo("Redação");
                    assertThat(raw.publishedAt()).isNotNull();
                })
                .assertNext(raw -> assertThat(raw.content()).isEqualTo("<p>Texto</p>"))
                .verifyComplete();

        assertThat(lastRequest.get().url().getPath()).isEqualTo("/api/items");
        assertThat(lastRequest.get().url().getQuery()).isEqualTo("url=https://g1.globo.com/rss/g1/");
    }

    @Test
    @DisplayName("Should fail when the bridge cannot fetch the feed")
    void shouldFailOnBridgeError() {
        FeedBridgeClient client = client(HttpStatus.BAD_GATEWAY, "{\"error\":\"upstream 404\"}");

        StepVerifier.create(client.fetchRaw(feed))
                .expectError(WebClientResponseException.class)
                .verify();
    }
}
