package org.opensearch.migrations.graphsync.common.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Sends requests with a Reactor Netty {@link HttpClient} whose base URL is the cluster endpoint.
 * The response body is read fully as UTF-8 text.
 */
@Slf4j
public class ReactorNettyAdapter implements HttpClientAdapter {
    private final HttpClient client;

    public ReactorNettyAdapter(HttpClient client) {
        this.client = client;
    }

    @Override
    public Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers) {
        return Mono.defer(() -> {
            var startNanos = System.nanoTime();
            return client
                .headers(h -> headers.forEach(h::add))
                .request(HttpMethod.valueOf(method))
                .uri("/" + path)
                .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
                .responseSingle((response, bytes) -> bytes.asString(StandardCharsets.UTF_8)
                    .singleOptional()
                    .map(responseBody -> new HttpResponse(
                        response.status().code(),
                        response.status().reasonPhrase(),
                        toSingleValuedHeaders(response.responseHeaders()),
                        responseBody.orElse(null)
                    )))
                .doOnNext(response -> log.atDebug()
                    .setMessage("{} /{} -> {} in {} ms")
                    .addArgument(method)
                    .addArgument(path)
                    .addArgument(response.statusCode)
                    .addArgument(() -> (System.nanoTime() - startNanos) / 1_000_000)
                    .log());
        });
    }

    /** Repeated headers are joined with commas. */
    private static Map<String, String> toSingleValuedHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (v1, v2) -> v1 + "," + v2));
    }
}
