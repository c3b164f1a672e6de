package org.healthdata.reporting.search.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * {@link HttpClientAdapter} over a reactor-netty {@link HttpClient} whose base URL is already set.
 */
public class ReactorNettyAdapter implements HttpClientAdapter {
    private final HttpClient client;

    public ReactorNettyAdapter(HttpClient client) {
        this.client = client;
    }

    @Override
    public Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers) {
        return client
            .headers(h -> headers.forEach(h::add))
            .request(HttpMethod.valueOf(method))
            .uri("/" + path)
            .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
            .responseSingle(
                (response, bytes) -> bytes.asString()
                    .singleOptional()
                    .map(bodyOp -> new HttpResponse(
                        response.status().code(),
                        response.status().reasonPhrase(),
                        extractHeaders(response.responseHeaders()),
                        bodyOp.orElse(null)
                    ))
            );
    }

    private static Map<String, String> extractHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2
            ));
    }
}
