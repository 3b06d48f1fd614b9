package com.poc.integration.virtualization;

import io.netty.channel.ChannelOption;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls the virtualization server's RESTful views, e.g.
 * {@code GET {baseUrl}/category_search?category=premium}.
 *
 * <p>The server answers {@code {"name": ..., "elements": [...], "links": [...]}}; some views
 * answer a bare array. Both shapes are accepted.
 */
public class RestVirtualizationAdapter implements VirtualizationAdapter {

    private static final Logger log = LoggerFactory.getLogger(RestVirtualizationAdapter.class);

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final WebClient webClient;

    public RestVirtualizationAdapter(WebClient webClient) {
        this.webClient = webClient;
    }

    public static RestVirtualizationAdapter create(String baseUrl, String username, String password,
                                                   int connectTimeoutMs) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs);

        WebClient webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeaders(headers -> headers.setBasicAuth(username, password))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
            .build();
        return new RestVirtualizationAdapter(webClient);
    }

    @Override
    public List<Map<String, Object>> queryView(String view, Map<String, String> params, Duration timeout) {
        log.debug("Querying view {} with {}", view, params);

        String body;
        try {
            body = webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/{view}");
                    params.forEach(uriBuilder::queryParam);
                    return uriBuilder.build(view);
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .block(timeout);
        } catch (WebClientResponseException.NotFound e) {
            throw new VirtualizationException("View not found: " + view
                + ". Views or REST services may not be published.", e);
        } catch (WebClientResponseException e) {
            throw new VirtualizationException("Virtualization HTTP error " + e.getStatusCode().value()
                + " on " + view, e);
        } catch (WebClientRequestException e) {
            throw new VirtualizationException("Virtualization server unreachable: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) signals an elapsed deadline this way
            throw new VirtualizationException("Virtualization request to " + view + " timed out", e);
        }

        return parseRows(body);
    }

    static List<Map<String, Object>> parseRows(String body) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return rows;
        }

        String trimmed = body.trim();
        Document envelope = trimmed.startsWith("[")
            ? Document.parse("{\"elements\": " + trimmed + "}")
            : Document.parse(trimmed);

        List<Document> elements = envelope.getList("elements", Document.class);
        if (elements == null) {
            return rows;
        }
        for (Document element : elements) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : element.entrySet()) {
                row.put(entry.getKey(), decodeJsonText(entry.getValue()));
            }
            rows.add(row);
        }
        return rows;
    }

    // Address and preferences come back as JSON text columns.
    private static Object decodeJsonText(Object value) {
        if (value instanceof String text && text.startsWith("{") && text.endsWith("}")) {
            try {
                return new LinkedHashMap<>(Document.parse(text));
            } catch (JsonParseException e) {
                log.trace("Column value is not JSON: {}", text);
                return text;
            }
        }
        return value;
    }
}
