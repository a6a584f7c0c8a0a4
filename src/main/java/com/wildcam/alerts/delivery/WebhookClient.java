package com.wildcam.alerts.delivery;

import com.wildcam.alerts.model.WebhookPayload;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Set;

/**
 * Performs one webhook POST and classifies the outcome.
 * 200, 201 and 204 count as delivered; any other status or a network error is
 * retryable; a malformed or non-HTTP URL is fatal.
 */
@Component
public class WebhookClient {

    private static final Set<Integer> SUCCESS_CODES = Set.of(200, 201, 204);

    private final RestTemplate restTemplate;

    public WebhookClient(@Qualifier("webhookRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public AttemptOutcome post(String url, WebhookPayload payload) {
        URI uri;
        try {
            uri = toUri(url);
        } catch (IllegalArgumentException e) {
            return AttemptOutcome.fatal("Invalid webhook URL: " + e.getMessage());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri, HttpMethod.POST, new HttpEntity<>(payload, headers), String.class);
            int status = response.getStatusCode().value();
            if (SUCCESS_CODES.contains(status)) {
                return AttemptOutcome.success(status);
            }
            return AttemptOutcome.retryable(status, "Unexpected status " + status);
        } catch (RestClientResponseException e) {
            return AttemptOutcome.retryable(e.getStatusCode().value(), "HTTP " + e.getStatusCode().value());
        } catch (RestClientException e) {
            return AttemptOutcome.retryable(0, e.getMessage());
        }
    }

    static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("empty");
        }
        URI uri = URI.create(url.trim());
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("unsupported scheme in " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("missing host in " + url);
        }
        return uri;
    }
}
