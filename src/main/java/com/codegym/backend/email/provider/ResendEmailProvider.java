package com.codegym.backend.email.provider;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Delivers mail through the Resend HTTP API.
 */
@Component
public class ResendEmailProvider implements EmailProviderClient {

    private final RestClient restClient;
    private final String apiKey;

    public ResendEmailProvider(
            RestClient.Builder restClientBuilder,
            @Value("${email.resend.base-url:https://api.resend.com}") String baseUrl,
            @Value("${email.resend.api-key:}") String apiKey
    ) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
        this.apiKey = apiKey;
    }

    @Override
    public void sendHtml(String to, String from, String subject, String html) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("email.resend.api-key is not configured");
        }

        restClient.post()
                .uri("/emails")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Authorization", "Bearer " + apiKey)
                .body(Map.of(
                        "from", from,
                        "to", List.of(to),
                        "subject", subject,
                        "html", html
                ))
                .retrieve()
                .toBodilessEntity();
    }
}
