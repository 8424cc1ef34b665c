package com.tixgo.booking.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Stripe Checkout Sessions over the REST API (form-encoded requests, JSON responses).
 */
@Component
@Slf4j
public class StripeCheckoutGateway implements CheckoutGateway {

    private static final String SESSIONS_PATH = "/v1/checkout/sessions";

    private final RestTemplate restTemplate;

    public StripeCheckoutGateway(@Qualifier("checkoutRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public CheckoutSession createSession(CheckoutSessionRequest request) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("mode", "payment");
        form.add("payment_method_types[0]", "card");
        form.add("line_items[0][price_data][currency]", request.getCurrency());
        form.add("line_items[0][price_data][unit_amount]", String.valueOf(request.getUnitAmount()));
        form.add("line_items[0][price_data][product_data][name]", request.getProductName());
        form.add("line_items[0][quantity]", String.valueOf(request.getQuantity()));
        form.add("success_url", request.getSuccessUrl());
        form.add("cancel_url", request.getCancelUrl());
        if (request.getMetadata() != null) {
            request.getMetadata().forEach((key, value) -> form.add("metadata[" + key + "]", value));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            ResponseEntity<JsonNode> response =
                restTemplate.postForEntity(SESSIONS_PATH, new HttpEntity<>(form, headers), JsonNode.class);

            CheckoutSession session = toSession(response);
            log.info("Checkout session created: {} for metadata {}", session.getId(), request.getMetadata());
            return session;

        } catch (RestClientException e) {
            log.error("Checkout session creation failed", e);
            throw new MarketplaceException(ErrorKind.UNAVAILABLE, "Payment provider is unavailable", e);
        }
    }

    @Override
    public CheckoutSession retrieveSession(String sessionId) {
        try {
            ResponseEntity<JsonNode> response =
                restTemplate.getForEntity(SESSIONS_PATH + "/{id}", JsonNode.class, sessionId);

            return toSession(response);

        } catch (HttpClientErrorException.NotFound e) {
            throw MarketplaceException.notFound("Checkout session", sessionId);
        } catch (RestClientException e) {
            log.error("Checkout session lookup failed: {}", sessionId, e);
            throw new MarketplaceException(ErrorKind.UNAVAILABLE, "Payment provider is unavailable", e);
        }
    }

    private CheckoutSession toSession(ResponseEntity<JsonNode> response) {
        JsonNode body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null || !body.hasNonNull("id")) {
            throw new MarketplaceException(ErrorKind.UNAVAILABLE,
                "Unexpected payment provider response: " + response.getStatusCode());
        }

        Map<String, String> metadata = new HashMap<>();
        JsonNode metadataNode = body.path("metadata");
        Iterator<Map.Entry<String, JsonNode>> fields = metadataNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            metadata.put(field.getKey(), field.getValue().asText());
        }

        return CheckoutSession.builder()
            .id(body.get("id").asText())
            .url(textOrNull(body, "url"))
            .paymentStatus(textOrNull(body, "payment_status"))
            .amountTotal(body.hasNonNull("amount_total") ? body.get("amount_total").asLong() : null)
            .currency(textOrNull(body, "currency"))
            .transactionRef(textOrNull(body, "payment_intent"))
            .metadata(metadata)
            .build();
    }

    private String textOrNull(JsonNode body, String field) {
        return body.hasNonNull(field) ? body.get(field).asText() : null;
    }
}
