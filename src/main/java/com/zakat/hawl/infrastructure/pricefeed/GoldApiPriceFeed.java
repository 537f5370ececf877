package com.zakat.hawl.infrastructure.pricefeed;

import com.fasterxml.jackson.databind.JsonNode;
import com.zakat.hawl.domain.exception.PriceFeedException;
import com.zakat.hawl.domain.model.MetalType;
import com.zakat.hawl.domain.service.PriceFeed;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * goldapi.io client: {@code GET {base}/{XAU|XAG}/{currency}} with an {@code x-access-token} header.
 *
 * Uses {@code price_gram_24k} when present, otherwise converts the troy-ounce
 * {@code price}. Timeouts come from the RestTemplate configuration.
 */
@Slf4j
@Component
public class GoldApiPriceFeed implements PriceFeed {

    static final BigDecimal GRAMS_PER_TROY_OUNCE = new BigDecimal("31.1034768");
    private static final int PRICE_SCALE = 6;

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    public GoldApiPriceFeed(@Qualifier("priceFeedRestTemplate") RestTemplate restTemplate,
                            @Value("${app.price-feed.base-url}") String baseUrl,
                            @Value("${app.price-feed.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    @Retry(name = "priceFeed")
    @CircuitBreaker(name = "priceFeed")
    public BigDecimal fetchPricePerGram(MetalType metal, String currency) {
        String url = String.format("%s/%s/%s", baseUrl, metal.getSymbol(), currency.toUpperCase(Locale.ROOT));

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("x-access-token", apiKey);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new PriceFeedException("Price feed request failed for " + metal + "/" + currency + ": " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new PriceFeedException("Price feed returned " + response.getStatusCode() + " for " + metal + "/" + currency);
        }

        BigDecimal pricePerGram = parsePricePerGram(response.getBody());
        log.info("Fetched {} price from {}: {} {}/g", metal, sourceName(), pricePerGram, currency);
        return pricePerGram;
    }

    @Override
    public String sourceName() {
        return "goldapi.io";
    }

    BigDecimal parsePricePerGram(JsonNode body) {
        JsonNode gram = body.get("price_gram_24k");
        if (isPositiveNumber(gram)) {
            return gram.decimalValue().setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        }

        JsonNode ounce = body.get("price");
        if (isPositiveNumber(ounce)) {
            return ounce.decimalValue().divide(GRAMS_PER_TROY_OUNCE, PRICE_SCALE, RoundingMode.HALF_UP);
        }

        throw new PriceFeedException("Malformed price feed payload: no positive price field");
    }

    private boolean isPositiveNumber(JsonNode node) {
        return node != null && node.isNumber() && node.decimalValue().signum() > 0;
    }
}
