package com.zakat.hawl.infrastructure.pricefeed;

import com.zakat.hawl.domain.exception.PriceFeedException;
import com.zakat.hawl.domain.model.MetalType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class GoldApiPriceFeedTest {

    private MockRestServiceServer server;
    private GoldApiPriceFeed priceFeed;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        priceFeed = new GoldApiPriceFeed(restTemplate, "https://api.test", "secret-key");
    }

    @Test
    void fetch_prefersGramPrice() {
        server.expect(requestTo("https://api.test/XAU/USD"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("x-access-token", "secret-key"))
                .andRespond(withSuccess("{\"price\": 2650.10, \"price_gram_24k\": 85.2}", MediaType.APPLICATION_JSON));

        BigDecimal price = priceFeed.fetchPricePerGram(MetalType.GOLD, "usd");

        assertEquals(new BigDecimal("85.200000"), price);
        server.verify();
    }

    @Test
    void fetch_convertsOuncePrice() {
        server.expect(requestTo("https://api.test/XAG/EUR"))
                .andRespond(withSuccess("{\"price\": 31.1034768}", MediaType.APPLICATION_JSON));

        BigDecimal price = priceFeed.fetchPricePerGram(MetalType.SILVER, "EUR");

        assertEquals(new BigDecimal("1.000000"), price);
    }

    @Test
    void fetch_serverError_throwsFeedException() {
        server.expect(requestTo("https://api.test/XAU/USD")).andRespond(withServerError());

        assertThrows(PriceFeedException.class, () -> priceFeed.fetchPricePerGram(MetalType.GOLD, "USD"));
    }

    @Test
    void fetch_missingPrice_throwsFeedException() {
        server.expect(requestTo("https://api.test/XAU/USD"))
                .andRespond(withSuccess("{\"price\": 0, \"metal\": \"XAU\"}", MediaType.APPLICATION_JSON));

        PriceFeedException error = assertThrows(PriceFeedException.class,
                () -> priceFeed.fetchPricePerGram(MetalType.GOLD, "USD"));
        assertTrue(error.getMessage().contains("Malformed"));
    }

    @Test
    void sourceName_isGoldApi() {
        assertEquals("goldapi.io", priceFeed.sourceName());
    }
}
