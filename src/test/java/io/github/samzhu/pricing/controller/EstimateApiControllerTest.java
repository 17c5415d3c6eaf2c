package io.github.samzhu.pricing.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Collections;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import io.github.samzhu.pricing.dto.api.GatewayPricingMode;

@SpringBootTest
@AutoConfigureMockMvc
class EstimateApiControllerTest {

    private static final String MINI_ITEM = """
        {"provider": "openai", "model": "gpt-4.1-mini", "usage": {"input_tokens_uncached": 1000}}
        """;

    @Autowired
    private MockMvc mockMvc;

    private ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    @Test
    void shouldEstimateCost() throws Exception {
        postJson("/v1/estimate", """
            {
              "provider": "openai",
              "model": "gpt-4.1-mini",
              "usage": {"input_tokens_uncached": 1200, "input_tokens_cached": 800, "output_tokens": 350}
            }
            """)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pricing_version").value("2026-02-22"))
            .andExpect(jsonPath("$.provider").value("openai"))
            .andExpect(jsonPath("$.model").value("gpt-4.1-mini"))
            .andExpect(jsonPath("$.breakdown", hasSize(3)))
            .andExpect(jsonPath("$.breakdown[0].dimension").value("input_tokens_cached"))
            .andExpect(jsonPath("$.breakdown[0].quantity").value(800))
            .andExpect(jsonPath("$.breakdown[0].rate").value("0.20"))
            .andExpect(jsonPath("$.breakdown[0].cost").value("0.000160"))
            .andExpect(jsonPath("$.total.currency").value("USD"))
            .andExpect(jsonPath("$.total.cost").value("0.002240"))
            .andExpect(jsonPath("$.warnings", hasSize(0)))
            .andExpect(jsonPath("$.meta.engine_version").value("0.1.0"))
            .andExpect(jsonPath("$.meta.computed_at").isString());
    }

    @Test
    void shouldEchoProviderAlias() throws Exception {
        postJson("/v1/estimate", """
            {"provider": "grok", "model": "grok-4", "usage": {"input_tokens_uncached": 1000000}}
            """)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.provider").value("grok"))
            .andExpect(jsonPath("$.model").value("grok-4"))
            .andExpect(jsonPath("$.total.cost").value("3.000000"));
    }

    @Test
    void shouldRejectUnratedDimensionInStrictMode() throws Exception {
        postJson("/v1/estimate", """
            {"provider": "openai", "model": "gpt-4.1-mini", "usage": {"reasoning_tokens": 1200}}
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_DIMENSION"))
            .andExpect(jsonPath("$.error.details.dimension").value("reasoning_tokens"));
    }

    @Test
    void shouldWarnForUnratedDimensionInLenientMode() throws Exception {
        postJson("/v1/estimate", """
            {
              "provider": "openai",
              "model": "gpt-4.1-mini",
              "usage": {"reasoning_tokens": 1200},
              "options": {"mode": "lenient"}
            }
            """)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total.cost").value("0.000000"))
            .andExpect(jsonPath("$.warnings[0]", containsString("reasoning_tokens")));
    }

    @Test
    void shouldSkipWhitespaceDimensionInLenientMode() throws Exception {
        postJson("/v1/estimate", """
            {
              "provider": "openai",
              "model": "gpt-4.1-mini",
              "usage": {" ": 5, "input_tokens_uncached": 1000},
              "options": {"mode": "lenient"}
            }
            """)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total.cost").value("0.000800"))
            .andExpect(jsonPath("$.warnings[0]").value(
                "Ignored unsupported dimension ' ' for provider 'openai' model 'gpt-4.1-mini'"));
    }

    @Test
    void shouldRejectEmptyDimensionKey() throws Exception {
        postJson("/v1/estimate", """
            {"provider": "openai", "model": "gpt-4.1-mini", "usage": {"": 5}}
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void shouldApplyOverrideRatecard() throws Exception {
        postJson("/v1/estimate", """
            {
              "provider": "openai",
              "model": "gpt-4.1-mini",
              "usage": {"input_tokens_uncached": 1000000},
              "overrides": {"ratecard": {"currency": "USD", "billable": {"input_tokens_uncached": {"per_1m": "1.0"}}}}
            }
            """)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.breakdown[0].rate").value("1.0"))
            .andExpect(jsonPath("$.total.cost").value("1.000000"));
    }

    @Test
    void shouldRejectOverrideWithBothRateKinds() throws Exception {
        postJson("/v1/estimate", """
            {
              "provider": "openai",
              "model": "gpt-4.1-mini",
              "usage": {"input_tokens_uncached": 1000},
              "overrides": {"ratecard": {"billable": {"input_tokens_uncached": {"per_1m": 1.0, "per_unit": 0.1}}}}
            }
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"))
            .andExpect(jsonPath("$.error.message").value("Request validation failed"));
    }

    @Test
    void shouldRejectOverrideWithUnsupportedDimension() throws Exception {
        postJson("/v1/estimate", """
            {
              "provider": "openai",
              "model": "gpt-4.1-mini",
              "usage": {"input_tokens_uncached": 1000},
              "overrides": {"ratecard": {"billable": {"frames": {"per_unit": 0.1}}}}
            }
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void shouldRejectEmptyUsage() throws Exception {
        postJson("/v1/estimate", """
            {"provider": "openai", "model": "gpt-4.1-mini", "usage": {}}
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"))
            .andExpect(jsonPath("$.error.details.validation_errors").isArray());
    }

    @Test
    void shouldRejectNegativeAndFractionalQuantities() throws Exception {
        postJson("/v1/estimate", """
            {"provider": "openai", "model": "gpt-4.1-mini", "usage": {"output_tokens": -1}}
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));

        postJson("/v1/estimate", """
            {"provider": "openai", "model": "gpt-4.1-mini", "usage": {"output_tokens": 1.5}}
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void shouldRejectUnknownFieldsAndMalformedJson() throws Exception {
        postJson("/v1/estimate", """
            {"provider": "openai", "model": "gpt-4.1-mini", "usage": {"output_tokens": 1}, "discount": 0.5}
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));

        postJson("/v1/estimate", "{\"provider\": ")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void shouldRejectUnknownPricingVersion() throws Exception {
        postJson("/v1/estimate", """
            {
              "provider": "openai",
              "model": "gpt-4.1-mini",
              "usage": {"output_tokens": 1},
              "options": {"pricing_version": "2025-01-01"}
            }
            """)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("PRICING_VERSION_NOT_FOUND"))
            .andExpect(jsonPath("$.error.details.pricing_version").value("2025-01-01"));
    }

    @Test
    void shouldWarnForNonDefaultGatewayPricingMode() throws Exception {
        postJson("/v1/estimate", """
            {
              "provider": "openai",
              "model": "gpt-4.1-mini",
              "usage": {"input_tokens_uncached": 1000},
              "options": {"gateway_pricing_mode": "registry_only"}
            }
            """)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.warnings", hasItem(GatewayPricingMode.NOT_IMPLEMENTED_WARNING)));
    }

    @Test
    void shouldReturnPartialBatchResults() throws Exception {
        postJson("/v1/estimate/batch", """
            {
              "items": [
                {"provider": "openai", "model": "gpt-4.1-mini", "usage": {"input_tokens_uncached": 1000}},
                {"provider": "openai", "model": "does-not-exist", "usage": {"input_tokens_uncached": 1000}},
                {"provider": "bedrock", "model": "moonshot/kimi-k2-thinking@us-east-1",
                 "usage": {"input_tokens_uncached": 1000000}}
              ]
            }
            """)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pricing_version").value("2026-02-22"))
            .andExpect(jsonPath("$.results", hasSize(2)))
            .andExpect(jsonPath("$.results[0].total.cost").value("0.000800"))
            .andExpect(jsonPath("$.results[1].total.cost").value("0.600000"))
            .andExpect(jsonPath("$.errors", hasSize(1)))
            .andExpect(jsonPath("$.errors[0].index").value(1))
            .andExpect(jsonPath("$.errors[0].error.code").value("MODEL_NOT_FOUND"));
    }

    @Test
    void shouldRejectOversizedBatch() throws Exception {
        String items = String.join(",", Collections.nCopies(101, MINI_ITEM.strip()));

        postJson("/v1/estimate/batch", "{\"items\": [" + items + "]}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"))
            .andExpect(jsonPath("$.error.message").value("Batch size exceeds limit"))
            .andExpect(jsonPath("$.error.details.max_items").value(100));
    }

    @Test
    void shouldRejectEmptyBatch() throws Exception {
        postJson("/v1/estimate/batch", "{\"items\": []}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void shouldRejectOversizedBody() throws Exception {
        String body = "x".repeat(1_048_577);

        postJson("/v1/estimate", body)
            .andExpect(status().isPayloadTooLarge())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"))
            .andExpect(jsonPath("$.error.message").value("Request body exceeds 1MB limit"))
            .andExpect(jsonPath("$.error.details.max_body_bytes").value(1_048_576))
            .andExpect(jsonPath("$.error.details.content_length").value(1_048_577));
    }

    @Test
    void shouldEchoOrGenerateRequestId() throws Exception {
        mockMvc.perform(post("/v1/estimate").contentType(MediaType.APPLICATION_JSON)
                .header("X-Request-Id", "req-123").content(MINI_ITEM))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Request-Id", "req-123"));

        postJson("/v1/estimate", MINI_ITEM)
            .andExpect(header().string("X-Request-Id",
                matchesPattern("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}")));
    }

    @Test
    void shouldAcceptBatchAtLimit() throws Exception {
        String items = Collections.nCopies(100, MINI_ITEM.strip()).stream().collect(Collectors.joining(","));

        postJson("/v1/estimate/batch", "{\"items\": [" + items + "]}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results", hasSize(100)))
            .andExpect(jsonPath("$.errors", hasSize(0)));
    }
}
