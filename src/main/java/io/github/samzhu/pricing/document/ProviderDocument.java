package io.github.samzhu.pricing.document;

import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * {@code providers/<provider>.json} 的檔案結構。
 *
 * <pre>
 * {
 *   "provider": "openai",
 *   "source": { "url": "https://openai.com/api/pricing", "retrieved_at": "2026-02-20" },
 *   "models": [
 *     {
 *       "model": "gpt-4.1-mini",
 *       "effective_from": "2025-04-14",
 *       "billable": {
 *         "input_tokens_uncached": { "per_1m": 0.80 },
 *         "output_tokens": { "per_1m": 3.20 }
 *       },
 *       "capabilities": ["chat"],
 *       "pricing_tiers": []
 *     }
 *   ]
 * }
 * </pre>
 */
public record ProviderDocument(
    @NotBlank
    String provider,

    @NotEmpty
    List<@NotNull @Valid ModelDocument> models,

    Map<String, Object> source
) {}
