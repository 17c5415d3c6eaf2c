package io.github.samzhu.pricing.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.pricing.model.RegistryMeta;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * {@code registry_meta.json} 的檔案結構。
 *
 * <pre>
 * {
 *   "pricing_version": "2026-02-22",
 *   "currency": "USD",
 *   "published_at": "2026-02-22",
 *   "schema_version": 1
 * }
 * </pre>
 */
public record RegistryMetaDocument(
    @JsonProperty("pricing_version")
    @NotBlank
    String pricingVersion,

    @NotNull
    @Pattern(regexp = "[A-Z]{3}", message = "must be a three-letter upper-case currency code")
    String currency,

    @JsonProperty("published_at")
    @NotNull
    @Pattern(regexp = DocumentPatterns.ISO_DATE, message = "must start with an ISO date (YYYY-MM-DD)")
    String publishedAt,

    @JsonProperty("schema_version")
    @NotNull
    @Min(1)
    Integer schemaVersion
) {
    public RegistryMeta toMeta() {
        return new RegistryMeta(pricingVersion, currency, publishedAt, schemaVersion);
    }
}
