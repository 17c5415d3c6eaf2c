package io.github.samzhu.pricing.dto.api;

/**
 * 存活檢查回應。
 */
public record HealthResponse(
    String status,
    String pricingVersion,
    String engineVersion
) {}
