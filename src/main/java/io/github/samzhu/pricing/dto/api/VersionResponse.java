package io.github.samzhu.pricing.dto.api;

/**
 * 目前生效的定價版本。
 */
public record VersionResponse(String pricingVersion) {}
