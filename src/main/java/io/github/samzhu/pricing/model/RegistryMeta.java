package io.github.samzhu.pricing.model;

/**
 * Registry 的中繼資料，啟動時載入一次。
 *
 * @param pricingVersion 目前生效的定價版本
 * @param currency 所有費率使用的幣別
 * @param publishedAt 發佈日期
 * @param schemaVersion 檔案格式版本
 */
public record RegistryMeta(
    String pricingVersion,
    String currency,
    String publishedAt,
    int schemaVersion
) {}
