package io.github.samzhu.pricing.document;

/**
 * Registry 檔案共用的格式規則。
 */
final class DocumentPatterns {

    static final String ISO_DATE = "\\d{4}-\\d{2}-\\d{2}.*";

    private DocumentPatterns() {
    }
}
