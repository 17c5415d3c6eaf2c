package io.github.samzhu.pricing.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 一組「計費維度 → 費率」的對照表。
 *
 * <p>建立後不可變，依維度名稱排序迭代。
 *
 * @param rates 維度名稱對應的費率
 */
public record Ratecard(Map<String, Rate> rates) {

    public Ratecard {
        rates = rates == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(rates));
    }

    public static Ratecard of(Map<String, Rate> rates) {
        return new Ratecard(rates);
    }

    /**
     * 查詢指定維度的費率。
     *
     * @param dimension 維度名稱
     * @return 費率，若此 ratecard 未定義該維度則為 empty
     */
    public Optional<Rate> rateFor(String dimension) {
        return Optional.ofNullable(rates.get(dimension));
    }
}
