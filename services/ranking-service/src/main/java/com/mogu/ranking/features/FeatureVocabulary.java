package com.mogu.ranking.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class FeatureVocabulary {
    public static final int HOUR_SLOTS = 24;

    private final Map<String, Integer> categoryIndex;
    private final Map<String, Integer> marketIndex;

    @Autowired
    public FeatureVocabulary(FeatureProperties properties) {
        this(properties.getCategories(), properties.getMarkets());
    }

    public FeatureVocabulary(List<String> categories, List<String> markets) {
        this.categoryIndex = index(categories);
        this.marketIndex = index(markets);
    }

    public int dimension() {
        return categoryIndex.size() + marketIndex.size() + HOUR_SLOTS;
    }

    public int categorySlot(String category) {
        Integer idx = category == null ? null : categoryIndex.get(category);
        return idx == null ? -1 : idx;
    }

    public int marketSlot(String market) {
        Integer idx = market == null ? null : marketIndex.get(market);
        return idx == null ? -1 : categoryIndex.size() + idx;
    }

    public int hourSlot(int hour) {
        return categoryIndex.size() + marketIndex.size() + Math.floorMod(hour, HOUR_SLOTS);
    }

    private static Map<String, Integer> index(List<String> values) {
        Map<String, Integer> index = new LinkedHashMap<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank() && !index.containsKey(value)) {
                    index.put(value, index.size());
                }
            }
        }
        return Collections.unmodifiableMap(index);
    }
}
