package com.mogu.ranking.profile;

import java.util.List;
import java.util.Set;

public record UserProfileFeatures(
    Set<String> interestedCategories,
    Set<String> preferredMarkets,
    List<Double> hourlyPreferences
) {
    public UserProfileFeatures {
        interestedCategories = interestedCategories == null ? Set.of() : Set.copyOf(interestedCategories);
        preferredMarkets = preferredMarkets == null ? Set.of() : Set.copyOf(preferredMarkets);
        hourlyPreferences = hourlyPreferences == null ? List.of() : List.copyOf(hourlyPreferences);
    }
}
