package com.mogu.ranking.service;

import com.mogu.ranking.ranking.EnsembleWeights;
import com.mogu.ranking.ranking.RankedPage;
import com.mogu.ranking.ranking.SortMode;
import java.util.List;

public record RecommendationResult(
    RankedPage page,
    SortMode sort,
    EnsembleWeights weights,
    double historyStrength,
    double cfCoverage,
    int candidates,
    List<String> reasonCodes
) {}
