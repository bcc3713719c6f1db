package com.shieldmail.spamengine.domain.model;

import java.util.List;

public record Explanation(List<TokenImpact> tokenImpacts, List<HeatmapUnit> heatmap) {
}
