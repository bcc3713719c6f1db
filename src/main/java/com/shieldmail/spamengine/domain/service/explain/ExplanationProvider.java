package com.shieldmail.spamengine.domain.service.explain;

import com.shieldmail.spamengine.domain.model.Explanation;
import com.shieldmail.spamengine.domain.model.HeatmapUnit;
import com.shieldmail.spamengine.domain.model.TokenImpact;

import java.util.List;

public interface ExplanationProvider {

    List<TokenImpact> tokenImpacts(String text, boolean isSpam, double spamProbability);

    List<HeatmapUnit> wordHeatmap(String text, boolean isSpam, double spamProbability);

    default Explanation explain(String text, boolean isSpam, double spamProbability) {
        return new Explanation(
                tokenImpacts(text, isSpam, spamProbability),
                wordHeatmap(text, isSpam, spamProbability));
    }
}
