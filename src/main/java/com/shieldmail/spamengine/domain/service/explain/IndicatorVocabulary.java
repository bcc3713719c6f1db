package com.shieldmail.spamengine.domain.service.explain;

import java.util.Set;

public final class IndicatorVocabulary {

    static final Set<String> SPAM_INDICATORS = Set.of(
            "winner", "prize", "free", "click", "urgent", "limited", "offer", "deal",
            "money", "cash", "win", "congratulations", "act now", "guaranteed",
            "http", "www", "buy now", "discount", "sale", "credit", "loan");

    static final Set<String> LEGITIMATE_INDICATORS = Set.of(
            "meeting", "please", "thanks", "thank", "follow", "question", "discussion",
            "project", "team", "schedule", "agenda", "report", "review", "update");

    private IndicatorVocabulary() {
    }

    public static boolean isSpamIndicator(String lowerCaseToken) {
        return SPAM_INDICATORS.contains(lowerCaseToken);
    }

    public static boolean isLegitimateIndicator(String lowerCaseToken) {
        return LEGITIMATE_INDICATORS.contains(lowerCaseToken);
    }
}
