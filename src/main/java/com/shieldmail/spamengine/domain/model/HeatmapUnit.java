package com.shieldmail.spamengine.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HeatmapUnit(
        String text,
        int index,
        double importance,
        @JsonProperty("isSpamIndicator") boolean spamIndicator
) {
}
