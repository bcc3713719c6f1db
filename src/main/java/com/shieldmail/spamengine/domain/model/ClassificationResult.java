package com.shieldmail.spamengine.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ClassificationResult {

    @JsonProperty("is_spam")
    private final boolean spam;

    @JsonProperty("spam_probability")
    private final double spamProbability;

    @JsonProperty("safe_probability")
    private final double safeProbability;
}
