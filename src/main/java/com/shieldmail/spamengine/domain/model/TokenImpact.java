package com.shieldmail.spamengine.domain.model;

public record TokenImpact(String token, double impact, double weight) {
}
