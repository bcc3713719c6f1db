package com.shieldmail.spamengine.domain.service.explain;

import com.shieldmail.spamengine.domain.model.HeatmapUnit;
import com.shieldmail.spamengine.domain.model.TokenImpact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class HeuristicExplanationProvider implements ExplanationProvider {

    static final int MAX_TOKENS = 15;
    static final double MAX_IMPACT = 0.3;

    private static final int SALT_LENGTH = 50;
    private static final int MIN_TOKEN_LENGTH = 3;

    private static final Pattern WHITESPACE = Pattern.compile(
            "[\\t\\n\\x0B\\f\\r \\u00A0\\u1680\\u2000-\\u200A\\u2028\\u2029\\u202F\\u205F\\u3000\\uFEFF]+");

    @Override
    public List<TokenImpact> tokenImpacts(String text, boolean isSpam, double spamProbability) {
        double p = sanitize(spamProbability);

        Map<String, Integer> counts = new LinkedHashMap<>();
        int total = 0;
        for (String token : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() < MIN_TOKEN_LENGTH) continue;
            counts.merge(token, 1, Integer::sum);
            total++;
        }
        if (total == 0) return List.of();

        String salt = text.substring(0, Math.min(SALT_LENGTH, text.length()));
        List<TokenImpact> impacts = new ArrayList<>(counts.size());

        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            String token = e.getKey();
            int count = e.getValue();
            double normalized = (StableHash.of(token + salt) % 1000) / 1000.0;

            double impact;
            if (IndicatorVocabulary.isSpamIndicator(token)) {
                impact = 0.15 + (normalized * 0.1);
            } else if (IndicatorVocabulary.isLegitimateIndicator(token)) {
                impact = -0.15 - (normalized * 0.1);
            } else {
                double freq = (double) count / total;
                double base = normalized - 0.5;
                if (isSpam) {
                    double bias = (p - 0.5) * 0.4;
                    impact = base * 0.12 + (freq * 0.02) + bias;
                    if (p > 0.7) {
                        impact = Math.max(0.05, impact);
                    }
                } else {
                    double bias = (0.5 - p) * 0.4;
                    impact = base * 0.12 - (freq * 0.02) - bias;
                    if (p < 0.3) {
                        impact = Math.min(-0.05, impact);
                    }
                }
            }

            impact = Math.max(-MAX_IMPACT, Math.min(MAX_IMPACT, impact));
            impacts.add(new TokenImpact(token, impact, count * 10 + normalized * 50));
        }

        impacts.sort(Comparator.comparingDouble((TokenImpact t) -> Math.abs(t.impact())).reversed());
        return List.copyOf(impacts.subList(0, Math.min(MAX_TOKENS, impacts.size())));
    }

    @Override
    public List<HeatmapUnit> wordHeatmap(String text, boolean isSpam, double spamProbability) {
        double p = sanitize(spamProbability);
        List<String> units = splitKeepingWhitespace(text);
        List<HeatmapUnit> heatmap = new ArrayList<>(units.size());

        for (int index = 0; index < units.size(); index++) {
            String unit = units.get(index);
            boolean separator = index % 2 == 1;
            String word = unit.toLowerCase(Locale.ROOT);

            if (separator || word.length() < MIN_TOKEN_LENGTH) {
                heatmap.add(new HeatmapUnit(unit, index, 0.0, false));
                continue;
            }

            long hash = StableHash.of(word + index);
            double importance;
            boolean spamIndicator;

            if (IndicatorVocabulary.isSpamIndicator(word)) {
                importance = 0.6 + (hash % 100) / 500.0;
                spamIndicator = true;
            } else if (IndicatorVocabulary.isLegitimateIndicator(word)) {
                importance = 0.6 + (hash % 100) / 500.0;
                spamIndicator = false;
            } else {
                double normalized = (hash % 100) / 100.0;
                importance = normalized * 0.4;
                if (isSpam) {
                    double threshold = p > 0.8 ? 0.35 : 0.55 - (p - 0.5) * 0.5;
                    spamIndicator = normalized > threshold;
                } else {
                    double threshold = p < 0.2 ? 0.65 : 0.45 + (0.5 - p) * 0.5;
                    spamIndicator = normalized > threshold;
                }
            }

            if (spamIndicator == isSpam) {
                importance = Math.min(1.0, importance * 1.5);
            } else {
                importance = importance * 0.6;
            }
            heatmap.add(new HeatmapUnit(unit, index, importance, spamIndicator));
        }
        return List.copyOf(heatmap);
    }

    static List<String> splitKeepingWhitespace(String text) {
        List<String> units = new ArrayList<>();
        Matcher m = WHITESPACE.matcher(text);
        int last = 0;
        while (m.find()) {
            units.add(text.substring(last, m.start()));
            units.add(m.group());
            last = m.end();
        }
        units.add(text.substring(last));
        return units;
    }

    private static double sanitize(double spamProbability) {
        if (Double.isNaN(spamProbability)) {
            log.debug("[Explain] spamProbability NaN, 0.5로 대체");
            return 0.5;
        }
        return Math.max(0.0, Math.min(1.0, spamProbability));
    }
}
