package com.shieldmail.spamengine.domain.service.explain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldmail.spamengine.domain.model.Explanation;
import com.shieldmail.spamengine.domain.model.HeatmapUnit;
import com.shieldmail.spamengine.domain.model.TokenImpact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeuristicExplanationProviderTest {

    private static final String SPAM_TEXT =
            "WINNER!! You have been selected for a $1000 prize! Click here now: http://spam-link.com";
    private static final String HAM_TEXT = "Hi, I wanted to follow up on our meeting yesterday.";

    private final HeuristicExplanationProvider provider = new HeuristicExplanationProvider();

    private static Map<String, TokenImpact> byToken(List<TokenImpact> impacts) {
        return impacts.stream().collect(Collectors.toMap(TokenImpact::token, Function.identity()));
    }

    @Test
    void spamScenarioPushesKeyTokensPositive() {
        Map<String, TokenImpact> impacts = byToken(provider.tokenImpacts(SPAM_TEXT, true, 0.98));

        assertThat(impacts).containsKeys("winner!!", "prize!", "click");
        assertThat(impacts.get("winner!!").impact()).isPositive();
        assertThat(impacts.get("prize!").impact()).isPositive();
        assertThat(impacts.get("click").impact()).isBetween(0.15, 0.25);
    }

    @Test
    void legitimateScenarioPushesKeyTokensNegative() {
        Map<String, TokenImpact> impacts = byToken(provider.tokenImpacts(HAM_TEXT, false, 0.02));

        assertThat(impacts.get("follow").impact()).isBetween(-0.25, -0.15);
        assertThat(impacts.get("meeting").impact()).isBetween(-0.25, -0.15);
        assertThat(impacts.values()).allSatisfy(t -> assertThat(t.impact()).isNegative());
    }

    @Test
    void indicatorImpactFollowsHashOfTokenAndPrefix() {
        TokenImpact click = byToken(provider.tokenImpacts(SPAM_TEXT, true, 0.98)).get("click");

        double normalized = (StableHash.of("click" + SPAM_TEXT.substring(0, 50)) % 1000) / 1000.0;
        assertThat(click.impact()).isEqualTo(0.15 + normalized * 0.1);
        assertThat(click.weight()).isEqualTo(10 + normalized * 50);
    }

    @Test
    void shortTokensAreIgnoredAndFrequencyFeedsWeight() {
        Map<String, TokenImpact> impacts = byToken(provider.tokenImpacts("ok ok cash cash cash is it", true, 0.9));

        assertThat(impacts).containsOnlyKeys("cash");
        assertThat(impacts.get("cash").weight()).isGreaterThanOrEqualTo(30.0).isLessThan(80.0);
    }

    @Test
    void tokenImpactsAreCappedAndSorted() {
        String text = IntStream.range(0, 40)
                .mapToObj(i -> "token" + i)
                .collect(Collectors.joining(" ")) + " free money offer meeting agenda";

        List<TokenImpact> impacts = provider.tokenImpacts(text, true, 0.76);

        assertThat(impacts).hasSize(HeuristicExplanationProvider.MAX_TOKENS);
        for (int i = 1; i < impacts.size(); i++) {
            assertThat(Math.abs(impacts.get(i - 1).impact()))
                    .isGreaterThanOrEqualTo(Math.abs(impacts.get(i).impact()));
        }
        assertThat(impacts).allSatisfy(t -> {
            assertThat(t.impact()).isBetween(-0.3, 0.3);
            assertThat(t.weight()).isNotNegative();
        });
    }

    @Test
    void highConfidenceSpamKeepsNeutralTokensPositive() {
        List<TokenImpact> impacts = provider.tokenImpacts(
                "quarterly numbers attached for tomorrow lunch", true, 0.95);

        assertThat(impacts).isNotEmpty().allSatisfy(t -> assertThat(t.impact()).isGreaterThanOrEqualTo(0.05));
    }

    @Test
    void outputIsDeterministic() {
        assertThat(provider.tokenImpacts(SPAM_TEXT, true, 0.81))
                .isEqualTo(provider.tokenImpacts(SPAM_TEXT, true, 0.81));
        assertThat(provider.wordHeatmap(SPAM_TEXT, true, 0.81))
                .isEqualTo(provider.wordHeatmap(SPAM_TEXT, true, 0.81));
        assertThat(new HeuristicExplanationProvider().explain(HAM_TEXT, false, 0.3))
                .isEqualTo(provider.explain(HAM_TEXT, false, 0.3));
    }

    @Test
    void heatmapRebuildsOriginalText() {
        String text = "  Dear team,\n\tplease review   the report.  ";

        List<HeatmapUnit> heatmap = provider.wordHeatmap(text, false, 0.1);

        assertThat(heatmap.stream().map(HeatmapUnit::text).collect(Collectors.joining())).isEqualTo(text);
        assertThat(heatmap.get(0).text()).isEmpty();
        assertThat(heatmap.get(heatmap.size() - 1).text()).isEmpty();
        for (int i = 0; i < heatmap.size(); i++) {
            assertThat(heatmap.get(i).index()).isEqualTo(i);
        }
    }

    @Test
    void whitespaceUnitsCarryNoImportance() {
        List<HeatmapUnit> heatmap = provider.wordHeatmap(SPAM_TEXT, true, 0.9);

        assertThat(heatmap).allSatisfy(u -> assertThat(u.importance()).isBetween(0.0, 1.0));
        assertThat(heatmap).filteredOn(u -> u.text().isBlank())
                .isNotEmpty()
                .allSatisfy(u -> assertThat(u.importance()).isZero());
    }

    @Test
    void indicatorWordsDominateHeatmap() {
        List<HeatmapUnit> heatmap = provider.wordHeatmap("Get your free gift before the meeting", true, 0.9);

        HeatmapUnit free = heatmap.stream().filter(u -> u.text().equals("free")).findFirst().orElseThrow();
        HeatmapUnit meeting = heatmap.stream().filter(u -> u.text().equals("meeting")).findFirst().orElseThrow();

        assertThat(free.spamIndicator()).isTrue();
        assertThat(free.importance()).isGreaterThanOrEqualTo(0.9);
        assertThat(meeting.spamIndicator()).isFalse();
        // contradicts the spam prediction, so damped
        assertThat(meeting.importance()).isBetween(0.36, 0.48);
    }

    @Test
    void highConfidenceLegitimateUsesFixedThreshold() {
        String text = "quarterly numbers attached for tomorrow lunch with everyone";

        List<HeatmapUnit> heatmap = provider.wordHeatmap(text, false, 0.05);

        for (HeatmapUnit unit : heatmap) {
            if (unit.index() % 2 == 1 || unit.text().length() < 3) continue;
            double normalized = (StableHash.of(unit.text().toLowerCase() + unit.index()) % 100) / 100.0;
            assertThat(unit.spamIndicator()).isEqualTo(normalized > 0.65);
            double expected = unit.spamIndicator() ? normalized * 0.4 * 0.6 : Math.min(1.0, normalized * 0.4 * 1.5);
            assertThat(unit.importance()).isCloseTo(expected, within(1e-12));
        }
    }

    @Test
    void probabilityOutsideUnitRangeIsClamped() {
        assertThat(provider.tokenImpacts(SPAM_TEXT, true, 1.7))
                .isEqualTo(provider.tokenImpacts(SPAM_TEXT, true, 1.0));
        assertThat(provider.wordHeatmap(HAM_TEXT, false, -0.4))
                .isEqualTo(provider.wordHeatmap(HAM_TEXT, false, 0.0));
    }

    @Test
    void emptyTextYieldsEmptyExplanation() {
        Explanation explanation = provider.explain("", false, 0.5);

        assertThat(explanation.tokenImpacts()).isEmpty();
        assertThat(explanation.heatmap()).containsExactly(new HeatmapUnit("", 0, 0.0, false));
    }

    @Test
    void midRangeHeatmapThresholdsFollowProbability() {
        String text = "quarterly numbers attached for tomorrow lunch with everyone in building seven";

        for (double p : new double[]{0.62, 0.75}) {
            double threshold = 0.55 - (p - 0.5) * 0.5;
            for (HeatmapUnit unit : provider.wordHeatmap(text, true, p)) {
                if (unit.index() % 2 == 1 || unit.text().length() < 3) continue;
                double normalized = (StableHash.of(unit.text() + unit.index()) % 100) / 100.0;
                assertThat(unit.spamIndicator()).isEqualTo(normalized > threshold);
            }
        }
        for (double p : new double[]{0.35, 0.45}) {
            double threshold = 0.45 + (0.5 - p) * 0.5;
            for (HeatmapUnit unit : provider.wordHeatmap(text, false, p)) {
                if (unit.index() % 2 == 1 || unit.text().length() < 3) continue;
                double normalized = (StableHash.of(unit.text() + unit.index()) % 100) / 100.0;
                assertThat(unit.spamIndicator()).isEqualTo(normalized > threshold);
            }
        }
    }

    @Test
    void neutralTokenImpactBlendsHashFrequencyAndBias() {
        String text = "quarterly numbers quarterly lunch";
        String salt = text;

        TokenImpact spamSide = byToken(provider.tokenImpacts(text, true, 0.62)).get("quarterly");
        double n = (StableHash.of("quarterly" + salt) % 1000) / 1000.0;
        assertThat(spamSide.impact())
                .isCloseTo((n - 0.5) * 0.12 + 0.5 * 0.02 + (0.62 - 0.5) * 0.4, within(1e-12));
        assertThat(spamSide.weight()).isCloseTo(20 + n * 50, within(1e-12));

        TokenImpact legitSide = byToken(provider.tokenImpacts(text, false, 0.35)).get("lunch");
        double m = (StableHash.of("lunch" + salt) % 1000) / 1000.0;
        assertThat(legitSide.impact())
                .isCloseTo((m - 0.5) * 0.12 - 0.25 * 0.02 - (0.5 - 0.35) * 0.4, within(1e-12));
    }

    @ParameterizedTest
    @MethodSource("dashboardVectors")
    void matchesDashboardVectors(DashboardVector vector) {
        Explanation explanation = provider.explain(vector.text(), vector.spam(), vector.spamProbability());

        assertThat(explanation.tokenImpacts()).extracting(TokenImpact::token)
                .containsExactlyElementsOf(vector.tokenImpacts().stream().map(TokenImpact::token).toList());
        for (int i = 0; i < vector.tokenImpacts().size(); i++) {
            TokenImpact expected = vector.tokenImpacts().get(i);
            TokenImpact actual = explanation.tokenImpacts().get(i);
            assertThat(actual.impact()).as(expected.token()).isCloseTo(expected.impact(), within(1e-12));
            assertThat(actual.weight()).as(expected.token()).isCloseTo(expected.weight(), within(1e-12));
        }

        assertThat(explanation.heatmap()).hasSameSizeAs(vector.heatmap());
        for (int i = 0; i < vector.heatmap().size(); i++) {
            HeatmapUnit expected = vector.heatmap().get(i);
            HeatmapUnit actual = explanation.heatmap().get(i);
            assertThat(actual.text()).isEqualTo(expected.text());
            assertThat(actual.index()).isEqualTo(expected.index());
            assertThat(actual.spamIndicator()).as(expected.text()).isEqualTo(expected.spamIndicator());
            assertThat(actual.importance()).as(expected.text()).isCloseTo(expected.importance(), within(1e-12));
        }
    }

    static List<DashboardVector> dashboardVectors() throws IOException {
        try (InputStream in = HeuristicExplanationProviderTest.class
                .getResourceAsStream("/fixtures/explanation-vectors.json")) {
            return new ObjectMapper().readValue(in, new TypeReference<List<DashboardVector>>() {
            });
        }
    }

    record DashboardVector(
            String text,
            boolean spam,
            @JsonProperty("spam_probability") double spamProbability,
            @JsonProperty("token_impacts") List<TokenImpact> tokenImpacts,
            List<HeatmapUnit> heatmap
    ) {
        @Override
        public String toString() {
            return text.strip() + " @ " + spamProbability;
        }
    }
}
