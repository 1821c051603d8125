package org.nowstart.scoring.service.param;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nowstart.scoring.data.dto.BacktestCacheRecord;
import org.nowstart.scoring.data.dto.ParamScoreOverrides;
import org.nowstart.scoring.data.dto.ParamScoreSummary;
import org.nowstart.scoring.data.dto.ScoreAvailability;
import org.nowstart.scoring.data.dto.ScoredParameterSet;
import org.nowstart.scoring.data.property.ParamScoreProperties;
import org.nowstart.scoring.data.property.TemplateScoreProperties;
import org.nowstart.scoring.data.type.ScoreAvailabilityReason;
import org.nowstart.scoring.repository.SettingsLookup;
import org.nowstart.scoring.service.settings.ScoreSettingsResolver;

class ParamScoreServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ParamScoreService service;

    @BeforeEach
    void setUp() {
        ScoreSettingsResolver resolver = new ScoreSettingsResolver(
                ParamScoreProperties.defaults(),
                TemplateScoreProperties.defaults(),
                SettingsLookup.NONE
        );
        service = new ParamScoreService(
                resolver,
                new CandidateEvaluator(new ParameterSetParser(objectMapper)),
                new StabilityScorer()
        );
    }

    @Test
    void score_nearbyParameterSetsRaiseEachOthersStability() {
        List<BacktestCacheRecord> records = List.of(
                record("c1", Map.of("p", 10), 1.0, 1.0, 0.2),
                record("c2", Map.of("p", 10.5), 1.2, 1.1, 0.25),
                record("c3", Map.of("p", 90), 0.3, 0.2, 0.05)
        );

        ParamScoreSummary summary = service.score(records, ParamScoreOverrides.builder().neighborThreshold(1.0).build());

        ScoredParameterSet c1 = scoredById(summary, "c1");
        ScoredParameterSet c2 = scoredById(summary, "c2");
        ScoredParameterSet c3 = scoredById(summary, "c3");
        assertThat(c1.stabilityScore()).isGreaterThan(c3.stabilityScore());
        assertThat(c2.stabilityScore()).isGreaterThan(c3.stabilityScore());
        assertThat(summary.scored()).extracting(item -> item.sourceRecord().id()).containsExactly("c1", "c2", "c3");
        assertThat(c1.coreScore()).isCloseTo(0.5, within(1e-6));
        assertThat(c2.coreScore()).isCloseTo(1.0, within(1e-6));
        assertThat(c1.finalScore()).isCloseTo(0.5, within(1e-6));
        assertThat(c2.finalScore()).isCloseTo(0.25, within(1e-6));
        assertThat(c3.finalScore()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void score_isolatedCandidatesScoreZero() {
        List<BacktestCacheRecord> records = List.of(
                record("c1", Map.of("p", 10), 1.0, 1.0, 0.2),
                record("c2", Map.of("p", 10.5), 1.2, 1.1, 0.25),
                record("c3", Map.of("p", 90), 0.3, 0.2, 0.05)
        );

        ParamScoreSummary summary = service.score(records);

        assertThat(summary.scored()).allSatisfy(item -> {
            assertThat(item.stabilityScore()).isZero();
            assertThat(item.finalScore()).isZero();
        });
        assertThat(summary.scored()).extracting(item -> item.sourceRecord().id()).containsExactly("c1", "c2", "c3");
    }

    @Test
    void score_singleCandidateHasFullCoreAndZeroStability() {
        ParamScoreSummary summary = service.score(List.of(record("only", Map.of("p", 1), 0.4, 0.3, 0.1)));

        ScoredParameterSet only = summary.best().orElseThrow();
        assertThat(only.coreScore()).isCloseTo(1.0, within(1e-6));
        assertThat(only.ddPenalty()).isEqualTo(1.0);
        assertThat(only.stabilityScore()).isZero();
        assertThat(only.finalScore()).isZero();
    }

    @Test
    void score_equalQualityNeighborsKeepFullStability() {
        List<BacktestCacheRecord> records = List.of(
                record("a", Map.of("p", 1), 1.0, 1.0, 0.2),
                record("b", Map.of("p", 2), 1.0, 1.0, 0.2)
        );

        ParamScoreSummary summary = service.score(records);

        assertThat(summary.scored()).allSatisfy(item -> {
            assertThat(item.stabilityScore()).isEqualTo(1.0);
            assertThat(item.finalScore()).isCloseTo(0.5, within(1e-6));
        });
    }

    @Test
    void score_appliesDrawdownPenaltyAndBlendsVerifyDrawdown() {
        BacktestCacheRecord record = record("dd", Map.of("p", 1), 1.0, 1.0, 0.2).toBuilder()
                .maxDrawdownRatio(0.2)
                .verifyMaxDrawdownRatio(0.4)
                .build();

        ScoredParameterSet scored = service.score(List.of(record)).best().orElseThrow();

        assertThat(scored.ddPenalty()).isCloseTo(Math.sqrt(Math.exp(-3.5 * 0.2) * Math.exp(-3.5 * 0.4)), within(1e-12));
    }

    @Test
    void score_negativeDrawdownRatioIsNotRewarded() {
        BacktestCacheRecord record = record("dd", Map.of("p", 1), 1.0, 1.0, 0.2).toBuilder()
                .maxDrawdownRatio(-0.3)
                .build();

        assertThat(service.score(List.of(record)).best().orElseThrow().ddPenalty()).isEqualTo(1.0);
    }

    @Test
    void score_verifyMetricsWithSameOrderingLeaveCoreScoreUnchanged() {
        List<BacktestCacheRecord> trainOnly = List.of(
                record("c1", Map.of("p", 10), 1.0, 1.0, 0.2),
                record("c2", Map.of("p", 10.5), 1.2, 1.1, 0.25),
                record("c3", Map.of("p", 90), 0.3, 0.2, 0.05)
        );
        List<BacktestCacheRecord> withVerify = new ArrayList<>();
        for (BacktestCacheRecord record : trainOnly) {
            withVerify.add(record.toBuilder()
                    .verifySharpeRatio(record.sharpeRatio() * 0.5)
                    .verifyCalmarRatio(record.calmarRatio() * 0.5)
                    .verifyTotalReturn(record.totalReturn() * 0.5)
                    .build());
        }

        ParamScoreSummary plain = service.score(trainOnly);
        ParamScoreSummary verified = service.score(withVerify);

        for (String id : List.of("c1", "c2", "c3")) {
            assertThat(scoredById(verified, id).coreScore())
                    .isCloseTo(scoredById(plain, id).coreScore(), within(1e-12));
        }
    }

    @Test
    void score_partialVerifyMetricsDoNotBlendCoreScore() {
        List<BacktestCacheRecord> records = List.of(
                record("c1", Map.of("p", 10), 1.0, 1.0, 0.2).toBuilder().verifySharpeRatio(5.0).verifyCalmarRatio(5.0).build(),
                record("c2", Map.of("p", 10.5), 1.2, 1.1, 0.25)
        );

        ScoredParameterSet c1 = scoredById(service.score(records), "c1");

        assertThat(c1.coreScore()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void score_fallsBackToVerifyCagrForVerifyReturn() {
        List<BacktestCacheRecord> records = List.of(
                record("c1", Map.of("p", 10), 1.0, 1.0, 0.2).toBuilder()
                        .verifySharpeRatio(2.0).verifyCalmarRatio(2.0).verifyCagr(0.3).build(),
                record("c2", Map.of("p", 10.5), 1.2, 1.1, 0.25).toBuilder()
                        .verifySharpeRatio(1.0).verifyCalmarRatio(1.0).verifyCagr(0.1).build()
        );

        ParamScoreSummary summary = service.score(records);

        assertThat(scoredById(summary, "c1").coreScore()).isCloseTo(Math.sqrt(1e-9), within(1e-6));
        assertThat(scoredById(summary, "c2").coreScore()).isCloseTo(Math.sqrt(1e-9), within(1e-6));
    }

    @Test
    void score_recordsAvailabilityForExcludedRecords() {
        List<BacktestCacheRecord> records = List.of(
                record("enough", Map.of("p", 1), 1.0, 1.0, 0.2).toBuilder().totalTrades(20).build(),
                record("short", Map.of("p", 2), 1.0, 1.0, 0.2).toBuilder().totalTrades(19).build(),
                record("broken", Map.of("p", 3), null, 1.0, 0.2)
        );

        ParamScoreSummary summary = service.score(records);

        assertThat(summary.scored()).hasSize(1);
        assertThat(summary.availabilityOf("enough")).contains(ScoreAvailability.eligibleRecord());
        assertThat(summary.availabilityOf("short").orElseThrow().reasonCode())
                .isEqualTo(ScoreAvailabilityReason.INSUFFICIENT_TRADES);
        assertThat(summary.availabilityOf(2).orElseThrow().reasonCode())
                .isEqualTo(ScoreAvailabilityReason.MISSING_METRICS);
    }

    @Test
    void score_keysAvailabilityByIndexWhenIdsRepeatOrAreMissing() {
        BacktestCacheRecord unnamed = record(null, Map.of("p", 1), 1.0, 1.0, 0.2);
        List<BacktestCacheRecord> records = Arrays.asList(unnamed, unnamed.toBuilder().totalTrades(1).build());

        ParamScoreSummary summary = service.score(records);

        assertThat(summary.availabilityById()).isEmpty();
        assertThat(summary.availabilityOf(0).orElseThrow().eligible()).isTrue();
        assertThat(summary.availabilityOf(1).orElseThrow().eligible()).isFalse();
    }

    @Test
    void score_allIneligibleYieldsNoScoredEntries() {
        List<BacktestCacheRecord> records = List.of(
                record("a", Map.of("p", 1), 1.0, 1.0, 0.2).toBuilder().totalTrades(null).build(),
                record("b", Map.of("p", 2), 1.0, 1.0, 0.2).toBuilder().totalTrades(5).build()
        );

        ParamScoreSummary summary = service.score(records);

        assertThat(summary.scored()).isEmpty();
        assertThat(summary.best()).isEmpty();
        assertThat(summary.availabilityByIndex()).hasSize(2);
    }

    @Test
    void score_emptyInputYieldsEmptySummary() {
        ParamScoreSummary summary = service.score(List.of());

        assertThat(summary.scored()).isEmpty();
        assertThat(summary.availabilityByIndex()).isEmpty();
    }

    @Test
    void score_minTradesOverrideTakesEffect() {
        List<BacktestCacheRecord> records = List.of(
                record("a", Map.of("p", 1), 1.0, 1.0, 0.2).toBuilder().totalTrades(5).build()
        );

        ParamScoreSummary summary = service.score(records, ParamScoreOverrides.builder().minTrades(5.0).build());

        assertThat(summary.scored()).hasSize(1);
    }

    @Test
    void score_keepsScoresWithinUnitInterval() {
        List<BacktestCacheRecord> records = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            records.add(record("r" + i, Map.of("p", i, "q", i % 3), 0.1 * i - 0.3, 0.05 * i, 0.02 * i - 0.1).toBuilder()
                    .maxDrawdownRatio(0.03 * i)
                    .build());
        }

        ParamScoreSummary summary = service.score(records, ParamScoreOverrides.builder().neighborThreshold(0.5).build());

        assertThat(summary.scored()).hasSize(12).allSatisfy(item -> {
            assertThat(item.coreScore()).isBetween(0.0, 1.0 + 1e-6);
            assertThat(item.ddPenalty()).isBetween(0.0, 1.0);
            assertThat(item.stabilityScore()).isBetween(0.0, 1.0);
            assertThat(item.finalScore()).isBetween(0.0, 1.0 + 1e-6);
            assertThat(item.finalScore100()).isBetween(0, 100);
        });
        assertThat(summary.scored()).isSortedAccordingTo(
                (left, right) -> Double.compare(right.finalScore(), left.finalScore()));
    }

    @Test
    void score_throwsWhenRecordsMissing() {
        assertThatThrownBy(() -> service.score(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("records");
        assertThatThrownBy(() -> service.score(Arrays.asList(record("a", Map.of("p", 1), 1.0, 1.0, 0.2), null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bestByTemplate_picksTopRankedSetPerTemplate() {
        List<BacktestCacheRecord> records = List.of(
                record("t1-a", Map.of("p", 1), 0.5, 0.5, 0.1),
                record("t1-b", Map.of("p", 2), 2.0, 2.0, 0.4),
                record("t1-c", Map.of("p", 3), 1.5, 1.5, 0.3),
                record("t2-a", Map.of("p", 1), 0.5, 0.5, 0.1).toBuilder().templateId("t2").build(),
                record("t3-a", Map.of("p", 1), 0.5, 0.5, 0.1).toBuilder().templateId("t3").totalTrades(1).build(),
                record("orphan", Map.of("p", 1), 9.0, 9.0, 9.0).toBuilder().templateId(" ").build()
        );

        Map<String, ScoredParameterSet> best = service.bestByTemplate(
                records,
                ParamScoreOverrides.builder().neighborThreshold(1.0).build()
        );

        assertThat(best).containsOnlyKeys("t1", "t2");
        // t1-c sits next to the strongest set; t1-b's neighborhood averages in the weakest one
        assertThat(best.get("t1").sourceRecord().id()).isEqualTo("t1-c");
        assertThat(best.get("t1").finalScore()).isCloseTo(0.5, within(1e-6));
        assertThat(best.get("t2").sourceRecord().id()).isEqualTo("t2-a");
    }

    @Test
    void bestByTemplate_withoutOverridesAppliesDefaultTradeFloor() {
        List<BacktestCacheRecord> records = List.of(
                record("t1-a", Map.of("p", 1), 1.0, 1.0, 0.2).toBuilder().totalTrades(19).build(),
                record("t2-a", Map.of("p", 1), 1.0, 1.0, 0.2).toBuilder().templateId("t2").build()
        );

        assertThat(service.bestByTemplate(records)).containsOnlyKeys("t2");
    }

    private ScoredParameterSet scoredById(ParamScoreSummary summary, String id) {
        return summary.scored().stream()
                .filter(item -> id.equals(item.sourceRecord().id()))
                .findFirst()
                .orElseThrow();
    }

    private BacktestCacheRecord record(String id, Map<String, Object> parameters, Double sharpe, Double calmar, Double totalReturn) {
        return BacktestCacheRecord.builder()
                .id(id)
                .templateId("t1")
                .parameters(objectMapper.valueToTree(parameters))
                .sharpeRatio(sharpe)
                .calmarRatio(calmar)
                .totalReturn(totalReturn)
                .totalTrades(100)
                .build();
    }
}
