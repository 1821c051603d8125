package org.nowstart.scoring.service.param;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParameterSpaceTest {

    private final ParameterSpace space = ParameterSpace.of(List.of(
            Map.of("p", 0, "q", 0, "initialCapital", 1000, "ticker", "AAPL"),
            Map.of("p", 10, "q", 5, "initialCapital", 5000, "ticker", "MSFT"),
            Map.of("p", 20, "q", 100, "initialCapital", 9000, "ticker", "TSLA")
    ));

    @Test
    void of_scalesNumericParametersByP10ToP90Spread() {
        assertThat(space.scales()).containsOnly(Map.entry("p", 10.0), Map.entry("q", 5.0));
    }

    @Test
    void of_dropsConstantParameters() {
        ParameterSpace constant = ParameterSpace.of(List.of(
                Map.of("p", 1, "flat", 3),
                Map.of("p", 2, "flat", 3),
                Map.of("p", 3, "flat", 3)
        ));

        assertThat(constant.scales()).containsOnlyKeys("p");
    }

    @Test
    void distance_isRootMeanSquareOfScaledDifferences() {
        assertThat(space.distance(Map.of("p", 0, "q", 0), Map.of("p", 10, "q", 5))).isCloseTo(1.0, within(1e-12));
        assertThat(space.distance(Map.of("p", 0, "q", 0), Map.of("p", 20, "q", 0))).isCloseTo(Math.sqrt(2.0), within(1e-12));
    }

    @Test
    void distance_addsFixedPenaltyWhenParameterMissingOnOneSide() {
        double distance = space.distance(Map.of("p", 0, "q", 0), Map.of("p", 5));

        assertThat(distance).isCloseTo(Math.sqrt((0.25 + 1.0) / 2.0), within(1e-12));
    }

    @Test
    void distance_treatsNonNumericValueAsMissing() {
        double distance = space.distance(Map.of("p", 0, "q", "fast"), Map.of("p", 0, "q", 0));

        assertThat(distance).isCloseTo(Math.sqrt(0.5), within(1e-12));
    }

    @Test
    void distance_isZeroWhenNoScaledParameterShared() {
        assertThat(space.distance(Map.of("ticker", "AAPL"), Map.of("initialCapital", 10))).isZero();
    }

    @Test
    void bucketKeys_coversAdjacentBucketsAndWholeVector() {
        assertThat(space.bucketKeys(Map.of("p", 10), 0.5))
                .containsExactly("p:2", "p:1", "p:3", "vector:p=2");
    }

    @Test
    void bucketKeys_usesEmptyVectorKeyWithoutScaledParameters() {
        assertThat(space.bucketKeys(Map.of("ticker", "AAPL"), 0.5)).containsExactly("vector:__empty__");
    }
}
