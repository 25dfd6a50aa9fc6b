package com.foodrec.service.scoring;

import com.foodrec.model.Place;
import com.foodrec.model.PriceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalScorersTest {

    @Nested
    class Keyword {

        private final Place taqueria = Place.builder()
                .placeId("p1")
                .name("Taquería El Pastor")
                .types(List.of("mexican_restaurant", "restaurant"))
                .summary("Tacos al pastor hechos al momento")
                .build();

        @Test
        void should_ReturnZero_When_NoKeywords() {
            assertThat(SignalScorers.keywordScore(taqueria, List.of())).isEqualTo(0.0);
            assertThat(SignalScorers.keywordScore(taqueria, null)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("partial matches earn partial credit")
        void should_GivePartialCredit() {
            assertThat(SignalScorers.keywordScore(taqueria, List.of("tacos", "vegan"))).isEqualTo(0.5);
        }

        @Test
        void should_MatchCaseInsensitivelyAcrossAllFields() {
            assertThat(SignalScorers.keywordScore(taqueria, List.of("TACOS", "Mexican", "pastor"))).isEqualTo(1.0);
        }

        @Test
        void should_CountBlankKeywordsInDenominatorOnly() {
            assertThat(SignalScorers.keywordScore(taqueria, Arrays.asList("tacos", " ", null, "sushi")))
                    .isEqualTo(0.25);
        }

        @Test
        void should_TolerateAllNullFields() {
            Place empty = Place.builder().placeId("p0").build();
            assertThat(SignalScorers.keywordScore(empty, List.of("tacos"))).isEqualTo(0.0);
        }
    }

    @Nested
    class Price {

        private final Place moderate = Place.builder().placeId("m").priceLevel(PriceCategory.MODERATE).build();
        private final Place unknown = Place.builder().placeId("u").build();

        @Test
        void should_ReturnOne_When_NoPreferenceAndNoBudget() {
            assertThat(SignalScorers.priceScore(moderate, List.of(), null)).isEqualTo(1.0);
            assertThat(SignalScorers.priceScore(unknown, List.of(), null)).isEqualTo(1.0);
        }

        @Test
        void should_ScoreAgainstPreferredLevels() {
            assertThat(SignalScorers.priceScore(moderate, List.of(1, 2), null)).isEqualTo(1.0);
            assertThat(SignalScorers.priceScore(moderate, List.of(3), null)).isEqualTo(0.0);
        }

        @Test
        void should_ReturnNeutral_When_PlacePriceUnknown() {
            assertThat(SignalScorers.priceScore(unknown, List.of(1), null)).isEqualTo(0.5);
        }

        @Test
        void should_UseBudgetLevels_When_NoExplicitPreference() {
            assertThat(SignalScorers.priceScore(moderate, List.of(), Set.of(1, 2))).isEqualTo(1.0);
            assertThat(SignalScorers.priceScore(moderate, List.of(), Set.of(3, 4))).isEqualTo(0.0);
        }

        @Test
        void should_IntersectPreferenceWithBudget() {
            // {2,3} ∩ {1,2} = {2}
            assertThat(SignalScorers.priceScore(moderate, List.of(2, 3), Set.of(1, 2))).isEqualTo(1.0);
            Place expensive = Place.builder().placeId("e").priceLevel(PriceCategory.EXPENSIVE).build();
            assertThat(SignalScorers.priceScore(expensive, List.of(2, 3), Set.of(1, 2))).isEqualTo(0.0);
        }

        @Test
        @DisplayName("an empty intersection imposes no price constraint at all")
        void should_ReturnOne_When_IntersectionIsEmpty() {
            assertThat(SignalScorers.priceScore(moderate, List.of(4), Set.of(0, 1))).isEqualTo(1.0);
            assertThat(SignalScorers.priceScore(unknown, List.of(4), Set.of(0, 1))).isEqualTo(1.0);
        }
    }

    @Nested
    class Quality {

        @Test
        void should_ReturnZero_When_RatingMissingOrZero() {
            assertThat(SignalScorers.qualityScore(null, 500L)).isEqualTo(0.0);
            assertThat(SignalScorers.qualityScore(0.0, 500L)).isEqualTo(0.0);
        }

        @Test
        void should_ReachFullConfidenceAroundThousandReviews() {
            assertThat(SignalScorers.qualityScore(5.0, 999L)).isCloseTo(1.0, within(1e-9));
            assertThat(SignalScorers.qualityScore(4.0, 5000L)).isCloseTo(0.8, within(1e-9));
        }

        @Test
        @DisplayName("a single five-star review does not beat thousands of 4.5-star reviews")
        void should_FavorReviewVolume() {
            assertThat(SignalScorers.qualityScore(5.0, 1L))
                    .isLessThan(SignalScorers.qualityScore(4.5, 3000L));
        }

        @Test
        void should_ClampOutOfRangeRatings() {
            assertThat(SignalScorers.qualityScore(7.0, 999L)).isCloseTo(1.0, within(1e-9));
            assertThat(SignalScorers.qualityScore(-1.0, 999L)).isEqualTo(0.0);
        }

        @Test
        void should_TreatMissingReviewCountAsZero() {
            assertThat(SignalScorers.qualityScore(4.8, null)).isEqualTo(0.0);
        }
    }

    @Nested
    class Open {

        @Test
        void should_NotPenalize_When_OpenNotRequired() {
            assertThat(SignalScorers.openScore(false, false)).isEqualTo(1.0);
            assertThat(SignalScorers.openScore(null, false)).isEqualTo(1.0);
        }

        @Test
        void should_ScoreOpenStatus_When_Required() {
            assertThat(SignalScorers.openScore(true, true)).isEqualTo(1.0);
            assertThat(SignalScorers.openScore(false, true)).isEqualTo(0.0);
            assertThat(SignalScorers.openScore(null, true)).isEqualTo(0.6);
        }
    }

    @Nested
    class Distance {

        @Test
        void should_ReturnNeutral_When_DistanceUnknown() {
            assertThat(SignalScorers.distanceScore(null, 3)).isEqualTo(0.6);
        }

        @Test
        void should_HavePlateauNearAndFloorFar() {
            assertThat(SignalScorers.distanceScore(0.0, 3)).isEqualTo(1.0);
            assertThat(SignalScorers.distanceScore(0.25, 3)).isEqualTo(1.0);
            assertThat(SignalScorers.distanceScore(3.0, 3)).isEqualTo(0.1);
            assertThat(SignalScorers.distanceScore(42.0, 3)).isEqualTo(0.1);
        }

        @Test
        void should_DecayLinearlyInBetween() {
            assertThat(SignalScorers.distanceScore(1.5, 3)).isCloseTo(0.55, within(1e-9));
        }

        @Test
        @DisplayName("moving farther away never raises the distance score")
        void should_BeMonotonicallyNonIncreasing() {
            double previous = Double.MAX_VALUE;
            for (double km = 0; km <= 5; km += 0.05) {
                double score = SignalScorers.distanceScore(km, 3);
                assertThat(score).isLessThanOrEqualTo(previous);
                assertThat(score).isBetween(0.1, 1.0);
                previous = score;
            }
        }
    }
}
