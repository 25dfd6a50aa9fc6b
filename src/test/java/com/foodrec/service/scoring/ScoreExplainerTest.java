package com.foodrec.service.scoring;

import com.foodrec.model.GeoPoint;
import com.foodrec.model.Place;
import com.foodrec.model.PriceCategory;
import com.foodrec.model.Profile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreExplainerTest {

    private static final GeoPoint ORIGIN = GeoPoint.of(14.5572969, -90.7332233);

    private static String explain(Place place, Profile profile, GeoPoint origin) {
        return ScoreExplainer.explain(place, profile, ScoreAggregator.aggregate(place, profile, origin));
    }

    @Test
    void should_JoinAllPieces_When_DataComplete() {
        Place place = Place.builder()
                .placeId("p1")
                .name("Tacos Chapines")
                .rating(4.6)
                .userRatingCount(1200L)
                .priceLevel(PriceCategory.MODERATE)
                .location(GeoPoint.of(14.5572969 + 0.00315, -90.7332233))
                .openNow(true)
                .build();
        Profile profile = Profile.builder().keywords(List.of("tacos")).build();

        assertThat(explain(place, profile, ORIGIN))
                .isEqualTo("$$ · 4.6★ (1200 reviews) · 350 m away · matches 100% of tastes (tacos) · open now");
    }

    @Test
    void should_ShowKilometers_When_OneKmOrMore() {
        Place place = Place.builder()
                .placeId("far")
                .location(GeoPoint.of(14.5572969 + 0.0126, -90.7332233))
                .build();

        assertThat(explain(place, Profile.defaults(), ORIGIN)).isEqualTo("1.4 km away");
    }

    @Test
    void should_OmitReviewCount_When_NoReviews() {
        Place place = Place.builder().placeId("new").rating(4.0).userRatingCount(0L).build();

        assertThat(explain(place, Profile.defaults(), null)).isEqualTo("4.0★");
    }

    @Test
    void should_OmitKeywordMatch_When_BelowHalf() {
        Place place = Place.builder().placeId("k").name("Pupusería").build();
        Profile profile = Profile.builder().keywords(List.of("pupusa", "ramen", "sushi")).build();

        assertThat(explain(place, profile, null)).isEmpty();
    }

    @Test
    void should_ShowRoundedPercentage_When_AtLeastHalf() {
        Place place = Place.builder().placeId("k").name("Ramen & Sushi Bar").build();
        Profile profile = Profile.builder().keywords(List.of("ramen", "sushi", "tacos")).build();

        assertThat(explain(place, profile, null)).isEqualTo("matches 67% of tastes (ramen, sushi, tacos)");
    }

    @Test
    void should_ProduceEmptyString_When_NothingKnown() {
        Place place = Place.builder().placeId("bare").openNow(false).build();

        assertThat(explain(place, Profile.builder().requireOpen(true).build(), ORIGIN)).isEmpty();
    }
}
