package com.couponbot.pipeline.domain.validation;

import com.couponbot.pipeline.domain.fetch.PageFetcher;
import com.couponbot.pipeline.test.fixtures.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.couponbot.pipeline.test.fixtures.CouponFixtures.SOME_NOW;
import static com.couponbot.pipeline.test.fixtures.CouponFixtures.pendingCouponBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class ValidatorRegistryTest {

    private final MutableClock clock = new MutableClock(SOME_NOW);

    @Mock
    PageFetcher fetcher;

    @Mock
    CouponValidator first;

    @Mock
    CouponValidator second;

    @Test
    void shouldUseFirstValidatorThatAcceptsSource() {
        // given
        var coupon = pendingCouponBuilder().build();
        var outcome = ValidationOutcome.valid("ok", SOME_NOW);
        given(first.canValidate("Generic")).willReturn(true);
        given(first.validate(coupon, fetcher)).willReturn(outcome);
        var registry = new ValidatorRegistry(List.of(first, second), fetcher, clock);

        // when
        var result = registry.validate(coupon);

        // then
        assertThat(result).isEqualTo(outcome);
        then(second).shouldHaveNoInteractions();
    }

    @Test
    void shouldSkipValidatorsThatDoNotAcceptSource() {
        // given
        var coupon = pendingCouponBuilder().build();
        var outcome = ValidationOutcome.invalid("nope", SOME_NOW);
        given(first.canValidate("Generic")).willReturn(false);
        given(second.canValidate("Generic")).willReturn(true);
        given(second.validate(coupon, fetcher)).willReturn(outcome);
        var registry = new ValidatorRegistry(List.of(first, second), fetcher, clock);

        // when
        var result = registry.validate(coupon);

        // then
        assertThat(result).isEqualTo(outcome);
    }

    @Test
    void shouldFailOpenWhenNoValidatorMatches() {
        // given
        var coupon = pendingCouponBuilder().source("Unknown").build();
        given(first.canValidate("Unknown")).willReturn(false);
        var registry = new ValidatorRegistry(List.of(first), fetcher, clock);

        // when
        var result = registry.validate(coupon);

        // then
        assertThat(result.valid()).isTrue();
        assertThat(result.message()).isEqualTo("no validator available for source Unknown");
        assertThat(result.validatedAt()).isEqualTo(SOME_NOW);
    }

    @Test
    void shouldRejectExpiredCouponWithoutConsultingValidators() {
        // given
        var coupon = pendingCouponBuilder().expiry(SOME_NOW.minus(Duration.ofSeconds(1))).build();
        var registry = new ValidatorRegistry(List.of(first, second), fetcher, clock);

        // when
        var result = registry.validate(coupon);

        // then
        assertThat(result.valid()).isFalse();
        assertThat(result.message()).isEqualTo("expired");
        then(first).shouldHaveNoInteractions();
        then(second).shouldHaveNoInteractions();
    }

    @Test
    void shouldTreatCouponWithoutExpiryAsNotExpired() {
        // given
        var coupon = pendingCouponBuilder().source("Unknown").expiry(null).build();
        var registry = new ValidatorRegistry(List.of(), fetcher, clock);

        // when
        var result = registry.validate(coupon);

        // then
        assertThat(result.valid()).isTrue();
    }

    @Test
    void shouldPropagateValidatorFailure() {
        // given
        var coupon = pendingCouponBuilder().build();
        given(first.canValidate("Generic")).willReturn(true);
        given(first.validate(coupon, fetcher)).willThrow(new IllegalStateException("boom"));
        var registry = new ValidatorRegistry(List.of(first), fetcher, clock);

        // when / then
        assertThatThrownBy(() -> registry.validate(coupon))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }
}
