package com.couponbot.pipeline.application.config;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.collect.CouponCollector;
import com.couponbot.pipeline.domain.validation.CouponValidator;
import com.couponbot.pipeline.test.fixtures.MutableClock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import static com.couponbot.pipeline.test.fixtures.CouponFixtures.SOME_NOW;
import static org.assertj.core.api.Assertions.assertThat;

class PipelineConfigTest {

    private final MutableClock clock = new MutableClock(SOME_NOW);

    @Test
    void shouldRegisterCollectorsInProcessingOrder() {
        var properties = new CouponBotProperties(
                new CouponBotProperties.Scraping(60, 10, "Coupon Bot/1.0", Duration.ofSeconds(30), List.of()),
                new CouponBotProperties.Validation(true, Duration.ofSeconds(30)),
                new CouponBotProperties.Discord(null, null, null, "Coupon Bot"));

        var sources = PipelineConfig.collectors(clock, properties).stream()
                .map(CouponCollector::source)
                .toList();

        assertThat(sources).containsExactly("Cursor AI", "GitHub", "Replit", "Warp", "Tabnine", "Generic");
    }

    @Test
    void shouldHaveExactlyOneValidatorPerSource() {
        var validators = PipelineConfig.validators(clock);

        Arrays.stream(CouponSource.values()).forEach(source ->
                assertThat(validators)
                        .filteredOn(validator -> validator.canValidate(source.label()))
                        .extracting(CouponValidator::name)
                        .hasSize(1));
    }
}
