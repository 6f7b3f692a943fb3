package com.couponbot.pipeline.application.config;

import com.couponbot.pipeline.domain.collect.CouponCollector;
import com.couponbot.pipeline.domain.coupon.CouponRepository;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import com.couponbot.pipeline.domain.notification.CouponNotifier;
import com.couponbot.pipeline.domain.pipeline.CouponPipeline;
import com.couponbot.pipeline.domain.pipeline.DeduplicationGate;
import com.couponbot.pipeline.domain.pipeline.PipelineMetrics;
import com.couponbot.pipeline.domain.validation.CouponValidator;
import com.couponbot.pipeline.domain.validation.ValidatorRegistry;
import com.couponbot.pipeline.infrastructure.scraper.CursorAiCollector;
import com.couponbot.pipeline.infrastructure.scraper.GenericDealsCollector;
import com.couponbot.pipeline.infrastructure.scraper.GitHubEducationCollector;
import com.couponbot.pipeline.infrastructure.scraper.ReplitEducationCollector;
import com.couponbot.pipeline.infrastructure.scraper.StudentProgramCollector;
import com.couponbot.pipeline.infrastructure.validation.CursorAiValidator;
import com.couponbot.pipeline.infrastructure.validation.GenericValidator;
import com.couponbot.pipeline.infrastructure.validation.GitHubValidator;
import com.couponbot.pipeline.infrastructure.validation.ProgramPageValidator;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires collectors and validators in registration order. Order matters: candidates are
 * processed in collector order and the first matching validator wins.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    static List<CouponCollector> collectors(Clock clock, CouponBotProperties properties) {
        return List.of(
                new CursorAiCollector(clock),
                new GitHubEducationCollector(clock),
                new ReplitEducationCollector(clock),
                StudentProgramCollector.warp(clock),
                StudentProgramCollector.tabnine(clock),
                new GenericDealsCollector(clock, properties.scraping().genericUrls()));
    }

    static List<CouponValidator> validators(Clock clock) {
        return List.of(
                new CursorAiValidator(clock),
                new GitHubValidator(clock),
                ProgramPageValidator.replit(clock),
                ProgramPageValidator.warp(clock),
                ProgramPageValidator.tabnine(clock),
                new GenericValidator(clock));
    }

    @Bean
    public ValidatorRegistry validatorRegistry(
            @Qualifier("validationPageFetcher") PageFetcher validationPageFetcher, Clock clock) {
        var registry = new ValidatorRegistry(validators(clock), validationPageFetcher, clock);
        log.info("Registered validators: {}", registry.validatorNames());
        return registry;
    }

    @Bean
    public CouponPipeline couponPipeline(
            CouponBotProperties properties,
            @Qualifier("scrapingPageFetcher") PageFetcher scrapingPageFetcher,
            @Qualifier("collectorExecutor") ThreadPoolTaskExecutor collectorExecutor,
            DeduplicationGate deduplicationGate,
            CouponRepository couponRepository,
            ValidatorRegistry validatorRegistry,
            CouponNotifier couponNotifier,
            PipelineMetrics pipelineMetrics,
            Clock clock) {
        var collectors = collectors(clock, properties);
        log.info("Registered collectors: {}", collectors.stream().map(CouponCollector::name).toList());
        return new CouponPipeline(
                collectors,
                scrapingPageFetcher,
                collectorExecutor,
                deduplicationGate,
                couponRepository,
                validatorRegistry,
                couponNotifier,
                pipelineMetrics,
                clock,
                properties.validation().enabled());
    }
}
