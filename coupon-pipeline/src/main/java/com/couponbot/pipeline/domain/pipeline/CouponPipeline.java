package com.couponbot.pipeline.domain.pipeline;

import com.couponbot.pipeline.domain.collect.CouponCollector;
import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.coupon.CouponCandidate;
import com.couponbot.pipeline.domain.coupon.CouponRepository;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import com.couponbot.pipeline.domain.notification.CouponNotifier;
import com.couponbot.pipeline.domain.validation.ValidationOutcome;
import com.couponbot.pipeline.domain.validation.ValidatorRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * One batch: re-deliver valid unposted records, run every collector, then push each
 * candidate through dedup, insert, validation and notification.
 * Failures are scoped to the collector or candidate that raised them.
 * Must not be run concurrently with itself; the dedup check-then-insert relies on it.
 */
@Slf4j
public class CouponPipeline {

    static final String VALIDATION_DISABLED_MESSAGE = "validation disabled";

    private final List<CouponCollector> collectors;
    private final PageFetcher scrapingFetcher;
    private final Executor collectorExecutor;
    private final DeduplicationGate deduplicationGate;
    private final CouponRepository couponRepository;
    private final ValidatorRegistry validatorRegistry;
    private final CouponNotifier notifier;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final boolean validationEnabled;

    public CouponPipeline(
            List<CouponCollector> collectors,
            PageFetcher scrapingFetcher,
            Executor collectorExecutor,
            DeduplicationGate deduplicationGate,
            CouponRepository couponRepository,
            ValidatorRegistry validatorRegistry,
            CouponNotifier notifier,
            PipelineMetrics metrics,
            Clock clock,
            boolean validationEnabled) {
        this.collectors = List.copyOf(collectors);
        this.scrapingFetcher = scrapingFetcher;
        this.collectorExecutor = collectorExecutor;
        this.deduplicationGate = deduplicationGate;
        this.couponRepository = couponRepository;
        this.validatorRegistry = validatorRegistry;
        this.notifier = notifier;
        this.metrics = metrics;
        this.clock = clock;
        this.validationEnabled = validationEnabled;
    }

    public BatchSummary runBatch() {
        var startedAt = clock.instant();
        log.info("batch.started: collectors={}, validationEnabled={}", collectors.size(), validationEnabled);

        var retried = 0;
        var retryPosted = 0;
        var retryFailed = 0;
        var interrupted = false;

        for (var pending : findRetryCandidates()) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }
            retried++;
            try {
                if (deliver(pending)) {
                    retryPosted++;
                }
            } catch (RuntimeException e) {
                retryFailed++;
                log.error("coupon.retry.failed: id={}, name={}", pending.id(), pending.name(), e);
            }
        }

        var failedCollectors = 0;
        var candidates = new ArrayList<CouponCandidate>();
        if (!interrupted) {
            for (var result : collectAll()) {
                if (result.failed()) {
                    failedCollectors++;
                } else {
                    candidates.addAll(result.candidates());
                }
            }
            metrics.collected(candidates.size());
            log.info("batch.collected: candidates={}, failedCollectors={}", candidates.size(), failedCollectors);
        }

        var states = new EnumMap<CandidateState, Integer>(CandidateState.class);
        for (var candidate : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("batch.interrupted: stopping before candidate {}", candidate.name());
                interrupted = true;
                break;
            }
            states.merge(process(candidate), 1, Integer::sum);
        }

        var summary = BatchSummary.builder()
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .collected(candidates.size())
                .deduplicated(count(states, CandidateState.DEDUPLICATED))
                .invalid(count(states, CandidateState.INVALID))
                .posted(count(states, CandidateState.POSTED))
                .validUnposted(count(states, CandidateState.VALID_UNPOSTED))
                .failed(count(states, CandidateState.FAILED))
                .failedCollectors(failedCollectors)
                .retried(retried)
                .retryPosted(retryPosted)
                .retryFailed(retryFailed)
                .interrupted(interrupted)
                .build();
        log.info("batch.finished: {}", summary);
        return summary;
    }

    CandidateState process(CouponCandidate candidate) {
        try {
            var fingerprint = candidate.fingerprint();
            if (deduplicationGate.isKnown(fingerprint)) {
                log.debug("coupon.deduplicated: name={}, fingerprint={}", candidate.name(), fingerprint);
                metrics.deduplicated();
                return CandidateState.DEDUPLICATED;
            }

            var stored = couponRepository.insert(candidate.toPendingCoupon(clock.instant()));

            var outcome = validate(stored);
            couponRepository.updateValidation(stored.id(), outcome.valid());
            if (!outcome.valid()) {
                log.info("coupon.invalid: id={}, name={}, reason={}", stored.id(), stored.name(), outcome.message());
                return CandidateState.INVALID;
            }

            var validated = stored.toBuilder()
                    .valid(true)
                    .validatedAt(outcome.validatedAt())
                    .build();
            return deliver(validated) ? CandidateState.POSTED : CandidateState.VALID_UNPOSTED;
        } catch (RuntimeException e) {
            log.error("coupon.failed: name={}, source={}", candidate.name(), candidate.source(), e);
            return CandidateState.FAILED;
        }
    }

    private ValidationOutcome validate(Coupon coupon) {
        if (!validationEnabled) {
            return ValidationOutcome.valid(VALIDATION_DISABLED_MESSAGE, clock.instant());
        }
        return validatorRegistry.validate(coupon);
    }

    private boolean deliver(Coupon coupon) {
        try {
            notifier.deliver(coupon);
        } catch (RuntimeException e) {
            metrics.deliveryFailed();
            log.error("coupon.delivery.failed: id={}, name={}", coupon.id(), coupon.name(), e);
            return false;
        }

        if (!couponRepository.markPosted(coupon.id())) {
            log.warn("coupon.posted.unrecorded: id={}, name={}", coupon.id(), coupon.name());
            return false;
        }
        metrics.posted();
        log.info("coupon.posted: id={}, source={}, name={}", coupon.id(), coupon.source(), coupon.name());
        return true;
    }

    private List<Coupon> findRetryCandidates() {
        try {
            return couponRepository.findValidUnposted();
        } catch (RuntimeException e) {
            log.error("batch.retry.skipped: could not load valid unposted records", e);
            return List.of();
        }
    }

    private List<CollectorResult> collectAll() {
        var futures = collectors.stream()
                .map(collector -> CompletableFuture.supplyAsync(() -> collect(collector), collectorExecutor))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private CollectorResult collect(CouponCollector collector) {
        try {
            var candidates = collector.collect(scrapingFetcher);
            log.info("collector.finished: name={}, candidates={}", collector.name(), candidates.size());
            return new CollectorResult(List.copyOf(candidates), false);
        } catch (RuntimeException e) {
            metrics.collectorFailed();
            log.error("collector.failed: name={}", collector.name(), e);
            return new CollectorResult(List.of(), true);
        }
    }

    private static int count(Map<CandidateState, Integer> states, CandidateState state) {
        return states.getOrDefault(state, 0);
    }

    private record CollectorResult(List<CouponCandidate> candidates, boolean failed) {
    }
}
