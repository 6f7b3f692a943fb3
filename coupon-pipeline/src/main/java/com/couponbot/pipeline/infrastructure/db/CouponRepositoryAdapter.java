package com.couponbot.pipeline.infrastructure.db;

import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.coupon.CouponRepository;
import com.couponbot.pipeline.infrastructure.db.mapper.CouponEntityMapper;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class CouponRepositoryAdapter implements CouponRepository {

    private final CouponJpaRepository jpaRepository;
    private final CouponEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional
    public Coupon insert(Coupon coupon) {
        var entity = mapper.toEntity(coupon);
        entity.setId(null);
        var saved = jpaRepository.saveAndFlush(entity);
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByFingerprint(String fingerprint) {
        return jpaRepository.existsByFingerprint(fingerprint);
    }

    @Override
    @Transactional
    public void updateValidation(long id, boolean valid) {
        jpaRepository.updateValidation(id, valid, clock.instant());
    }

    @Override
    @Transactional
    public boolean markPosted(long id) {
        var updated = jpaRepository.markPosted(id);
        if (updated == 0) {
            log.warn("markPosted skipped for coupon {}: not valid or not validated", id);
        }
        return updated > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Coupon> findValidUnposted() {
        return jpaRepository.findValidUnposted(clock.instant()).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public int deleteExpired() {
        return jpaRepository.deleteExpired(clock.instant());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Coupon> findById(long id) {
        return jpaRepository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Coupon> findAll() {
        return jpaRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Coupon> findBySource(String source) {
        return jpaRepository.findBySourceOrderByCreatedAtDescIdDesc(source).stream()
                .map(mapper::toDomain)
                .toList();
    }
}
