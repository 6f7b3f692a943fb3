package com.couponbot.pipeline.domain.coupon;

import java.util.List;
import java.util.Optional;

public interface CouponRepository {

    /**
     * Stores a new record and returns it with its store-assigned id.
     * Fails when the fingerprint is already present.
     */
    Coupon insert(Coupon coupon);

    boolean existsByFingerprint(String fingerprint);

    /**
     * Records a validation attempt; sets {@code validatedAt} to now and never touches {@code posted}.
     */
    void updateValidation(long id, boolean valid);

    /**
     * Flips {@code posted} to true. Only valid, validated records are affected.
     *
     * @return whether the record was flipped
     */
    boolean markPosted(long id);

    /**
     * Valid, not yet posted and not expired records, oldest first.
     */
    List<Coupon> findValidUnposted();

    int deleteExpired();

    Optional<Coupon> findById(long id);

    List<Coupon> findAll();

    List<Coupon> findBySource(String source);
}
