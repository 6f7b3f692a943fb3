package com.couponbot.pipeline.infrastructure.db;

import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CouponJpaRepository extends JpaRepository<CouponEntity, Long> {

    boolean existsByFingerprint(String fingerprint);

    List<CouponEntity> findAllByOrderByCreatedAtDescIdDesc();

    List<CouponEntity> findBySourceOrderByCreatedAtDescIdDesc(String source);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE CouponEntity c SET c.valid = :valid, c.validatedAt = :now WHERE c.id = :id")
    int updateValidation(@Param("id") Long id, @Param("valid") boolean valid, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE CouponEntity c SET c.posted = true
            WHERE c.id = :id AND c.valid = true AND c.validatedAt IS NOT NULL
            """)
    int markPosted(@Param("id") Long id);

    @Query("""
            SELECT c FROM CouponEntity c
            WHERE c.valid = true AND c.posted = false
              AND (c.expiry IS NULL OR c.expiry > :now)
            ORDER BY c.createdAt ASC, c.id ASC
            """)
    List<CouponEntity> findValidUnposted(@Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM CouponEntity c WHERE c.expiry IS NOT NULL AND c.expiry < :now")
    int deleteExpired(@Param("now") Instant now);
}
