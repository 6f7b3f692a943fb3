package com.couponbot.pipeline.infrastructure.db;

import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.infrastructure.db.mapper.CouponEntityMapperImpl;
import com.couponbot.pipeline.test.fixtures.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static com.couponbot.pipeline.test.fixtures.CouponFixtures.SOME_NOW;
import static com.couponbot.pipeline.test.fixtures.CouponFixtures.candidate;
import static com.couponbot.pipeline.test.fixtures.CouponFixtures.genericCandidateBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({CouponRepositoryAdapter.class, CouponEntityMapperImpl.class,
        CouponRepositoryAdapterIntegrationTest.ClockTestConfig.class})
class CouponRepositoryAdapterIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:17-alpine"))
            .withDatabaseName("coupons_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @TestConfiguration
    static class ClockTestConfig {

        @Bean
        MutableClock clock() {
            return new MutableClock(SOME_NOW);
        }
    }

    @Autowired
    CouponRepositoryAdapter adapter;

    @Autowired
    MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(SOME_NOW);
    }

    private Coupon insert(String name, String code, String source) {
        return adapter.insert(candidate(name, code, source).toPendingCoupon(clock.instant()));
    }

    @Test
    void shouldAssignIdAndFindByFingerprint() {
        var stored = adapter.insert(genericCandidateBuilder().build().toPendingCoupon(SOME_NOW));

        assertThat(stored.id()).isNotNull();
        assertThat(stored.valid()).isFalse();
        assertThat(stored.posted()).isFalse();
        assertThat(adapter.existsByFingerprint(stored.fingerprint())).isTrue();
        assertThat(adapter.existsByFingerprint("0".repeat(64))).isFalse();
    }

    @Test
    void shouldRejectDuplicateFingerprint() {
        adapter.insert(genericCandidateBuilder().build().toPendingCoupon(SOME_NOW));

        assertThatThrownBy(() -> adapter.insert(genericCandidateBuilder().build().toPendingCoupon(SOME_NOW)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void shouldOnlyMarkValidatedValidRecordsAsPosted() {
        // given
        var pending = insert("Pending", "CODE-P", "Generic");
        var invalid = insert("Invalid", "CODE-I", "Generic");
        var valid = insert("Valid", "CODE-V", "Generic");
        adapter.updateValidation(invalid.id(), false);
        adapter.updateValidation(valid.id(), true);

        // when
        var pendingPosted = adapter.markPosted(pending.id());
        var invalidPosted = adapter.markPosted(invalid.id());
        var validPosted = adapter.markPosted(valid.id());

        // then
        assertThat(pendingPosted).isFalse();
        assertThat(invalidPosted).isFalse();
        assertThat(validPosted).isTrue();
        assertThat(adapter.findById(pending.id())).hasValueSatisfying(c -> assertThat(c.posted()).isFalse());
        assertThat(adapter.findById(invalid.id())).hasValueSatisfying(c -> assertThat(c.posted()).isFalse());
        assertThat(adapter.findById(valid.id())).hasValueSatisfying(c -> assertThat(c.posted()).isTrue());
    }

    @Test
    void shouldOverwriteValidatedAtWithoutResettingPosted() {
        // given
        var coupon = insert("Revalidated", "CODE-R", "Generic");
        adapter.updateValidation(coupon.id(), true);
        adapter.markPosted(coupon.id());

        // when
        clock.advance(Duration.ofHours(2));
        adapter.updateValidation(coupon.id(), true);

        // then
        var reloaded = adapter.findById(coupon.id()).orElseThrow();
        assertThat(reloaded.validatedAt()).isEqualTo(SOME_NOW.plus(Duration.ofHours(2)));
        assertThat(reloaded.posted()).isTrue();
        assertThat(reloaded.createdAt()).isEqualTo(SOME_NOW);
    }

    @Test
    void shouldListOnlyValidUnpostedUnexpiredRecords() {
        // given
        var ready = insert("Ready", "CODE-1", "Generic");
        var posted = insert("Posted", "CODE-2", "Generic");
        var expiring = adapter.insert(candidate("Expiring", "CODE-3", "Generic").toBuilder()
                .expiry(SOME_NOW.plus(Duration.ofHours(1)))
                .build()
                .toPendingCoupon(SOME_NOW));
        insert("Unvalidated", "CODE-4", "Generic");
        adapter.updateValidation(ready.id(), true);
        adapter.updateValidation(posted.id(), true);
        adapter.updateValidation(expiring.id(), true);
        adapter.markPosted(posted.id());

        // when
        clock.advance(Duration.ofHours(2));
        var pending = adapter.findValidUnposted();

        // then
        assertThat(pending).extracting(Coupon::name).containsExactly("Ready");
    }

    @Test
    void shouldDeleteOnlyExpiredRecords() {
        // given
        adapter.insert(candidate("Yesterday", "CODE-Y", "Generic").toBuilder()
                .expiry(SOME_NOW.minus(Duration.ofDays(1))).build().toPendingCoupon(SOME_NOW));
        adapter.insert(candidate("Tomorrow", "CODE-T", "Generic").toBuilder()
                .expiry(SOME_NOW.plus(Duration.ofDays(1))).build().toPendingCoupon(SOME_NOW));
        adapter.insert(candidate("Forever", "CODE-F", "Generic").toBuilder()
                .expiry(null).build().toPendingCoupon(SOME_NOW));

        // when
        var deleted = adapter.deleteExpired();

        // then
        assertThat(deleted).isEqualTo(1);
        assertThat(adapter.findAll()).extracting(Coupon::name).containsExactlyInAnyOrder("Tomorrow", "Forever");
    }

    @Test
    void shouldListNewestFirstAndFilterBySource() {
        // given
        insert("Older", "CODE-O", "GitHub");
        clock.advance(Duration.ofMinutes(5));
        insert("Newer", "CODE-N", "GitHub");
        insert("Elsewhere", "CODE-E", "Warp");

        // when / then
        assertThat(adapter.findBySource("GitHub")).extracting(Coupon::name).containsExactly("Newer", "Older");
        assertThat(adapter.findAll()).hasSize(3);
    }
}
