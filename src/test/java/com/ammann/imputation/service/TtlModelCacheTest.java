/* (C)2026 */
package com.ammann.imputation.service;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.nn.MinMaxScaler;
import com.ammann.imputation.nn.SequenceRegressor;
import com.ammann.imputation.store.ModelArtifact;
import com.ammann.imputation.store.ModelKey;
import com.ammann.imputation.support.InMemoryModelArtifactStore;
import com.ammann.imputation.support.TestDataFactory;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TtlModelCacheTest {

    private static final ModelKey KEY = new ModelKey(TestDataFactory.STATION, MeasuredParameter.PM25);

    private ManualTicker ticker;
    private InMemoryModelArtifactStore artifacts;
    private TtlModelCache cache;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker();
        artifacts = new InMemoryModelArtifactStore();
        cache = new TtlModelCache(Duration.ofHours(1), ticker);
    }

    private ModelArtifact publish() {
        return artifacts.publish(KEY, TestDataFactory.NOW, 4, SequenceRegressor.initialize(4, 2, 0.0, 1L),
                new MinMaxScaler(0.0, 10.0), 0.5, 0.5);
    }

    @Test
    void servesCachedArtifactUntilTtlExpires() {
        publish();

        cache.getOrLoad(KEY, artifacts::findActive);
        ticker.advance(Duration.ofMinutes(59));
        Optional<ModelArtifact> cached = cache.getOrLoad(KEY, artifacts::findActive);

        assertThat(cached).hasValueSatisfying(a -> assertThat(a.version()).isEqualTo(1));
        assertThat(artifacts.activeLoads()).isEqualTo(1);

        ticker.advance(Duration.ofMinutes(1));
        cache.getOrLoad(KEY, artifacts::findActive);

        assertThat(artifacts.activeLoads()).isEqualTo(2);
    }

    @Test
    void staleEntryIsReplacedByNewerVersionAfterExpiry() {
        publish();
        cache.getOrLoad(KEY, artifacts::findActive);
        publish();

        assertThat(cache.getOrLoad(KEY, artifacts::findActive))
                .hasValueSatisfying(a -> assertThat(a.version()).isEqualTo(1));

        ticker.advance(Duration.ofHours(2));

        assertThat(cache.getOrLoad(KEY, artifacts::findActive))
                .hasValueSatisfying(a -> assertThat(a.version()).isEqualTo(2));
    }

    @Test
    void missingModelIsNotCached() {
        assertThat(cache.getOrLoad(KEY, artifacts::findActive)).isEmpty();
        assertThat(cache.size()).isZero();

        publish();

        assertThat(cache.getOrLoad(KEY, artifacts::findActive)).isPresent();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void invalidateForcesReload() {
        publish();
        cache.getOrLoad(KEY, artifacts::findActive);

        cache.invalidate(KEY);
        cache.getOrLoad(KEY, artifacts::findActive);
        cache.invalidateAll();

        assertThat(artifacts.activeLoads()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    void invalidationDuringLoadDiscardsTheLoadedArtifact() throws Exception {
        publish();
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<ModelArtifact>> slowLoad = pool.submit(() -> cache.getOrLoad(KEY, key -> {
                Optional<ModelArtifact> pending = artifacts.findActive(key);
                loading.countDown();
                try {
                    release.await(5, SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return pending;
            }));
            assertThat(loading.await(5, SECONDS)).isTrue();

            artifacts.updateCertification(KEY, 1, CertificationStatus.REJECTED);
            Future<?> invalidation = pool.submit(() -> cache.invalidate(KEY));
            release.countDown();
            invalidation.get(5, SECONDS);

            assertThat(slowLoad.get(5, SECONDS))
                    .hasValueSatisfying(a -> assertThat(a.certification()).isEqualTo(CertificationStatus.PENDING));
        } finally {
            pool.shutdownNow();
        }

        assertThat(cache.getOrLoad(KEY, artifacts::findActive))
                .hasValueSatisfying(a -> assertThat(a.certification()).isEqualTo(CertificationStatus.REJECTED));
    }

    @Test
    void concurrentMissesShareOneLoad() throws Exception {
        publish();
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] readers = new Future<?>[4];
            for (int i = 0; i < readers.length; i++) {
                readers[i] = pool.submit(() -> {
                    start.await(5, SECONDS);
                    return cache.getOrLoad(KEY, key -> {
                        loads.incrementAndGet();
                        return artifacts.findActive(key);
                    });
                });
            }
            start.countDown();
            for (Future<?> reader : readers) {
                assertThat(reader.get(5, SECONDS)).isEqualTo(cache.getOrLoad(KEY, artifacts::findActive));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(loads.get()).isEqualTo(1);
    }

    @Test
    void clockConstructorExpiresOnInjectedClock() {
        MutableClock clock = new MutableClock(TestDataFactory.NOW);
        TtlModelCache clocked = new TtlModelCache(Duration.ofHours(1), clock);
        publish();

        clocked.getOrLoad(KEY, artifacts::findActive);
        clock.advance(Duration.ofMinutes(30));
        clocked.getOrLoad(KEY, artifacts::findActive);
        assertThat(artifacts.activeLoads()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(30));
        clocked.getOrLoad(KEY, artifacts::findActive);
        assertThat(artifacts.activeLoads()).isEqualTo(2);
    }

    private static final class ManualTicker implements Ticker {

        private final AtomicLong nanos = new AtomicLong();

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }

        @Override
        public long read() {
            return nanos.get();
        }
    }

    private static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
