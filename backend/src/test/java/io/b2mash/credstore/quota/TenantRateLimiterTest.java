package io.b2mash.credstore.quota;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Ticker;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TenantRateLimiterTest {

  private static final UUID TENANT_A = UUID.randomUUID();
  private static final UUID TENANT_B = UUID.randomUUID();

  @Test
  void shouldRejectTheRequestThatCrossesTheLimit() {
    var ticker = new FakeTicker();
    var limiter = new TenantRateLimiter(ticker);

    for (int i = 0; i < 5; i++) {
      assertThat(limiter.tryAcquire(TENANT_A, RequestKind.WRITE, 5)).isTrue();
    }
    // 6th crosses the limit
    assertThat(limiter.tryAcquire(TENANT_A, RequestKind.WRITE, 5)).isFalse();
    assertThat(limiter.currentCount(TENANT_A, RequestKind.WRITE)).isEqualTo(5);
  }

  @Test
  void shouldCountTenantsAndKindsSeparately() {
    var limiter = new TenantRateLimiter(new FakeTicker());

    assertThat(limiter.tryAcquire(TENANT_A, RequestKind.WRITE, 1)).isTrue();
    assertThat(limiter.tryAcquire(TENANT_A, RequestKind.WRITE, 1)).isFalse();

    assertThat(limiter.tryAcquire(TENANT_A, RequestKind.READ, 1)).isTrue();
    assertThat(limiter.tryAcquire(TENANT_B, RequestKind.WRITE, 1)).isTrue();
  }

  @Test
  void shouldStartTheNextWindowFromZero() {
    var ticker = new FakeTicker();
    var limiter = new TenantRateLimiter(ticker);
    assertThat(limiter.tryAcquire(TENANT_A, RequestKind.READ, 2)).isTrue();
    assertThat(limiter.tryAcquire(TENANT_A, RequestKind.READ, 2)).isTrue();
    assertThat(limiter.tryAcquire(TENANT_A, RequestKind.READ, 2)).isFalse();

    ticker.advance(TimeUnit.MINUTES.toNanos(1));

    assertThat(limiter.currentCount(TENANT_A, RequestKind.READ)).isZero();
    assertThat(limiter.tryAcquire(TENANT_A, RequestKind.READ, 2)).isTrue();
  }

  @Test
  void shouldNeverExceedTheLimitUnderConcurrentRequests() throws InterruptedException {
    var limiter = new TenantRateLimiter(new FakeTicker());
    var admitted = new AtomicInteger();
    var start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      for (int i = 0; i < 200; i++) {
        pool.submit(
            () -> {
              start.await();
              if (limiter.tryAcquire(TENANT_A, RequestKind.WRITE, 50)) {
                admitted.incrementAndGet();
              }
              return null;
            });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(admitted).hasValue(50);
  }

  static class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
      return nanos.get();
    }

    void advance(long deltaNanos) {
      nanos.addAndGet(deltaNanos);
    }
  }
}
