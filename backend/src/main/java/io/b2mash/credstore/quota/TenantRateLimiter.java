package io.b2mash.credstore.quota;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Fixed one-minute windows per tenant and request kind. The counter is incremented first and
 * rolled back when it passes the limit, so concurrent requests can never push a window over its
 * ceiling and the request that would cross it is the one rejected.
 */
@Service
public class TenantRateLimiter {

  private static final long WINDOW_NANOS = TimeUnit.MINUTES.toNanos(1);

  private final Ticker ticker;
  private final Cache<String, AtomicInteger> counters;

  @Autowired
  public TenantRateLimiter() {
    this(Ticker.systemTicker());
  }

  TenantRateLimiter(Ticker ticker) {
    this.ticker = ticker;
    this.counters =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(2))
            .maximumSize(100_000)
            .ticker(ticker)
            .build();
  }

  public boolean tryAcquire(UUID tenantId, RequestKind kind, int limit) {
    var counter = counters.get(key(tenantId, kind), k -> new AtomicInteger(0));
    int count = counter.incrementAndGet();
    if (count > limit) {
      counter.decrementAndGet();
      return false;
    }
    return true;
  }

  /** Requests admitted in the current window. */
  public int currentCount(UUID tenantId, RequestKind kind) {
    var counter = counters.getIfPresent(key(tenantId, kind));
    return counter != null ? counter.get() : 0;
  }

  private String key(UUID tenantId, RequestKind kind) {
    return tenantId + ":" + kind + ":" + ticker.read() / WINDOW_NANOS;
  }
}
