package at.sv.sky.visibility;

import at.sv.sky.ObserverLocation;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.function.Supplier;

/**
 * Memoizes visibility windows per {@code (targetId, observerFingerprint, minAltitude, timeBucket)}.
 * Entries expire one bucket length after they were written, so a periodic refresh recomputes
 * each window at most once per bucket.
 */
public final class VisibilityWindowCache {

    private final Duration bucketLength;
    private final Cache<Key, VisibilityWindow> cache;

    public VisibilityWindowCache(Ticker ticker, Duration bucketLength) {
        if (bucketLength.toSeconds() < 1) {
            throw new IllegalArgumentException("Bucket length must be at least one second: " + bucketLength);
        }
        this.bucketLength = bucketLength;
        cache = Caffeine.newBuilder()
                        .ticker(ticker)
                        .expireAfterWrite(bucketLength)
                        .build();
    }

    public VisibilityWindow get(String targetId, ObserverLocation location, double minAltitude, ZonedDateTime now,
                                Supplier<VisibilityWindow> computation) {
        Key key = new Key(targetId, location.fingerprint(), minAltitude, timeBucket(now));
        return cache.get(key, k -> computation.get());
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }

    long timeBucket(ZonedDateTime now) {
        return now.toEpochSecond() / bucketLength.toSeconds();
    }

    private record Key(String targetId, String observerFingerprint, double minAltitude, long timeBucket) {
    }
}
