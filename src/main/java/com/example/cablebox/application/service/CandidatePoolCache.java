package com.example.cablebox.application.service;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.common.util.RandomSource;
import com.example.cablebox.domain.model.CandidateFilter;
import com.example.cablebox.infrastructure.catalog.TrackCatalog;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Short-lived, process-local cache of sampled candidate pools.
 * <p>
 * A pool is a contiguous window of at most {@code candidatePoolSize} matching
 * rows in id order. The window start is random (or derived from the seed), so
 * successive cache generations rotate through large catalogs without loading
 * them whole. All map access happens under the instance monitor; catalog
 * queries run outside it and their failures are never cached.
 */
@Component
public class CandidatePoolCache {

    private static final Logger log = LoggerFactory.getLogger(CandidatePoolCache.class);

    private final TrackCatalog trackCatalog;
    private final AppStationProperties stationProperties;
    private final Clock clock;
    private final RandomSource randomSource;
    private final LinkedHashMap<PoolKey, PoolEntry> entries = new LinkedHashMap<>();

    @Autowired
    public CandidatePoolCache(TrackCatalog trackCatalog, AppStationProperties stationProperties) {
        this(trackCatalog, stationProperties, Clock.systemUTC(), RandomSource.system());
    }

    CandidatePoolCache(TrackCatalog trackCatalog,
                       AppStationProperties stationProperties,
                       Clock clock,
                       RandomSource randomSource) {
        this.trackCatalog = trackCatalog;
        this.stationProperties = stationProperties;
        this.clock = clock;
        this.randomSource = randomSource;
    }

    /**
     * Cached pool for the key, loading it from the catalog on a miss. An empty
     * list means the filter matches nothing.
     */
    public List<TrackEntity> getPool(Long userId,
                                     Long stationId,
                                     CandidateFilter filter,
                                     String filterSignature,
                                     String seed) {
        PoolKey key = new PoolKey(userId, stationId, filterSignature, seed);
        synchronized (this) {
            purge(clock.millis());
            PoolEntry cached = entries.get(key);
            if (cached != null) {
                log.debug("STATION_EVENT event=pool_cache_hit stationId={} size={}", stationId, cached.tracks.size());
                return cached.tracks;
            }
        }

        List<TrackEntity> pool = loadPool(stationId, filter, seed);
        long expiresAt = clock.millis() + Math.max(0L, stationProperties.getCacheTtlSeconds()) * 1000L;
        synchronized (this) {
            entries.remove(key);
            entries.put(key, new PoolEntry(pool, expiresAt));
            purge(clock.millis());
        }
        log.debug("STATION_EVENT event=pool_cache_miss stationId={} size={}", stationId, pool.size());
        return pool;
    }

    synchronized int size() {
        return entries.size();
    }

    List<TrackEntity> loadPool(Long stationId, CandidateFilter filter, String seed) {
        long totalMatches = trackCatalog.count(filter);
        if (totalMatches <= 0) {
            return Collections.emptyList();
        }
        int poolSize = (int) Math.min(Math.max(1, stationProperties.getCandidatePoolSize()), totalMatches);
        long maxOffset = totalMatches - poolSize;
        long offset = 0L;
        if (maxOffset > 0) {
            String seedKey = seed == null ? null : seed + ":" + stationId + ":" + totalMatches;
            double draw = randomSource.drawFor(seedKey);
            offset = Math.min(maxOffset, (long) Math.floor(draw * (maxOffset + 1)));
        }

        List<TrackEntity> rows = trackCatalog.findPage(filter, offset, poolSize);
        if (rows.size() >= poolSize) {
            return Collections.unmodifiableList(new ArrayList<>(rows));
        }

        // The catalog shrank between count and fetch: top up from the start.
        Map<String, TrackEntity> byId = new LinkedHashMap<>();
        for (TrackEntity row : rows) {
            byId.putIfAbsent(row.getId(), row);
        }
        for (TrackEntity row : trackCatalog.findPage(filter, 0L, poolSize - rows.size())) {
            byId.putIfAbsent(row.getId(), row);
        }
        return Collections.unmodifiableList(new ArrayList<>(byId.values()));
    }

    private void purge(long nowMillis) {
        Iterator<PoolEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(nowMillis)) {
                iterator.remove();
            }
        }
        int cap = Math.max(1, stationProperties.getCacheMaxEntries());
        Iterator<PoolKey> oldest = entries.keySet().iterator();
        while (entries.size() > cap && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    private static final class PoolKey {
        private final Long userId;
        private final Long stationId;
        private final String filterSignature;
        private final String seed;

        private PoolKey(Long userId, Long stationId, String filterSignature, String seed) {
            this.userId = userId;
            this.stationId = stationId;
            this.filterSignature = filterSignature;
            this.seed = seed;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof PoolKey)) {
                return false;
            }
            PoolKey other = (PoolKey) o;
            return Objects.equals(userId, other.userId)
                    && Objects.equals(stationId, other.stationId)
                    && Objects.equals(filterSignature, other.filterSignature)
                    && Objects.equals(seed, other.seed);
        }

        @Override
        public int hashCode() {
            return Objects.hash(userId, stationId, filterSignature, seed);
        }
    }

    private static final class PoolEntry {
        private final List<TrackEntity> tracks;
        private final long expiresAtMillis;

        private PoolEntry(List<TrackEntity> tracks, long expiresAtMillis) {
            this.tracks = tracks;
            this.expiresAtMillis = expiresAtMillis;
        }

        private boolean isExpired(long nowMillis) {
            return nowMillis >= expiresAtMillis;
        }
    }
}
