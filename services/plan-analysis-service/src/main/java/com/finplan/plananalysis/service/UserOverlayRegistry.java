package com.finplan.plananalysis.service;

import com.finplan.plananalysis.config.PlanAnalysisProperties;
import com.finplan.plananalysis.ml.UserTagOverlay;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory per-user overlays, bounded in size and evicted after a period of inactivity.
 * An evicted overlay is simply re-hydrated from the correction store on next use.
 *
 * <p>Writers that read the store and publish an overlay run under the user's lock
 * (see {@link #withUserLock}), so a load taken before a save can never replace the
 * overlay that save has already taught.
 */
@Slf4j
@Component
public class UserOverlayRegistry {

    private final Cache<UUID, UserTagOverlay> overlays;
    private final Cache<UUID, ReentrantLock> locks;

    public UserOverlayRegistry(PlanAnalysisProperties properties) {
        PlanAnalysisProperties.OverlayCache config = properties.getOverlayCache();
        this.overlays = Caffeine.newBuilder()
            .maximumSize(config.getMaxUsers())
            .expireAfterAccess(config.getExpireAfterAccess())
            .build();
        this.locks = Caffeine.newBuilder()
            .weakValues()
            .build();
        log.info("User overlay registry: max {} users, expire after {}",
            config.getMaxUsers(), config.getExpireAfterAccess());
    }

    public Optional<UserTagOverlay> find(UUID userId) {
        return Optional.ofNullable(overlays.getIfPresent(userId));
    }

    /**
     * Runs {@code action} while holding the user's lock. Locks are per user, so
     * different users never wait on each other.
     */
    public <T> T withUserLock(UUID userId, Supplier<T> action) {
        ReentrantLock lock = locks.get(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void put(UserTagOverlay overlay) {
        overlays.put(overlay.getUserId(), overlay);
    }

    public void evict(UUID userId) {
        overlays.invalidate(userId);
    }

    public long size() {
        overlays.cleanUp();
        return overlays.estimatedSize();
    }
}
