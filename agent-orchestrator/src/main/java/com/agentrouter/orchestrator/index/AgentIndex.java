package com.agentrouter.orchestrator.index;

import com.agentrouter.common.exception.AgentIndexException;
import com.agentrouter.common.model.AgentProfile;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide, read-mostly holder of the agent profiles used for routing.
 *
 * <p>Single writer, many readers: the load on start and each TTL refresh swap in a whole new
 * {@link IndexSnapshot}; readers always see one complete generation.
 *
 * <p>Refresh loop, same shape as a recursive scheduling cycle:
 * <pre>
 *   delay(refreshTtl) → reload → swap snapshot (or keep previous on failure) → repeat
 * </pre>
 *
 * <p>Load failures:
 * <ul>
 *   <li>initial load fails, fallback configured → the fallback profile is installed alone</li>
 *   <li>initial load fails, no fallback → the index stays empty and routing fails hard</li>
 *   <li>a later refresh fails → the previous snapshot is kept</li>
 * </ul>
 */
public class AgentIndex {

    private static final Logger log = LoggerFactory.getLogger(AgentIndex.class);

    private final AgentProfileLoader loader;
    private final String location;
    private final Duration refreshTtl;
    private final AgentProfile fallbackProfile;
    private final Clock clock;

    private final AtomicReference<IndexSnapshot> snapshot = new AtomicReference<>(IndexSnapshot.EMPTY);
    private volatile Disposable refreshCycle;
    private volatile boolean stopped;

    public AgentIndex(AgentProfileLoader loader, String location, Duration refreshTtl,
                      AgentProfile fallbackProfile, Clock clock) {
        this.loader          = loader;
        this.location        = location;
        this.refreshTtl      = refreshTtl;
        this.fallbackProfile = fallbackProfile;
        this.clock           = clock;
    }

    @PostConstruct
    public void start() {
        load();
        scheduleNextRefresh();
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable cycle = refreshCycle;
        if (cycle != null) {
            cycle.dispose();
        }
    }

    /** Initial load; installs the fallback profile when the configured index is unusable. */
    public IndexSnapshot load() {
        try {
            return refresh();
        } catch (AgentIndexException e) {
            if (fallbackProfile == null) {
                log.error("Agent index unavailable and no fallback profile configured. location={}", location, e);
                return snapshot.get();
            }
            IndexSnapshot fallback = new IndexSnapshot(List.of(fallbackProfile), clock.instant(), true);
            snapshot.set(fallback);
            log.error("Agent index unavailable, routing to fallback profile. location={} fallbackAgent={}",
                      location, fallbackProfile.id(), e);
            return fallback;
        }
    }

    /**
     * Reloads the index from its location and swaps it in.
     *
     * @throws AgentIndexException when the reload fails; the current snapshot is kept
     */
    public IndexSnapshot refresh() {
        List<AgentProfile> profiles = loader.load(location);
        IndexSnapshot next = new IndexSnapshot(profiles, clock.instant(), false);
        snapshot.set(next);
        log.info("AGENT_INDEX_REFRESHED location={} agents={}", location, profiles.size());
        return next;
    }

    public IndexSnapshot snapshot() {
        return snapshot.get();
    }

    /** Current profiles; may be empty when nothing could be loaded. */
    public List<AgentProfile> profiles() {
        return snapshot.get().profiles();
    }

    // ── refresh loop ──────────────────────────────────────────────────────

    private void scheduleNextRefresh() {
        if (stopped) {
            return;
        }
        refreshCycle = Mono.delay(refreshTtl)
            .publishOn(Schedulers.boundedElastic())
            .map(tick -> refresh())
            .subscribe(
                next -> scheduleNextRefresh(),
                err -> {
                    log.warn("Agent index refresh failed, keeping previous snapshot. location={} agents={}",
                             location, profiles().size(), err);
                    scheduleNextRefresh();
                });
    }
}
