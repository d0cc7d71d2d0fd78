package com.elssolution.hydromonitor.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keyed alert episodes for the acquisition path.
 * Keys: REMOTE_DOWN, REMOTE_AUTH, REMOTE_DECODE, STORAGE_DOWN, POLLER_UNCAUGHT, UNCAUGHT.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    /** One episode of a key; replaced as a whole on every change. */
    @Value
    @Builder(toBuilder = true)
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms
        long lastSeen;    // epoch ms
        int count;        // raises in this episode
        boolean active;
    }

    @Value
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;
        String type;      // RAISE | RESOLVE
    }

    @Value
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent; // newest first
    }

    static final int RECENT_CAPACITY = 50;

    private final ConcurrentMap<String, AlertView> episodes = new ConcurrentHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>(); // newest first, guarded by itself

    /** Opens an episode for the key, or counts one more raise in the open one. */
    public void raise(String key, String message, Severity sev) {
        long now = System.currentTimeMillis();
        AlertView ep = episodes.compute(key, (k, cur) -> (cur == null || !cur.isActive())
                ? AlertView.builder()
                    .key(k).message(message).severity(sev)
                    .firstSeen(now).lastSeen(now).count(1).active(true)
                    .build()
                : cur.toBuilder()
                    .message(message).severity(sev)
                    .lastSeen(now).count(cur.getCount() + 1)
                    .build());

        if (ep.getCount() == 1) {
            log.warn("ALERT RAISE key={} sev={} msg={}", key, sev, message);
        } else if (log.isDebugEnabled()) {
            log.debug("ALERT REPEAT key={} count={} msg={}", key, ep.getCount(), message);
        }
        record(new EventView(key, message, sev, now, "RAISE"));
    }

    /** Closes the open episode of the key; no-op when there is none. */
    public void resolve(String key) {
        long now = System.currentTimeMillis();
        AtomicReference<AlertView> closed = new AtomicReference<>();
        episodes.computeIfPresent(key, (k, cur) -> {
            if (!cur.isActive()) return cur;
            closed.set(cur);
            return cur.toBuilder().active(false).lastSeen(now).build();
        });

        AlertView was = closed.get();
        if (was != null) {
            log.info("ALERT RESOLVE key={} after {} raise(s)", key, was.getCount());
            record(new EventView(key, "recovered", was.getSeverity(), now, "RESOLVE"));
        }
    }

    public boolean isActive(String key) {
        AlertView ep = episodes.get(key);
        return ep != null && ep.isActive();
    }

    public AlertsSnapshot snapshot() {
        List<AlertView> active = episodes.values().stream()
                .filter(AlertView::isActive)
                .sorted(Comparator.comparingLong(AlertView::getLastSeen).reversed())
                .toList();
        synchronized (recent) {
            return new AlertsSnapshot(active, new ArrayList<>(recent));
        }
    }

    private void record(EventView ev) {
        synchronized (recent) {
            recent.addFirst(ev);
            while (recent.size() > RECENT_CAPACITY) recent.removeLast();
        }
    }
}
