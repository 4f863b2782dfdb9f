package io.chatrelay.core.visit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unbounded visitor to page-list accumulator. Each visitor's list is guarded by its own monitor.
 */
public final class InMemoryVisitTracker implements VisitTracker {
    private final Map<String, List<String>> visits = new ConcurrentHashMap<>();

    @Override
    public void initialize(String visitorKey) {
        bucket(visitorKey);
    }

    @Override
    public List<String> recordVisit(String visitorKey, String page) {
        List<String> pages = bucket(visitorKey);
        synchronized (pages) {
            pages.add(page == null ? "" : page);
            return List.copyOf(pages);
        }
    }

    @Override
    public List<String> pages(String visitorKey) {
        if (visitorKey == null) {
            return List.of();
        }
        List<String> pages = visits.get(visitorKey);
        if (pages == null) {
            return List.of();
        }
        synchronized (pages) {
            return List.copyOf(pages);
        }
    }

    private List<String> bucket(String visitorKey) {
        Objects.requireNonNull(visitorKey, "visitorKey must not be null");
        return visits.computeIfAbsent(visitorKey, ignored -> new ArrayList<>());
    }
}
