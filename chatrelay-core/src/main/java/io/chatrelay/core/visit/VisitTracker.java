package io.chatrelay.core.visit;

import java.util.List;

public interface VisitTracker {
    void initialize(String visitorKey);

    List<String> recordVisit(String visitorKey, String page);

    List<String> pages(String visitorKey);
}
