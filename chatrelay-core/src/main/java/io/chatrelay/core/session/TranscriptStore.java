package io.chatrelay.core.session;

import io.chatrelay.core.model.Turn;
import java.util.List;

public interface TranscriptStore {
    String createSession();

    Transcript getOrCreate(String sessionKey);

    void append(String sessionKey, Turn turn);

    List<Turn> snapshot(String sessionKey);

    int sessionCount();
}
