package io.chatrelay.core.session;

import io.chatrelay.core.model.Turn;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class InMemoryTranscriptStore implements TranscriptStore {
    public static final int DEFAULT_MAX_TURNS = 30;

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTranscriptStore.class);

    private final int maxTurns;
    private final Map<String, Transcript> transcripts = new ConcurrentHashMap<>();

    public InMemoryTranscriptStore() {
        this(DEFAULT_MAX_TURNS);
    }

    public InMemoryTranscriptStore(int maxTurns) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be positive");
        }
        this.maxTurns = maxTurns;
    }

    @Override
    public String createSession() {
        String key = UUID.randomUUID().toString();
        transcripts.put(key, new Transcript(maxTurns));
        LOG.debug("Created session {}", key);
        return key;
    }

    @Override
    public Transcript getOrCreate(String sessionKey) {
        Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        return transcripts.computeIfAbsent(sessionKey, key -> {
            LOG.debug("Provisioned transcript for unknown session {}", key);
            return new Transcript(maxTurns);
        });
    }

    @Override
    public void append(String sessionKey, Turn turn) {
        getOrCreate(sessionKey).append(turn);
    }

    @Override
    public List<Turn> snapshot(String sessionKey) {
        if (sessionKey == null) {
            return List.of();
        }
        Transcript transcript = transcripts.get(sessionKey);
        return transcript == null ? List.of() : transcript.snapshot();
    }

    @Override
    public int sessionCount() {
        return transcripts.size();
    }
}
