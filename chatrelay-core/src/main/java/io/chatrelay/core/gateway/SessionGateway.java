package io.chatrelay.core.gateway;

import io.chatrelay.core.assembly.AssemblyResult;
import io.chatrelay.core.assembly.MessageAssembler;
import io.chatrelay.core.model.HistoryEntry;
import io.chatrelay.core.model.Turn;
import io.chatrelay.core.provider.InferenceException;
import io.chatrelay.core.provider.InferenceProvider;
import io.chatrelay.core.provider.InferenceRequest;
import io.chatrelay.core.session.Transcript;
import io.chatrelay.core.session.TranscriptStore;
import io.chatrelay.core.visit.VisitTracker;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays one chat turn per call: record the user turn, assemble the outbound request,
 * call the provider, record the reply. A failed call keeps the recorded user turn.
 */
public final class SessionGateway {
    private static final Logger LOG = LoggerFactory.getLogger(SessionGateway.class);

    private final TranscriptStore transcripts;
    private final VisitTracker visits;
    private final MessageAssembler assembler;
    private final InferenceProvider provider;
    private final RelaySettings settings;

    public SessionGateway(
        TranscriptStore transcripts,
        VisitTracker visits,
        InferenceProvider provider,
        RelaySettings settings
    ) {
        this(transcripts, visits, new MessageAssembler(), provider, settings);
    }

    public SessionGateway(
        TranscriptStore transcripts,
        VisitTracker visits,
        MessageAssembler assembler,
        InferenceProvider provider,
        RelaySettings settings
    ) {
        this.transcripts = Objects.requireNonNull(transcripts, "transcripts must not be null");
        this.visits = Objects.requireNonNull(visits, "visits must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.settings = settings == null ? RelaySettings.defaults() : settings;
    }

    public String newSession() {
        String key = transcripts.createSession();
        visits.initialize(key);
        LOG.info("New session {}", key);
        return key;
    }

    public String chat(String sessionKey, String text, List<String> imageRefs) {
        Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        String userText = text == null ? "" : text;

        Transcript transcript = transcripts.getOrCreate(sessionKey);
        transcript.append(Turn.user(userText));

        AssemblyResult assembled = assembler.build(transcript.snapshot(), userText, imageRefs);
        if (assembled instanceof AssemblyResult.Rejected rejected) {
            LOG.info("Rejected image reference for session {}: {}", sessionKey, rejected.invalidReference());
            throw new InvalidImageReferenceException(rejected.invalidReference(), rejected.reason());
        }
        AssemblyResult.Assembled request = (AssemblyResult.Assembled) assembled;

        String reply;
        try {
            reply = provider.complete(new InferenceRequest(
                settings.model(),
                request.messages(),
                settings.temperature(),
                settings.maxTokens(),
                settings.timeout()
            ));
        } catch (InferenceException e) {
            LOG.warn("Provider {} failed for session {}: {}", provider.name(), sessionKey, e.getMessage());
            throw new InferenceFailureException(e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Provider {} raised unexpectedly for session {}", provider.name(), sessionKey, e);
            throw new InferenceFailureException(String.valueOf(e.getMessage()), e);
        }

        String stored = reply == null ? "" : reply;
        transcript.append(Turn.assistant(stored));
        return stored;
    }

    public List<HistoryEntry> history(String sessionKey) {
        List<Turn> snapshot = transcripts.snapshot(sessionKey);
        List<HistoryEntry> entries = new ArrayList<>(snapshot.size());
        for (Turn turn : snapshot) {
            entries.add(HistoryEntry.of(turn));
        }
        return entries;
    }

    public List<String> trackVisit(String visitorKey, String page) {
        return visits.recordVisit(visitorKey, page);
    }

    public String modelIdentifier() {
        return settings.model();
    }

    public int sessionCount() {
        return transcripts.sessionCount();
    }
}
