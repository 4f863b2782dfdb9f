package io.chatrelay.core.assembly;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class ImageReferences {

    private ImageReferences() {
    }

    public static boolean isValid(String reference) {
        if (reference == null || reference.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(reference);
            String scheme = uri.getScheme();
            if (scheme == null || !uri.isAbsolute()) {
                return false;
            }
            String normalized = scheme.toLowerCase(Locale.ROOT);
            if (!"http".equals(normalized) && !"https".equals(normalized)) {
                return false;
            }
            return uri.getHost() != null && !uri.getHost().isBlank();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Returns the first reference that is not an absolute http(s) URL, if any.
     */
    public static Optional<String> firstInvalid(List<String> references) {
        if (references == null) {
            return Optional.empty();
        }
        for (String reference : references) {
            if (!isValid(reference)) {
                return Optional.of(reference == null ? "null" : reference);
            }
        }
        return Optional.empty();
    }
}
