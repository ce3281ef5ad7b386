package io.mcpcompat.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive header lookup and media-type matching.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Non-blank first value of a header, trimmed.
     */
    public static Optional<String> nonBlank(Map<String, ? extends Iterable<String>> headers, String name) {
        return firstValue(headers, name).map(String::trim).filter(v -> !v.isEmpty());
    }

    /**
     * Whether an {@code Accept}-style header lists the given media type (parameters ignored).
     */
    public static boolean accepts(Optional<String> accept, String mediaType) {
        if (accept.isEmpty()) return false;
        String target = normalizeMediaType(mediaType);
        for (String part : accept.get().split(",")) {
            String candidate = normalizeMediaType(part);
            if (candidate.equals(target) || candidate.equals("*/*")) return true;
        }
        return false;
    }

    public static String normalizeMediaType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
