package io.mcpcompat.server.core;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal query string parser (framework-neutral).
 */
final class QueryString {

    private QueryString() {}

    static Map<String, String> parse(URI uri) {
        String q = uri.getRawQuery();
        if (q == null || q.isEmpty()) return Map.of();
        Map<String, String> out = new HashMap<>();
        for (String part : q.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.putIfAbsent(decode(part), "");
            } else {
                out.putIfAbsent(decode(part.substring(0, eq)), decode(part.substring(eq + 1)));
            }
        }
        return out;
    }

    /**
     * First non-blank value of {@code key}.
     */
    static Optional<String> nonBlank(URI uri, String key) {
        String v = parse(uri).get(key);
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v);
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
