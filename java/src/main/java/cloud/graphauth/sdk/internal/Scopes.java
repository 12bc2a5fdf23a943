package cloud.graphauth.sdk.internal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parsing and formatting of OAuth scope lists.
 */
public final class Scopes {

    private Scopes() {
    }

    /**
     * Splits a space- or comma-delimited scope string, dropping blanks and duplicates while keeping order.
     */
    public static List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        for (String part : raw.trim().split("[\\s,]+")) {
            parts.add(part);
        }
        return normalize(parts);
    }

    public static List<String> normalize(Collection<String> scopes) {
        if (scopes == null) {
            return List.of();
        }
        Set<String> ordered = new LinkedHashSet<>();
        scopes.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .forEach(ordered::add);
        return List.copyOf(ordered);
    }

    /**
     * Formats scopes for the {@code scope} form parameter.
     */
    public static String join(List<String> scopes) {
        return String.join(" ", scopes);
    }
}
