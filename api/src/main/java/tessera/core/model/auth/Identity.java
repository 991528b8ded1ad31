package tessera.core.model.auth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An authenticated principal.
 *
 * <p>Claims are copied on construction and cannot be modified afterwards; an
 * identity embedded in an access token is never mutated.
 *
 * <p>Numeric claim values are widened to {@link Long} or {@link Double}, nested
 * lists and maps included, so an identity compares equal to the one read back
 * from a token or from storage.
 *
 * @param subjectId opaque subject identifier
 * @param claims    role, email and other scalar or list claims
 */
public record Identity(String subjectId, Map<String, Object> claims) {

    public Identity {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        claims = claims == null || claims.isEmpty() ? Map.of() : normalizeMap(claims);
    }

    public static Identity of(String subjectId) {
        return new Identity(subjectId, Map.of());
    }

    /**
     * Copy of this identity without the named claims.
     */
    public Identity without(Set<String> claimNames) {
        if (claimNames.stream().noneMatch(claims::containsKey)) {
            return this;
        }
        final var kept = new LinkedHashMap<>(claims);
        kept.keySet().removeAll(claimNames);
        return new Identity(subjectId, kept);
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> source) {
        final var copy = new LinkedHashMap<String, Object>();
        source.forEach((name, value) -> copy.put(String.valueOf(name), normalize(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            return normalizeMap(map);
        }
        if (value instanceof Collection<?> collection) {
            final List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(element -> copy.add(normalize(element)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
