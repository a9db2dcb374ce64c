package org.sn.realtime.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;


/**
 * One or more tokens naming the cached query results that a subscription keeps fresh.
 * A descriptor is either a single token or an ordered, non-empty list of tokens.
 * A list means "invalidate all of these".
 *
 * <p>A one element list is the same descriptor as the single token,
 * since both name the same query key in the cache.
 *
 * <p>The string form of a single token is the token itself.
 * The string form of a longer list is its JSON array, for example <code>["jobs-list","42"]</code>.
 */
public final class CacheKeyDescriptor {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> TOKEN_LIST = new TypeReference<>() { };

    private final @Nonnull List<String> tokens;

    private CacheKeyDescriptor(List<String> tokens) {
        this.tokens = tokens;
    }

    public static CacheKeyDescriptor of(String token) {
        Objects.requireNonNull(token, "token");
        return new CacheKeyDescriptor(List.of(token));
    }

    /**
     * Create a list descriptor.
     *
     * @throws IllegalArgumentException if tokens is empty
     * @throws NullPointerException if tokens or any token is null
     */
    public static CacheKeyDescriptor of(List<String> tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("descriptor must have at least one token");
        }
        return new CacheKeyDescriptor(List.copyOf(tokens));
    }

    public static CacheKeyDescriptor of(String first, String... rest) {
        String[] all = new String[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return of(List.of(all));
    }

    /**
     * Inverse of {@link #asString()}.
     * A value that is a JSON array of strings is a list, anything else is a single token.
     */
    public static CacheKeyDescriptor parse(String value) {
        if (value.startsWith("[")) {
            List<String> tokens;
            try {
                tokens = MAPPER.readValue(value, TOKEN_LIST);
            } catch (JsonProcessingException e) {
                return of(value);
            }
            if (tokens != null && !tokens.isEmpty() && !tokens.contains(null)) {
                return of(tokens);
            }
        }
        return of(value);
    }

    public @Nonnull List<String> tokens() {
        return tokens;
    }

    public boolean isList() {
        return tokens.size() > 1;
    }

    public @Nonnull String asString() {
        if (!isList()) {
            return tokens.get(0);
        }
        try {
            return MAPPER.writeValueAsString(tokens);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("unable to write tokens " + tokens, e);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CacheKeyDescriptor that)) {
            return false;
        }
        return tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return asString();
    }
}
