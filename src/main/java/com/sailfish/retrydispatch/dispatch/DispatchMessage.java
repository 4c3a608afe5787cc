package com.sailfish.retrydispatch.dispatch;

import java.io.Serializable;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Transport envelope carrying a comma-delimited list of execution record ids.
 * Size limits are enforced by {@link DispatchMessageChunker} on the way in and by the {@link DispatchQueue}.
 */
public final class DispatchMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DELIMITER = ",";

    private final String payload;

    public DispatchMessage(String payload) {
        this.payload = Objects.requireNonNull(payload, "payload cannot be null");
    }

    public static DispatchMessage ofIds(Collection<Long> ids) {
        return new DispatchMessage(ids.stream().map(String::valueOf).collect(Collectors.joining(DELIMITER)));
    }

    /**
     * Parses one token of the payload.
     *
     * @param token A trimmed token.
     * @return The id, always positive.
     * @throws MalformedIdException if the token is not a positive integer id.
     */
    public static Long parseId(String token) {
        long id;
        try {
            id = Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new MalformedIdException(token, e);
        }
        if (id <= 0) {
            throw new MalformedIdException(token, null);
        }
        return id;
    }

    public String getPayload() {
        return payload;
    }

    /**
     * @return The encoded length of the payload, the quantity bounded by the transport limit.
     */
    public int length() {
        return payload.length();
    }

    /**
     * @return The distinct, trimmed, non-empty tokens of the payload in order of first appearance.
     */
    public Set<String> idTokens() {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : payload.split(DELIMITER)) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                tokens.add(trimmed);
            }
        }
        return tokens;
    }

    public int idCount() {
        return idTokens().size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return payload.equals(((DispatchMessage) o).payload);
    }

    @Override
    public int hashCode() {
        return payload.hashCode();
    }

    @Override
    public String toString() {
        String preview = payload.length() > 64 ? payload.substring(0, 61) + "..." : payload;
        return "DispatchMessage{length=" + payload.length() + ", ids='" + preview + "'}";
    }
}
