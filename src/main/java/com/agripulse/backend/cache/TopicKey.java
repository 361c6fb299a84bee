package com.agripulse.backend.cache;

import java.util.Locale;

/**
 * Identifies one cacheable unit: a domain (dashboard, terminal, ...) plus the
 * parameter that selects the topic inside it. Both parts are trimmed and
 * lower-cased so "Wheat" and "wheat " land on the same entry.
 */
public record TopicKey(String domain, String param) {

    private static final char SEPARATOR = ':';

    public TopicKey {
        domain = normalize(domain, "domain");
        param = normalize(param, "param");
        if (domain.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("domain must not contain '" + SEPARATOR + "': " + domain);
        }
    }

    public static TopicKey of(String domain, String param) {
        return new TopicKey(domain, param);
    }

    /**
     * Parses the {@code domain:param} form written by {@link #toString()}.
     */
    public static TopicKey parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("topic key is null");
        }
        int i = value.indexOf(SEPARATOR);
        if (i <= 0 || i == value.length() - 1) {
            throw new IllegalArgumentException("malformed topic key: " + value);
        }
        return new TopicKey(value.substring(0, i), value.substring(i + 1));
    }

    private static String normalize(String part, String name) {
        if (part == null || part.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return part.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return domain + SEPARATOR + param;
    }
}
