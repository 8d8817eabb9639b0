package io.agentmesh.bus;

/**
 * Subscription pattern compiled once at subscribe time.
 *
 * <ul>
 *   <li>{@code *} matches every type</li>
 *   <li>{@code clock:*} matches types starting with {@code clock:}</li>
 *   <li>{@code *:tick} matches types ending with {@code :tick}</li>
 *   <li>anything else must equal the type</li>
 * </ul>
 */
public record SubscriptionPattern(String raw, Kind kind, String token) {

    public enum Kind {
        ALL,
        PREFIX,
        SUFFIX,
        EXACT
    }

    public static SubscriptionPattern compile(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("subscription pattern cannot be empty");
        }
        if ("*".equals(raw)) {
            return new SubscriptionPattern(raw, Kind.ALL, "");
        }
        if (raw.endsWith(":*")) {
            return new SubscriptionPattern(raw, Kind.PREFIX, raw.substring(0, raw.length() - 1));
        }
        if (raw.startsWith("*:")) {
            return new SubscriptionPattern(raw, Kind.SUFFIX, raw.substring(1));
        }
        return new SubscriptionPattern(raw, Kind.EXACT, raw);
    }

    public boolean matches(String eventType) {
        if (eventType == null) {
            return false;
        }
        return switch (kind) {
            case ALL -> true;
            case PREFIX -> eventType.startsWith(token);
            case SUFFIX -> eventType.endsWith(token);
            case EXACT -> eventType.equals(token);
        };
    }
}
