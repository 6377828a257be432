package org.Aayush.market.core;

import org.Aayush.market.model.MarketSide;

import java.util.Locale;

/**
 * Request defaults applied by {@link MatchingCore} when a request leaves a field unset.
 */
public final class MatchingDefaults {
    static final String PROP_DEFAULT_CAPACITY = "market.defaults.capacity";
    static final String PROP_FAVORED_SIDE = "market.defaults.favoredSide";

    private static final int FALLBACK_CAPACITY = 1;
    private static final MarketSide FALLBACK_SIDE = MarketSide.STUDENTS;

    private final int defaultCapacity;
    private final MarketSide favoredSide;

    private MatchingDefaults(int defaultCapacity, MarketSide favoredSide) {
        this.defaultCapacity = defaultCapacity < 0 ? FALLBACK_CAPACITY : defaultCapacity;
        this.favoredSide = favoredSide == null ? FALLBACK_SIDE : favoredSide;
    }

    /**
     * Creates defaults with explicit values.
     */
    public static MatchingDefaults of(int defaultCapacity, MarketSide favoredSide) {
        return new MatchingDefaults(defaultCapacity, favoredSide);
    }

    /**
     * Loads defaults from system properties, falling back on missing or malformed values.
     */
    public static MatchingDefaults defaults() {
        return MatchingDefaults.of(readCapacity(), readSide());
    }

    /**
     * Capacity used for declarations that omit one.
     */
    public int defaultCapacity() {
        return defaultCapacity;
    }

    /**
     * Side that proposes (DA) or plays the agent role (TTC) when a request names none.
     */
    public MarketSide favoredSide() {
        return favoredSide;
    }

    private static int readCapacity() {
        String raw = System.getProperty(PROP_DEFAULT_CAPACITY);
        if (raw == null || raw.isBlank()) {
            return FALLBACK_CAPACITY;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return FALLBACK_CAPACITY;
        }
    }

    private static MarketSide readSide() {
        String raw = System.getProperty(PROP_FAVORED_SIDE);
        if (raw == null || raw.isBlank()) {
            return FALLBACK_SIDE;
        }
        try {
            return MarketSide.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return FALLBACK_SIDE;
        }
    }
}
