/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.util;

import java.util.Locale;
import java.util.regex.Pattern;

import villagecompute.quotes.exceptions.InvalidSymbolException;

/**
 * Ticker symbol canonicalization.
 *
 * <p>
 * Trims surrounding whitespace, uppercases, and accepts only 1-10 ASCII letters or digits. Normalizing an already
 * normalized symbol returns it unchanged.
 *
 * <pre>
 * SymbolNormalizer.normalize(" Aapl ") // "AAPL"
 * SymbolNormalizer.normalize("BRK.B") // throws InvalidSymbolException
 * </pre>
 */
public final class SymbolNormalizer {

    public static final int MAX_LENGTH = 10;

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9]{1," + MAX_LENGTH + "}$");

    private SymbolNormalizer() {
        // Utility class, no instantiation
    }

    /**
     * Returns the canonical form of a ticker symbol.
     *
     * @param raw
     *            symbol as supplied by the caller, may be null
     * @return trimmed uppercase symbol
     * @throws InvalidSymbolException
     *             if the symbol is empty, longer than {@value #MAX_LENGTH} characters, or not alphanumeric
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidSymbolException(raw, "Symbol must not be empty");
        }

        String symbol = raw.trim().toUpperCase(Locale.ROOT);

        if (symbol.length() > MAX_LENGTH) {
            throw new InvalidSymbolException(raw,
                    "Symbol '" + symbol + "' exceeds " + MAX_LENGTH + " characters");
        }
        if (!SYMBOL_PATTERN.matcher(symbol).matches()) {
            throw new InvalidSymbolException(raw, "Symbol '" + symbol + "' must be alphanumeric");
        }

        return symbol;
    }

    /**
     * @return true if {@link #normalize(String)} would accept the symbol
     */
    public static boolean isValid(String raw) {
        try {
            normalize(raw);
            return true;
        } catch (InvalidSymbolException e) {
            return false;
        }
    }
}
