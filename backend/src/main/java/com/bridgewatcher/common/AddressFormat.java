package com.bridgewatcher.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shape checks and conversions for EVM account identifiers (0x + 40 hex) and 32-byte log topics.
 */
public final class AddressFormat {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern WORD = Pattern.compile("^0x[0-9a-fA-F]{64}$");
    private static final String ZERO_PADDING = "0".repeat(24);

    private AddressFormat() {
    }

    public static boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.trim()).matches();
    }

    public static boolean isWord(String value) {
        return value != null && WORD.matcher(value).matches();
    }

    /**
     * Lower-cases the hex digits; the 0x prefix is kept. Addresses are compared and emitted in this form.
     */
    public static String normalize(String address) {
        if (!isValidAddress(address)) {
            throw new IllegalArgumentException("Malformed address: " + address);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Extracts the address held in a left-padded 32-byte word (indexed address topic or ABI-encoded address).
     *
     * @throws IllegalArgumentException if the value is not a 32-byte word or the upper 12 bytes are not zero
     */
    public static String fromWord(String word) {
        if (!isWord(word)) {
            throw new IllegalArgumentException("Not a 32-byte word: " + word);
        }
        String hex = word.substring(2);
        if (!hex.startsWith(ZERO_PADDING)) {
            throw new IllegalArgumentException("Word does not hold an address: " + word);
        }
        return "0x" + hex.substring(24).toLowerCase(Locale.ROOT);
    }

    public static String toWord(String address) {
        return "0x" + ZERO_PADDING + normalize(address).substring(2);
    }
}
