package com.bomassembler.cli;

/**
 * Splits {@code key<separator>value} command-line arguments.
 */
final class Pairs {

    private Pairs() {
        // Utility class
    }

    /**
     * Splits at the first separator. Both parts are trimmed; the second is null when the
     * separator is absent or nothing follows it.
     *
     * @param value raw argument
     * @param separator separator character
     * @return {@code [first, second]}
     */
    static String[] split(String value, char separator) {
        int index = value.indexOf(separator);
        if (index < 0) {
            return new String[] {value.trim(), null};
        }
        String second = value.substring(index + 1).trim();
        return new String[] {value.substring(0, index).trim(), second.isEmpty() ? null : second};
    }
}
