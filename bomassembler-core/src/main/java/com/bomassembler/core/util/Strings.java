package com.bomassembler.core.util;

/**
 * Small string helpers shared by the engines.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /**
     * Composes a {@code "name (contact)"} display string. The parenthesized part is omitted when
     * the contact is blank.
     *
     * @param name display name
     * @param contact e-mail or other contact value
     * @return display string
     */
    public static String display(String name, String contact) {
        String safeName = name == null ? "" : name.trim();
        if (isBlank(contact)) {
            return safeName;
        }
        return safeName + " (" + contact.trim() + ")";
    }
}
