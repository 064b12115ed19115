package com.stealerlens.credentials;

import java.util.regex.Pattern;

/**
 * Reversible escaping of backslash, quotes, line breaks, tabs and NUL in credential values.
 *
 * {@code unescape(escape(s))} returns {@code s} for every string, and
 * {@code escape(unescape(e))} returns {@code e} for every output {@code e} of {@link #escape}.
 */
public final class PasswordEscaper {

    private static final Pattern SPECIAL_CHARACTERS = Pattern.compile("[!@#$%^&*()_+\\-=\\[\\]{};':\"\\\\|,.<>/?`~]");

    private PasswordEscaper() {
    }

    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        // backslash first so the escapes added below are not escaped again
        return value
            .replace("\\", "\\\\")
            .replace("'", "\\'")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t")
            .replace("\0", "\\0");
    }

    /**
     * Inverse of {@link #escape}. Decoded left to right so that an escaped backslash
     * followed by a letter ("\\\\n") stays a backslash and a letter.
     * Unknown escape pairs and a trailing lone backslash are kept as written.
     */
    public static String unescape(String value) {
        if (value == null || value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 == value.length()) {
                out.append(c);
                continue;
            }
            char next = value.charAt(i + 1);
            switch (next) {
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case '0' -> out.append('\0');
                default -> out.append(c).append(next);
            }
            i++;
        }
        return out.toString();
    }

    /**
     * True if the value contains punctuation that commonly trips naive quoting. Used for logging only.
     */
    public static boolean hasSpecialCharacters(String value) {
        return value != null && SPECIAL_CHARACTERS.matcher(value).find();
    }
}
