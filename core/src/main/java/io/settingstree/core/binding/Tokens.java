package io.settingstree.core.binding;

import java.util.Locale;
import java.util.regex.Pattern;

/** Conversions from free-form strings to identifier-safe tokens. */
public final class Tokens {

    private static final Pattern NOT_WORD = Pattern.compile("\\W");
    private static final Pattern IDENT_SEPARATORS = Pattern.compile("[-,.@/+]");

    private Tokens() {
        // utility class
    }

    /** Replaces every character that is not a letter, digit or underscore with {@code _}. */
    public static String asToken(String value) {
        return NOT_WORD.matcher(value).replaceAll("_");
    }

    /** Lower-cased identifier form of a schema id or node name, e.g. {@code vnd,foo-bar} to {@code vnd_foo_bar}. */
    public static String toIdentifier(String value) {
        return IDENT_SEPARATORS.matcher(value).replaceAll("_").toLowerCase(Locale.ROOT);
    }
}
