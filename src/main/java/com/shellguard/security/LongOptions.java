package com.shellguard.security;

import java.util.Collection;
import java.util.Optional;

/**
 * Long-option matching as GNU {@code getopt_long} does it: an exact name wins, otherwise a unique prefix.
 * An ambiguous or unknown name resolves to empty, and callers treat that as unsafe.
 */
public final class LongOptions {

    private LongOptions() {
    }

    /** Name part of {@code --name[=value]}. */
    public static String name(String arg) {
        int eq = arg.indexOf('=');
        return eq < 0 ? arg.substring(2) : arg.substring(2, eq);
    }

    public static boolean hasAttachedValue(String arg) {
        return arg.indexOf('=') >= 0;
    }

    public static Optional<String> resolve(String arg, Collection<String> known) {
        var name = name(arg);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        if (known.contains(name)) {
            return Optional.of(name);
        }
        String match = null;
        for (var option : known) {
            if (option.startsWith(name)) {
                if (match != null) {
                    return Optional.empty();
                }
                match = option;
            }
        }
        return Optional.ofNullable(match);
    }

    /**
     * Walks a short-option cluster such as {@code -rn5}. Returns how many words the cluster consumes (1, or 2 when
     * its last option takes the next word as value), or -1 when it contains an option outside {@code flags} and
     * {@code valued}.
     */
    public static int shortCluster(String arg, String flags, String valued) {
        for (int c = 1; c < arg.length(); c++) {
            char ch = arg.charAt(c);
            if (valued.indexOf(ch) >= 0) {
                return c + 1 < arg.length() ? 1 : 2;
            }
            if (flags.indexOf(ch) < 0) {
                return -1;
            }
        }
        return 1;
    }
}
