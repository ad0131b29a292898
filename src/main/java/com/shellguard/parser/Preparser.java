package com.shellguard.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text rewrites applied before parsing. Arithmetic expansions become {@code 0}, {@code [[ ]]} tests become
 * {@code true} and a leading {@code time} keyword is dropped. A rewrite is skipped whenever the matched text could
 * hide a command, leaving the construct to the parser.
 */
public final class Preparser {

    private static final Pattern ARITHMETIC = Pattern.compile("\\$\\(\\((.*?)\\)\\)");
    private static final Pattern EXTENDED_TEST = Pattern.compile("\\[\\[(.*?)]]");
    private static final Pattern TIME_FLAG = Pattern.compile("^(-p|--)(\\s+|$)");
    private static final String[] HIDING = {"$(", "`", "<(", ">(", "'", "\"", "\\", ";", "&", "|"};

    private Preparser() {
    }

    public static String normalize(String command) {
        var cleaned = stripTime(command);
        cleaned = rewrite(ARITHMETIC, cleaned, "0", true);
        return rewrite(EXTENDED_TEST, cleaned, "true", false);
    }

    /** Drops a leading {@code time} keyword with its {@code -p} and {@code --} flags. {@code timeout} is untouched. */
    static String stripTime(String command) {
        var stripped = command.stripLeading();
        if (!stripped.startsWith("time")) {
            return command;
        }
        var rest = stripped.substring(4);
        if (!rest.isEmpty() && " \t\n;|&".indexOf(rest.charAt(0)) < 0) {
            return command;
        }
        rest = rest.stripLeading();
        var m = TIME_FLAG.matcher(rest);
        while (m.find()) {
            var flag = m.group(1);
            rest = rest.substring(m.end());
            if (flag.equals("--")) {
                break;
            }
            m = TIME_FLAG.matcher(rest);
        }
        return rest;
    }

    private static String rewrite(Pattern pattern, String input, String replacement, boolean balancedParens) {
        var m = pattern.matcher(input);
        var out = new StringBuilder();
        while (m.find()) {
            var body = m.group(1);
            var safe = !mayHideCommand(body) && (!balancedParens || isBalanced(body));
            m.appendReplacement(out, Matcher.quoteReplacement(safe ? replacement : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static boolean mayHideCommand(String body) {
        for (var marker : HIDING) {
            if (body.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBalanced(String body) {
        int level = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') {
                level++;
            } else if (c == ')' && --level < 0) {
                return false;
            }
        }
        return level == 0;
    }
}
