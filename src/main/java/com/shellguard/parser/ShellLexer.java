package com.shellguard.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits shell source into words, operators and redirects. Quote removal happens here; command and
 * process substitutions are parsed recursively and attached to the word that contains them.
 */
final class ShellLexer {

    enum Type { WORD, OPERATOR, REDIRECT, ARITHMETIC, NEWLINE, EOF }

    static final class Token {
        final Type type;
        final String text;
        final String raw;
        final boolean quoted;
        final List<Node> parts;
        final int start;
        String heredocBody;
        boolean heredocQuoted;

        Token(Type type, String text, String raw, boolean quoted, List<Node> parts, int start) {
            this.type = type;
            this.text = text;
            this.raw = raw;
            this.quoted = quoted;
            this.parts = parts;
            this.start = start;
        }

        boolean isOperator(String op) {
            return type == Type.OPERATOR && text.equals(op);
        }

        boolean isWord(String word) {
            return type == Type.WORD && !quoted && text.equals(word);
        }

        @Override
        public String toString() {
            return type == Type.WORD ? raw : type == Type.EOF ? "end of input" : text;
        }
    }

    private record PendingHeredoc(Token redirect, String delimiter, boolean quoted, boolean stripTabs) {}

    private static final String[] REDIRECT_OPERATORS = {
            "&>>", "<<<", "<<-", "&>", "<<", "<&", "<>", ">>", ">&", ">|", "<", ">"
    };
    private static final String[] CONTROL_OPERATORS = {
            "&&", "||", ";;", "|&", "&", "|", ";", "(", ")"
    };
    /** Matched against a word's unquoted characters, with every quoted or expanded segment collapsed to '_'. */
    private static final Pattern BRACE_EXPANSION = Pattern.compile("\\{[^{}]*(,|\\.\\.)[^{}]*}");

    private final String input;
    private final int depth;
    private final List<Token> tokens = new ArrayList<>();
    private final List<PendingHeredoc> pendingHeredocs = new ArrayList<>();
    private Token awaitingDelimiter;
    private int pos;

    // per-word state
    private StringBuilder text;
    private StringBuilder shape;
    private boolean quoted;
    private List<Node> parts;

    ShellLexer(String input, int depth) {
        this.input = input;
        this.depth = depth;
    }

    List<Token> tokenize() throws ShellParseException {
        if (input.indexOf('\0') >= 0) {
            throw new ShellParseException("NUL character in input");
        }
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == ' ' || c == '\t') {
                pos++;
            } else if (c == '\\' && peekChar(1) == '\n') {
                pos += 2;
            } else if (c == '\n') {
                tokens.add(new Token(Type.NEWLINE, "\n", "\n", false, List.of(), pos));
                pos++;
                readPendingHeredocs();
            } else if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == '(' && peekChar(1) == '(') {
                int start = pos;
                int end = findClosingParen(pos);
                tokens.add(new Token(Type.ARITHMETIC, input.substring(start, end + 1),
                        input.substring(start, end + 1), false, List.of(), start));
                pos = end + 1;
            } else if ((c == '<' || c == '>') && peekChar(1) == '(') {
                scanWordToken();
            } else if (Character.isDigit(c) && ioNumberEnd() > 0) {
                pos = ioNumberEnd();
                scanRedirect();
            } else if (startsRedirect()) {
                scanRedirect();
            } else if (startsControlOperator() != null) {
                var op = startsControlOperator();
                tokens.add(new Token(Type.OPERATOR, op, op, false, List.of(), pos));
                pos += op.length();
            } else {
                scanWordToken();
            }
        }
        if (awaitingDelimiter != null) {
            throw new ShellParseException("missing here-document delimiter");
        }
        // a here-document on the last line with no body reads as empty
        for (var pending : pendingHeredocs) {
            pending.redirect().heredocBody = "";
            pending.redirect().heredocQuoted = pending.quoted();
        }
        tokens.add(new Token(Type.EOF, "", "", false, List.of(), pos));
        return tokens;
    }

    /** Collects the substitutions embedded in expansion text such as {@code ${...}} or {@code $((...))}. */
    List<Node> embeddedSubstitutions() throws ShellParseException {
        beginWord();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == '$') {
                scanDollar(true);
            } else if (c == '`') {
                scanBacktick();
            } else if (c == '\'') {
                int end = input.indexOf('\'', pos + 1);
                if (end < 0) {
                    throw new ShellParseException("unterminated single quote");
                }
                pos = end + 1;
            } else if ((c == '<' || c == '>') && peekChar(1) == '(') {
                scanProcessSubstitution();
            } else {
                pos++;
            }
        }
        return parts;
    }

    private char peekChar(int offset) {
        int i = pos + offset;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private int ioNumberEnd() {
        int i = pos;
        while (i < input.length() && Character.isDigit(input.charAt(i))) {
            i++;
        }
        if (i >= input.length()) {
            return -1;
        }
        char c = input.charAt(i);
        if ((c == '<' || c == '>') && !(i + 1 < input.length() && input.charAt(i + 1) == '(')) {
            return i;
        }
        return -1;
    }

    private boolean startsRedirect() {
        for (var op : REDIRECT_OPERATORS) {
            if (input.startsWith(op, pos)) {
                return true;
            }
        }
        return false;
    }

    private String startsControlOperator() {
        for (var op : CONTROL_OPERATORS) {
            if (input.startsWith(op, pos)) {
                return op;
            }
        }
        return null;
    }

    private void scanRedirect() {
        for (var op : REDIRECT_OPERATORS) {
            if (input.startsWith(op, pos)) {
                var token = new Token(Type.REDIRECT, op, op, false, List.of(), pos);
                tokens.add(token);
                pos += op.length();
                if (op.equals("<<") || op.equals("<<-")) {
                    awaitingDelimiter = token;
                }
                return;
            }
        }
    }

    private void scanWordToken() throws ShellParseException {
        int start = pos;
        scanWord();
        var token = new Token(Type.WORD, text.toString(), input.substring(start, pos), quoted, List.copyOf(parts), start);
        tokens.add(token);
        if (awaitingDelimiter != null) {
            pendingHeredocs.add(new PendingHeredoc(awaitingDelimiter, token.text, token.quoted,
                    awaitingDelimiter.text.equals("<<-")));
            awaitingDelimiter = null;
        }
    }

    private void beginWord() {
        text = new StringBuilder();
        shape = new StringBuilder();
        quoted = false;
        parts = new ArrayList<>();
    }

    private void scanWord() throws ShellParseException {
        beginWord();
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if ((c == '<' || c == '>') && peekChar(1) == '(' && pos == start) {
                scanProcessSubstitution();
                shape.append('_');
                continue;
            }
            if (isMeta(c)) {
                break;
            }
            switch (c) {
                case '\\' -> {
                    char next = peekChar(1);
                    if (next == '\n') {
                        pos += 2;
                    } else if (pos + 1 < input.length()) {
                        text.append(next);
                        shape.append('_');
                        quoted = true;
                        pos += 2;
                    } else {
                        text.append('\\');
                        shape.append('_');
                        pos++;
                    }
                }
                case '\'' -> {
                    int end = input.indexOf('\'', pos + 1);
                    if (end < 0) {
                        throw new ShellParseException("unterminated single quote");
                    }
                    text.append(input, pos + 1, end);
                    shape.append('_');
                    quoted = true;
                    pos = end + 1;
                }
                case '"' -> {
                    scanDoubleQuoted();
                    shape.append('_');
                }
                case '$' -> {
                    scanDollar(false);
                    shape.append('_');
                }
                case '`' -> {
                    scanBacktick();
                    shape.append('_');
                }
                case '~' -> {
                    if (pos == start) {
                        parts.add(new Node(NodeKind.TILDE, "~", List.of()));
                    }
                    text.append(c);
                    shape.append(c);
                    pos++;
                }
                default -> {
                    if (c == '*' || c == '?' || c == '[' && closesBracket(pos)) {
                        parts.add(Node.glob(String.valueOf(c)));
                    }
                    text.append(c);
                    shape.append(c);
                    pos++;
                }
            }
        }
        if (BRACE_EXPANSION.matcher(shape).find()) {
            throw new ShellParseException("brace expansion in " + input.substring(start, pos));
        }
    }

    /** True when the '[' at {@code open} has a ']' later in the same word, making it a bracket glob. */
    private boolean closesBracket(int open) {
        for (int i = open + 1; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == ']') {
                return true;
            }
            if (isMeta(c)) {
                return false;
            }
        }
        return false;
    }

    private static boolean isMeta(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == ';' || c == '&' || c == '|'
                || c == '(' || c == ')' || c == '<' || c == '>';
    }

    private void scanDoubleQuoted() throws ShellParseException {
        quoted = true;
        pos++;
        while (true) {
            if (pos >= input.length()) {
                throw new ShellParseException("unterminated double quote");
            }
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return;
            }
            if (c == '\\' && pos + 1 < input.length()) {
                char next = input.charAt(pos + 1);
                if (next == '\n') {
                    pos += 2;
                } else if ("$`\"\\".indexOf(next) >= 0) {
                    text.append(next);
                    pos += 2;
                } else {
                    text.append(c);
                    pos++;
                }
            } else if (c == '$') {
                scanDollar(true);
            } else if (c == '`') {
                scanBacktick();
            } else {
                text.append(c);
                pos++;
            }
        }
    }

    private void scanDollar(boolean inDoubleQuotes) throws ShellParseException {
        char next = peekChar(1);
        if (next == '(' && peekChar(2) == '(' && findClosingParen(pos + 2) == findClosingParen(pos + 1) - 1) {
            int end = findClosingParen(pos + 1);
            parts.addAll(new ShellLexer(input.substring(pos + 3, end - 1), depth).embeddedSubstitutions());
            text.append(input, pos, end + 1);
            pos = end + 1;
        } else if (next == '(') {
            // also covers "$((" that does not close with "))", which the shell runs as a command substitution
            int end = findClosingParen(pos + 1);
            var body = input.substring(pos + 2, end);
            parts.add(Node.commandSubstitution(nested(body)));
            text.append(input, pos, end + 1);
            pos = end + 1;
        } else if (next == '{') {
            int end = findClosingBrace(pos + 1);
            var body = input.substring(pos + 2, end);
            parts.add(new Node(NodeKind.PARAMETER, body, List.of()));
            parts.addAll(new ShellLexer(body, depth).embeddedSubstitutions());
            text.append(input, pos, end + 1);
            pos = end + 1;
        } else if (next == '\'' && !inDoubleQuotes) {
            int i = pos + 2;
            while (i < input.length() && input.charAt(i) != '\'') {
                i += input.charAt(i) == '\\' ? 2 : 1;
            }
            if (i >= input.length()) {
                throw new ShellParseException("unterminated ANSI-C quote");
            }
            text.append(decodeAnsiC(input.substring(pos + 2, i)));
            quoted = true;
            pos = i + 1;
        } else if (next == '"' && !inDoubleQuotes) {
            pos++;
            scanDoubleQuoted();
        } else if (Character.isLetter(next) || next == '_') {
            int i = pos + 1;
            while (i < input.length() && (Character.isLetterOrDigit(input.charAt(i)) || input.charAt(i) == '_')) {
                i++;
            }
            parts.add(new Node(NodeKind.PARAMETER, input.substring(pos + 1, i), List.of()));
            text.append(input, pos, i);
            pos = i;
        } else if (Character.isDigit(next) || "@*#?$!-".indexOf(next) >= 0 && next != '\0') {
            parts.add(new Node(NodeKind.PARAMETER, String.valueOf(next), List.of()));
            text.append(input, pos, pos + 2);
            pos += 2;
        } else {
            text.append('$');
            pos++;
        }
    }

    /** Decodes the backslash escapes of a {@code $'...'} body the way bash does. */
    static String decodeAnsiC(String body) throws ShellParseException {
        var out = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'e', 'E' -> out.append('\u001b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000b');
                case '\\', '\'', '"', '?' -> out.append(e);
                case 'c' -> {
                    if (i < body.length()) {
                        appendCodePoint(out, body.charAt(i) & 0x1f);
                        i++;
                    } else {
                        out.append("\\c");
                    }
                }
                case 'x', 'u', 'U' -> {
                    int max = e == 'x' ? 2 : e == 'u' ? 4 : 8;
                    int end = i;
                    while (end < body.length() && end - i < max && Character.digit(body.charAt(end), 16) >= 0) {
                        end++;
                    }
                    if (end == i) {
                        out.append('\\').append(e);
                    } else {
                        appendCodePoint(out, Integer.parseUnsignedInt(body.substring(i, end), 16));
                        i = end;
                    }
                }
                default -> {
                    if (e >= '0' && e <= '7') {
                        int end = i;
                        while (end < body.length() && end - i < 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        appendCodePoint(out, Integer.parseInt(body.substring(i - 1, end), 8) & 0xff);
                        i = end;
                    } else {
                        out.append('\\').append(e);
                    }
                }
            }
        }
        return out.toString();
    }

    private static void appendCodePoint(StringBuilder out, int codePoint) throws ShellParseException {
        // bash truncates the word at NUL
        if (codePoint == 0 || !Character.isValidCodePoint(codePoint)) {
            throw new ShellParseException("unrepresentable character in ANSI-C quote");
        }
        out.appendCodePoint(codePoint);
    }

    private void scanBacktick() throws ShellParseException {
        var body = new StringBuilder();
        int i = pos + 1;
        while (true) {
            if (i >= input.length()) {
                throw new ShellParseException("unterminated backquote");
            }
            char c = input.charAt(i);
            if (c == '`') {
                break;
            }
            if (c == '\\' && i + 1 < input.length() && "\\`$".indexOf(input.charAt(i + 1)) >= 0) {
                body.append(input.charAt(i + 1));
                i += 2;
            } else {
                body.append(c);
                i++;
            }
        }
        parts.add(Node.commandSubstitution(nested(body.toString())));
        text.append(input, pos, i + 1);
        pos = i + 1;
    }

    private void scanProcessSubstitution() throws ShellParseException {
        var direction = String.valueOf(input.charAt(pos));
        int end = findClosingParen(pos + 1);
        parts.add(Node.processSubstitution(direction, nested(input.substring(pos + 2, end))));
        text.append(input, pos, end + 1);
        pos = end + 1;
    }

    private List<Node> nested(String body) throws ShellParseException {
        return new ShellParser(depth + 1).parseProgram(body);
    }

    /** Index of the ')' matching the '(' at {@code open}, skipping quoted text. */
    private int findClosingParen(int open) throws ShellParseException {
        int level = 0;
        int i = open;
        while (i < input.length()) {
            char c = input.charAt(i);
            switch (c) {
                case '\\' -> i += 2;
                case '\'' -> i = skipSingleQuoted(i);
                case '"' -> i = skipDoubleQuoted(i);
                case '`' -> i = skipBacktick(i);
                case '#' -> {
                    if (i > open && isCommentStart(i)) {
                        while (i < input.length() && input.charAt(i) != '\n') {
                            i++;
                        }
                    } else {
                        i++;
                    }
                }
                case '(' -> {
                    level++;
                    i++;
                }
                case ')' -> {
                    level--;
                    if (level == 0) {
                        return i;
                    }
                    i++;
                }
                default -> i++;
            }
        }
        throw new ShellParseException("unterminated substitution");
    }

    private int findClosingBrace(int open) throws ShellParseException {
        int level = 0;
        int i = open;
        while (i < input.length()) {
            char c = input.charAt(i);
            switch (c) {
                case '\\' -> i += 2;
                case '\'' -> i = skipSingleQuoted(i);
                case '"' -> i = skipDoubleQuoted(i);
                case '`' -> i = skipBacktick(i);
                case '(' -> i = input.charAt(i - 1) == '$' || input.charAt(i - 1) == '<' || input.charAt(i - 1) == '>'
                        ? findClosingParen(i) + 1 : i + 1;
                case '{' -> {
                    level++;
                    i++;
                }
                case '}' -> {
                    level--;
                    if (level == 0) {
                        return i;
                    }
                    i++;
                }
                default -> i++;
            }
        }
        throw new ShellParseException("unterminated parameter expansion");
    }

    private boolean isCommentStart(int i) {
        char prev = input.charAt(i - 1);
        return prev == ' ' || prev == '\t' || prev == '\n' || prev == ';' || prev == '(';
    }

    private int skipSingleQuoted(int i) throws ShellParseException {
        int end = input.indexOf('\'', i + 1);
        if (end < 0) {
            throw new ShellParseException("unterminated single quote");
        }
        return end + 1;
    }

    private int skipDoubleQuoted(int i) throws ShellParseException {
        int j = i + 1;
        while (j < input.length()) {
            char c = input.charAt(j);
            if (c == '\\') {
                j += 2;
            } else if (c == '"') {
                return j + 1;
            } else if (c == '$' && j + 1 < input.length() && input.charAt(j + 1) == '(') {
                j = findClosingParen(j + 1) + 1;
            } else if (c == '`') {
                j = skipBacktick(j);
            } else {
                j++;
            }
        }
        throw new ShellParseException("unterminated double quote");
    }

    private int skipBacktick(int i) throws ShellParseException {
        int j = i + 1;
        while (j < input.length()) {
            char c = input.charAt(j);
            if (c == '\\') {
                j += 2;
            } else if (c == '`') {
                return j + 1;
            } else {
                j++;
            }
        }
        throw new ShellParseException("unterminated backquote");
    }

    private void readPendingHeredocs() throws ShellParseException {
        if (awaitingDelimiter != null) {
            throw new ShellParseException("missing here-document delimiter");
        }
        for (var pending : pendingHeredocs) {
            var body = new StringBuilder();
            boolean terminated = false;
            while (pos < input.length()) {
                int eol = input.indexOf('\n', pos);
                int lineEnd = eol < 0 ? input.length() : eol;
                var line = input.substring(pos, lineEnd);
                pos = eol < 0 ? input.length() : eol + 1;
                var candidate = pending.stripTabs() ? line.replaceFirst("^\t+", "") : line;
                if (candidate.equals(pending.delimiter())) {
                    terminated = true;
                    break;
                }
                body.append(line).append('\n');
            }
            if (!terminated && body.length() == 0) {
                throw new ShellParseException("here-document without body");
            }
            var content = body.toString();
            if (!pending.quoted() && (content.contains("$(") || content.contains("`"))) {
                throw new ShellParseException("command substitution inside unquoted here-document");
            }
            pending.redirect().heredocBody = content;
            pending.redirect().heredocQuoted = pending.quoted();
        }
        pendingHeredocs.clear();
    }
}
