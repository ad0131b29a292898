package com.shellguard.parser;

import com.shellguard.parser.ShellLexer.Token;
import com.shellguard.parser.ShellLexer.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the subset of shell grammar the classifier understands: lists, and-or chains,
 * pipelines, simple commands, brace groups, subshells, {@code if}/{@code for}/{@code while}/{@code until},
 * function definitions and {@code [[ ]]} tests. Anything else is rejected with {@link ShellParseException}.
 */
public final class ShellParser {

    static final int MAX_DEPTH = 64;

    private static final Pattern ASSIGNMENT = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\[[^\\]]*\\])?\\+?=.*", Pattern.DOTALL);
    private static final Set<String> UNSUPPORTED = Set.of("case", "select", "coproc", "esac");
    private static final Set<String> MISPLACED = Set.of("then", "elif", "else", "fi", "do", "done", "}");

    private final int depth;
    private List<Token> tokens;
    private int pos;

    ShellParser(int depth) {
        this.depth = depth;
    }

    /** Parses a complete program. An empty or comment-only program yields an empty list. */
    public static List<Node> parse(String source) throws ShellParseException {
        return new ShellParser(0).parseProgram(source);
    }

    List<Node> parseProgram(String source) throws ShellParseException {
        if (depth > MAX_DEPTH) {
            throw new ShellParseException("nesting deeper than " + MAX_DEPTH);
        }
        tokens = new ShellLexer(source, depth).tokenize();
        pos = 0;
        skipNewlines();
        if (peek().type == Type.EOF) {
            return List.of();
        }
        var program = parseList(Set.of());
        skipNewlines();
        if (peek().type != Type.EOF) {
            throw unexpected(peek());
        }
        return List.of(program);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private void skipNewlines() {
        while (peek().type == Type.NEWLINE) {
            pos++;
        }
    }

    private static ShellParseException unexpected(Token token) {
        return new ShellParseException("unexpected token '" + token + "'");
    }

    private Node parseList(Set<String> terminators) throws ShellParseException {
        var parts = new ArrayList<Node>();
        parts.add(parseAndOr());
        while (true) {
            var t = peek();
            if (t.type == Type.NEWLINE || t.isOperator(";") || t.isOperator("&")) {
                advance();
                skipNewlines();
                if (atListEnd(terminators)) {
                    break;
                }
                parts.add(Node.operator(t.text));
                parts.add(parseAndOr());
            } else {
                break;
            }
        }
        return parts.size() == 1 ? parts.get(0) : Node.of(NodeKind.LIST, parts);
    }

    private boolean atListEnd(Set<String> terminators) {
        var t = peek();
        if (t.type == Type.EOF || t.isOperator(")")) {
            return true;
        }
        return t.type == Type.WORD && !t.quoted && terminators.contains(t.text);
    }

    private Node parseAndOr() throws ShellParseException {
        var first = parsePipeline();
        if (!peek().isOperator("&&") && !peek().isOperator("||")) {
            return first;
        }
        var parts = new ArrayList<Node>();
        parts.add(first);
        while (peek().isOperator("&&") || peek().isOperator("||")) {
            parts.add(Node.operator(advance().text));
            skipNewlines();
            parts.add(parsePipeline());
        }
        return Node.of(NodeKind.LIST, parts);
    }

    private Node parsePipeline() throws ShellParseException {
        var parts = new ArrayList<Node>();
        if (peek().isWord("!")) {
            advance();
            parts.add(Node.reserved("!"));
        }
        parts.add(parseCommand());
        while (peek().isOperator("|") || peek().isOperator("|&")) {
            parts.add(Node.pipe(advance().text));
            skipNewlines();
            parts.add(parseCommand());
        }
        return parts.size() == 1 ? parts.get(0) : Node.of(NodeKind.PIPELINE, parts);
    }

    private Node parseCommand() throws ShellParseException {
        var t = peek();
        if (t.type == Type.ARITHMETIC) {
            advance();
            var parts = new ArrayList<Node>();
            parts.add(Node.word(t.text));
            parseTrailingRedirects(parts);
            return new Node(NodeKind.ARITHMETIC, t.text, parts);
        }
        if (t.isOperator("(")) {
            return parseSubshell();
        }
        if (t.type == Type.WORD && !t.quoted) {
            if (UNSUPPORTED.contains(t.text)) {
                throw new ShellParseException("unsupported construct '" + t.text + "'");
            }
            if (MISPLACED.contains(t.text)) {
                throw unexpected(t);
            }
            switch (t.text) {
                case "{":
                    return parseBraceGroup();
                case "if":
                    return parseIf();
                case "for":
                    return parseFor();
                case "while":
                    return parseLoop(NodeKind.WHILE);
                case "until":
                    return parseLoop(NodeKind.UNTIL);
                case "function":
                    return parseFunction();
                default:
                    break;
            }
        }
        if (t.type == Type.WORD && tokens.get(pos + 1).isOperator("(")) {
            return parseFunction();
        }
        if (t.type == Type.WORD || t.type == Type.REDIRECT) {
            return parseSimpleCommand();
        }
        throw unexpected(t);
    }

    private Node parseSimpleCommand() throws ShellParseException {
        var parts = new ArrayList<Node>();
        boolean commandSeen = false;
        while (true) {
            var t = peek();
            if (t.type == Type.REDIRECT) {
                parts.add(parseRedirect());
            } else if (t.type == Type.WORD) {
                advance();
                if (!commandSeen && !t.quoted && t.text.equals("[[")) {
                    parseConditional(parts);
                    commandSeen = true;
                } else if (!commandSeen && ASSIGNMENT.matcher(t.raw).matches()) {
                    if (tokens.get(pos).isOperator("(") && t.raw.endsWith("=")) {
                        throw new ShellParseException("array assignment is not supported");
                    }
                    parts.add(Node.assignment(t.text, t.parts));
                } else {
                    parts.add(Node.word(t.text, t.parts));
                    commandSeen = true;
                }
            } else {
                break;
            }
        }
        if (parts.isEmpty()) {
            throw unexpected(peek());
        }
        return Node.of(NodeKind.COMMAND, parts);
    }

    /**
     * A {@code [[ ... ]]} test runs no program of its own; it reads as {@code true} whose arguments keep any
     * substitutions the test expression contains.
     */
    private void parseConditional(List<Node> parts) throws ShellParseException {
        parts.add(Node.word("true"));
        while (true) {
            var t = peek();
            if (t.type == Type.EOF || t.type == Type.NEWLINE || t.isOperator(";") || t.isOperator("&")) {
                throw new ShellParseException("unterminated [[ test");
            }
            if (t.type == Type.ARITHMETIC) {
                throw new ShellParseException("arithmetic inside [[ test");
            }
            advance();
            if (t.isWord("]]")) {
                return;
            }
            if (t.type == Type.WORD) {
                parts.add(Node.word(t.text, t.parts));
            }
        }
    }

    private Node parseRedirect() throws ShellParseException {
        var op = advance();
        var target = peek();
        if (target.type != Type.WORD) {
            throw new ShellParseException("redirect '" + op.text + "' without a target");
        }
        advance();
        var parts = new ArrayList<Node>();
        parts.add(Node.word(target.text, target.parts));
        if (op.heredocBody != null) {
            parts.add(new Node(NodeKind.HEREDOC, op.heredocBody, List.of()));
        }
        return Node.redirect(op.text, parts);
    }

    private void parseTrailingRedirects(List<Node> parts) throws ShellParseException {
        while (peek().type == Type.REDIRECT) {
            parts.add(parseRedirect());
        }
    }

    private void expectReserved(String word, List<Node> parts) throws ShellParseException {
        var t = peek();
        if (!t.isWord(word)) {
            throw new ShellParseException("expected '" + word + "' but found '" + t + "'");
        }
        advance();
        parts.add(Node.reserved(word));
    }

    private Node parseSubshell() throws ShellParseException {
        advance();
        var parts = new ArrayList<Node>();
        parts.add(Node.reserved("("));
        skipNewlines();
        parts.add(parseList(Set.of()));
        skipNewlines();
        if (!peek().isOperator(")")) {
            throw new ShellParseException("unterminated subshell");
        }
        advance();
        parts.add(Node.reserved(")"));
        parseTrailingRedirects(parts);
        return Node.of(NodeKind.COMPOUND, parts);
    }

    private Node parseBraceGroup() throws ShellParseException {
        advance();
        var parts = new ArrayList<Node>();
        parts.add(Node.reserved("{"));
        skipNewlines();
        parts.add(parseList(Set.of("}")));
        expectReserved("}", parts);
        parseTrailingRedirects(parts);
        return Node.of(NodeKind.COMPOUND, parts);
    }

    private Node parseIf() throws ShellParseException {
        var parts = new ArrayList<Node>();
        expectReserved("if", parts);
        skipNewlines();
        parts.add(parseList(Set.of("then")));
        expectReserved("then", parts);
        skipNewlines();
        parts.add(parseList(Set.of("elif", "else", "fi")));
        while (peek().isWord("elif")) {
            expectReserved("elif", parts);
            skipNewlines();
            parts.add(parseList(Set.of("then")));
            expectReserved("then", parts);
            skipNewlines();
            parts.add(parseList(Set.of("elif", "else", "fi")));
        }
        if (peek().isWord("else")) {
            expectReserved("else", parts);
            skipNewlines();
            parts.add(parseList(Set.of("fi")));
        }
        expectReserved("fi", parts);
        parseTrailingRedirects(parts);
        return Node.of(NodeKind.IF, parts);
    }

    private Node parseFor() throws ShellParseException {
        var parts = new ArrayList<Node>();
        expectReserved("for", parts);
        var name = peek();
        if (name.type != Type.WORD) {
            throw new ShellParseException("unsupported for-loop form");
        }
        advance();
        parts.add(Node.word(name.text, name.parts));
        skipNewlines();
        if (peek().isWord("in")) {
            expectReserved("in", parts);
            while (peek().type == Type.WORD) {
                var w = advance();
                parts.add(Node.word(w.text, w.parts));
            }
        }
        if (peek().isOperator(";")) {
            parts.add(Node.operator(advance().text));
        }
        skipNewlines();
        parseLoopBody(parts);
        return Node.of(NodeKind.FOR, parts);
    }

    private Node parseLoop(NodeKind kind) throws ShellParseException {
        var parts = new ArrayList<Node>();
        parts.add(Node.reserved(advance().text));
        skipNewlines();
        parts.add(parseList(Set.of("do")));
        parseLoopBody(parts);
        return Node.of(kind, parts);
    }

    private void parseLoopBody(List<Node> parts) throws ShellParseException {
        expectReserved("do", parts);
        skipNewlines();
        parts.add(parseList(Set.of("done")));
        expectReserved("done", parts);
        parseTrailingRedirects(parts);
    }

    private Node parseFunction() throws ShellParseException {
        var parts = new ArrayList<Node>();
        if (peek().isWord("function")) {
            advance();
        }
        var name = peek();
        if (name.type != Type.WORD) {
            throw unexpected(name);
        }
        advance();
        parts.add(Node.word(name.text));
        if (peek().isOperator("(")) {
            advance();
            if (!peek().isOperator(")")) {
                throw unexpected(peek());
            }
            advance();
        }
        skipNewlines();
        var body = parseCommand();
        if (body.is(NodeKind.COMMAND) || body.is(NodeKind.LIST) || body.is(NodeKind.PIPELINE)) {
            throw new ShellParseException("function body must be a compound command");
        }
        parts.add(body);
        return Node.of(NodeKind.FUNCTION, parts);
    }
}
