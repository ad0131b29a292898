package com.shellguard.parser;

import java.util.List;
import java.util.Objects;

/**
 * Syntax tree node. {@code text} carries the word (quotes removed), operator, reserved word,
 * redirect operator or process-substitution direction; {@code parts} carries children in source order.
 */
public record Node(NodeKind kind, String text, List<Node> parts) {

    public Node {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
        parts = List.copyOf(parts);
    }

    public static Node of(NodeKind kind, List<Node> parts) {
        return new Node(kind, "", parts);
    }

    public static Node word(String text, List<Node> parts) {
        return new Node(NodeKind.WORD, text, parts);
    }

    public static Node word(String text) {
        return new Node(NodeKind.WORD, text, List.of());
    }

    public static Node assignment(String text, List<Node> parts) {
        return new Node(NodeKind.ASSIGNMENT, text, parts);
    }

    public static Node reserved(String text) {
        return new Node(NodeKind.RESERVED_WORD, text, List.of());
    }

    public static Node operator(String text) {
        return new Node(NodeKind.OPERATOR, text, List.of());
    }

    public static Node pipe(String text) {
        return new Node(NodeKind.PIPE, text, List.of());
    }

    /** {@code parts} holds the target word, followed by a HEREDOC node for here-documents. */
    public static Node redirect(String operator, List<Node> parts) {
        return new Node(NodeKind.REDIRECT, operator, parts);
    }

    /** Unquoted pattern character of a word that undergoes pathname expansion. */
    public static Node glob(String pattern) {
        return new Node(NodeKind.GLOB, pattern, List.of());
    }

    public static Node commandSubstitution(List<Node> body) {
        return new Node(NodeKind.COMMAND_SUBSTITUTION, "", body);
    }

    /** {@code direction} is {@code "<"} for input and {@code ">"} for output substitutions. */
    public static Node processSubstitution(String direction, List<Node> body) {
        return new Node(NodeKind.PROCESS_SUBSTITUTION, direction, body);
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public Node last() {
        return parts.get(parts.size() - 1);
    }
}
