package com.shellguard.parser;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.shared.model.CommandFragment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flattens a syntax tree into the commands it would run. Every node kind is handled explicitly; meeting a kind
 * outside that set abandons the walk and yields a single parse-failure fragment.
 */
public class SyntaxTreeWalker {

    private static final Pattern FD_DUPLICATION = Pattern.compile("\\d+-?|-");

    private final DecisionTrace trace;

    public SyntaxTreeWalker(DecisionTrace trace) {
        this.trace = trace;
    }

    public List<CommandFragment> fragment(List<Node> roots) {
        var out = new ArrayList<CommandFragment>();
        try {
            for (var root : roots) {
                visit(root, out);
            }
        } catch (UnsupportedNodeException e) {
            trace.record(1, "Unsupported syntax node {}, failing closed", e.kind);
            return List.of(CommandFragment.parseFailure());
        }
        return out;
    }

    /** True for redirects that may create or modify a file. Descriptor duplication such as {@code 2>&1} is not. */
    public static boolean writesOutput(Node redirect) {
        switch (redirect.text()) {
            case ">":
            case ">>":
            case ">|":
            case "&>":
            case "&>>":
            case "<>":
                return true;
            case ">&":
                var target = redirect.parts().isEmpty() ? "" : redirect.parts().get(0).text();
                return !FD_DUPLICATION.matcher(target).matches();
            default:
                return false;
        }
    }

    private void visit(Node node, List<CommandFragment> out) {
        switch (node.kind()) {
            case COMMAND -> visitCommand(node, out);
            case PIPELINE, LIST, COMPOUND, IF, FOR, WHILE, UNTIL, COMMAND_SUBSTITUTION -> visitAll(node.parts(), out);
            case FUNCTION -> visit(node.last(), out);
            case PROCESS_SUBSTITUTION -> {
                if (">".equals(node.text())) {
                    out.add(CommandFragment.outputChannel());
                }
                visitAll(node.parts(), out);
            }
            case REDIRECT -> {
                if (writesOutput(node)) {
                    out.add(CommandFragment.outputChannel());
                }
                visitAll(node.parts(), out);
            }
            case WORD, ASSIGNMENT -> visitAll(node.parts(), out);
            case RESERVED_WORD, OPERATOR, PIPE, PARAMETER, TILDE, GLOB, HEREDOC -> {
                // nothing runs
            }
            default -> throw new UnsupportedNodeException(node.kind());
        }
    }

    /** A word whose value the shell computes at run time, so its text here is not what the command receives. */
    private static boolean isExpanded(Node word) {
        return word.parts().stream().anyMatch(p ->
                p.is(NodeKind.PARAMETER) || p.is(NodeKind.COMMAND_SUBSTITUTION) || p.is(NodeKind.GLOB));
    }

    private void visitAll(List<Node> nodes, List<CommandFragment> out) {
        for (var n : nodes) {
            visit(n, out);
        }
    }

    private void visitCommand(Node command, List<CommandFragment> out) {
        var words = new ArrayList<String>();
        var expanded = new HashSet<Integer>();
        var nested = new ArrayList<CommandFragment>();
        boolean output = false;
        for (var part : command.parts()) {
            switch (part.kind()) {
                case WORD -> {
                    if (isExpanded(part)) {
                        expanded.add(words.size());
                    }
                    words.add(part.text());
                    visitAll(part.parts(), nested);
                }
                case ASSIGNMENT -> visitAll(part.parts(), nested);
                case REDIRECT -> {
                    output |= writesOutput(part);
                    visitAll(part.parts(), nested);
                }
                default -> throw new UnsupportedNodeException(part.kind());
            }
        }
        if (!words.isEmpty()) {
            out.add(new CommandFragment(words.get(0), words.subList(1, words.size()), output, expanded));
        } else if (output) {
            out.add(CommandFragment.outputChannel());
        }
        out.addAll(nested);
    }

    private static final class UnsupportedNodeException extends RuntimeException {
        final NodeKind kind;

        UnsupportedNodeException(NodeKind kind) {
            super(kind.name(), null, false, false);
            this.kind = kind;
        }
    }
}
