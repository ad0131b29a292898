package com.shellguard.parser;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.shared.model.CommandFragment;

import java.util.List;

/**
 * Turns a raw command line into the flat list of command fragments it would execute. Never throws: input the
 * grammar cannot represent comes back as a single parse-failure fragment.
 */
public class CommandParser {

    private final DecisionTrace trace;
    private final SyntaxTreeWalker walker;

    public CommandParser(DecisionTrace trace) {
        this.trace = trace;
        this.walker = new SyntaxTreeWalker(trace);
    }

    public List<CommandFragment> parse(String command) {
        if (command == null) {
            return List.of(CommandFragment.parseFailure());
        }
        var cleaned = Preparser.normalize(command);
        if (cleaned.isBlank()) {
            return List.of();
        }
        try {
            var nodes = ShellParser.parse(cleaned);
            var fragments = walker.fragment(nodes);
            trace.record(3, "Parsed {} fragment(s) from: {}", fragments.size(), cleaned);
            return fragments;
        } catch (ShellParseException e) {
            trace.record(1, "Parse failed ({}): {}", e.getMessage(), cleaned);
            return List.of(CommandFragment.parseFailure());
        } catch (StackOverflowError e) {
            trace.record(1, "Parse exhausted the stack: {}", cleaned);
            return List.of(CommandFragment.parseFailure());
        }
    }
}
