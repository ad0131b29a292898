package com.shellguard.shared.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One flattened command invocation: executable, arguments and whether it writes through an output redirect.
 * {@code expandedWords} holds the positions of words whose final value depends on a shell expansion
 * (parameter, command substitution, glob); position 0 is the executable, position {@code i + 1} is {@code args[i]}.
 */
public record CommandFragment(String executable, List<String> args, boolean hasOutputRedirect,
                              Set<Integer> expandedWords) {

    /** Executable of the poisoned fragment; contains a NUL so no policy entry can ever match it. */
    public static final String PARSE_FAILURE = "\0__PARSE_FAILURE__";

    /** Executable of the marker fragment emitted for hidden output channels. */
    public static final String OUTPUT_CHANNEL = "__output_channel__";

    public CommandFragment {
        Objects.requireNonNull(executable, "executable");
        args = List.copyOf(args);
        expandedWords = expandedWords == null ? Set.of() : Set.copyOf(expandedWords);
    }

    public CommandFragment(String executable, List<String> args, boolean hasOutputRedirect) {
        this(executable, args, hasOutputRedirect, Set.of());
    }

    public static CommandFragment of(String executable, String... args) {
        return new CommandFragment(executable, List.of(args), false);
    }

    public static CommandFragment of(List<String> words) {
        if (words.isEmpty()) throw new IllegalArgumentException("Fragment needs at least one word");
        return new CommandFragment(words.get(0), words.subList(1, words.size()), false);
    }

    public static CommandFragment parseFailure() {
        return new CommandFragment(PARSE_FAILURE, List.of(), false);
    }

    public static CommandFragment outputChannel() {
        return new CommandFragment(OUTPUT_CHANNEL, List.of(), true);
    }

    public CommandFragment withExecutable(String newExecutable) {
        return new CommandFragment(newExecutable, args, hasOutputRedirect, expandedWords);
    }

    /** The command a wrapper runs: {@code args[argIndex]} becomes the executable, later arguments stay arguments. */
    public CommandFragment unwrap(int argIndex) {
        var shifted = new HashSet<Integer>();
        for (int word : expandedWords) {
            if (word > argIndex) {
                shifted.add(word - argIndex - 1);
            }
        }
        return new CommandFragment(args.get(argIndex), args.subList(argIndex + 1, args.size()), hasOutputRedirect, shifted);
    }

    public boolean isExpanded(int word) {
        return expandedWords.contains(word);
    }

    public boolean hasExpandedArgs() {
        return expandedWords.stream().anyMatch(w -> w > 0);
    }

    /** True when one of the first {@code count} arguments comes from an expansion. */
    public boolean expandsLeadingArgs(int count) {
        return expandedWords.stream().anyMatch(w -> w > 0 && w <= count);
    }

    public boolean isParseFailure() {
        return PARSE_FAILURE.equals(executable);
    }
}
