package com.shellguard.parser;

public enum NodeKind {
    // command-bearing
    COMMAND,
    PIPELINE,
    LIST,
    COMPOUND,
    FOR,
    WHILE,
    UNTIL,
    IF,
    FUNCTION,
    COMMAND_SUBSTITUTION,
    PROCESS_SUBSTITUTION,
    // leaf / structural
    WORD,
    ASSIGNMENT,
    REDIRECT,
    RESERVED_WORD,
    OPERATOR,
    PIPE,
    PARAMETER,
    TILDE,
    GLOB,
    HEREDOC,
    // produced by the grammar but never understood by the walker
    ARITHMETIC
}
