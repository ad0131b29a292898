package com.shellguard.security;

import java.util.Set;

/**
 * Built-in executable sets. User settings can extend or shrink the whitelist but never the never-approve set.
 */
public final class CommandSets {

    private CommandSets() {
    }

    public static final Set<String> DEFAULT_WHITELIST = Set.of(
            // filesystem listing and metadata
            "ls", "tree", "stat", "file", "du", "df",
            // file reading
            "cat", "head", "tail", "less", "more", "tac",
            // search
            "grep", "rg", "fd", "find", "locate", "strings", "ag",
            // text processing
            "sed", "cut", "paste", "tr", "sort", "uniq", "comm", "join", "fmt", "column", "nl", "rev",
            "fold", "expand", "unexpand", "wc", "xargs", "jq", "yq",
            // comparison
            "diff", "cmp",
            // paths and lookup
            "readlink", "realpath", "basename", "dirname", "which", "type", "whereis",
            // system info
            "id", "whoami", "groups", "uname", "hostname", "uptime", "printenv",
            // checksums and dumps
            "sha256sum", "sha1sum", "md5sum", "cksum", "b2sum", "xxd", "hexdump", "od",
            // shell builtins
            "echo", "printf", "true", "false", "test", "[", "read",
            // processes
            "ps", "top", "htop", "lsof", "pgrep");

    public static final Set<String> NEVER_APPROVE = Set.of(
            "eval", "exec", "source", ".",
            "sudo", "su",
            "bash", "sh", "zsh", "fish", "dash", "csh", "ksh",
            "python", "python3", "perl", "ruby", "node", "deno", "bun",
            "parallel");

    public static final Set<String> AWK_VARIANTS = Set.of("awk", "gawk", "mawk", "nawk");

    public static final Set<String> GIT_READONLY = Set.of(
            "blame", "diff", "log", "ls-files", "ls-tree", "rev-parse", "show", "show-ref", "status");

    public static final Set<String> GIT_LOCAL_WRITES = Set.of("branch", "tag", "remote", "stash", "add", "config");

    public static final Set<String> WRAPPERS = Set.of("env", "nice", "time", "command", "nohup");
}
