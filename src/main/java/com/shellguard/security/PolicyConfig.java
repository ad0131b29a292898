package com.shellguard.security;

import com.shellguard.security.handler.AwkHandler;
import com.shellguard.security.handler.CommandHandler;
import com.shellguard.security.handler.FindHandler;
import com.shellguard.security.handler.SedHandler;
import com.shellguard.security.handler.XargsHandler;
import com.shellguard.shared.config.PolicySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable policy consulted by every pipeline stage. Built once per invocation, before any evaluation.
 */
public final class PolicyConfig {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfig.class);

    private final Set<String> whitelist;
    private final Set<String> neverApprove;
    private final Map<String, Set<String>> subcommands;
    private final Map<String, CommandHandler> handlers;
    private final boolean gitLocalWrites;
    private final boolean awkSafeMode;

    private PolicyConfig(Set<String> whitelist, Set<String> neverApprove, Map<String, Set<String>> subcommands,
                         Map<String, CommandHandler> handlers, boolean gitLocalWrites, boolean awkSafeMode) {
        this.whitelist = Collections.unmodifiableSet(new TreeSet<>(whitelist));
        this.neverApprove = Collections.unmodifiableSet(new TreeSet<>(neverApprove));
        this.subcommands = Map.copyOf(subcommands);
        this.handlers = Map.copyOf(handlers);
        this.gitLocalWrites = gitLocalWrites;
        this.awkSafeMode = awkSafeMode;
    }

    public static PolicyConfig defaults() {
        return from(PolicySettings.defaults());
    }

    public static PolicyConfig from(PolicySettings settings) {
        requireNames(settings.extraCommands(), "extraCommands");
        requireNames(settings.removeCommands(), "removeCommands");
        requireNames(settings.subcommandWhitelist().keySet(), "subcommandWhitelist");

        var neverApprove = new HashSet<>(CommandSets.NEVER_APPROVE);
        if (!settings.awkSafeMode()) {
            neverApprove.addAll(CommandSets.AWK_VARIANTS);
        }

        var subcommands = new HashMap<String, Set<String>>();
        var git = new HashSet<>(CommandSets.GIT_READONLY);
        if (settings.gitLocalWrites()) {
            git.addAll(CommandSets.GIT_LOCAL_WRITES);
        }
        subcommands.put("git", git);
        settings.subcommandWhitelist().forEach((exe, allowed) -> {
            requireNames(allowed, "subcommandWhitelist." + exe);
            subcommands.computeIfAbsent(exe, k -> new HashSet<>()).addAll(allowed);
        });

        var whitelist = new HashSet<>(CommandSets.DEFAULT_WHITELIST);
        whitelist.addAll(settings.extraCommands());
        if (settings.awkSafeMode()) {
            whitelist.addAll(CommandSets.AWK_VARIANTS);
        }
        settings.removeCommands().forEach(whitelist::remove);
        for (var exe : List.copyOf(whitelist)) {
            if (neverApprove.contains(exe)) {
                log.warn("Ignoring whitelist entry '{}': it is in the never-approve set", exe);
                whitelist.remove(exe);
            } else if (subcommands.containsKey(exe)) {
                log.warn("Ignoring whitelist entry '{}': it is governed by the subcommand whitelist", exe);
                whitelist.remove(exe);
            }
        }

        var handlers = new HashMap<String, CommandHandler>();
        handlers.put("sed", new SedHandler());
        handlers.put("find", new FindHandler());
        handlers.put("xargs", new XargsHandler());
        if (settings.awkSafeMode()) {
            var awk = new AwkHandler();
            CommandSets.AWK_VARIANTS.forEach(v -> handlers.put(v, awk));
        }

        var frozen = new HashMap<String, Set<String>>();
        subcommands.forEach((exe, allowed) -> frozen.put(exe, Set.copyOf(allowed)));
        return new PolicyConfig(whitelist, neverApprove, frozen, handlers,
                settings.gitLocalWrites(), settings.awkSafeMode());
    }

    private static void requireNames(Iterable<String> names, String field) {
        for (var name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Blank executable name in " + field);
            }
        }
    }

    public boolean isWhitelisted(String executable) {
        return whitelist.contains(executable);
    }

    public boolean isNeverApprove(String executable) {
        return neverApprove.contains(executable);
    }

    public Optional<Set<String>> subcommandsFor(String executable) {
        return Optional.ofNullable(subcommands.get(executable));
    }

    public Optional<CommandHandler> handlerFor(String executable) {
        return Optional.ofNullable(handlers.get(executable));
    }

    public Set<String> whitelist() { return whitelist; }

    public Set<String> neverApprove() { return neverApprove; }

    public boolean gitLocalWrites() { return gitLocalWrites; }

    public boolean awkSafeMode() { return awkSafeMode; }
}
