package com.shellguard.shared.config;

import java.util.List;
import java.util.Map;

/**
 * User-facing policy knobs, as read from settings. Turned into a {@code PolicyConfig} once per invocation.
 */
public record PolicySettings(
    List<String> extraCommands,
    List<String> removeCommands,
    Map<String, List<String>> subcommandWhitelist,
    boolean gitLocalWrites,
    boolean awkSafeMode
) {
    public PolicySettings {
        if (extraCommands == null || removeCommands == null || subcommandWhitelist == null) {
            throw new IllegalArgumentException("Policy settings collections must not be null");
        }
        extraCommands = List.copyOf(extraCommands);
        removeCommands = List.copyOf(removeCommands);
        subcommandWhitelist = Map.copyOf(subcommandWhitelist);
    }

    public static PolicySettings defaults() {
        return new PolicySettings(List.of(), List.of(), Map.of(), false, false);
    }

    public PolicySettings withGitLocalWrites(boolean enabled) {
        return new PolicySettings(extraCommands, removeCommands, subcommandWhitelist, enabled, awkSafeMode);
    }

    public PolicySettings withAwkSafeMode(boolean enabled) {
        return new PolicySettings(extraCommands, removeCommands, subcommandWhitelist, gitLocalWrites, enabled);
    }
}
