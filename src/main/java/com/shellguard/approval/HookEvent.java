package com.shellguard.approval;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Hook events the classifier answers. Each has its own "allow" response shape.
 */
public enum HookEvent {
    PRE_TOOL_USE("PreToolUse"),
    PERMISSION_REQUEST("PermissionRequest");

    private final String wireName;

    HookEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<HookEvent> fromWireName(String name) {
        for (var event : values()) {
            if (event.wireName.equals(name)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    /** Reads {@code hook_event_name}; absent or unknown names yield empty. */
    public static Optional<HookEvent> detect(JsonNode envelope) {
        var name = envelope.path("hook_event_name");
        return name.isTextual() ? fromWireName(name.asText()) : Optional.empty();
    }
}
