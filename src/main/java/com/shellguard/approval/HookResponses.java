package com.shellguard.approval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the JSON written to stdout for an approved command.
 */
public final class HookResponses {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HookResponses() {
    }

    public static ObjectNode allow(HookEvent event, String command) {
        var root = MAPPER.createObjectNode();
        var output = root.putObject("hookSpecificOutput");
        output.put("hookEventName", event.wireName());
        switch (event) {
            case PRE_TOOL_USE -> {
                output.put("permissionDecision", "allow");
                output.put("permissionDecisionReason", "Read-only command: " + command);
            }
            case PERMISSION_REQUEST -> output.putObject("decision").put("behavior", "allow");
        }
        return root;
    }

    public static String allowJson(HookEvent event, String command) {
        try {
            return MAPPER.writeValueAsString(allow(event, command));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize hook response", e);
        }
    }
}
