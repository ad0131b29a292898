package com.shellguard.approval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellguard.security.CommandClassifier;
import com.shellguard.security.PolicyConfig;
import com.shellguard.shared.model.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class HookProcessorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HookProcessor processor = new HookProcessor(new CommandClassifier(PolicyConfig.defaults()));

    private static String request(String event, String tool, String command) {
        var root = MAPPER.createObjectNode();
        if (event != null) root.put("hook_event_name", event);
        root.put("tool_name", tool);
        root.putObject("tool_input").put("command", command);
        return root.toString();
    }

    // --- approvals ---

    @Test
    void preToolUseAllowsReadOnlyCommand() throws Exception {
        var out = processor.process(request("PreToolUse", "Bash", "git status")).orElseThrow();
        var output = MAPPER.readTree(out).path("hookSpecificOutput");
        assertEquals("PreToolUse", output.path("hookEventName").asText());
        assertEquals("allow", output.path("permissionDecision").asText());
        assertEquals("Read-only command: git status", output.path("permissionDecisionReason").asText());
    }

    @Test
    void permissionRequestAllowsReadOnlyCommand() throws Exception {
        var out = processor.process(request("PermissionRequest", "Bash", "ls -la | wc -l")).orElseThrow();
        var output = MAPPER.readTree(out).path("hookSpecificOutput");
        assertEquals("PermissionRequest", output.path("hookEventName").asText());
        assertEquals("allow", output.path("decision").path("behavior").asText());
        assertTrue(output.path("permissionDecision").isMissingNode());
    }

    @Test
    void responseIsSingleLine() {
        var out = processor.process(request("PreToolUse", "Bash", "cat <<EOF\nhi\nEOF")).orElseThrow();
        assertFalse(out.contains("\n"));
    }

    // --- no decision ---

    @Test
    void unsafeCommandPrintsNothing() {
        assertTrue(processor.process(request("PreToolUse", "Bash", "rm -rf /")).isEmpty());
        assertTrue(processor.process(request("PermissionRequest", "Bash", "ls > out")).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not json", "[1,2]", "\"Bash\"", "{\"tool_name\": \"Bash\"", "null"})
    void malformedInputPrintsNothing(String raw) {
        assertTrue(processor.process(raw).isEmpty());
    }

    @Test
    void nullInputPrintsNothing() {
        assertTrue(processor.process(null).isEmpty());
    }

    @Test
    void otherToolsAreIgnored() {
        var classifier = mock(CommandClassifier.class);
        var guarded = new HookProcessor(classifier);

        assertTrue(guarded.process(request("PreToolUse", "Write", "ls")).isEmpty());
        assertTrue(guarded.process(request("PreToolUse", "bash", "ls")).isEmpty());

        verify(classifier, never()).classify(anyString());
    }

    @Test
    void missingOrBlankCommandIsIgnored() {
        var classifier = mock(CommandClassifier.class);
        var guarded = new HookProcessor(classifier);

        assertTrue(guarded.process("{\"hook_event_name\":\"PreToolUse\",\"tool_name\":\"Bash\"}").isEmpty());
        assertTrue(guarded.process("{\"hook_event_name\":\"PreToolUse\",\"tool_name\":\"Bash\",\"tool_input\":{\"command\":42}}").isEmpty());
        assertTrue(guarded.process(request("PreToolUse", "Bash", "  ")).isEmpty());

        verify(classifier, never()).classify(anyString());
    }

    @Test
    void unknownEventSkipsClassification() {
        var classifier = mock(CommandClassifier.class);
        when(classifier.classify(anyString())).thenReturn(Verdict.APPROVE);
        var guarded = new HookProcessor(classifier);

        assertTrue(guarded.process(request("PostToolUse", "Bash", "ls")).isEmpty());
        assertTrue(guarded.process(request(null, "Bash", "ls")).isEmpty());

        verify(classifier, never()).classify(anyString());
    }

    @Test
    void classifierVerdictDecides() {
        var classifier = mock(CommandClassifier.class);
        when(classifier.classify("make")).thenReturn(Verdict.APPROVE);
        when(classifier.classify("ls")).thenReturn(Verdict.FALLTHROUGH);
        var guarded = new HookProcessor(classifier);

        assertTrue(guarded.process(request("PreToolUse", "Bash", "make")).isPresent());
        assertTrue(guarded.process(request("PreToolUse", "Bash", "ls")).isEmpty());
    }

    @Test
    void eventNamesRoundTrip() {
        for (var event : HookEvent.values()) {
            assertEquals(event, HookEvent.fromWireName(event.wireName()).orElseThrow());
        }
        assertTrue(HookEvent.fromWireName("preToolUse").isEmpty());
    }
}
