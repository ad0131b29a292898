package com.shellguard.approval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellguard.security.CommandClassifier;
import com.shellguard.shared.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Maps one hook request envelope to the response to print. Empty means "print nothing", which the caller reads as
 * "ask the user as usual".
 */
public class HookProcessor {

    private static final Logger log = LoggerFactory.getLogger(HookProcessor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final String GOVERNED_TOOL = "Bash";

    private final CommandClassifier classifier;

    public HookProcessor(CommandClassifier classifier) {
        this.classifier = classifier;
    }

    public Optional<String> process(String requestJson) {
        if (requestJson == null || requestJson.isBlank()) {
            return Optional.empty();
        }
        JsonNode envelope;
        try {
            envelope = MAPPER.readTree(requestJson);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed hook envelope: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (envelope == null || !envelope.isObject()) {
            return Optional.empty();
        }
        if (!GOVERNED_TOOL.equals(envelope.path("tool_name").asText(null))) {
            return Optional.empty();
        }
        var commandNode = envelope.path("tool_input").path("command");
        if (!commandNode.isTextual() || commandNode.asText().isBlank()) {
            return Optional.empty();
        }
        var event = HookEvent.detect(envelope);
        if (event.isEmpty()) {
            log.debug("Unsupported hook event: {}", envelope.path("hook_event_name"));
            return Optional.empty();
        }
        var command = commandNode.asText();
        if (classifier.classify(command) != Verdict.APPROVE) {
            return Optional.empty();
        }
        return Optional.of(HookResponses.allowJson(event.get(), command));
    }
}
