package com.shellguard.observability;

import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps formatted decisions in memory, for callers that want to show why a command fell through.
 */
public class RecordingDecisionTrace implements DecisionTrace {

    public record Event(int level, String message) {}

    private final List<Event> events = new ArrayList<>();

    @Override
    public void record(int level, String message, Object... args) {
        events.add(new Event(level, MessageFormatter.arrayFormat(message, args).getMessage()));
    }

    public List<Event> events() {
        return List.copyOf(events);
    }

    public List<String> messages() {
        return events.stream().map(Event::message).toList();
    }

    public boolean contains(String fragment) {
        return events.stream().anyMatch(e -> e.message().contains(fragment));
    }
}
