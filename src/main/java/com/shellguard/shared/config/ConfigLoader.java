package com.shellguard.shared.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the {@code readonlyBashHook} section of the agent's settings.json, or of the file named by
 * {@code SHELLGUARD_CONFIG}. {@code .json} files go through Jackson, anything else through SnakeYAML.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String SECTION = "readonlyBashHook";
    static final String DEBUG_ENV = "SHELLGUARD_DEBUG";
    static final String CONFIG_ENV = "SHELLGUARD_CONFIG";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final List<Path> DEFAULT_PATHS = List.of(
        Path.of(".claude", "settings.json"),
        Path.of(System.getProperty("user.home"), ".claude", "settings.json")
    );

    public static ShellGuardConfig load() {
        var candidates = new ArrayList<Path>();
        var explicit = envOrDefault(CONFIG_ENV, "");
        if (!explicit.isBlank()) candidates.add(Path.of(explicit));
        candidates.addAll(DEFAULT_PATHS);
        return new ShellGuardConfig(loadPolicy(candidates), traceVerbosity(envOrDefault(DEBUG_ENV, "0")));
    }

    /** First readable candidate wins; later candidates are not merged in. */
    public static PolicySettings loadPolicy(List<Path> candidates) {
        for (var path : candidates) {
            if (!Files.isRegularFile(path)) continue;
            Map<String, Object> raw;
            try {
                raw = readDocument(path);
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable settings {}: {}", path, e.getMessage());
                continue;
            }
            log.debug("Loaded settings from {}", path);
            return parsePolicy(asMap(raw.get(SECTION)));
        }
        return PolicySettings.defaults();
    }

    private static Map<String, Object> readDocument(Path path) throws IOException {
        try (var in = Files.newInputStream(path)) {
            if (path.getFileName().toString().endsWith(".json")) {
                return asMap(MAPPER.readValue(in, Map.class));
            }
            return asMap(new Yaml().load(in));
        }
    }

    static PolicySettings parsePolicy(Map<String, Object> section) {
        var features = asMap(section.get("features"));
        return new PolicySettings(
            stringList(section.get("extraCommands")),
            stringList(section.get("removeCommands")),
            subcommands(section.get("subcommandWhitelist")),
            Boolean.TRUE.equals(features.get("gitLocalWrites")),
            Boolean.TRUE.equals(features.get("awkSafeMode"))
        );
    }

    static int traceVerbosity(String raw) {
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}", DEBUG_ENV, raw);
            return 0;
        }
    }

    private static Map<String, List<String>> subcommands(Object raw) {
        var result = new LinkedHashMap<String, List<String>>();
        asMap(raw).forEach((exe, subs) -> {
            if (exe == null || exe.isBlank()) return;
            if (!(subs instanceof List<?>)) {
                log.warn("Ignoring subcommandWhitelist entry '{}': expected a list", exe);
                return;
            }
            result.put(exe, stringList(subs));
        });
        return result;
    }

    private static List<String> stringList(Object raw) {
        if (!(raw instanceof List<?> list)) return List.of();
        var result = new ArrayList<String>();
        for (var item : list) {
            if (item instanceof String s && !s.isBlank()) result.add(s);
        }
        return result;
    }

    private static Map<String, Object> asMap(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) return Map.of();
        var result = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
