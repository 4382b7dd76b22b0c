package org.faultscan.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable mapping from fault category to the lowercase substrings that trigger it.
 * Categories are enumerated in alphabetical order; that order is the tie-break when
 * two categories score the same.
 * Safe to share between threads once constructed.
 */
public final class RuleTable {

    public static final String NETWORK = "Network";
    public static final String RESOURCE = "Resource";
    public static final String SECURITY = "Security";
    public static final String HARDWARE = "Hardware";
    public static final String APPLICATION = "Application";

    private static final RuleTable DEFAULTS = new RuleTable(Map.of(
            NETWORK, List.of("connection", "timeout", "network", "socket",
                    "refused", "unreachable", "dns", "port", "link"),
            RESOURCE, List.of("memory", "cpu", "disk", "allocation", "limit",
                    "exceeded", "usage", "capacity", "resource"),
            SECURITY, List.of("authentication", "permission", "denied", "unauthorized",
                    "access", "login", "credential", "security", "auth"),
            HARDWARE, List.of("hardware", "device", "driver", "firmware", "physical"),
            APPLICATION, List.of("error", "exception", "failed", "crash", "abort",
                    "core", "fault", "fatal", "panic", "signal")));

    private final Map<String, Set<String>> rules;

    public RuleTable(Map<String, ? extends Iterable<String>> source) {
        Objects.requireNonNull(source, "Rule source cannot be null");
        final Map<String, Set<String>> sorted = new TreeMap<>();
        source.forEach((category, triggers) -> {
            final Set<String> copy = new LinkedHashSet<>();
            triggers.forEach(copy::add);
            sorted.put(category, Collections.unmodifiableSet(copy));
        });
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(sorted));
    }

    /**
     * The five built-in fault categories.
     */
    public static RuleTable defaults() {
        return DEFAULTS;
    }

    /**
     * Trigger substrings of a category, or an empty set when the category is unknown.
     */
    public Set<String> lookup(String category) {
        return rules.getOrDefault(category, Set.of());
    }

    public Set<String> categories() {
        return rules.keySet();
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "RuleTable" + rules;
    }
}
