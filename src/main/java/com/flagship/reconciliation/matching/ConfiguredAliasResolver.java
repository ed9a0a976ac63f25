package com.flagship.reconciliation.matching;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Alias resolver backed by the {@code reconciliation.matching.description-aliases} map.
 * First canonical name (in configuration order) with an alias contained in the text wins.
 */
public class ConfiguredAliasResolver implements AliasResolver {

    private final Map<String, List<String>> aliases;

    public ConfiguredAliasResolver(Map<String, List<String>> aliases) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        aliases.forEach((canonical, values) -> normalized.put(canonical,
            values.stream().map(v -> v.toLowerCase(Locale.ROOT).trim()).filter(v -> !v.isEmpty()).toList()));
        this.aliases = normalized;
    }

    @Override
    public Optional<String> canonicalName(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return aliases.entrySet().stream()
            .filter(entry -> entry.getValue().stream().anyMatch(lower::contains))
            .map(Map.Entry::getKey)
            .findFirst();
    }
}
