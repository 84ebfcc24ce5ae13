package com.gnovoa.tourney.rules;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Per-rule overrides under {@code rules.catalog.<rule-id>}. Anything left out keeps the
 * {@link RuleId} default.
 */
@ConfigurationProperties(prefix = "rules")
public record RuleProperties(Map<String, RuleSettings> catalog) {

    public RuleProperties {
        catalog = catalog == null ? Map.of() : Map.copyOf(catalog);
    }

    public static RuleProperties defaults() {
        return new RuleProperties(Map.of());
    }

    public record RuleSettings(Boolean enabled, Integer priority, Map<String, Double> parameters) {
        public RuleSettings {
            parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        }
    }
}
