package com.raditha.formscope.config;

import java.util.Map;

/**
 * Builds mining and expression configuration from Settings (formscope.yml)
 * with CLI overrides.
 *
 * Configuration priority: CLI arguments > formscope.yml > defaults
 */
public class FormscopeSettings {

    private static final String CONFIG_KEY = "formscope";
    private static final String MINING_KEY = "mining";
    private static final String EXPRESSION_KEY = "expression";

    private FormscopeSettings() {
    }

    /**
     * Load mining configuration.
     * <p>
     * A preset (CLI or YAML) supplies the base values; explicit YAML values
     * replace them, and non-zero CLI values replace both.
     *
     * @param minOccurrencesCLI CLI minimum occurrences (0 = use YAML/default)
     * @param minGroupSizeCLI   CLI minimum group size (0 = use YAML/default)
     * @param maxGroupSizeCLI   CLI maximum group size (0 = use YAML/default)
     * @param presetCLI         CLI preset name (null = use YAML/default)
     * @return Complete mining configuration
     * @throws IllegalArgumentException for an unknown preset or invalid values
     */
    public static MiningConfig loadMiningConfig(int minOccurrencesCLI, int minGroupSizeCLI, int maxGroupSizeCLI,
            String presetCLI) {
        Map<String, Object> config = section(MINING_KEY);

        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        MiningConfig base = preset(preset);

        int minOccurrences = minOccurrencesCLI != 0 ? minOccurrencesCLI
                : getInt(config, "min_occurrences", base.minOccurrences());
        int minGroupSize = minGroupSizeCLI != 0 ? minGroupSizeCLI
                : getInt(config, "min_group_size", base.minGroupSize());
        int maxGroupSize = maxGroupSizeCLI != 0 ? maxGroupSizeCLI
                : getInt(config, "max_group_size", base.maxGroupSize());

        return new MiningConfig(
                minOccurrences,
                minGroupSize,
                maxGroupSize,
                getDouble(config, "group_similarity_threshold", base.groupSimilarityThreshold()),
                getDouble(config, "label_similarity_threshold", base.labelSimilarityThreshold()));
    }

    /**
     * Load expression analysis configuration from YAML or defaults.
     */
    public static ExpressionAnalysisConfig loadExpressionConfig() {
        Map<String, Object> config = section(EXPRESSION_KEY);
        ExpressionAnalysisConfig defaults = ExpressionAnalysisConfig.defaults();

        return new ExpressionAnalysisConfig(
                getInt(config, "complexity_threshold", defaults.complexityThreshold()),
                getInt(config, "max_sub_expression_depth", defaults.maxSubExpressionDepth()),
                getBoolean(config, "fix_operator_ordering", defaults.fixOperatorOrdering()));
    }

    private static MiningConfig preset(String name) {
        if (name == null) {
            return MiningConfig.defaults();
        }
        return switch (name) {
            case "strict" -> MiningConfig.strict();
            case "lenient" -> MiningConfig.lenient();
            case "default" -> MiningConfig.defaults();
            default -> throw new IllegalArgumentException("Unknown mining preset: " + name);
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(String name) {
        Object root = Settings.getProperty(CONFIG_KEY);
        if (root instanceof Map) {
            Object section = ((Map<String, Object>) root).get(name);
            if (section instanceof Map) {
                return (Map<String, Object>) section;
            }
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
