package com.raditha.canon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.canon.format.OrphanCommentPolicy;
import com.raditha.canon.normalization.rules.DefaultValueRule;
import com.raditha.canon.normalization.rules.ValueAliasRule;
import com.raditha.canon.patch.TransactionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads configuration from a YAML file (canon.yml) with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > canon.yml > defaults
 * <p>
 * The file holds the settings either at its top level or under a {@code canon} key:
 * <pre>
 * canon:
 *   preset: tekton
 *   duration_keys: [timeout]
 *   json_string_keys: [value]
 *   aliases:
 *     - {key: apiVersion, spelling: tekton.dev/v1, canonical: tekton.dev/v1beta1}
 *   defaults:
 *     - {parent: "$", key: metadata, value: {}}
 *   ignored_paths: [metadata.uid]
 *   orphan_comments: previous
 *   transaction_mode: best-effort
 * </pre>
 */
public class CanonSettings {

    private static final Logger logger = LoggerFactory.getLogger(CanonSettings.class);

    public static final String DEFAULT_FILE = "canon.yml";
    private static final String CONFIG_KEY = "canon";

    private CanonSettings() {
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile  the YAML file, or null to look for canon.yml in the working directory
     * @param presetCLI   CLI preset name (null = use YAML/default)
     * @param modeCLI     CLI transaction mode (null = use YAML/default)
     * @return complete configuration
     * @throws IOException if the file exists but cannot be read
     * @throws IllegalArgumentException if the file holds invalid settings
     */
    public static CanonConfig loadConfig(Path configFile, String presetCLI, String modeCLI) throws IOException {
        Path file = configFile != null ? configFile : Path.of(DEFAULT_FILE);
        Map<String, Object> config = read(file, configFile != null);
        if (config.isEmpty()) {
            return createFromCLI(presetCLI, modeCLI);
        }

        // Determine preset (CLI > YAML)
        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        CanonConfig base = preset != null ? CanonConfig.preset(preset) : CanonConfig.defaults();

        List<String> timestampPatterns = getListString(config, "timestamp_patterns");
        if (timestampPatterns.isEmpty()) {
            timestampPatterns = base.timestampPatterns();
        }
        List<String> durationKeys = merge(base.durationKeys(), getListString(config, "duration_keys"));
        List<String> jsonStringKeys = merge(base.jsonStringKeys(), getListString(config, "json_string_keys"));
        List<String> ignoredPaths = merge(base.ignoredPaths(), getListString(config, "ignored_paths"));

        List<ValueAliasRule.Alias> aliases = new ArrayList<>(base.aliases());
        for (Map<String, Object> alias : getListMap(config, "aliases")) {
            aliases.add(new ValueAliasRule.Alias(getString(alias, "key", null), getString(alias, "spelling", null),
                    getString(alias, "canonical", null)));
        }

        List<DefaultValueRule> defaultValues = new ArrayList<>(base.defaultValues());
        for (Map<String, Object> rule : getListMap(config, "defaults")) {
            defaultValues.add(DefaultValueRule.of(getString(rule, "parent", "$"), getString(rule, "key", null),
                    rule.get("value")));
        }

        String policy = getString(config, "orphan_comments", null);
        OrphanCommentPolicy orphanComments = policy != null
                ? OrphanCommentPolicy.fromString(policy)
                : base.orphanCommentPolicy();

        String mode = modeCLI != null ? modeCLI : getString(config, "transaction_mode", null);
        TransactionMode transactionMode = mode != null ? TransactionMode.fromString(mode) : base.transactionMode();

        CanonConfig result = new CanonConfig(
                timestampPatterns,
                durationKeys,
                jsonStringKeys,
                aliases,
                defaultValues,
                ignoredPaths,
                orphanComments,
                getBoolean(config, "verify_round_trip", base.verifyRoundTrip()),
                transactionMode,
                getBoolean(config, "allow_unhinted_insert", base.allowUnhintedInsert()));
        logger.info("Loaded configuration from {}: {}", file, result.describe());
        return result;
    }

    private static CanonConfig createFromCLI(String presetCLI, String modeCLI) {
        CanonConfig config = presetCLI != null ? CanonConfig.preset(presetCLI) : CanonConfig.defaults();
        if (modeCLI != null) {
            config = config.withTransactionMode(TransactionMode.fromString(modeCLI));
        }
        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> read(Path file, boolean required) throws IOException {
        if (!Files.exists(file)) {
            if (required) {
                throw new IOException("Configuration file not found: " + file);
            }
            return Map.of();
        }
        String content = Files.readString(file);
        if (content.isBlank()) {
            return Map.of();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        Object raw = mapper.readValue(content, Object.class);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Configuration file " + file + " must hold a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) raw;
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            return (Map<String, Object>) section;
        }
        return root;
    }

    private static List<String> merge(List<String> base, List<String> extra) {
        List<String> merged = new ArrayList<>(base);
        for (String value : extra) {
            if (!merged.contains(value)) {
                merged.add(value);
            }
        }
        return merged;
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

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object item : (List<?>) value) {
                result.add(String.valueOf(item));
            }
            return result;
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getListMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof List)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Entries of " + key + " must be mappings, found: " + item);
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }
}
