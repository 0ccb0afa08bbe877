package com.raditha.canon.config;

import com.raditha.canon.format.OrphanCommentPolicy;
import com.raditha.canon.normalization.RuleSet;
import com.raditha.canon.normalization.rules.DefaultValueRule;
import com.raditha.canon.normalization.rules.TimestampRule;
import com.raditha.canon.normalization.rules.ValueAliasRule;
import com.raditha.canon.patch.TransactionMode;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Configuration for normalization and patch-back.
 * Holds the rule set inputs and the switches of the pipeline.
 *
 * @param timestampPatterns   DateTimeFormatter patterns recognised as timestamps, in priority order
 * @param durationKeys        keys whose values are read as Go-style durations
 * @param jsonStringKeys      keys whose quoted string values are read as the JSON they hold
 * @param aliases             alternative spellings of values under a key
 * @param defaultValues       keys with default values; absent keys read as the default
 * @param ignoredPaths        path patterns left out of the semantic tree
 * @param orphanCommentPolicy where comments of deleted entries go; null for the format's choice
 * @param verifyRoundTrip     check that every parsed document reassembles to its source
 * @param transactionMode     what a failing edit does to the rest of its patch
 * @param allowUnhintedInsert let inserts into empty collections use the format's layout without a hint
 */
public record CanonConfig(
        List<String> timestampPatterns,
        List<String> durationKeys,
        List<String> jsonStringKeys,
        List<ValueAliasRule.Alias> aliases,
        List<DefaultValueRule> defaultValues,
        List<String> ignoredPaths,
        OrphanCommentPolicy orphanCommentPolicy,
        boolean verifyRoundTrip,
        TransactionMode transactionMode,
        boolean allowUnhintedInsert) {

    /**
     * Validate configuration.
     */
    public CanonConfig {
        if (timestampPatterns == null) {
            timestampPatterns = TimestampRule.DEFAULT_PATTERNS;
        }
        timestampPatterns = List.copyOf(timestampPatterns);
        durationKeys = durationKeys == null ? List.of() : List.copyOf(durationKeys);
        jsonStringKeys = jsonStringKeys == null ? List.of() : List.copyOf(jsonStringKeys);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        defaultValues = defaultValues == null ? List.of() : List.copyOf(defaultValues);
        ignoredPaths = ignoredPaths == null ? List.of() : List.copyOf(ignoredPaths);
        if (transactionMode == null) {
            throw new IllegalArgumentException("transactionMode cannot be null");
        }
        for (String key : durationKeys) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("durationKeys cannot contain blank keys");
            }
        }
        for (String key : jsonStringKeys) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("jsonStringKeys cannot contain blank keys");
            }
        }
    }

    /**
     * Default preset: core rules, round-trip verification, atomic patches.
     */
    public static CanonConfig defaults() {
        return new CanonConfig(
                TimestampRule.DEFAULT_PATTERNS,
                List.of(), // durationKeys
                List.of(), // jsonStringKeys
                List.of(), // aliases
                List.of(), // defaultValues
                List.of(), // ignoredPaths
                null, // orphanCommentPolicy - format decides
                true, // verifyRoundTrip
                TransactionMode.ALL_OR_NOTHING,
                false); // allowUnhintedInsert
    }

    /**
     * Strict preset: only offset-qualified ISO timestamps, comments of deleted entries stay
     * with the entry before them, atomic patches.
     */
    public static CanonConfig strict() {
        return new CanonConfig(
                List.of("yyyy-MM-dd'T'HH:mm:ssXXX", "yyyy-MM-dd'T'HH:mm:ss.SSSXXX"),
                List.of(), // durationKeys
                List.of(), // jsonStringKeys
                List.of(), // aliases
                List.of(), // defaultValues
                List.of(), // ignoredPaths
                OrphanCommentPolicy.ATTACH_TO_PREVIOUS,
                true, // verifyRoundTrip
                TransactionMode.ALL_OR_NOTHING,
                false); // allowUnhintedInsert
    }

    /**
     * Lenient preset: failing edits are skipped, empty collections accept inserts without a hint.
     */
    public static CanonConfig lenient() {
        return new CanonConfig(
                TimestampRule.DEFAULT_PATTERNS,
                List.of(), // durationKeys
                List.of(), // jsonStringKeys
                List.of(), // aliases
                List.of(), // defaultValues
                List.of(), // ignoredPaths
                null, // orphanCommentPolicy
                true, // verifyRoundTrip
                TransactionMode.BEST_EFFORT,
                true); // allowUnhintedInsert
    }

    /**
     * Tekton preset: the conventions of Tekton task and pipeline manifests as the cluster
     * returns them. Timeouts compare as durations, the v1 api version reads as v1beta1, parameter
     * values hold JSON, values the cluster fills in by default compare equal to absent ones where
     * the cluster fills them in, and server-managed metadata is ignored.
     */
    public static CanonConfig tekton() {
        return new CanonConfig(
                TimestampRule.DEFAULT_PATTERNS,
                List.of("timeout"),
                List.of("value"),
                List.of(new ValueAliasRule.Alias("apiVersion", "tekton.dev/v1", "tekton.dev/v1beta1")),
                List.of(
                        DefaultValueRule.of("$", "kind", "Task"),
                        DefaultValueRule.of("**.taskRef", "kind", "Task"),
                        DefaultValueRule.of("$", "metadata", Map.of()),
                        DefaultValueRule.of("**.taskSpec", "metadata", Map.of()),
                        DefaultValueRule.of("$", "spec", null),
                        DefaultValueRule.of("**.params[*]", "type", "string"),
                        DefaultValueRule.of("**.results[*]", "type", "string"),
                        DefaultValueRule.of("**.steps[*]", "computeResources", Map.of()),
                        DefaultValueRule.of("**.sidecars[*]", "computeResources", Map.of()),
                        DefaultValueRule.of("**.steps[*]", "name", "")),
                List.of(
                        "metadata.creationTimestamp",
                        "metadata.generation",
                        "metadata.labels['paas.redhat.com/appcode']",
                        "metadata.namespace",
                        "metadata.resourceVersion",
                        "metadata.uid"),
                null, // orphanCommentPolicy
                true, // verifyRoundTrip
                TransactionMode.ALL_OR_NOTHING,
                false); // allowUnhintedInsert
    }

    /**
     * Preset by name.
     */
    public static CanonConfig preset(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Preset name cannot be null");
        }
        return switch (name.toLowerCase()) {
            case "default", "defaults" -> defaults();
            case "strict" -> strict();
            case "lenient" -> lenient();
            case "tekton" -> tekton();
            default -> throw new IllegalArgumentException(
                    "Invalid preset: " + name + ". Must be: default, strict, lenient or tekton");
        };
    }

    /**
     * The rule set these settings describe.
     */
    public RuleSet ruleSet() {
        RuleSet.Builder builder = RuleSet.builder()
                .timestampPatterns(timestampPatterns)
                .durationKeys(new LinkedHashSet<>(durationKeys))
                .jsonStringKeys(new LinkedHashSet<>(jsonStringKeys));
        for (ValueAliasRule.Alias alias : aliases) {
            builder.alias(alias.key(), alias.spelling(), alias.canonical());
        }
        for (DefaultValueRule rule : defaultValues) {
            builder.defaultValue(rule.parent().toString(), rule.key(), rule.defaultValue());
        }
        for (String path : ignoredPaths) {
            builder.ignore(path);
        }
        return builder.build();
    }

    public CanonConfig withTransactionMode(TransactionMode mode) {
        return new CanonConfig(timestampPatterns, durationKeys, jsonStringKeys, aliases, defaultValues, ignoredPaths,
                orphanCommentPolicy, verifyRoundTrip, mode, allowUnhintedInsert);
    }

    public CanonConfig withVerifyRoundTrip(boolean verify) {
        return new CanonConfig(timestampPatterns, durationKeys, jsonStringKeys, aliases, defaultValues, ignoredPaths,
                orphanCommentPolicy, verify, transactionMode, allowUnhintedInsert);
    }

    /**
     * Summary for logging.
     */
    public Map<String, Object> describe() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("timestamp_patterns", timestampPatterns.size());
        summary.put("duration_keys", durationKeys);
        summary.put("json_string_keys", jsonStringKeys);
        summary.put("aliases", aliases.size());
        summary.put("defaults", defaultValues.size());
        summary.put("ignored_paths", ignoredPaths.size());
        summary.put("transaction_mode", transactionMode);
        return summary;
    }
}
