package com.raditha.canon.normalization;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.exceptions.ParseException;
import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.normalization.rules.BooleanRule;
import com.raditha.canon.normalization.rules.DefaultValueRule;
import com.raditha.canon.normalization.rules.DurationRule;
import com.raditha.canon.normalization.rules.IgnoredPathRule;
import com.raditha.canon.normalization.rules.JsonStringRule;
import com.raditha.canon.normalization.rules.NullRule;
import com.raditha.canon.normalization.rules.NumberRule;
import com.raditha.canon.normalization.rules.QuoteStyleRule;
import com.raditha.canon.normalization.rules.TimestampRule;
import com.raditha.canon.normalization.rules.ValueAliasRule;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticPath;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The explicit rule configuration normalization runs with. Scalar rules are tried in a fixed
 * precedence: keyed rules (durations, aliases, embedded JSON) first, then null, boolean, integer, float and
 * timestamp, and finally plain strings.
 */
public final class RuleSet {

    private final DurationRule durations;
    private final ValueAliasRule aliases;
    private final JsonStringRule jsonStrings;
    private final NullRule nulls = new NullRule();
    private final BooleanRule booleans = new BooleanRule();
    private final NumberRule numbers = new NumberRule();
    private final TimestampRule timestamps;
    private final QuoteStyleRule strings = new QuoteStyleRule();
    private final List<NormalizationRule> scalarRules;
    private final List<DefaultValueRule> defaults;
    private final List<IgnoredPathRule> ignored;

    private RuleSet(Builder builder) {
        this.durations = new DurationRule(builder.durationKeys);
        this.aliases = new ValueAliasRule(builder.aliases);
        this.jsonStrings = new JsonStringRule(builder.jsonStringKeys);
        this.timestamps = new TimestampRule(builder.timestampPatterns);
        this.defaults = List.copyOf(builder.defaults);
        this.ignored = List.copyOf(builder.ignored);
        this.scalarRules = List.of(durations, aliases, jsonStrings, nulls, booleans, numbers, timestamps, strings);
    }

    /**
     * Core rules only: quoting, numbers, booleans, nulls and the default timestamp patterns.
     */
    public static RuleSet defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read a literal: resolve its quoting, then run the scalar rules in precedence order.
     *
     * @throws ParseException if the literal is malformed
     */
    public ScalarReading read(String literal, QuoteStyle quote, String key, SemanticPath path, FormatProfile profile,
                              SourceLocation location) {
        String text;
        try {
            text = profile.syntax().decode(literal, quote);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), location, profile.name(), e);
        }
        ScalarInput input = new ScalarInput(literal, quote, text, key, path, profile, location);
        for (NormalizationRule rule : scalarRules) {
            Optional<ScalarReading> reading = rule.read(input);
            if (reading.isPresent()) {
                return reading.get();
            }
        }
        throw new IllegalStateException("No rule read literal " + literal);
    }

    /**
     * A reader bound to one format, as used by renderers to check their output.
     */
    public ScalarReader readerFor(FormatProfile profile) {
        return (literal, quote, key, path) -> read(literal, quote, key, path, profile, SourceLocation.of(path.toString()));
    }

    public Optional<NormalizationRule> rule(RuleKind kind) {
        return scalarRules.stream().filter(r -> r.kind() == kind).findFirst();
    }

    /**
     * The rule that writes values of a kind when no recorded rule applies.
     */
    public NormalizationRule ruleFor(SemanticKind kind) {
        return switch (kind) {
            case NULL -> nulls;
            case BOOL -> booleans;
            case INT, FLOAT -> numbers;
            case TIMESTAMP -> timestamps;
            case STRING -> strings;
            default -> throw new IllegalArgumentException("No scalar rule writes " + kind);
        };
    }

    public List<DefaultValueRule> defaultsFor(SemanticPath mappingPath) {
        List<DefaultValueRule> result = new ArrayList<>();
        for (DefaultValueRule rule : defaults) {
            if (rule.appliesTo(mappingPath)) {
                result.add(rule);
            }
        }
        return result;
    }

    public Optional<DefaultValueRule> defaultFor(SemanticPath mappingPath, String key) {
        return defaultsFor(mappingPath).stream().filter(d -> d.key().equals(key)).findFirst();
    }

    public boolean isIgnored(SemanticPath path) {
        return ignored.stream().anyMatch(rule -> rule.ignores(path));
    }

    public List<IgnoredPathRule> ignoredPaths() {
        return ignored;
    }

    public TimestampRule timestamps() {
        return timestamps;
    }

    public DurationRule durations() {
        return durations;
    }

    public ValueAliasRule aliases() {
        return aliases;
    }

    public JsonStringRule jsonStrings() {
        return jsonStrings;
    }

    /**
     * Builder for rule sets.
     */
    public static final class Builder {

        private final List<String> timestampPatterns = new ArrayList<>(TimestampRule.DEFAULT_PATTERNS);
        private final Set<String> durationKeys = new LinkedHashSet<>();
        private final List<ValueAliasRule.Alias> aliases = new ArrayList<>();
        private final Set<String> jsonStringKeys = new LinkedHashSet<>();
        private final List<DefaultValueRule> defaults = new ArrayList<>();
        private final List<IgnoredPathRule> ignored = new ArrayList<>();

        private Builder() {
        }

        public Builder timestampPatterns(List<String> patterns) {
            timestampPatterns.clear();
            timestampPatterns.addAll(patterns);
            return this;
        }

        public Builder durationKeys(Set<String> keys) {
            durationKeys.addAll(keys);
            return this;
        }

        public Builder jsonStringKeys(Set<String> keys) {
            jsonStringKeys.addAll(keys);
            return this;
        }

        public Builder alias(String key, String spelling, String canonical) {
            aliases.add(new ValueAliasRule.Alias(key, spelling, canonical));
            return this;
        }

        public Builder defaultValue(String parentPattern, String key, Object value) {
            defaults.add(DefaultValueRule.of(parentPattern, key, value));
            return this;
        }

        public Builder ignore(String pathPattern) {
            ignored.add(IgnoredPathRule.of(pathPattern));
            return this;
        }

        public RuleSet build() {
            return new RuleSet(this);
        }
    }
}
