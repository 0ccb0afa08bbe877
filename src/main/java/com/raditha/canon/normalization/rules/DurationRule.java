package com.raditha.canon.normalization.rules;

import com.raditha.canon.normalization.NormalizationRule;
import com.raditha.canon.normalization.RenderContext;
import com.raditha.canon.normalization.RuleKind;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.normalization.ScalarInput;
import com.raditha.canon.normalization.ScalarReading;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go-style durations under configured keys: {@code 1h0m0s} and {@code 60m} both read as
 * {@code 1h}. Zero components are dropped; an all-zero duration is {@code 0s}.
 */
public class DurationRule implements NormalizationRule {

    private static final Pattern DURATION = Pattern.compile("(?:([0-9]+)h)?(?:([0-9]+)m)?(?:([0-9]+(?:\\.[0-9]+)?)s)?");
    private static final BigInteger SIXTY = BigInteger.valueOf(60);

    private final Set<String> keys;

    public DurationRule(Set<String> keys) {
        this.keys = Set.copyOf(keys);
    }

    public Set<String> keys() {
        return keys;
    }

    @Override
    public RuleKind kind() {
        return RuleKind.DURATION;
    }

    @Override
    public Optional<ScalarReading> read(ScalarInput input) {
        if (input.key() == null || !keys.contains(input.key())) {
            return Optional.empty();
        }
        return canonicalize(input.text()).map(canonical -> new ScalarReading(SemanticKind.STRING, canonical,
                RuleTag.of(RuleKind.DURATION, input.quote(), input.literal(), SemanticKind.STRING, canonical)));
    }

    /**
     * Canonical spelling of a duration, or empty when the text is not one.
     */
    public static Optional<String> canonicalize(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = DURATION.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        BigInteger hours = m.group(1) == null ? BigInteger.ZERO : new BigInteger(m.group(1));
        BigInteger minutes = m.group(2) == null ? BigInteger.ZERO : new BigInteger(m.group(2));
        BigDecimal seconds = m.group(3) == null ? BigDecimal.ZERO : new BigDecimal(m.group(3));

        BigInteger wholeSeconds = seconds.toBigInteger();
        BigDecimal fraction = seconds.subtract(new BigDecimal(wholeSeconds));
        BigInteger totalSeconds = hours.multiply(SIXTY).add(minutes).multiply(SIXTY).add(wholeSeconds);

        BigInteger[] hm = totalSeconds.divideAndRemainder(SIXTY.multiply(SIXTY));
        BigInteger[] ms = hm[1].divideAndRemainder(SIXTY);
        BigDecimal secs = new BigDecimal(ms[1]).add(fraction).stripTrailingZeros();

        StringBuilder sb = new StringBuilder();
        if (hm[0].signum() > 0) {
            sb.append(hm[0]).append('h');
        }
        if (ms[0].signum() > 0) {
            sb.append(ms[0]).append('m');
        }
        if (secs.signum() > 0) {
            sb.append(secs.toPlainString()).append('s');
        }
        return Optional.of(sb.length() == 0 ? "0s" : sb.toString());
    }

    @Override
    public Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context) {
        if (value.kind() != SemanticKind.STRING) {
            return Optional.empty();
        }
        String text = (String) value.value();
        String canonical = canonicalize(text).orElse(text);
        RenderContext quoted = context.preferredQuote() == null && tag != null
                ? context.withPreferredQuote(tag.quote()) : context;
        return Optional.of(QuoteStyleRule.quote(canonical, quoted));
    }
}
