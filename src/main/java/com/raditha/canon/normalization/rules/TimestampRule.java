package com.raditha.canon.normalization.rules;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.exceptions.AmbiguousTimestampFormatException;
import com.raditha.canon.exceptions.InvalidEditException;
import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.normalization.NormalizationRule;
import com.raditha.canon.normalization.RenderContext;
import com.raditha.canon.normalization.RuleKind;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.normalization.ScalarInput;
import com.raditha.canon.normalization.ScalarReading;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Timestamps in configured {@link DateTimeFormatter} patterns. The canonical value is the
 * {@link Instant}; timestamps without an offset are taken as UTC. The pattern and offset of the
 * literal are recorded so a changed value is written the same way.
 * <p>
 * A literal matching several patterns is read by the first of them, unless the matches disagree
 * on the instant, which raises {@link AmbiguousTimestampFormatException}.
 */
public class TimestampRule implements NormalizationRule {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "yyyy-MM-dd'T'HH:mm:ssXXX",
            "yyyy-MM-dd'T'HH:mm:ss.SSSXXX",
            "yyyy-MM-dd'T'HH:mm:ss",
            "yyyy-MM-dd HH:mm:ss",
            "yyyy-MM-dd");

    private final Map<String, DateTimeFormatter> formatters = new LinkedHashMap<>();

    private record Match(String pattern, Instant instant, ZoneOffset offset) {
    }

    public TimestampRule() {
        this(DEFAULT_PATTERNS);
    }

    public TimestampRule(List<String> patterns) {
        for (String pattern : patterns) {
            try {
                formatters.put(pattern, DateTimeFormatter.ofPattern(strictYear(pattern))
                        .withResolverStyle(ResolverStyle.STRICT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid timestamp pattern '" + pattern + "'", e);
            }
        }
    }

    public List<String> patterns() {
        return new ArrayList<>(formatters.keySet());
    }

    /**
     * Year-of-era ({@code y}) needs an era to resolve strictly; proleptic year ({@code u}) does not.
     */
    static String strictYear(String pattern) {
        StringBuilder sb = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            sb.append(!quoted && c == 'y' ? 'u' : c);
        }
        return sb.toString();
    }

    @Override
    public RuleKind kind() {
        return RuleKind.TIMESTAMP;
    }

    @Override
    public Optional<ScalarReading> read(ScalarInput input) {
        if (formatters.isEmpty() || (!input.isPlain() && !input.profile().typedQuotedStrings())) {
            return Optional.empty();
        }
        String text = input.text();
        if (text.isEmpty() || !Character.isDigit(text.charAt(0))) {
            return Optional.empty();
        }
        List<Match> matches = match(text);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        Set<Instant> instants = new LinkedHashSet<>();
        matches.forEach(m -> instants.add(m.instant()));
        if (instants.size() > 1) {
            List<String> patterns = new ArrayList<>();
            matches.forEach(m -> patterns.add(m.pattern()));
            throw new AmbiguousTimestampFormatException(input.literal(), patterns, input.location());
        }
        Match first = matches.get(0);
        RuleTag tag = new RuleTag(RuleKind.TIMESTAMP, input.quote(), input.literal(), SemanticKind.TIMESTAMP,
                first.instant(), null, first.pattern(), first.offset());
        return Optional.of(new ScalarReading(SemanticKind.TIMESTAMP, first.instant(), tag));
    }

    private List<Match> match(String text) {
        List<Match> matches = new ArrayList<>();
        for (Map.Entry<String, DateTimeFormatter> e : formatters.entrySet()) {
            parse(e.getValue(), text).ifPresent(m -> matches.add(new Match(e.getKey(), m.instant(), m.offset())));
        }
        return matches;
    }

    private static Optional<Match> parse(DateTimeFormatter formatter, String text) {
        TemporalAccessor parsed;
        try {
            parsed = formatter.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        if (parsed instanceof OffsetDateTime odt) {
            return Optional.of(new Match(null, odt.toInstant(), odt.getOffset()));
        }
        if (parsed instanceof LocalDateTime ldt) {
            return Optional.of(new Match(null, ldt.toInstant(ZoneOffset.UTC), null));
        }
        return Optional.of(new Match(null, ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant(), null));
    }

    @Override
    public Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context) {
        if (value.kind() != SemanticKind.TIMESTAMP) {
            return Optional.empty();
        }
        Instant instant = (Instant) value.value();
        boolean tagged = tag != null && tag.kind() == RuleKind.TIMESTAMP;
        ZoneOffset offset = tagged && tag.offset() != null ? tag.offset() : ZoneOffset.UTC;

        List<String> candidates = new ArrayList<>();
        if (tagged && formatters.containsKey(tag.pattern())) {
            candidates.add(tag.pattern());
        }
        candidates.addAll(formatters.keySet());
        for (String pattern : candidates) {
            DateTimeFormatter formatter = formatters.get(pattern);
            String text = formatter.format(instant.atOffset(offset));
            Optional<Match> back = parse(formatter, text);
            if (back.isPresent() && back.get().instant().equals(instant)) {
                return Optional.of(quoteIfNeeded(text, tagged ? tag.quote() : QuoteStyle.PLAIN, context));
            }
        }
        throw new InvalidEditException("No configured timestamp pattern can represent " + instant,
                SourceLocation.of(String.valueOf(context.path())), "timestamp");
    }

    private static String quoteIfNeeded(String text, QuoteStyle quote, RenderContext context) {
        if (quote == QuoteStyle.PLAIN && !context.profile().typedQuotedStrings()) {
            return text;
        }
        QuoteStyle q = quote == QuoteStyle.PLAIN ? context.profile().fallbackQuote() : quote;
        return context.profile().syntax().encode(text, q);
    }
}
