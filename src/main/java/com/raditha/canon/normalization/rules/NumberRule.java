package com.raditha.canon.normalization.rules;

import com.raditha.canon.normalization.NormalizationRule;
import com.raditha.canon.normalization.NumberSpelling;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Integers and floats. The value is exact ({@link BigInteger} or {@link BigDecimal}); sign, zero
 * padding, radix, digit case, fraction digits and exponent form are spelling and are recorded in a
 * {@link NumberSpelling}.
 */
public class NumberRule implements NormalizationRule {

    private static final Pattern DECIMAL = Pattern.compile("([-+]?)([0-9]+)");
    private static final Pattern PREFIXED = Pattern.compile("([-+]?)0([xob])([0-9a-fA-F]+)");
    private static final Pattern FLOAT = Pattern.compile(
            "([-+]?)(\\.[0-9]+|[0-9]+(?:\\.[0-9]*)?)(?:([eE])([-+]?)([0-9]+))?");

    @Override
    public RuleKind kind() {
        return RuleKind.NUMBER_SPELLING;
    }

    @Override
    public Optional<ScalarReading> read(ScalarInput input) {
        if (!input.isPlain()) {
            return Optional.empty();
        }
        String literal = input.literal();
        Matcher m = DECIMAL.matcher(literal);
        if (m.matches()) {
            String digits = m.group(2);
            BigInteger value = new BigInteger(digits);
            if ("-".equals(m.group(1))) {
                value = value.negate();
            }
            NumberSpelling spelling = NumberSpelling.integer(10, false, "+".equals(m.group(1)), paddedWidth(digits));
            return Optional.of(integer(input, value, spelling));
        }
        m = PREFIXED.matcher(literal);
        if (m.matches()) {
            int radix = switch (m.group(2)) {
                case "x" -> 16;
                case "o" -> 8;
                default -> 2;
            };
            String digits = m.group(3);
            BigInteger value;
            try {
                value = new BigInteger(digits, radix);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            if ("-".equals(m.group(1))) {
                value = value.negate();
            }
            boolean upper = !digits.equals(digits.toLowerCase());
            NumberSpelling spelling = NumberSpelling.integer(radix, upper, "+".equals(m.group(1)), paddedWidth(digits));
            return Optional.of(integer(input, value, spelling));
        }
        m = FLOAT.matcher(literal);
        if (m.matches()) {
            String mantissa = m.group(2);
            int dot = mantissa.indexOf('.');
            String intDigits = dot < 0 ? mantissa : mantissa.substring(0, dot);
            int fraction = dot < 0 ? 0 : mantissa.length() - dot - 1;
            boolean exponent = m.group(3) != null;
            NumberSpelling spelling = new NumberSpelling(10, false, "+".equals(m.group(1)), paddedWidth(intDigits),
                    fraction, exponent, exponent ? m.group(3).charAt(0) : 'e',
                    exponent && "+".equals(m.group(4)), exponent ? paddedWidth(m.group(5)) : 0,
                    mantissa.startsWith("."), mantissa.endsWith("."));
            BigDecimal value = new BigDecimal(literal.startsWith("+") ? literal.substring(1) : literal);
            RuleTag tag = new RuleTag(RuleKind.NUMBER_SPELLING, input.quote(), literal, SemanticKind.FLOAT, value,
                    spelling, null, null);
            return Optional.of(new ScalarReading(SemanticKind.FLOAT, value, tag));
        }
        return Optional.empty();
    }

    private static ScalarReading integer(ScalarInput input, BigInteger value, NumberSpelling spelling) {
        RuleTag tag = new RuleTag(RuleKind.NUMBER_SPELLING, input.quote(), input.literal(), SemanticKind.INT, value,
                spelling, null, null);
        return new ScalarReading(SemanticKind.INT, value, tag);
    }

    private static int paddedWidth(String digits) {
        return digits.length() > 1 && digits.charAt(0) == '0' ? digits.length() : 0;
    }

    @Override
    public Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context) {
        NumberSpelling spelling = tag != null && tag.kind() == RuleKind.NUMBER_SPELLING
                && tag.valueKind() == value.kind() && tag.spelling() != null
                ? tag.spelling() : NumberSpelling.DECIMAL;
        if (value.kind() == SemanticKind.INT) {
            return Optional.of(renderInteger((BigInteger) value.value(), spelling));
        }
        if (value.kind() == SemanticKind.FLOAT) {
            return Optional.of(renderFloat((BigDecimal) value.value(), spelling));
        }
        return Optional.empty();
    }

    static String renderInteger(BigInteger value, NumberSpelling spelling) {
        String sign = value.signum() < 0 ? "-" : spelling.explicitPlus() ? "+" : "";
        String digits = value.abs().toString(spelling.radix());
        if (spelling.upperCase()) {
            digits = digits.toUpperCase();
        }
        digits = pad(digits, spelling.width());
        String prefix = switch (spelling.radix()) {
            case 16 -> "0x";
            case 8 -> "0o";
            case 2 -> "0b";
            default -> "";
        };
        return sign + prefix + digits;
    }

    static String renderFloat(BigDecimal value, NumberSpelling spelling) {
        String sign = value.signum() < 0 ? "-" : spelling.explicitPlus() ? "+" : "";
        BigDecimal abs = value.abs();
        if (spelling.exponent()) {
            int exp = abs.signum() == 0 ? 0 : abs.precision() - abs.scale() - 1;
            String mantissa = fixed(abs.movePointLeft(exp), spelling.fractionDigits(), true);
            if (mantissa.endsWith(".") && !spelling.trailingDot()) {
                mantissa = mantissa.substring(0, mantissa.length() - 1);
            }
            String expSign = exp < 0 ? "-" : spelling.exponentPlus() ? "+" : "";
            return sign + mantissa + spelling.exponentChar() + expSign
                    + pad(Integer.toString(Math.abs(exp)), spelling.exponentWidth());
        }
        String body = fixed(abs, spelling.fractionDigits(), spelling.trailingDot());
        if (spelling.leadingDot() && body.startsWith("0.") && body.length() > 2) {
            body = body.substring(1);
        } else if (spelling.width() > 0) {
            int dot = body.indexOf('.');
            body = pad(body.substring(0, dot), spelling.width()) + body.substring(dot);
        }
        return sign + body;
    }

    /**
     * Plain decimal notation that always contains a point, so the text reads back as a float.
     */
    private static String fixed(BigDecimal abs, int fractionDigits, boolean trailingDot) {
        BigDecimal stripped = abs.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        int scale = Math.max(stripped.scale(), fractionDigits);
        String text = stripped.setScale(scale).toPlainString();
        if (scale == 0) {
            text += trailingDot ? "." : ".0";
        }
        return text;
    }

    private static String pad(String digits, int width) {
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }
}
