package com.raditha.canon.normalization;

/**
 * How a number was spelled, so a changed value can be written the same way.
 *
 * @param radix          10, 16, 8 or 2
 * @param upperCase      hexadecimal digits in upper case
 * @param explicitPlus   positive values carry a {@code +}
 * @param width          zero-padded width of the integer digits, 0 when not padded
 * @param fractionDigits digits written after the decimal point
 * @param exponent       scientific notation
 * @param exponentChar   {@code e} or {@code E}
 * @param exponentPlus   non-negative exponents carry a {@code +}
 * @param exponentWidth  zero-padded width of the exponent digits, 0 when not padded
 * @param leadingDot     {@code .5} rather than {@code 0.5}
 * @param trailingDot    {@code 5.} rather than {@code 5.0}
 */
public record NumberSpelling(
        int radix,
        boolean upperCase,
        boolean explicitPlus,
        int width,
        int fractionDigits,
        boolean exponent,
        char exponentChar,
        boolean exponentPlus,
        int exponentWidth,
        boolean leadingDot,
        boolean trailingDot) {

    public static final NumberSpelling DECIMAL = new NumberSpelling(10, false, false, 0, 0, false, 'e', false, 0,
            false, false);

    public NumberSpelling {
        if (radix != 10 && radix != 16 && radix != 8 && radix != 2) {
            throw new IllegalArgumentException("Unsupported radix " + radix);
        }
        if (width < 0 || fractionDigits < 0 || exponentWidth < 0) {
            throw new IllegalArgumentException("Widths must be >= 0");
        }
    }

    public static NumberSpelling integer(int radix, boolean upperCase, boolean explicitPlus, int width) {
        return new NumberSpelling(radix, upperCase, explicitPlus, width, 0, false, 'e', false, 0, false, false);
    }
}
