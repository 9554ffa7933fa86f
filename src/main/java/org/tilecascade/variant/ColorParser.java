package org.tilecascade.variant;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses colors written as {@code #rgb}, {@code #rrggbb}, {@code 0xRRGGBB} or bare hex digits.
 */
public final class ColorParser {

    private static final Pattern HEX_COLOR = Pattern.compile("^(?:#|0[xX])?([0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");

    private ColorParser() {}

    /**
     * Parses a color.
     *
     * @param input The text, may be null.
     * @return The color as 0xRRGGBB, or empty if the text is not a color.
     */
    public static OptionalInt parse(String input) {
        if (input == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = HEX_COLOR.matcher(input.trim());
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        String digits = matcher.group(1);
        if (digits.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (char ch : digits.toCharArray()) {
                expanded.append(ch).append(ch);
            }
            digits = expanded.toString();
        }
        return OptionalInt.of(Integer.parseInt(digits, 16));
    }
}
