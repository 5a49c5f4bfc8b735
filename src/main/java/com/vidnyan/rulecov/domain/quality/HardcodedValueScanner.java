package com.vidnyan.rulecov.domain.quality;

import com.vidnyan.rulecov.domain.query.QueryText;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds literal values in a query that would be better exposed as rule properties.
 * Literals inside a {@code let} clause are already named and are skipped.
 */
public final class HardcodedValueScanner {

    private static final Pattern STRING = Pattern.compile("(['\"])([^'\"]*)\\1");
    private static final Pattern NUMBER = Pattern.compile("\\b((?![01]\\b)\\d+)\\b");
    private static final Pattern LET = Pattern.compile("(?i)(?<![\\w-])let\\s+");
    private static final Pattern RETURN = Pattern.compile("(?i)^return(?![\\w-])");
    private static final int MIN_REPORTED_STRING = 5;

    /**
     * A literal and its offset in the query.
     */
    public record HardcodedValue(String value, int position, boolean number) {
    }

    private HardcodedValueScanner() {
    }

    public static List<HardcodedValue> scan(String query) {
        List<HardcodedValue> values = new ArrayList<>();
        if (query == null || query.isEmpty()) {
            return values;
        }
        int[] letRange = letRange(query);

        Matcher string = STRING.matcher(query);
        while (string.find()) {
            if (inRange(string.start(), letRange) || string.group(2).length() < MIN_REPORTED_STRING) {
                continue;
            }
            values.add(new HardcodedValue(string.group(), string.start(), false));
        }
        String masked = QueryText.mask(query);
        Matcher number = NUMBER.matcher(masked);
        while (number.find()) {
            if (!inRange(number.start(), letRange)) {
                values.add(new HardcodedValue(number.group(1), number.start(), true));
            }
        }
        return values;
    }

    private static int[] letRange(String query) {
        String masked = QueryText.mask(query);
        Matcher let = LET.matcher(masked);
        if (!let.find()) {
            return new int[] {-1, -1};
        }
        int depth = 0;
        for (int i = let.end(); i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && !Character.isLetterOrDigit(masked.charAt(i - 1))
                    && RETURN.matcher(masked.substring(i)).find()) {
                return new int[] {let.start(), i + "return".length()};
            }
        }
        return new int[] {let.start(), masked.length()};
    }

    private static boolean inRange(int position, int[] range) {
        return range[0] >= 0 && position >= range[0] && position < range[1];
    }
}
