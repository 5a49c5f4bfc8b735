package com.vidnyan.rulecov.domain.query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers over XPath query text.
 * Structural scans run on a masked copy in which string literals and
 * comments are blanked out, so offsets stay aligned with the original.
 */
public final class QueryText {

    private QueryText() {
    }

    /**
     * A slice of the original text together with its offset.
     */
    public record Segment(String text, int offset) {

        public Segment trimmed() {
            int start = 0;
            while (start < text.length() && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            return new Segment(text.trim(), offset + start);
        }
    }

    /**
     * Replace the contents of quoted literals and {@code (: :)} comments with spaces.
     * Quote characters themselves are kept.
     */
    public static String mask(String text) {
        StringBuilder masked = new StringBuilder(text);
        char quote = 0;
        int commentDepth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (commentDepth > 0) {
                if (c == ':' && i + 1 < text.length() && text.charAt(i + 1) == ')') {
                    commentDepth--;
                    masked.setCharAt(i, ' ');
                    masked.setCharAt(i + 1, ' ');
                    i++;
                } else {
                    masked.setCharAt(i, ' ');
                }
            } else if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    masked.setCharAt(i, ' ');
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' && i + 1 < text.length() && text.charAt(i + 1) == ':') {
                commentDepth++;
                masked.setCharAt(i, ' ');
                masked.setCharAt(i + 1, ' ');
                i++;
            }
        }
        return masked.toString();
    }

    /**
     * Index of the bracket closing the one at {@code openIndex}, or -1 when unbalanced.
     */
    public static int findClosing(String masked, int openIndex) {
        char open = masked.charAt(openIndex);
        char close = switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            default -> throw new IllegalArgumentException("Not an opening bracket: " + open);
        };
        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Split at every occurrence of a boolean keyword that sits outside quotes,
     * parentheses and predicate brackets.
     */
    public static List<Segment> splitTopLevel(String original, String keyword) {
        String masked = mask(original);
        Pattern pattern = keywordPattern(keyword);
        List<Segment> parts = new ArrayList<>();
        int depth = 0;
        int partStart = 0;
        int i = 0;
        while (i < masked.length()) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && Character.isLetter(c)) {
                Matcher matcher = pattern.matcher(masked)
                        .useTransparentBounds(true)
                        .region(i, masked.length());
                if (matcher.lookingAt()) {
                    parts.add(new Segment(original.substring(partStart, i), partStart));
                    i = matcher.end();
                    partStart = i;
                    continue;
                }
            }
            i++;
        }
        parts.add(new Segment(original.substring(partStart), partStart));
        return parts.stream()
                .map(Segment::trimmed)
                .filter(part -> !part.text().isEmpty())
                .toList();
    }

    /**
     * True when the whole text is a single {@code name(...)} call.
     */
    public static boolean isSingleCall(String text, String functionName) {
        String trimmed = text.trim();
        String masked = mask(trimmed);
        Matcher matcher = Pattern.compile("^" + functionName + "\\s*\\(").matcher(masked);
        if (!matcher.find()) {
            return false;
        }
        int open = matcher.end() - 1;
        return findClosing(masked, open) == masked.length() - 1;
    }

    /**
     * Text between the outermost parentheses of a single call.
     */
    public static Segment callArguments(String text, int offset) {
        String masked = mask(text);
        int open = masked.indexOf('(');
        int close = findClosing(masked, open);
        return new Segment(text.substring(open + 1, close), offset + open + 1).trimmed();
    }

    static Pattern keywordPattern(String keyword) {
        return Pattern.compile("(?<![\\w-])" + keyword + "(?![\\w-])");
    }
}
