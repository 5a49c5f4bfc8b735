package com.vidnyan.rulecov.domain.marker;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical conventions of annotated example text.
 * <p>
 * Inline markers are trailing comments holding a glyph:
 * {@code insert acc; // ❌ DML in loop}. Section markers are comment lines
 * opening a block: {@code // Violation: DML in loop}.
 */
public final class MarkerSyntax {

    public static final String VIOLATION_GLYPH = "❌";
    public static final String VALID_GLYPH = "✅";

    private static final Pattern INLINE = Pattern.compile(
            "//(?:(?!//)[^\\n])*?(" + VIOLATION_GLYPH + "|" + VALID_GLYPH + ")\\uFE0F?(.*)$");
    private static final Pattern SECTION_HEADER = Pattern.compile("^\\s*//\\s*(Violation|Valid):(.*)$");

    private MarkerSyntax() {
    }

    /**
     * An inline marker found on a line.
     *
     * @param kind        marker kind
     * @param description trimmed text after the glyph, possibly empty
     * @param commentStart offset of the {@code //} that carries the glyph
     */
    public record InlineMatch(MarkerKind kind, String description, int commentStart) {
    }

    /**
     * A section header found on a line.
     */
    public record HeaderMatch(MarkerKind kind, String description) {
    }

    public static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\\r?\\n", -1));
    }

    public static Optional<InlineMatch> inline(String line) {
        Matcher matcher = INLINE.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        MarkerKind kind = matcher.group(1).equals(VIOLATION_GLYPH) ? MarkerKind.VIOLATION : MarkerKind.VALID;
        return Optional.of(new InlineMatch(kind, matcher.group(2).trim(), matcher.start()));
    }

    public static Optional<HeaderMatch> header(String line) {
        Matcher matcher = SECTION_HEADER.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        MarkerKind kind = matcher.group(1).equals("Violation") ? MarkerKind.VIOLATION : MarkerKind.VALID;
        return Optional.of(new HeaderMatch(kind, matcher.group(2).trim()));
    }

    public static boolean isComment(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("*");
    }

    /**
     * Code part of a line, with any inline marker comment removed.
     */
    public static String codePart(String line) {
        return inline(line)
                .map(match -> line.substring(0, match.commentStart()))
                .orElse(line)
                .trim();
    }
}
