package com.vidnyan.rulecov.domain.coverage;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text shapes of Apex constructs, shared by the coverage checkers.
 */
public final class CodePatterns {

    public static final Pattern DOTTED_CALL = Pattern.compile("\\b([A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)+)\\s*\\(");
    public static final Pattern CALL = Pattern.compile("\\b([A-Za-z_]\\w*)\\s*\\(");
    public static final Pattern METHOD_SIGNATURE = Pattern.compile(
            "\\b(public|private|protected|global)\\s+(static\\s+|override\\s+|virtual\\s+|abstract\\s+)*"
                    + "[\\w<>\\[\\],. ]+?\\s+\\w+\\s*\\(");
    public static final Pattern FIELD_DECLARATION = Pattern.compile(
            "\\b(private|public|protected|global)\\s+(static\\s+)?(final\\s+)?[\\w<>\\[\\],.]+\\s+\\w+\\s*(=|;)",
            Pattern.CASE_INSENSITIVE);
    public static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'|\"[^\"]*\"");
    public static final Pattern NUMBER_LITERAL = Pattern.compile("\\b\\d+(\\.\\d+)?[lLdD]?\\b");
    public static final Pattern ANNOTATION = Pattern.compile("@\\w+");
    public static final Pattern ANNOTATION_PARAMETER = Pattern.compile("@\\w+\\s*\\(\\s*\\w+\\s*=");
    public static final Pattern NESTED_CLASS = Pattern.compile("\\bclass\\s+\\w+[^{]*\\{[\\s\\S]*\\bclass\\s+\\w+");

    /** Words that look like calls when followed by a parenthesis. */
    public static final Set<String> CONTROL_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "new", "super", "this", "do", "try", "when");

    /** Boolean modifier attributes and the keyword each one stands for. */
    public static final Map<String, String> MODIFIER_KEYWORDS = Map.ofEntries(
            Map.entry("Final", "final"),
            Map.entry("Static", "static"),
            Map.entry("Abstract", "abstract"),
            Map.entry("Virtual", "virtual"),
            Map.entry("Override", "override"),
            Map.entry("Transient", "transient"),
            Map.entry("Global", "global"),
            Map.entry("Public", "public"),
            Map.entry("Private", "private"),
            Map.entry("Protected", "protected"),
            Map.entry("WithSharing", "with sharing"),
            Map.entry("WithoutSharing", "without sharing"),
            Map.entry("InheritedSharing", "inherited sharing"),
            Map.entry("Testmethod", "testmethod"),
            Map.entry("Webservice", "webservice")
    );

    /** Words after which an identifier and a parenthesis still form a call. */
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "return", "throw", "else", "when", "in", "do", "and", "or", "not");

    private static final Pattern KEYWORD_SPLIT = Pattern.compile("[=<>!()\\[\\]]+");
    private static final Set<String> BOOLEAN_WORDS = Set.of("and", "or", "not", "true", "false");

    private CodePatterns() {
    }

    public static boolean containsIgnoreCase(String content, String needle) {
        return content.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    public static boolean containsWord(String content, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word).replace(" ", "\\E\\s+\\Q") + "\\b",
                Pattern.CASE_INSENSITIVE).matcher(content).find();
    }

    public static boolean matches(Pattern pattern, String content) {
        return pattern.matcher(content).find();
    }

    /**
     * True when some identifier other than a control keyword is followed by a parenthesis.
     */
    public static boolean containsCall(String content) {
        return !callNames(content).isEmpty();
    }

    /**
     * Call names in order of appearance. Dotted calls keep their qualifier.
     */
    public static List<String> callNames(String content) {
        Set<String> names = new LinkedHashSet<>();
        Matcher dotted = DOTTED_CALL.matcher(content);
        while (dotted.find()) {
            names.add(dotted.group(1));
        }
        Matcher plain = CALL.matcher(content);
        while (plain.find()) {
            String name = plain.group(1);
            boolean qualified = plain.start() > 0 && content.charAt(plain.start() - 1) == '.';
            if (qualified || CONTROL_KEYWORDS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            String previous = previousToken(content, plain.start());
            if (!isConstructorOrDeclaration(previous)) {
                names.add(name);
            }
        }
        return List.copyOf(names);
    }

    /**
     * The token ending right before {@code end} on the same line: a word, a closing
     * type bracket glued to its type, or empty for anything else.
     */
    static String previousToken(String content, int end) {
        int i = end;
        while (i > 0 && Character.isWhitespace(content.charAt(i - 1))) {
            if (content.charAt(i - 1) == '\n') {
                return "";
            }
            i--;
        }
        if (i == 0) {
            return "";
        }
        char last = content.charAt(i - 1);
        if ((last == '>' || last == ']') && i > 1) {
            char before = content.charAt(i - 2);
            return Character.isJavaIdentifierPart(before) || before == '>' || before == '[' ? String.valueOf(last) : "";
        }
        int wordEnd = i;
        while (i > 0 && Character.isJavaIdentifierPart(content.charAt(i - 1))) {
            i--;
        }
        return content.substring(i, wordEnd);
    }

    private static boolean isConstructorOrDeclaration(String previous) {
        if (previous.isEmpty()) {
            return false;
        }
        String word = previous.toLowerCase(Locale.ROOT);
        if ("new".equals(word)) {
            return true;
        }
        return !EXPRESSION_KEYWORDS.contains(word) && !Character.isDigit(previous.charAt(0));
    }

    public static Optional<String> modifierKeyword(String attribute) {
        return Optional.ofNullable(MODIFIER_KEYWORDS.get(attribute));
    }

    /**
     * Generic keyword extraction: split on relational and bracket operators,
     * drop attribute references and boolean words.
     */
    public static List<String> keywords(String expression, Pattern splitOn, Set<String> extraStopWords) {
        return Arrays.stream(splitOn.split(expression))
                .map(String::trim)
                .map(token -> token.replaceAll("^['\"]|['\"]$", "").trim())
                .map(token -> token.replaceAll("^[./]+", ""))
                .filter(token -> !token.isEmpty())
                .filter(token -> !token.startsWith("@"))
                .filter(token -> !BOOLEAN_WORDS.contains(token.toLowerCase(Locale.ROOT)))
                .filter(token -> !extraStopWords.contains(token.toLowerCase(Locale.ROOT)))
                .distinct()
                .toList();
    }

    public static List<String> keywords(String expression) {
        return keywords(expression, KEYWORD_SPLIT, Set.of());
    }
}
