package com.vidnyan.rulecov.domain.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a {@link QueryAnalysis} from an XPath rule query.
 * Pure and deterministic: no I/O, no state between calls.
 */
@Slf4j
@Component
public class QueryAnalyzer {

    private static final Pattern PATH_STEP = Pattern.compile("(//|/|::)\\s*(?=[A-Za-z])");
    private static final Pattern ATTRIBUTE = Pattern.compile("@([A-Za-z][A-Za-z0-9]*)");
    private static final Pattern OPERATOR = Pattern.compile(
            "!=|<=|>=|:=|=|<|>|(?<![\\w-])(and|or|not)(?![\\w-])");
    private static final Pattern LET_BINDING = Pattern.compile("(?<![\\w-])let\\s+\\$");
    private static final Pattern LET_VARIABLE = Pattern.compile("\\$([A-Za-z_][\\w-]*)\\s*(:=|=)");
    private static final Pattern RETURN_KEYWORD = Pattern.compile("(?<![\\w-])return(?![\\w-])");
    private static final Pattern IF_PREDICATE = Pattern.compile("^if\\s*\\(");
    private static final Pattern QUANTIFIED_PREDICATE = Pattern.compile("^(every|some)\\s+\\$");
    private static final String FUNCTION_NAME = "[A-Za-z][\\w-]*(?::[\\w-]+)?";

    public QueryAnalysis analyze(String query) {
        if (query == null || query.isBlank()) {
            return QueryAnalysis.empty();
        }
        String masked = QueryText.mask(query);

        QueryAnalysis analysis = new QueryAnalysis(
                Collections.unmodifiableSet(extractNodeTypes(masked)),
                Collections.unmodifiableSet(extractAttributes(masked)),
                Collections.unmodifiableSet(extractOperators(masked)),
                List.copyOf(extractConditionals(query, masked)),
                Collections.unmodifiableMap(extractLetVariables(query)),
                LET_BINDING.matcher(masked).find(),
                containsUnion(masked)
        );
        log.debug("Analyzed query: {} node types, {} attributes, {} conditionals",
                analysis.nodeTypes().size(), analysis.attributes().size(), analysis.conditionals().size());
        return analysis;
    }

    private Set<String> extractNodeTypes(String masked) {
        Set<String> nodeTypes = new LinkedHashSet<>();
        Matcher matcher = PATH_STEP.matcher(masked);
        while (matcher.find()) {
            NodeTypeVocabulary.longestMatch(masked, matcher.end()).ifPresent(nodeTypes::add);
        }
        return nodeTypes;
    }

    private Set<String> extractAttributes(String masked) {
        Set<String> attributes = new LinkedHashSet<>();
        Matcher matcher = ATTRIBUTE.matcher(masked);
        while (matcher.find()) {
            attributes.add(matcher.group(1));
        }
        return attributes;
    }

    private Set<String> extractOperators(String masked) {
        Set<String> operators = new LinkedHashSet<>();
        Matcher matcher = OPERATOR.matcher(masked);
        while (matcher.find()) {
            String operator = matcher.group();
            if (!operator.equals(":=")) {
                operators.add(operator);
            }
        }
        return operators;
    }

    private boolean containsUnion(String masked) {
        for (int i = 0; i < masked.length(); i++) {
            if (masked.charAt(i) != '|') {
                continue;
            }
            boolean doubled = (i > 0 && masked.charAt(i - 1) == '|')
                    || (i + 1 < masked.length() && masked.charAt(i + 1) == '|');
            if (!doubled) {
                return true;
            }
        }
        return false;
    }

    // Conditionals

    private List<Conditional> extractConditionals(String query, String masked) {
        List<Conditional> conditionals = new ArrayList<>();
        for (int open = masked.indexOf('['); open >= 0; open = masked.indexOf('[', open + 1)) {
            int close = QueryText.findClosing(masked, open);
            if (close < 0) {
                log.debug("Unbalanced predicate at offset {}", open);
                continue;
            }
            QueryText.Segment body = new QueryText.Segment(query.substring(open + 1, close), open + 1).trimmed();
            if (!body.text().isEmpty()) {
                classify(body, conditionals);
            }
        }
        conditionals.sort(Comparator.comparingInt(Conditional::position));
        return conditionals;
    }

    private void classify(QueryText.Segment predicate, List<Conditional> out) {
        String maskedText = QueryText.mask(predicate.text());

        if (IF_PREDICATE.matcher(maskedText).find()) {
            out.add(Conditional.of(ConditionalKind.IF, predicate));
            return;
        }
        if (QUANTIFIED_PREDICATE.matcher(maskedText).find()) {
            out.add(Conditional.of(ConditionalKind.QUANTIFIED, predicate));
            return;
        }
        if (QueryText.isSingleCall(predicate.text(), "not")) {
            out.add(Conditional.of(ConditionalKind.NOT, QueryText.callArguments(predicate.text(), predicate.offset())));
            return;
        }
        for (ConditionalKind kind : List.of(ConditionalKind.AND, ConditionalKind.OR)) {
            List<QueryText.Segment> parts = QueryText.splitTopLevel(predicate.text(), kind.label());
            if (parts.size() > 1) {
                out.add(Conditional.of(kind, predicate));
                for (QueryText.Segment part : parts) {
                    if (QueryText.isSingleCall(part.text(), "not")) {
                        QueryText.Segment inner = QueryText.callArguments(part.text(), predicate.offset() + part.offset());
                        out.add(Conditional.of(ConditionalKind.NOT, inner));
                    }
                }
                return;
            }
        }
        if (QueryText.isSingleCall(predicate.text(), FUNCTION_NAME)) {
            out.add(Conditional.of(ConditionalKind.BOOLEAN_FUNCTION, predicate));
        }
    }

    // Let bindings

    /**
     * Variables bound by {@code let} clauses, in binding order.
     * Both {@code :=} and {@code =} are accepted as the binding operator.
     */
    public Map<String, String> extractLetVariables(String query) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (query == null) {
            return variables;
        }
        String masked = QueryText.mask(query);
        Matcher let = LET_BINDING.matcher(masked);
        int from = 0;
        while (let.find(from)) {
            int cursor = let.end() - 1;
            while (true) {
                Matcher variable = LET_VARIABLE.matcher(masked).region(cursor, masked.length());
                if (!variable.lookingAt()) {
                    break;
                }
                int expressionStart = variable.end();
                int expressionEnd = scanBindingEnd(masked, expressionStart);
                variables.put(variable.group(1), query.substring(expressionStart, expressionEnd).trim());
                cursor = expressionEnd;
                if (cursor < masked.length() && masked.charAt(cursor) == ',') {
                    cursor = skipWhitespace(masked, cursor + 1);
                    continue;
                }
                break;
            }
            from = Math.max(cursor, let.end());
            if (from >= masked.length()) {
                break;
            }
        }
        return variables;
    }

    private int scanBindingEnd(String masked, int start) {
        int depth = 0;
        for (int i = start; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth == 0 && c == ',') {
                return i;
            } else if (depth == 0 && RETURN_KEYWORD.matcher(masked)
                    .useTransparentBounds(true)
                    .region(i, masked.length())
                    .lookingAt()) {
                return i;
            }
        }
        return masked.length();
    }

    private int skipWhitespace(String text, int index) {
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }
}
