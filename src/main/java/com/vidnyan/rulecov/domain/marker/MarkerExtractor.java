package com.vidnyan.rulecov.domain.marker;

import com.vidnyan.rulecov.domain.query.QueryAnalysis;
import com.vidnyan.rulecov.domain.query.QueryAnalyzer;
import com.vidnyan.rulecov.domain.syntax.SyntaxNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns annotated example text into violation and valid markers.
 * <p>
 * Inline glyph markers always win: when the text holds any inline marker,
 * section headers only switch mode and emit nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarkerExtractor {

    static final String INLINE_VIOLATION_PLACEHOLDER = "Inline violation marker";
    static final String INLINE_VALID_PLACEHOLDER = "Inline valid marker";
    static final String MAY_NOT_TRIGGER = " (rule may not trigger)";

    private final QueryAnalyzer queryAnalyzer;

    /**
     * Markers of one example, split by kind.
     */
    public record ExtractedMarkers(List<Marker> violationMarkers, List<Marker> validMarkers) {

        public static ExtractedMarkers none() {
            return new ExtractedMarkers(List.of(), List.of());
        }

        public boolean isEmpty() {
            return violationMarkers.isEmpty() && validMarkers.isEmpty();
        }
    }

    public ExtractedMarkers extract(String text) {
        return extract(text, null, null);
    }

    /**
     * Extract markers, refining inline markers with the syntax tree when one is given.
     *
     * @param text  raw example text
     * @param query rule query used for the trigger sanity note, may be null
     * @param tree  parsed example, may be null for text-only mode
     */
    public ExtractedMarkers extract(String text, String query, SyntaxNode tree) {
        List<String> lines = MarkerSyntax.lines(text);
        if (lines.isEmpty()) {
            return ExtractedMarkers.none();
        }
        boolean hasInline = lines.stream().anyMatch(line -> MarkerSyntax.inline(line).isPresent());

        List<Marker> violations = new ArrayList<>();
        List<Marker> valids = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;

            Optional<MarkerSyntax.InlineMatch> inline = MarkerSyntax.inline(line);
            if (inline.isPresent()) {
                MarkerKind kind = inline.get().kind();
                String description = inline.get().description().isEmpty()
                        ? inlinePlaceholder(kind)
                        : inline.get().description();
                add(kind, lineNumber, description, violations, valids);
                continue;
            }

            Optional<MarkerSyntax.HeaderMatch> header = MarkerSyntax.header(line);
            if (header.isPresent() && !hasInline) {
                MarkerKind kind = header.get().kind();
                String description = header.get().description().isEmpty()
                        ? kind.displayName()
                        : header.get().description();
                add(kind, lineNumber, description, violations, valids);
            }
        }

        if (tree != null) {
            QueryAnalysis analysis = queryAnalyzer.analyze(query);
            violations = refine(violations, lines, tree, analysis);
            valids = refine(valids, lines, tree, analysis);
        }
        return new ExtractedMarkers(List.copyOf(violations), List.copyOf(valids));
    }

    private void add(MarkerKind kind, int lineNumber, String description,
                     List<Marker> violations, List<Marker> valids) {
        List<Marker> target = kind == MarkerKind.VIOLATION ? violations : valids;
        target.add(Marker.of(lineNumber, description, kind, target.size()));
    }

    private String inlinePlaceholder(MarkerKind kind) {
        return kind == MarkerKind.VIOLATION ? INLINE_VIOLATION_PLACEHOLDER : INLINE_VALID_PLACEHOLDER;
    }

    private List<Marker> refine(List<Marker> markers, List<String> lines, SyntaxNode tree, QueryAnalysis analysis) {
        List<Marker> refined = new ArrayList<>(markers.size());
        for (Marker marker : markers) {
            if (MarkerSyntax.inline(lines.get(marker.lineNumber() - 1)).isEmpty()) {
                refined.add(marker);
                continue;
            }
            List<SyntaxNode> nodes = tree.startingOn(marker.lineNumber());
            if (nodes.isEmpty()) {
                refined.add(marker);
                continue;
            }
            SyntaxNode outermost = nodes.get(0);
            String description = marker.description();
            if (marker.isViolation() && !analysis.nodeTypes().isEmpty() && !mayTrigger(nodes, analysis)) {
                description = description + MAY_NOT_TRIGGER;
            }
            log.debug("Marker at line {} attributed to {}", marker.lineNumber(), outermost.kind());
            refined.add(marker.withNode(outermost.span().orElse(null), outermost.kind(), description));
        }
        return refined;
    }

    private boolean mayTrigger(List<SyntaxNode> nodesOnLine, QueryAnalysis analysis) {
        return nodesOnLine.stream()
                .flatMap(SyntaxNode::stream)
                .anyMatch(node -> analysis.nodeTypes().contains(node.kind()));
    }
}
