package com.vidnyan.rulecov.domain.marker;

import com.vidnyan.rulecov.domain.syntax.SyntaxNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds an {@link Example} from raw example text.
 * Code lines are classified by the current section, and an inline glyph
 * overrides the section for its own line.
 */
@Component
@RequiredArgsConstructor
public class ExampleParser {

    private final MarkerExtractor markerExtractor;

    public Example parse(String content, int exampleIndex) {
        return parse(content, exampleIndex, null, null);
    }

    public Example parse(String content, int exampleIndex, String query, SyntaxNode tree) {
        List<String> violations = new ArrayList<>();
        List<String> valids = new ArrayList<>();
        MarkerKind currentMode = null;

        for (String line : MarkerSyntax.lines(content)) {
            if (line.isBlank()) {
                continue;
            }
            Optional<MarkerSyntax.InlineMatch> inline = MarkerSyntax.inline(line);
            if (inline.isPresent()) {
                String code = MarkerSyntax.codePart(line);
                if (!code.isEmpty()) {
                    (inline.get().kind() == MarkerKind.VIOLATION ? violations : valids).add(code);
                }
                continue;
            }
            Optional<MarkerSyntax.HeaderMatch> header = MarkerSyntax.header(line);
            if (header.isPresent()) {
                currentMode = header.get().kind();
                continue;
            }
            if (MarkerSyntax.isComment(line) || currentMode == null) {
                continue;
            }
            (currentMode == MarkerKind.VIOLATION ? violations : valids).add(line.trim());
        }

        MarkerExtractor.ExtractedMarkers markers = markerExtractor.extract(content, query, tree);
        return new Example(content, exampleIndex, violations, valids,
                markers.violationMarkers(), markers.validMarkers());
    }
}
