package com.vidnyan.rulecov.domain.rule;

import java.nio.file.Path;
import java.util.List;

/**
 * A rule file as read from disk: metadata plus the raw text of each example.
 */
public record RuleDocument(
    Path source,
    RuleMetadata metadata,
    List<ExampleBlock> examples
) {

    public RuleDocument {
        examples = List.copyOf(examples);
    }

    /**
     * Raw text of one {@code <example>} element.
     *
     * @param exampleIndex 1-based position among all example elements
     * @param content      trimmed element text
     */
    public record ExampleBlock(int exampleIndex, String content) {
    }
}
