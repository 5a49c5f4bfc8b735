package com.vidnyan.rulecov.application.port.out;

import com.vidnyan.rulecov.domain.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Port for optional syntax tree parsing of example snippets.
 * An empty result means text-only mode for that snippet.
 */
public interface SyntaxTreeParser {

    Optional<SyntaxNode> parse(String snippet);
}
