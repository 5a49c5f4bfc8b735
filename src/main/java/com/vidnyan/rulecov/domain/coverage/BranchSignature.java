package com.vidnyan.rulecov.domain.coverage;

import com.vidnyan.rulecov.domain.marker.MarkerKind;

/**
 * Identity of a query branch exercised by a marked section of an example.
 *
 * @param section       section type of the marker
 * @param nodeType      queried node type seen on the marker's lines
 * @param discriminator call name for method calls, empty for other node types
 */
public record BranchSignature(
    MarkerKind section,
    String nodeType,
    String discriminator
) {

    /**
     * True when the signature carries a call name rather than only a node kind.
     */
    public boolean isPrecise() {
        return !discriminator.isEmpty();
    }

    public String format() {
        String base = section.displayName() + " " + nodeType;
        return isPrecise() ? base + " " + discriminator : base;
    }
}
