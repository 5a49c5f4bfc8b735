package com.vidnyan.rulecov.domain.marker;

/**
 * Inclusive range of 1-based example lines.
 */
public record LineRange(int start, int end) {

    public boolean contains(int line) {
        return line >= start && line <= end;
    }
}
