package com.vidnyan.rulecov.application.port.out;

import com.vidnyan.rulecov.domain.rule.RuleDocument;

import java.nio.file.Path;

/**
 * Port for reading rule files.
 */
public interface RuleFileReader {

    /**
     * Read metadata and example texts of a rule file.
     * @throws com.vidnyan.rulecov.domain.rule.RuleFileReadException when the file cannot be read or parsed
     */
    RuleDocument read(Path ruleFile);
}
