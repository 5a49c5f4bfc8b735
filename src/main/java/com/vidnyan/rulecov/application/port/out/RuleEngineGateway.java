package com.vidnyan.rulecov.application.port.out;

import com.vidnyan.rulecov.domain.oracle.EngineOutcome;

import java.nio.file.Path;

/**
 * Port for running the external rule engine on a fixture.
 * Failures are returned as {@link EngineOutcome#failure(String)}, not thrown.
 */
public interface RuleEngineGateway {

    EngineOutcome run(Path fixturePath, Path ruleFile);
}
