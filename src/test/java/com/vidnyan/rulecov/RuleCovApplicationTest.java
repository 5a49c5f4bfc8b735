package com.vidnyan.rulecov;

import com.vidnyan.rulecov.application.port.in.TestRuleUseCase;
import com.vidnyan.rulecov.application.port.out.FixtureGenerator;
import com.vidnyan.rulecov.application.port.out.RuleEngineGateway;
import com.vidnyan.rulecov.application.port.out.RuleFileReader;
import com.vidnyan.rulecov.application.port.out.SyntaxTreeParser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {"rulecov.engine.timeout=5s", "rulecov.example-concurrency=2"})
class RuleCovApplicationTest {

    @Autowired
    private TestRuleUseCase testRuleUseCase;

    @Autowired
    private RuleFileReader ruleFileReader;

    @Autowired
    private FixtureGenerator fixtureGenerator;

    @Autowired
    private RuleEngineGateway ruleEngineGateway;

    @Autowired
    private SyntaxTreeParser syntaxTreeParser;

    @Autowired
    private RuleCovProperties properties;

    @Test
    void contextLoads_ShouldWireEveryPortAndBindProperties() {
        assertNotNull(testRuleUseCase);
        assertNotNull(ruleFileReader);
        assertNotNull(fixtureGenerator);
        assertNotNull(ruleEngineGateway);
        assertNotNull(syntaxTreeParser);
        assertEquals(Duration.ofSeconds(5), properties.getEngine().getTimeout());
        assertEquals(2, properties.effectiveExampleConcurrency());
        assertEquals("pmd", properties.getEngine().getCommand());
        assertTrue(properties.getRuleFiles().isEmpty());
    }
}
