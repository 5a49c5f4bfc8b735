package com.vidnyan.rulecov;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the rule test harness.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "rulecov")
public class RuleCovProperties {

    /**
     * Rule files to test when run from the command line.
     */
    private List<String> ruleFiles = new ArrayList<>();

    /**
     * Maximum examples of one rule run at the same time.
     * Zero or less means the number of available processors.
     */
    private int exampleConcurrency = 0;

    private Engine engine = new Engine();

    private Fixture fixture = new Fixture();

    private Report report = new Report();

    private SyntaxTree syntaxTree = new SyntaxTree();

    public int effectiveExampleConcurrency() {
        return exampleConcurrency > 0 ? exampleConcurrency : Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Engine {
        /**
         * PMD executable, resolved on the PATH when not absolute.
         */
        private String command = "pmd";

        /**
         * Per invocation timeout; the process tree is destroyed when it expires.
         */
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Fixture {
        /**
         * Directory for generated fixtures. Blank means the system temp directory.
         */
        private String directory = "";
    }

    @Data
    public static class Report {
        /**
         * Where the JSON batch report is written. Blank disables the report file.
         */
        private String output = "";
    }

    @Data
    public static class SyntaxTree {
        /**
         * Parse examples to refine markers and node coverage.
         */
        private boolean enabled = true;
    }
}
