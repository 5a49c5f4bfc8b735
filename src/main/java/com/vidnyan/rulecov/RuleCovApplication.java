package com.vidnyan.rulecov;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RuleCov - coverage-guided verification of PMD Apex XPath rules.
 *
 * Checks that a rule's annotated examples exercise its query and that the
 * rule engine agrees with every violation and valid marker.
 */
@SpringBootApplication
public class RuleCovApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuleCovApplication.class, args);
    }
}
