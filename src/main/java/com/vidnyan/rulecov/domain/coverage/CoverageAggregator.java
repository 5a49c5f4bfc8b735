package com.vidnyan.rulecov.domain.coverage;

import com.vidnyan.rulecov.domain.coverage.strategy.ConditionalCoverageStrategies;
import com.vidnyan.rulecov.domain.marker.Example;
import com.vidnyan.rulecov.domain.marker.Marker;
import com.vidnyan.rulecov.domain.marker.MarkerSpans;
import com.vidnyan.rulecov.domain.query.Conditional;
import com.vidnyan.rulecov.domain.query.NodeTypeVocabulary;
import com.vidnyan.rulecov.domain.query.QueryAnalysis;
import com.vidnyan.rulecov.domain.query.QueryAnalyzer;
import com.vidnyan.rulecov.domain.syntax.SyntaxNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Combines node type, attribute and conditional coverage of a rule's examples
 * into one {@link RuleCoverageResult}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoverageAggregator {

    static final String NOTHING_TO_CHECK = "No query or examples to check";
    static final String METHOD_CALL = "MethodCallExpression";

    private final QueryAnalyzer queryAnalyzer;
    private final NodeCoverageChecker nodeChecker;
    private final AttributeCoverageChecker attributeChecker;
    private final ConditionalCoverageStrategies strategies;

    public RuleCoverageResult aggregate(String query, List<Example> examples) {
        return aggregate(query, examples, List.of());
    }

    /**
     * Check coverage of a query by its examples.
     *
     * @param trees parsed examples, empty in text-only mode
     */
    public RuleCoverageResult aggregate(String query, List<Example> examples, Collection<SyntaxNode> trees) {
        if (query == null || query.isBlank() || examples.isEmpty()) {
            return RuleCoverageResult.empty(NOTHING_TO_CHECK);
        }
        QueryAnalysis analysis = queryAnalyzer.analyze(query);
        String content = examples.stream()
                .sorted(Comparator.comparingInt(Example::exampleIndex))
                .map(Example::content)
                .collect(Collectors.joining("\n"));

        List<CoverageResult> results = new ArrayList<>();
        if (!analysis.nodeTypes().isEmpty()) {
            results.add(nodeChecker.check(analysis.nodeTypes(), content, trees));
        }
        if (!analysis.attributes().isEmpty()) {
            results.add(attributeChecker.check(analysis.attributes(), query, content));
        }
        for (Conditional conditional : analysis.conditionals()) {
            results.add(strategies.check(conditional, content));
        }

        List<RedundantBranch> redundant = findRedundantBranches(analysis, examples, new CoverageLedger());
        RuleCoverageResult result = combine(results, redundant);
        log.debug("Coverage: {}/{} results satisfied, {} redundant branches",
                result.coveredCount(), results.size(), redundant.size());
        return result;
    }

    /**
     * Pure combination of individual results. Uncovered branches keep result order.
     */
    public RuleCoverageResult combine(List<CoverageResult> results, List<RedundantBranch> redundant) {
        List<String> uncovered = new ArrayList<>();
        for (CoverageResult result : results) {
            if (result.success()) {
                continue;
            }
            if (result.details().isEmpty()) {
                uncovered.add(result.subject());
            } else {
                result.details().forEach(detail -> uncovered.add(result.subject() + ": " + detail));
            }
        }
        boolean overall = results.stream().allMatch(CoverageResult::success);
        return new RuleCoverageResult(results, uncovered, redundant, overall);
    }

    /**
     * Branches that an example exercises after an earlier example already did.
     * Method calls are told apart by call name; other node kinds only by kind and section.
     */
    public List<RedundantBranch> findRedundantBranches(QueryAnalysis analysis, List<Example> examples,
                                                       CoverageLedger ledger) {
        List<RedundantBranch> redundant = new ArrayList<>();
        List<Example> ordered = examples.stream()
                .sorted(Comparator.comparingInt(Example::exampleIndex))
                .toList();
        for (Example example : ordered) {
            List<Marker> markers = example.allMarkers().toList();
            for (Marker marker : markers) {
                String code = String.join("\n", MarkerSpans.codeLines(marker, example));
                if (code.isBlank()) {
                    continue;
                }
                for (BranchSignature signature : signatures(analysis, marker, code)) {
                    OptionalInt first = ledger.record(signature, example.exampleIndex());
                    if (first.isPresent()) {
                        redundant.add(new RedundantBranch(example.exampleIndex(), signature, first.getAsInt()));
                    }
                }
            }
        }
        return redundant;
    }

    private List<BranchSignature> signatures(QueryAnalysis analysis, Marker marker, String code) {
        List<BranchSignature> signatures = new ArrayList<>();
        for (String nodeType : analysis.nodeTypes()) {
            if (NodeTypeVocabulary.SCAFFOLDING.equals(nodeType)) {
                continue;
            }
            if (METHOD_CALL.equals(nodeType)) {
                for (String callName : CodePatterns.callNames(code)) {
                    signatures.add(new BranchSignature(marker.kind(), nodeType, callName));
                }
            } else if (nodeChecker.isCovered(nodeType, code)) {
                signatures.add(new BranchSignature(marker.kind(), nodeType, ""));
            }
        }
        return signatures;
    }
}
