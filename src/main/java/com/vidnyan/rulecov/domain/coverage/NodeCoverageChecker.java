package com.vidnyan.rulecov.domain.coverage;

import com.vidnyan.rulecov.domain.query.NodeTypeVocabulary;
import com.vidnyan.rulecov.domain.syntax.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether example code plausibly produces a given syntax node type.
 */
@Slf4j
@Component
public class NodeCoverageChecker {

    public static final String SUBJECT = "Node types";

    private static final int CI = Pattern.CASE_INSENSITIVE;
    private static final Pattern NEW_LIST = Pattern.compile("\\bnew\\s+List\\s*[<(]", CI);
    private static final Pattern NEW_LIST_INIT = Pattern.compile("\\bnew\\s+List\\s*<[^>]*>\\s*\\(\\s*\\w", CI);
    private static final Pattern NEW_MAP = Pattern.compile("\\bnew\\s+Map\\s*[<(]", CI);
    private static final Pattern NEW_SET = Pattern.compile("\\bnew\\s+Set\\s*[<(]", CI);
    private static final Pattern NEW_OBJECT = Pattern.compile("\\bnew\\s+\\w+(\\.\\w+)*\\s*\\(", CI);
    private static final Pattern NEW_ARRAY = Pattern.compile("\\bnew\\s+\\w+\\s*\\[", CI);
    private static final Pattern CLASS = Pattern.compile("\\bclass\\s+\\w+", CI);
    private static final Pattern INTERFACE = Pattern.compile("\\binterface\\s+\\w+", CI);
    private static final Pattern ENUM = Pattern.compile("\\benum\\s+\\w+", CI);
    private static final Pattern TRIGGER = Pattern.compile("\\btrigger\\s+\\w+\\s+on\\s+\\w+", CI);
    private static final Pattern PARAMETER = Pattern.compile("\\w+\\s*\\(\\s*[\\w<>\\[\\],.]+\\s+\\w+", CI);
    private static final Pattern PROPERTY = Pattern.compile("\\{\\s*(get|set)\\s*[;{]", CI);
    private static final Pattern IF = Pattern.compile("\\bif\\s*\\(", CI);
    private static final Pattern ELSE = Pattern.compile("\\belse\\b", CI);
    private static final Pattern WHILE = Pattern.compile("\\bwhile\\s*\\(", CI);
    private static final Pattern DO = Pattern.compile("\\bdo\\s*\\{", CI);
    private static final Pattern FOR = Pattern.compile("\\bfor\\s*\\(", CI);
    private static final Pattern FOR_EACH = Pattern.compile("\\bfor\\s*\\([^;)]*:", CI);
    private static final Pattern SWITCH = Pattern.compile("\\bswitch\\s+on\\b", CI);
    private static final Pattern WHEN = Pattern.compile("\\bwhen\\b", CI);
    private static final Pattern TRY = Pattern.compile("\\btry\\s*\\{", CI);
    private static final Pattern CATCH = Pattern.compile("\\bcatch\\s*\\(", CI);
    private static final Pattern RETURN = Pattern.compile("\\breturn\\b", CI);
    private static final Pattern THROW = Pattern.compile("\\bthrow\\b", CI);
    private static final Pattern BREAK = Pattern.compile("\\bbreak\\s*;", CI);
    private static final Pattern CONTINUE = Pattern.compile("\\bcontinue\\s*;", CI);
    private static final Pattern EMPTY_STATEMENT = Pattern.compile("(^|[;{}])\\s*;");
    private static final Pattern RUN_AS = Pattern.compile("\\bSystem\\.runAs\\s*\\(", CI);
    private static final Pattern VARIABLE_DECLARATION = Pattern.compile("\\b[\\w<>\\[\\],.]+\\s+\\w+\\s*(=[^=]|;)");
    private static final Pattern ASSIGNMENT = Pattern.compile("[^=!<>+\\-*/]=[^=]|[+\\-*/]=");
    private static final Pattern BOOLEAN = Pattern.compile("&&|\\|\\||==|!=|<=|>=|[^=<>!]<[^=<]|[^-=<>]>[^=>]");
    private static final Pattern BINARY = Pattern.compile("\\w\\s*[+\\-*/%]\\s*\\w");
    private static final Pattern PREFIX = Pattern.compile("(\\+\\+|--|!)\\s*\\w");
    private static final Pattern POSTFIX = Pattern.compile("\\w\\s*(\\+\\+|--)");
    private static final Pattern TERNARY = Pattern.compile("\\?[^:;]+:");
    private static final Pattern CAST = Pattern.compile("\\(\\s*[A-Z][\\w.<>]*\\s*\\)\\s*\\w");
    private static final Pattern INSTANCE_OF = Pattern.compile("\\binstanceof\\b", CI);
    private static final Pattern ARRAY_ACCESS = Pattern.compile("\\w\\s*\\[\\s*[\\w.]+\\s*]");
    private static final Pattern ARRAY_STORE = Pattern.compile("\\w\\s*\\[\\s*[\\w.]+\\s*]\\s*=[^=]");
    private static final Pattern SOQL = Pattern.compile("\\[\\s*SELECT\\b", CI);
    private static final Pattern SOSL = Pattern.compile("\\[\\s*FIND\\b", CI);
    private static final Pattern BINDING = Pattern.compile("\\[[^\\]]*:\\s*\\w", CI);
    private static final Pattern THIS = Pattern.compile("\\bthis\\b", CI);
    private static final Pattern THIS_CALL = Pattern.compile("\\bthis\\s*\\(", CI);
    private static final Pattern SUPER = Pattern.compile("\\bsuper\\b", CI);
    private static final Pattern SUPER_CALL = Pattern.compile("\\bsuper\\s*[.(]", CI);
    private static final Pattern TRIGGER_VARIABLE = Pattern.compile("\\bTrigger\\.(new|old|newMap|oldMap)\\b", CI);
    private static final Pattern REFERENCE = Pattern.compile("\\b\\w+\\.\\w+\\b");
    private static final Pattern IDENTIFIER = Pattern.compile("\\b[A-Za-z_]\\w*\\b");
    private static final Pattern MODIFIER = Pattern.compile(
            "\\b(public|private|protected|global|static|final|abstract|virtual|override|transient|webservice)\\b", CI);
    private static final Pattern FORMAL_COMMENT = Pattern.compile("/\\*\\*");
    private static final Pattern MAP_ENTRY = Pattern.compile("=>");
    private static final Pattern COMPOUND = Pattern.compile("\\{[^{}]*;[^{}]*}");

    public boolean isCovered(String nodeType, String content) {
        return isCovered(nodeType, content, List.of());
    }

    /**
     * Coverage of one node type. A parsed tree that contains the kind decides first,
     * then the text heuristic for the kind.
     */
    public boolean isCovered(String nodeType, String content, Collection<SyntaxNode> trees) {
        if (NodeTypeVocabulary.SCAFFOLDING.equals(nodeType)) {
            return true;
        }
        if (trees.stream().anyMatch(tree -> tree.containsKind(nodeType))) {
            return true;
        }
        return matchesShape(nodeType, content);
    }

    /**
     * Presence of a query token: node type names use their shape heuristic,
     * anything else a case-insensitive substring search.
     */
    public boolean isTokenPresent(String token, String content) {
        if (NodeTypeVocabulary.isKnown(token)) {
            return isCovered(token, content);
        }
        return CodePatterns.containsIgnoreCase(content, token);
    }

    /**
     * Check all node types of a query against the examples' combined content.
     */
    public CoverageResult check(Set<String> nodeTypes, String content, Collection<SyntaxNode> trees) {
        List<String> uncovered = new ArrayList<>();
        for (String nodeType : nodeTypes) {
            if (!isCovered(nodeType, content, trees)) {
                uncovered.add(nodeType);
            }
        }
        int covered = nodeTypes.size() - uncovered.size();
        String fraction = covered + "/" + nodeTypes.size() + " node types covered";
        CoverageEvidence evidence = new CoverageEvidence("node_types", fraction, covered, nodeTypes.size());
        log.debug("Node type coverage: {}", fraction);
        if (uncovered.isEmpty()) {
            return CoverageResult.covered(SUBJECT, fraction, List.of(evidence));
        }
        return CoverageResult.uncovered(SUBJECT, fraction + ", missing: " + String.join(", ", uncovered),
                List.of(evidence), uncovered);
    }

    private boolean matchesShape(String nodeType, String content) {
        return switch (nodeType) {
            case "ApexFile", "CompilationUnit" -> !content.isBlank();
            case "UserClass", "UserClassMethods" -> CodePatterns.matches(CLASS, content);
            case "UserInterface" -> CodePatterns.matches(INTERFACE, content);
            case "UserEnum", "EnumValue" -> CodePatterns.matches(ENUM, content);
            case "UserTrigger", "TriggerDeclaration" -> CodePatterns.matches(TRIGGER, content);
            case "UserExceptionMethods" -> CodePatterns.containsIgnoreCase(content, "Exception");
            case "AnonymousClass" -> CodePatterns.matches(NEW_OBJECT, content) && content.contains("{");
            case "Method", "MethodBlockStatement" -> CodePatterns.matches(CodePatterns.METHOD_SIGNATURE, content);
            case "Parameter" -> CodePatterns.matches(PARAMETER, content);
            case "Property", "PropertyGetter", "PropertySetter" -> CodePatterns.matches(PROPERTY, content);
            case "Field", "FieldDeclaration", "FieldDeclarationStatements" ->
                    CodePatterns.matches(CodePatterns.FIELD_DECLARATION, content);
            case "ModifierNode", "KeywordModifier" -> CodePatterns.matches(MODIFIER, content);
            case "Annotation" -> CodePatterns.matches(CodePatterns.ANNOTATION, content);
            case "AnnotationParameter" -> CodePatterns.matches(CodePatterns.ANNOTATION_PARAMETER, content);
            case "FormalComment" -> CodePatterns.matches(FORMAL_COMMENT, content);
            case "Identifier", "TypeRef" -> CodePatterns.matches(IDENTIFIER, content);
            case "ConstructorPreamble", "ConstructorPreambleStatement" ->
                    CodePatterns.matches(THIS_CALL, content) || CodePatterns.matches(SUPER_CALL, content);
            case "BlockStatement", "CompoundStatement", "Statement", "StatementExecuted", "ExpressionStatement" ->
                    CodePatterns.matches(COMPOUND, content) || content.contains(";");
            case "IfBlockStatement" -> CodePatterns.matches(IF, content);
            case "IfElseBlockStatement" -> CodePatterns.matches(IF, content) && CodePatterns.matches(ELSE, content);
            case "SwitchStatement" -> CodePatterns.matches(SWITCH, content);
            case "ValueWhenBlock", "TypeWhenBlock", "ElseWhenBlock", "WhenValue", "WhenType", "WhenElse" ->
                    CodePatterns.matches(SWITCH, content) && CodePatterns.matches(WHEN, content);
            case "WhileLoopStatement" -> CodePatterns.matches(WHILE, content);
            case "DoLoopStatement" -> CodePatterns.matches(DO, content);
            case "ForLoopStatement" -> CodePatterns.matches(FOR, content);
            case "ForEachStatement" -> CodePatterns.matches(FOR_EACH, content);
            case "ReturnStatement" -> CodePatterns.matches(RETURN, content);
            case "ThrowStatement" -> CodePatterns.matches(THROW, content);
            case "BreakStatement" -> CodePatterns.matches(BREAK, content);
            case "ContinueStatement" -> CodePatterns.matches(CONTINUE, content);
            case "EmptyStatement" -> CodePatterns.matches(EMPTY_STATEMENT, content);
            case "TryCatchFinallyBlockStatement" -> CodePatterns.matches(TRY, content);
            case "CatchBlockStatement" -> CodePatterns.matches(CATCH, content);
            case "RunAsBlockStatement" -> CodePatterns.matches(RUN_AS, content);
            case "VariableDeclaration", "VariableDeclarationStatements" ->
                    CodePatterns.matches(VARIABLE_DECLARATION, content);
            case "DmlInsertStatement" -> dml("insert", content);
            case "DmlUpdateStatement" -> dml("update", content);
            case "DmlDeleteStatement" -> dml("delete", content);
            case "DmlUndeleteStatement" -> dml("undelete", content);
            case "DmlUpsertStatement" -> dml("upsert", content);
            case "DmlMergeStatement" -> dml("merge", content);
            case "MethodCallExpression", "JavaMethodCallExpression" -> CodePatterns.containsCall(content);
            case "ThisMethodCallExpression" -> CodePatterns.matches(THIS_CALL, content);
            case "SuperMethodCallExpression" -> CodePatterns.matches(SUPER_CALL, content);
            case "ThisVariableExpression" -> CodePatterns.matches(THIS, content);
            case "SuperVariableExpression" -> CodePatterns.matches(SUPER, content);
            case "TriggerVariableExpression" -> CodePatterns.matches(TRIGGER_VARIABLE, content);
            case "VariableExpression", "JavaVariableExpression", "ReferenceExpression", "EmptyReferenceExpression" ->
                    CodePatterns.matches(IDENTIFIER, content);
            case "ClassRefExpression" -> CodePatterns.matches(REFERENCE, content);
            case "LiteralExpression" -> CodePatterns.matches(CodePatterns.STRING_LITERAL, content)
                    || CodePatterns.matches(CodePatterns.NUMBER_LITERAL, content)
                    || CodePatterns.containsWord(content, "null")
                    || CodePatterns.containsWord(content, "true")
                    || CodePatterns.containsWord(content, "false");
            case "BinaryExpression" -> CodePatterns.matches(BINARY, content);
            case "BooleanExpression" -> CodePatterns.matches(BOOLEAN, content);
            case "AssignmentExpression" -> CodePatterns.matches(ASSIGNMENT, content);
            case "PrefixExpression" -> CodePatterns.matches(PREFIX, content);
            case "PostfixExpression" -> CodePatterns.matches(POSTFIX, content);
            case "TernaryExpression" -> CodePatterns.matches(TERNARY, content);
            case "CastExpression" -> CodePatterns.matches(CAST, content);
            case "InstanceOfExpression" -> CodePatterns.matches(INSTANCE_OF, content);
            case "NestedExpression" -> content.contains("(");
            case "ArrayLoadExpression" -> CodePatterns.matches(ARRAY_ACCESS, content);
            case "ArrayStoreExpression", "IllegalStoreExpression" -> CodePatterns.matches(ARRAY_STORE, content);
            case "NewObjectExpression", "ConstructorInitializer", "NewKeyValueObjectExpression" ->
                    CodePatterns.matches(NEW_OBJECT, content);
            case "NewListLiteralExpression" -> CodePatterns.matches(NEW_LIST, content);
            case "NewListInitExpression" -> CodePatterns.matches(NEW_LIST_INIT, content);
            case "NewMapLiteralExpression", "NewMapInitExpression", "MapInitializer" ->
                    CodePatterns.matches(NEW_MAP, content);
            case "NewSetLiteralExpression", "NewSetInitExpression" -> CodePatterns.matches(NEW_SET, content);
            case "ValuesInitializer" -> content.contains("{") && CodePatterns.matches(NEW_OBJECT, content);
            case "SizedArrayInitializer" -> CodePatterns.matches(NEW_ARRAY, content);
            case "MapEntryNode" -> CodePatterns.matches(MAP_ENTRY, content);
            case "SoqlExpression" -> CodePatterns.matches(SOQL, content);
            case "SoslExpression" -> CodePatterns.matches(SOSL, content);
            case "SoqlOrSoslBinding" -> CodePatterns.matches(BINDING, content);
            default -> CodePatterns.containsIgnoreCase(content, nodeType);
        };
    }

    private boolean dml(String keyword, String content) {
        return Pattern.compile("\\b" + keyword + "\\s+\\w", CI).matcher(content).find()
                || Pattern.compile("\\bDatabase\\." + keyword + "\\s*\\(", CI).matcher(content).find();
    }
}
