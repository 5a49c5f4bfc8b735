package com.vidnyan.rulecov.domain.query;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Known node type names of the PMD Apex syntax tree.
 */
public final class NodeTypeVocabulary {

    /** Node type that only represents generated scaffolding around real code. */
    public static final String SCAFFOLDING = "StandardCondition";

    private static final Set<String> NAMES = Set.of(
            // declarations
            "ApexFile", "CompilationUnit", "UserClass", "UserInterface", "UserEnum", "UserTrigger",
            "UserClassMethods", "UserExceptionMethods", "AnonymousClass", "TriggerDeclaration",
            "Method", "MethodBlockStatement", "Parameter", "Property", "PropertyGetter", "PropertySetter",
            "Field", "FieldDeclaration", "FieldDeclarationStatements", "EnumValue",
            "ModifierNode", "KeywordModifier", "Annotation", "AnnotationParameter", "FormalComment",
            "Identifier", "TypeRef", "ConstructorPreamble", "ConstructorPreambleStatement",
            // statements
            "BlockStatement", "ExpressionStatement", "Statement", "StatementExecuted",
            "IfBlockStatement", "IfElseBlockStatement", "ElseWhenBlock", "ValueWhenBlock", "TypeWhenBlock",
            "WhenValue", "WhenType", "WhenElse", "SwitchStatement",
            "WhileLoopStatement", "DoLoopStatement", "ForLoopStatement", "ForEachStatement",
            "ReturnStatement", "ThrowStatement", "BreakStatement", "ContinueStatement", "EmptyStatement",
            "CompoundStatement", "TryCatchFinallyBlockStatement", "CatchBlockStatement", "RunAsBlockStatement",
            "VariableDeclaration", "VariableDeclarationStatements",
            "DmlInsertStatement", "DmlUpdateStatement", "DmlDeleteStatement", "DmlUndeleteStatement",
            "DmlUpsertStatement", "DmlMergeStatement",
            // expressions
            "MethodCallExpression", "VariableExpression", "LiteralExpression", "BinaryExpression",
            "BooleanExpression", "AssignmentExpression", "PrefixExpression", "PostfixExpression",
            "TernaryExpression", "CastExpression", "InstanceOfExpression", "NestedExpression",
            "ArrayLoadExpression", "ArrayStoreExpression", "ClassRefExpression", "ReferenceExpression",
            "EmptyReferenceExpression", "IllegalStoreExpression", "TriggerVariableExpression",
            "ThisVariableExpression", "SuperVariableExpression", "ThisMethodCallExpression",
            "SuperMethodCallExpression", "JavaVariableExpression", "JavaMethodCallExpression",
            "NewObjectExpression", "NewListLiteralExpression", "NewListInitExpression",
            "NewMapLiteralExpression", "NewMapInitExpression", "NewSetLiteralExpression",
            "NewSetInitExpression", "NewKeyValueObjectExpression", "MapEntryNode",
            "ConstructorInitializer", "ValuesInitializer", "MapInitializer", "SizedArrayInitializer",
            "SoqlExpression", "SoslExpression", "SoqlOrSoslBinding", "StandardCondition"
    );

    private static final List<String> BY_LENGTH = NAMES.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .toList();

    private NodeTypeVocabulary() {
    }

    public static boolean isKnown(String name) {
        return NAMES.contains(name);
    }

    /**
     * Longest known name starting at {@code start} that ends on an identifier boundary.
     */
    public static Optional<String> longestMatch(String text, int start) {
        for (String name : BY_LENGTH) {
            int end = start + name.length();
            if (text.startsWith(name, start)
                    && (end == text.length() || !Character.isJavaIdentifierPart(text.charAt(end)))) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
