package com.vidnyan.rulecov.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.vidnyan.rulecov.application.port.out.SyntaxTreeParser;
import com.vidnyan.rulecov.domain.syntax.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JavaParser-based implementation of SyntaxTreeParser.
 * <p>
 * Apex snippets are first rewritten into Java of identical layout: Apex-only
 * keywords are blanked or swapped for same-length Java keywords, DML statements
 * become {@code assert} statements and SOQL blocks become {@code null}. The
 * rewritten positions are remembered so those nodes get their Apex kinds back.
 * Java nodes without an Apex counterpart are dropped and their children lifted.
 */
@Slf4j
@Component
public class JavaParserSyntaxTreeParser implements SyntaxTreeParser {

    static final String ROOT_KIND = "ApexFile";

    private static final Pattern BLANKED_KEYWORDS = Pattern.compile(
            "(?i)\\b(?:with\\s+sharing|without\\s+sharing|inherited\\s+sharing|override|virtual|testmethod|webservice)\\b");
    private static final Pattern GLOBAL = Pattern.compile("\\bglobal\\b");
    private static final Pattern DML = Pattern.compile("(?i)\\b(insert|update|delete|upsert|undelete)(?=\\s+[\\w\\[])");
    private static final Pattern SOQL = Pattern.compile("(?i)\\[\\s*(SELECT|FIND)\\b[^\\]]*\\]");

    private static final Map<Class<? extends Node>, String> KINDS = new LinkedHashMap<>();

    static {
        KINDS.put(EnumDeclaration.class, "UserEnum");
        KINDS.put(EnumConstantDeclaration.class, "EnumValue");
        KINDS.put(MethodDeclaration.class, "Method");
        KINDS.put(ConstructorDeclaration.class, "Method");
        KINDS.put(Parameter.class, "Parameter");
        KINDS.put(FieldDeclaration.class, "FieldDeclarationStatements");
        KINDS.put(VariableDeclarationExpr.class, "VariableDeclarationStatements");
        KINDS.put(AnnotationExpr.class, "Annotation");
        KINDS.put(BlockStmt.class, "BlockStatement");
        KINDS.put(ExpressionStmt.class, "ExpressionStatement");
        KINDS.put(IfStmt.class, "IfBlockStatement");
        KINDS.put(ForStmt.class, "ForLoopStatement");
        KINDS.put(ForEachStmt.class, "ForEachStatement");
        KINDS.put(WhileStmt.class, "WhileLoopStatement");
        KINDS.put(DoStmt.class, "DoLoopStatement");
        KINDS.put(SwitchStmt.class, "SwitchStatement");
        KINDS.put(TryStmt.class, "TryCatchFinallyBlockStatement");
        KINDS.put(CatchClause.class, "CatchBlockStatement");
        KINDS.put(ReturnStmt.class, "ReturnStatement");
        KINDS.put(ThrowStmt.class, "ThrowStatement");
        KINDS.put(BreakStmt.class, "BreakStatement");
        KINDS.put(ContinueStmt.class, "ContinueStatement");
        KINDS.put(MethodCallExpr.class, "MethodCallExpression");
        KINDS.put(ObjectCreationExpr.class, "NewObjectExpression");
        KINDS.put(AssignExpr.class, "AssignmentExpression");
        KINDS.put(CastExpr.class, "CastExpression");
        KINDS.put(ConditionalExpr.class, "TernaryExpression");
        KINDS.put(InstanceOfExpr.class, "InstanceOfExpression");
        KINDS.put(EnclosedExpr.class, "NestedExpression");
        KINDS.put(ArrayAccessExpr.class, "ArrayLoadExpression");
        KINDS.put(ThisExpr.class, "ThisVariableExpression");
        KINDS.put(NameExpr.class, "VariableExpression");
        KINDS.put(FieldAccessExpr.class, "VariableExpression");
        KINDS.put(StringLiteralExpr.class, "LiteralExpression");
        KINDS.put(IntegerLiteralExpr.class, "LiteralExpression");
        KINDS.put(LongLiteralExpr.class, "LiteralExpression");
        KINDS.put(DoubleLiteralExpr.class, "LiteralExpression");
        KINDS.put(BooleanLiteralExpr.class, "LiteralExpression");
        KINDS.put(NullLiteralExpr.class, "LiteralExpression");
    }

    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    @Override
    public Optional<SyntaxNode> parse(String snippet) {
        if (snippet == null || snippet.isBlank()) {
            return Optional.empty();
        }
        Normalized normalized = normalize(snippet);

        Optional<SyntaxNode> tree = parseAs(normalized, Wrapping.NONE)
                .or(() -> parseAs(normalized, Wrapping.CLASS))
                .or(() -> parseAs(normalized, Wrapping.METHOD));
        if (tree.isEmpty()) {
            log.debug("Snippet could not be parsed, falling back to text-only mode");
        }
        return tree;
    }

    private Optional<SyntaxNode> parseAs(Normalized normalized, Wrapping wrapping) {
        String source = wrapping.prefix + normalized.text() + wrapping.suffix;
        ParseResult<CompilationUnit> result;
        synchronized (parser) {
            result = parser.parse(source);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.trace("Parse as {} failed: {}", wrapping, result.getProblems());
            return Optional.empty();
        }
        CompilationUnit unit = result.getResult().get();
        Converter converter = new Converter(wrapping.lineOffset, normalized.rewrittenKinds());
        List<Node> roots = wrapping.roots.apply(unit);
        if (roots == null) {
            return Optional.empty();
        }
        List<SyntaxNode> children = new ArrayList<>();
        roots.forEach(root -> children.addAll(converter.convert(root, 1)));
        return Optional.of(new SyntaxNode(ROOT_KIND, Map.of(), children));
    }

    /**
     * Rewrite Apex-only syntax into Java without moving any character.
     */
    Normalized normalize(String snippet) {
        Map<String, String> rewrittenKinds = new HashMap<>();
        StringBuilder text = new StringBuilder(snippet);
        quoteStrings(text);

        Matcher blanked = BLANKED_KEYWORDS.matcher(snippet);
        while (blanked.find()) {
            for (int i = blanked.start(); i < blanked.end(); i++) {
                if (text.charAt(i) != '\n') {
                    text.setCharAt(i, ' ');
                }
            }
        }
        Matcher global = GLOBAL.matcher(text.toString());
        while (global.find()) {
            text.replace(global.start(), global.end(), "public");
        }
        Matcher dml = DML.matcher(text.toString());
        while (dml.find()) {
            String keyword = dml.group(1);
            text.replace(dml.start(), dml.end(), "assert" + " ".repeat(keyword.length() - "assert".length()));
            rewrittenKinds.put(positionKey(text, dml.start()),
                    "Dml" + keyword.substring(0, 1).toUpperCase(Locale.ROOT)
                            + keyword.substring(1).toLowerCase(Locale.ROOT) + "Statement");
        }
        Matcher soql = SOQL.matcher(text.toString());
        while (soql.find()) {
            for (int i = soql.start(); i < soql.end(); i++) {
                if (text.charAt(i) != '\n') {
                    text.setCharAt(i, ' ');
                }
            }
            text.replace(soql.start(), soql.start() + 4, "null");
            rewrittenKinds.put(positionKey(text, soql.start()),
                    soql.group(1).equalsIgnoreCase("FIND") ? "SoslExpression" : "SoqlExpression");
        }
        return new Normalized(text.toString(), rewrittenKinds);
    }

    /**
     * Turn Apex single-quoted strings into Java string literals in place.
     * Comments are skipped so an apostrophe in prose does not open a string.
     */
    private static void quoteStrings(StringBuilder text) {
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
            if (c == '/' && next == '/') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                i = end < 0 ? text.length() : end + 2;
            } else if (c == '\'') {
                int end = i + 1;
                while (end < text.length() && text.charAt(end) != '\'' && text.charAt(end) != '\n') {
                    end += text.charAt(end) == '\\' ? 2 : 1;
                }
                if (end < text.length() && text.charAt(end) == '\'') {
                    for (int k = i + 1; k < end; k++) {
                        if (text.charAt(k) == '"' && text.charAt(k - 1) != '\\') {
                            text.setCharAt(k, '\'');
                        }
                    }
                    text.setCharAt(i, '"');
                    text.setCharAt(end, '"');
                }
                i = end + 1;
            } else {
                i++;
            }
        }
    }

    private static String positionKey(CharSequence text, int offset) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return line + ":" + column;
    }

    /**
     * Snippet rewritten to Java, with the Apex kind of each rewritten node by {@code line:column}.
     */
    record Normalized(String text, Map<String, String> rewrittenKinds) {}

    private enum Wrapping {
        NONE("", "", 0, unit -> unit.getTypes().stream().map(Node.class::cast).toList()),
        CLASS("class RuleCovSnippet {\n", "\n}", 1,
                unit -> unit.getType(0).getMembers().stream().map(Node.class::cast).toList()),
        METHOD("class RuleCovSnippet {\nvoid snippet() {\n", "\n}\n}", 2,
                unit -> unit.getType(0).getMethods().isEmpty()
                        ? null
                        : unit.getType(0).getMethods().get(0).getBody()
                                .map(body -> body.getStatements().stream().map(Node.class::cast).toList())
                                .orElse(null));

        private final String prefix;
        private final String suffix;
        private final int lineOffset;
        private final Function<CompilationUnit, List<Node>> roots;

        Wrapping(String prefix, String suffix, int lineOffset, Function<CompilationUnit, List<Node>> roots) {
            this.prefix = prefix;
            this.suffix = suffix;
            this.lineOffset = lineOffset;
            this.roots = roots;
        }
    }

    /**
     * Single top-down pass from JavaParser nodes to syntax nodes.
     * A node without a position takes the begin line handed down by its parent.
     */
    private static final class Converter {

        private final int lineOffset;
        private final Map<String, String> rewrittenKinds;

        Converter(int lineOffset, Map<String, String> rewrittenKinds) {
            this.lineOffset = lineOffset;
            this.rewrittenKinds = rewrittenKinds;
        }

        List<SyntaxNode> convert(Node node, int inheritedLine) {
            Optional<Position> begin = node.getBegin();
            int beginLine = begin.map(p -> p.line - lineOffset).orElse(inheritedLine);

            List<SyntaxNode> children = new ArrayList<>();
            for (Node child : node.getChildNodes()) {
                children.addAll(convert(child, beginLine));
            }
            String kind = kindOf(node);
            if (kind == null) {
                return children;
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put(SyntaxNode.BEGIN_LINE, String.valueOf(beginLine));
            begin.ifPresent(p -> attributes.put(SyntaxNode.BEGIN_COLUMN, String.valueOf(p.column)));
            node.getEnd().ifPresent(p -> {
                attributes.put(SyntaxNode.END_LINE, String.valueOf(p.line - lineOffset));
                attributes.put(SyntaxNode.END_COLUMN, String.valueOf(p.column));
            });
            describe(node, kind, attributes);
            return List.of(new SyntaxNode(kind, attributes, children));
        }

        private String kindOf(Node node) {
            if (node instanceof AssertStmt || node instanceof NullLiteralExpr) {
                String rewritten = node.getBegin()
                        .map(p -> rewrittenKinds.get((p.line - lineOffset) + ":" + p.column))
                        .orElse(null);
                if (rewritten != null) {
                    return rewritten;
                }
            }
            if (node instanceof ClassOrInterfaceDeclaration declaration) {
                return declaration.isInterface() ? "UserInterface" : "UserClass";
            }
            if (node instanceof VariableDeclarator) {
                return node.getParentNode().filter(FieldDeclaration.class::isInstance).isPresent()
                        ? "FieldDeclaration"
                        : "VariableDeclaration";
            }
            if (node instanceof BinaryExpr binary) {
                return binary.getOperator() == BinaryExpr.Operator.AND || binary.getOperator() == BinaryExpr.Operator.OR
                        ? "BooleanExpression"
                        : "BinaryExpression";
            }
            if (node instanceof UnaryExpr unary) {
                return unary.isPostfix() ? "PostfixExpression" : "PrefixExpression";
            }
            for (Map.Entry<Class<? extends Node>, String> entry : KINDS.entrySet()) {
                if (entry.getKey().isInstance(node)) {
                    return entry.getValue();
                }
            }
            return null;
        }

        private void describe(Node node, String kind, Map<String, String> attributes) {
            if (node instanceof NodeWithSimpleName<?> named) {
                attributes.put("Image", named.getNameAsString());
                attributes.put("Name", named.getNameAsString());
            }
            if (node instanceof NameExpr name) {
                attributes.put("Image", name.getNameAsString());
            }
            if (node instanceof AnnotationExpr annotation) {
                attributes.put("Name", annotation.getNameAsString());
                attributes.put("Image", annotation.getNameAsString());
            }
            if (node instanceof MethodCallExpr call) {
                attributes.put("MethodName", call.getNameAsString());
                attributes.put("FullMethodName", call.getScope()
                        .map(scope -> scope + "." + call.getNameAsString())
                        .orElse(call.getNameAsString()));
            }
            if (node instanceof TypeDeclaration<?> type) {
                attributes.put("Nested", String.valueOf(type.isNestedType()));
            }
            if (node instanceof NodeWithModifiers<?> modified) {
                for (Modifier modifier : modified.getModifiers()) {
                    String keyword = modifier.getKeyword().asString();
                    attributes.put(keyword.substring(0, 1).toUpperCase(Locale.ROOT) + keyword.substring(1), "true");
                }
            }
            if ("LiteralExpression".equals(kind)) {
                literal(node, attributes);
            }
        }

        private void literal(Node node, Map<String, String> attributes) {
            if (node instanceof StringLiteralExpr string) {
                attributes.put("LiteralType", "String");
                attributes.put("Image", string.getValue());
            } else if (node instanceof IntegerLiteralExpr || node instanceof LongLiteralExpr) {
                attributes.put("LiteralType", node instanceof LongLiteralExpr ? "Long" : "Integer");
                attributes.put("Image", ((LiteralStringValueExpr) node).getValue());
            } else if (node instanceof DoubleLiteralExpr number) {
                attributes.put("LiteralType", "Double");
                attributes.put("Image", number.getValue());
            } else if (node instanceof BooleanLiteralExpr bool) {
                attributes.put("LiteralType", "Boolean");
                attributes.put("Image", String.valueOf(bool.getValue()));
            } else if (node instanceof NullLiteralExpr) {
                attributes.put("LiteralType", "Null");
            }
        }
    }
}
