package com.autoheal.core.code;

import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Compile-time rules of Python 3 that the tree-sitter grammar does not enforce.
 *
 * The grammar still accepts Python 2 statements (print, exec, "except E, e:", the
 * {@code <>} operator, long and octal literals), and it reads a body that is not
 * indented as an empty block followed by top-level code. CPython rejects all of
 * these, so they are reported like any other syntax error. Only runs on trees
 * without ERROR or MISSING nodes.
 */
final class Python3Rules {

    private static final Pattern LEGACY_OCTAL = Pattern.compile("0[0-9_]*[1-9][0-9_]*");
    private static final Pattern LONG_SUFFIX  = Pattern.compile("[0-9a-fA-FxXoObB_]+[lL]");

    private Python3Rules() {}

    static Optional<PythonSyntaxParser.SyntaxProblem> firstViolation(PythonSyntaxParser.ParsedSource parsed) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(parsed.root(), false, false));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Optional<PythonSyntaxParser.SyntaxProblem> problem = check(parsed, frame);
            if (problem.isPresent()) {
                return problem;
            }

            TSNode node = frame.node;
            String type = node.getType();
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (child == null || child.isNull()) continue;
                stack.push(new Frame(child, childInFunction(type, frame), childInLoop(type, child, frame)));
            }
        }
        return Optional.empty();
    }

    // =========================================================================
    // Scope tracking
    // =========================================================================

    private static boolean childInFunction(String parentType, Frame parent) {
        switch (parentType) {
            case "function_definition":
            case "lambda":
                return true;
            case "class_definition":
                return false;
            default:
                return parent.inFunction;
        }
    }

    /** A loop's else clause belongs to the enclosing loop, not to this one. */
    private static boolean childInLoop(String parentType, TSNode child, Frame parent) {
        switch (parentType) {
            case "for_statement":
            case "while_statement":
                return !"else_clause".equals(child.getType()) || parent.inLoop;
            case "function_definition":
            case "class_definition":
            case "lambda":
                return false;
            default:
                return parent.inLoop;
        }
    }

    // =========================================================================
    // Checks
    // =========================================================================

    private static Optional<PythonSyntaxParser.SyntaxProblem> check(PythonSyntaxParser.ParsedSource parsed,
                                                                    Frame frame) {
        TSNode node = frame.node;
        switch (node.getType()) {
            case "module":
                return checkTopLevelIndent(node);
            case "print_statement":
                return problem(node, "Missing parentheses in call to 'print'");
            case "exec_statement":
                return problem(node, "Missing parentheses in call to 'exec'");
            case "except_clause":
                if (hasDirectChild(node, ",")) {
                    return problem(node, "multiple exception types must be parenthesized");
                }
                break;
            case "comparison_operator":
                if (hasDirectChild(node, "<>")) {
                    return problem(node, "invalid syntax '<>'");
                }
                break;
            case "integer":
                String literal = parsed.text(node);
                if (LEGACY_OCTAL.matcher(literal).matches()) {
                    return problem(node, "leading zeros in decimal integer literals are not permitted");
                }
                if (LONG_SUFFIX.matcher(literal).matches()) {
                    return problem(node, "invalid decimal literal '" + literal + "'");
                }
                break;
            case "return_statement":
                if (!frame.inFunction) return problem(node, "'return' outside function");
                break;
            case "yield":
                // the keyword token inside a yield expression shares the type but has no children
                if (node.getChildCount() > 0 && !frame.inFunction) return problem(node, "'yield' outside function");
                break;
            case "break_statement":
                if (!frame.inLoop) return problem(node, "'break' outside loop");
                break;
            case "continue_statement":
                if (!frame.inLoop) return problem(node, "'continue' not properly in loop");
                break;
            default:
                break;
        }
        return checkBlocks(node);
    }

    private static Optional<PythonSyntaxParser.SyntaxProblem> checkTopLevelIndent(TSNode module) {
        int lastRow = -1;
        for (TSNode statement : statements(module)) {
            int row = statement.getStartPoint().getRow();
            if (row != lastRow && statement.getStartPoint().getColumn() != 0) {
                return problem(statement, "unexpected indent");
            }
            lastRow = row;
        }
        return Optional.empty();
    }

    /** Every block owned by this node must be indented past the header, at one consistent depth. */
    private static Optional<PythonSyntaxParser.SyntaxProblem> checkBlocks(TSNode owner) {
        int colonRow = owner.getStartPoint().getRow();

        for (int i = 0; i < owner.getChildCount(); i++) {
            TSNode child = owner.getChild(i);
            if (child == null || child.isNull()) continue;

            if (":".equals(child.getType())) {
                colonRow = child.getStartPoint().getRow();
                continue;
            }
            if (!"block".equals(child.getType())) continue;

            List<TSNode> statements = statements(child);
            if (statements.isEmpty()) {
                int line = colonRow + 2;
                return Optional.of(new PythonSyntaxParser.SyntaxProblem(line,
                        "Syntax error: expected an indented block after line " + (colonRow + 1)
                                + " at line " + line));
            }

            TSNode first = statements.get(0);
            if (first.getStartPoint().getRow() == colonRow) {
                continue; // body on the header line
            }

            int indent = first.getStartPoint().getColumn();
            if (indent <= owner.getStartPoint().getColumn()) {
                return problem(first, "expected an indented block");
            }

            int lastRow = first.getStartPoint().getRow();
            for (TSNode statement : statements.subList(1, statements.size())) {
                int row = statement.getStartPoint().getRow();
                if (row == lastRow) continue; // a; b on one line
                int column = statement.getStartPoint().getColumn();
                if (column < indent) {
                    return problem(statement, "unindent does not match any outer indentation level");
                }
                if (column > indent) {
                    return problem(statement, "unexpected indent");
                }
                lastRow = row;
            }
        }
        return Optional.empty();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static List<TSNode> statements(TSNode container) {
        List<TSNode> statements = new ArrayList<>();
        for (int i = 0; i < container.getNamedChildCount(); i++) {
            TSNode child = container.getNamedChild(i);
            if (child != null && !child.isNull() && !"comment".equals(child.getType())) {
                statements.add(child);
            }
        }
        return statements;
    }

    private static boolean hasDirectChild(TSNode node, String type) {
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && type.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    private static Optional<PythonSyntaxParser.SyntaxProblem> problem(TSNode node, String reason) {
        int line = node.getStartPoint().getRow() + 1;
        return Optional.of(new PythonSyntaxParser.SyntaxProblem(line, "Syntax error: " + reason + " at line " + line));
    }

    private static final class Frame {
        final TSNode  node;
        final boolean inFunction;
        final boolean inLoop;

        Frame(TSNode node, boolean inFunction, boolean inLoop) {
            this.node       = node;
            this.inFunction = inFunction;
            this.inLoop     = inLoop;
        }
    }
}
