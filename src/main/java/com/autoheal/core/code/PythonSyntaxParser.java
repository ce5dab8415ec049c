package com.autoheal.core.code;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Thin wrapper over the tree-sitter Python grammar.
 *
 * tree-sitter never rejects input; it recovers and marks the damage with ERROR and
 * MISSING nodes. A source is treated as unparseable when its tree contains either,
 * or when a clean tree breaks one of the {@link Python3Rules}.
 */
public class PythonSyntaxParser {

    public ParsedSource parse(String source) {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        TSTree tree = Objects.requireNonNull(parser.parseString(null, source), "tree-sitter returned no tree");
        return new ParsedSource(tree, source);
    }

    /** First syntax problem in document order, if any. */
    public Optional<SyntaxProblem> findSyntaxError(String source) {
        return parse(source).firstSyntaxProblem();
    }

    public boolean isValid(String source) {
        return findSyntaxError(source).isEmpty();
    }

    // =========================================================================

    public static final class ParsedSource {

        private final TSTree tree;
        private final String source;
        private final byte[] bytes;
        private final String[] lines;

        ParsedSource(TSTree tree, String source) {
            this.tree   = tree;
            this.source = source;
            this.bytes  = source.getBytes(StandardCharsets.UTF_8);
            this.lines  = source.split("\\R", -1);
        }

        public TSNode root() {
            return tree.getRootNode();
        }

        public String source() {
            return source;
        }

        /** Node text; tree-sitter offsets are UTF-8 byte positions. */
        public String text(TSNode node) {
            int start = Math.max(0, node.getStartByte());
            int end   = Math.min(bytes.length, node.getEndByte());
            return end > start ? new String(bytes, start, end - start, StandardCharsets.UTF_8) : "";
        }

        /** Source line by 1-based number, stripped; empty when out of range. */
        public String line(int lineNumber) {
            return lineNumber >= 1 && lineNumber <= lines.length ? lines[lineNumber - 1].strip() : "";
        }

        /** Pre-order walk without recursion; deep expression trees would overflow the stack. */
        public void walk(Consumer<TSNode> visitor) {
            Deque<TSNode> stack = new ArrayDeque<>();
            stack.push(root());
            while (!stack.isEmpty()) {
                TSNode node = stack.pop();
                visitor.accept(node);
                for (int i = node.getChildCount() - 1; i >= 0; i--) {
                    TSNode child = node.getChild(i);
                    if (child != null && !child.isNull()) {
                        stack.push(child);
                    }
                }
            }
        }

        public Optional<SyntaxProblem> firstSyntaxProblem() {
            TSNode root = root();
            if (!root.hasError()) {
                return Python3Rules.firstViolation(this);
            }

            Deque<TSNode> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                TSNode node = stack.pop();
                if ("ERROR".equals(node.getType()) || node.isMissing()) {
                    return Optional.of(describe(node));
                }
                for (int i = node.getChildCount() - 1; i >= 0; i--) {
                    TSNode child = node.getChild(i);
                    if (child != null && !child.isNull() && (child.hasError() || child.isMissing())) {
                        stack.push(child);
                    }
                }
            }
            // hasError() without a locatable node: report the start of the file
            return Optional.of(new SyntaxProblem(1, "Syntax error: invalid syntax"));
        }

        private SyntaxProblem describe(TSNode node) {
            int line = node.getStartPoint().getRow() + 1;
            if (node.isMissing()) {
                return new SyntaxProblem(line, "Syntax error: missing '" + node.getType() + "' at line " + line);
            }
            String snippet = text(node).strip();
            int newline = snippet.indexOf('\n');
            if (newline >= 0) snippet = snippet.substring(0, newline);
            if (snippet.length() > 40) snippet = snippet.substring(0, 40) + "...";
            return new SyntaxProblem(line, snippet.isEmpty()
                    ? "Syntax error: invalid syntax at line " + line
                    : "Syntax error: invalid syntax near '" + snippet + "' at line " + line);
        }
    }

    public static final class SyntaxProblem {
        private final int    line;
        private final String message;

        public SyntaxProblem(int line, String message) {
            this.line    = line;
            this.message = message;
        }

        public int getLine()       { return line; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return message;
        }
    }
}
