package com.autoheal.core.code;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree pass over a parsed file: long function bodies and except clauses with no
 * exception type.
 */
public class SyntaxTreeInspector {

    private final int longFunctionLines;

    public SyntaxTreeInspector(int longFunctionLines) {
        this.longFunctionLines = longFunctionLines;
    }

    public List<Issue> inspect(PythonSyntaxParser.ParsedSource parsed, String file) {
        List<Issue> issues = new ArrayList<>();

        parsed.walk(node -> {
            String type = node.getType();
            if ("function_definition".equals(type)) {
                checkFunctionLength(parsed, file, node, issues);
            } else if ("except_clause".equals(type) && isBareExcept(node)) {
                int line = node.getStartPoint().getRow() + 1;
                issues.add(new Issue(Issue.BARE_EXCEPT, Severity.MEDIUM, file, line,
                        "Bare except clause - catch specific exceptions", parsed.line(line)));
            }
        });

        return issues;
    }

    private void checkFunctionLength(PythonSyntaxParser.ParsedSource parsed, String file,
                                     TSNode node, List<Issue> issues) {
        int span = node.getEndPoint().getRow() - node.getStartPoint().getRow();
        if (span <= longFunctionLines) return;

        TSNode nameNode = node.getChildByFieldName("name");
        String name = nameNode != null && !nameNode.isNull() ? parsed.text(nameNode) : "<anonymous>";
        int line = node.getStartPoint().getRow() + 1;

        issues.add(new Issue(Issue.LONG_FUNCTION, Severity.LOW, file, line,
                "Function " + name + " is " + span + " lines long",
                "Functions should be at most " + longFunctionLines + " lines"));
    }

    /** An except clause whose only named children are its body and comments. */
    static boolean isBareExcept(TSNode exceptClause) {
        for (int i = 0; i < exceptClause.getNamedChildCount(); i++) {
            String childType = exceptClause.getNamedChild(i).getType();
            if (!"block".equals(childType) && !"comment".equals(childType)) {
                return false;
            }
        }
        return true;
    }
}
