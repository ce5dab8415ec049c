package com.autoheal.core.code;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PythonSyntaxParserTest {

    private final PythonSyntaxParser parser = new PythonSyntaxParser();

    @Test
    void testValidSource() {
        assertTrue(parser.isValid("def ok(a, b):\n    return a + b\n"));
        assertTrue(parser.isValid(""));
    }

    @Test
    void testInvalidSourceReportsLine() {
        Optional<PythonSyntaxParser.SyntaxProblem> problem =
                parser.findSyntaxError("x = 1\ny = 2\ndef broken(:\n    pass\n");

        assertTrue(problem.isPresent());
        assertEquals(3, problem.get().getLine());
        assertTrue(problem.get().getMessage().startsWith("Syntax error"));
    }

    @Test
    void testNodeTextUsesByteOffsets() {
        PythonSyntaxParser.ParsedSource parsed = parser.parse("name = \"héllo\"\nother = 1\n");
        StringBuilder identifiers = new StringBuilder();

        parsed.walk(node -> {
            if ("identifier".equals(node.getType())) {
                identifiers.append(parsed.text(node)).append(',');
            }
        });

        assertEquals("name,other,", identifiers.toString());
        assertEquals("other = 1", parsed.line(2));
        assertEquals("", parsed.line(99));
    }

    @Test
    void testPython2FormsAreRejected() {
        assertProblem("print \"hello\"\n", 1, "print");
        assertProblem("exec \"x = 1\"\n", 1, "exec");
        assertProblem("try:\n    pass\nexcept ValueError, e:\n    pass\n", 3, "parenthesized");
        assertProblem("if 1 <> 2:\n    pass\n", 1, "");
        assertProblem("mode = 0755\n", 1, "leading zeros");
        assertProblem("big = 10L\n", 1, "");
    }

    @Test
    void testBadIndentationIsRejected() {
        assertProblem("def f():\nreturn 1\n", 2, "");
        assertFalse(parser.isValid("x = 1\n    y = 2\n"));
        assertFalse(parser.isValid("def f():\n        x = 1\n    y = 2\n"));
        assertFalse(parser.isValid("def f():\n    # nothing yet\n"));
    }

    @Test
    void testStatementsOutsideTheirScopeAreRejected() {
        assertProblem("return 5\n", 1, "'return' outside function");
        assertProblem("x = 1\nbreak\n", 2, "'break' outside loop");
        assertProblem("class A:\n    return 1\n", 2, "'return' outside function");
        assertProblem("def f():\n    continue\n", 2, "'continue' not properly in loop");
    }

    @Test
    void testValidPython3StaysValid() {
        List<String> sources = List.of(
                "if x: a = 1; b = 2\n",
                "def f():\n    a = 1; b = 2\n    return a\n",
                "for i in range(3):\n    for j in range(3):\n        if j:\n            break\n    else:\n        continue\n",
                "def gen():\n    yield 1\n",
                "try:\n    pass\nexcept (ValueError, KeyError) as e:\n    pass\n",
                "print('x')\nexec('y = 1')\n",
                "mode = 0o755\nzero = 00\nbig = 10\n",
                "class A:\n    \"\"\"Doc.\"\"\"\n\n    def m(self):\n        return [x for x in range(3)]\n",
                "x = (1 +\n     2)\n",
                "while True:\n    # comment\n    break\n",
                "async def f():\n    await g()\n    return 1\n",
                "if a:\n    pass\nelif b:\n    pass\nelse:\n    pass\n",
                "def f(\n    a,\n    b,\n):\n    return a\n");

        for (String source : sources) {
            assertEquals(Optional.empty(), parser.findSyntaxError(source).map(Object::toString), source);
        }
    }

    private void assertProblem(String source, int line, String messagePart) {
        Optional<PythonSyntaxParser.SyntaxProblem> problem = parser.findSyntaxError(source);

        assertTrue(problem.isPresent(), source);
        assertEquals(line, problem.get().getLine(), source);
        assertTrue(problem.get().getMessage().startsWith("Syntax error"), problem.get().getMessage());
        assertTrue(problem.get().getMessage().contains(messagePart), problem.get().getMessage());
    }
}
