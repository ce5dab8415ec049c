package com.autoheal.core.code;

import com.autoheal.config.AutoHealProperties;
import com.autoheal.core.filesystem.FileSystemManager;
import com.autoheal.llm.StubLLMClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CodeAnalyzerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    static final String BARE_EXCEPT_SOURCE = String.join("\n",
            "import os",
            "",
            "",
            "def load(path):",
            "    data = None",
            "    with open(path) as fh:",
            "        data = fh.read()",
            "    try:",
            "        return int(data)",
            "    except:",
            "        return 0",
            "");

    @TempDir
    Path tempDir;

    private AutoHealProperties properties;
    private FileSystemManager  fileSystem;
    private StubLLMClient      model;

    @BeforeEach
    void setUp() {
        properties = new AutoHealProperties();
        properties.setWorkspacePath(tempDir.toString());
        fileSystem = new FileSystemManager(properties);
        model      = StubLLMClient.failing("offline");
    }

    private CodeAnalyzer analyzer() {
        return new CodeAnalyzer(properties, fileSystem, model.asModelClient(), CLOCK);
    }

    private void write(String file, String content) throws Exception {
        Path path = tempDir.resolve(file);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    private static List<Issue> ofKind(CodeAnalysis analysis, String kind) {
        return analysis.getIssues().stream().filter(i -> i.getKind().equals(kind)).collect(Collectors.toList());
    }

    @Test
    void testBareExceptReportedOnceAtItsLine() throws Exception {
        write("app.py", BARE_EXCEPT_SOURCE);

        CodeAnalysis analysis = analyzer().analyze();

        List<Issue> bare = ofKind(analysis, Issue.BARE_EXCEPT);
        assertEquals(1, bare.size(), "Tree pass and line pass must not double-report");
        assertEquals(10, bare.get(0).getLine());
        assertEquals(Severity.MEDIUM, bare.get(0).getSeverity());
        assertEquals("app.py", bare.get(0).getFile());
        assertEquals("except:", bare.get(0).getDetail());
    }

    @Test
    void testSyntaxErrorStopsOtherChecks() throws Exception {
        write("broken.py", "def broken(:\n    print('x')  # TODO fix\n");

        CodeAnalysis analysis = analyzer().analyze();

        assertEquals(1, analysis.getIssues().size());
        Issue issue = analysis.getIssues().get(0);
        assertEquals(Issue.SYNTAX_ERROR, issue.getKind());
        assertEquals(Severity.HIGH, issue.getSeverity());
        assertTrue(issue.getMessage().startsWith("Syntax error"));
        assertEquals(1, analysis.getMetrics().getHighSeverity());
        assertEquals(List.of("Address high-severity issues immediately"), analysis.getRecommendations());
    }

    @Test
    void testPython3RejectsAreSyntaxErrors() throws Exception {
        write("py2_print.py", "import os\nprint \"hello\"  # TODO drop\n");
        write("py2_exec.py", "exec \"x = 1\"\n");
        write("py2_except.py", "try:\n    pass\nexcept ValueError, e:\n    pass\n");
        write("unindented.py", "def f():\nreturn 1\n");
        write("top_return.py", "return 5\n");

        CodeAnalysis analysis = analyzer().analyze();

        assertEquals(5, analysis.getFilesAnalyzed());
        assertEquals(5, analysis.getIssues().size(), "Only the syntax error is reported per file");
        for (Issue issue : analysis.getIssues()) {
            assertEquals(Issue.SYNTAX_ERROR, issue.getKind(), issue.getFile());
            assertEquals(Severity.HIGH, issue.getSeverity(), issue.getFile());
        }
        assertEquals(3, analysis.getIssues().stream()
                .filter(i -> i.getFile().equals("py2_except.py")).findFirst().orElseThrow().getLine());
        assertEquals(5, analysis.getMetrics().getHighSeverity());
    }

    @Test
    void testLongFunction() throws Exception {
        properties.getAnalysis().setLongFunctionLines(3);
        write("long.py", String.join("\n",
                "def big():",
                "    a = 1",
                "    b = 2",
                "    c = 3",
                "    d = 4",
                "    return a + b + c + d",
                "",
                "def small():",
                "    return 1",
                ""));

        List<Issue> longFunctions = ofKind(analyzer().analyze(), Issue.LONG_FUNCTION);

        assertEquals(1, longFunctions.size());
        assertEquals(Severity.LOW, longFunctions.get(0).getSeverity());
        assertEquals(1, longFunctions.get(0).getLine());
        assertTrue(longFunctions.get(0).getMessage().startsWith("Function big is "));
    }

    @Test
    void testLineChecks() throws Exception {
        write("paths.py", String.join("\n",
                "DATA = \"/home/alice/data.csv\"  # TODO move to config",
                "print(DATA)",
                ""));

        CodeAnalysis analysis = analyzer().analyze();

        assertEquals(1, ofKind(analysis, Issue.HARDCODED_PATHS).size());
        assertEquals(1, ofKind(analysis, Issue.TODO_COMMENTS).size());
        assertEquals(2, ofKind(analysis, Issue.PRINT_DEBUG).get(0).getLine());
        assertEquals(3, analysis.getMetrics().getMediumSeverity());
    }

    @Test
    void testOptimizationOpportunities() throws Exception {
        write("loops.py", String.join("\n",
                "result = []",
                "result.append(1)",
                "result.append(2)",
                "result.append(3)",
                "for i in range(len(result)):",
                "    total = result[i]",
                ""));

        CodeAnalysis analysis = analyzer().analyze();

        List<Optimization> optimizations = analysis.getOptimizations();
        assertEquals(2, optimizations.size());

        Optimization append = optimizations.stream()
                .filter(o -> o.getKind().equals(Optimization.MULTIPLE_APPEND)).findFirst().orElseThrow();
        assertEquals(2, append.getLine(), "A run is reported once, at its first call");

        Optimization iteration = optimizations.stream()
                .filter(o -> o.getKind().equals(Optimization.INEFFICIENT_ITERATION)).findFirst().orElseThrow();
        assertEquals(5, iteration.getLine());
        assertEquals(2, analysis.getMetrics().getOptimizationOpportunities());
        assertEquals(List.of("Review and implement optimization opportunities"), analysis.getRecommendations());
    }

    @Test
    void testExcludedDirectoriesAreSkipped() throws Exception {
        write("app.py", "x = 1\n");
        write("venv/lib/site.py", "def broken(:\n");
        write("agent_backups/app_20260101_000000_000.py", "def broken(:\n");

        CodeAnalysis analysis = analyzer().analyze();

        assertEquals(1, analysis.getFilesAnalyzed());
        assertTrue(analysis.getIssues().isEmpty());
    }

    @Test
    void testExplicitPathsAndUnreadableFile() throws Exception {
        write("app.py", "x = 1\n");

        CodeAnalysis analysis = analyzer().analyze(List.of("app.py", "missing.py", "README.md"));

        assertEquals(2, analysis.getFilesAnalyzed());
        assertTrue(analysis.getFileErrors().containsKey("missing.py"));
    }

    @Test
    void testModelRecommendationsUsedWhenAvailable() throws Exception {
        model = StubLLMClient.answering("- Replace bare excepts\n- Add logging");
        write("app.py", BARE_EXCEPT_SOURCE);

        CodeAnalysis analysis = analyzer().analyze();

        assertEquals(List.of("Replace bare excepts", "Add logging"), analysis.getRecommendations());
    }

    @Test
    void testMeasureDoesNotCallModel() throws Exception {
        model = StubLLMClient.answering("- anything");
        write("app.py", BARE_EXCEPT_SOURCE);

        CodeAnalysis measured = analyzer().measure();

        assertEquals(1, measured.getMetrics().getTotalIssues());
        assertTrue(measured.getRecommendations().isEmpty());
        assertEquals(0, model.getCallCount());
    }
}
