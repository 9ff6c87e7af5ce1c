package com.skilltrace;

import com.skilltrace.analysis.PatternCatalog;
import com.skilltrace.analysis.PatternTag;
import com.skilltrace.analysis.PythonSourceScanner;
import com.skilltrace.analysis.SubmissionAnalyzer;
import com.skilltrace.analysis.SubmissionModels.ErrorKind;
import com.skilltrace.analysis.SubmissionModels.ExecutionOutcome;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionAnalyzerTest {
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final SubmissionAnalyzer analyzer = new SubmissionAnalyzer(
            new PythonSourceScanner(), PatternCatalog.defaultCatalog(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void detectsConstructsInCleanSubmission() {
        String code = """
                class Account:
                    def __init__(self, items):
                        self.items = [x * 2 for x in items]

                    @property
                    def total(self):
                        return sum(v for v in self.items)
                """;

        var analysis = analyzer.analyze(code, "w-3", "oop_fundamentals", 10, 10, 240, 0, ExecutionOutcome.clean());

        assertEquals(ErrorKind.NONE, analysis.errorKind());
        assertTrue(analysis.detectedPatterns().contains(PatternTag.CLASS_DEFINITION));
        assertTrue(analysis.detectedPatterns().contains(PatternTag.FUNCTION_DEFINITION));
        assertTrue(analysis.detectedPatterns().contains(PatternTag.LIST_COMPREHENSION));
        assertTrue(analysis.detectedPatterns().contains(PatternTag.GENERATOR_EXPRESSION));
        assertTrue(analysis.detectedPatterns().contains(PatternTag.PROPERTY_DECORATOR));
        assertFalse(analysis.detectedPatterns().contains(PatternTag.FOR_LOOP));
        assertTrue(analysis.feedback().startsWith("Excellent work!"));
        assertTrue(analysis.feedback().contains("list comprehension"));
        assertEquals(NOW, analysis.timestamp());
        assertEquals("w-3", analysis.workshopId());
        assertEquals("oop_fundamentals", analysis.moduleId());
    }

    @Test
    void tellsDictFromSetComprehension() {
        var dict = analyzer.analyze("squares = {n: n * n for n in range(5)}", "w", "m", 1, 1, 10, 0, null);
        assertTrue(dict.detectedPatterns().contains(PatternTag.DICT_COMPREHENSION));
        assertFalse(dict.detectedPatterns().contains(PatternTag.SET_COMPREHENSION));

        var set = analyzer.analyze("evens = {n for n in nums if n % 2 == 0}", "w", "m", 1, 1, 10, 0, null);
        assertTrue(set.detectedPatterns().contains(PatternTag.SET_COMPREHENSION));
        assertFalse(set.detectedPatterns().contains(PatternTag.DICT_COMPREHENSION));
    }

    @Test
    void ignoresKeywordsInsideStringsAndComments() {
        String code = """
                # while we wait
                message = "for x in items"
                total = 0
                """;
        var analysis = analyzer.analyze(code, "w", "m", 5, 5, 30, 0, ExecutionOutcome.clean());
        assertTrue(analysis.detectedPatterns().isEmpty());
        assertEquals(ErrorKind.NONE, analysis.errorKind());
    }

    @Test
    void unclosedBracketIsSyntaxErrorWithLine() {
        var analysis = analyzer.analyze("print(", "w", "m", 0, 10, 30, 0, ExecutionOutcome.clean());
        assertEquals(ErrorKind.SYNTAX, analysis.errorKind());
        assertTrue(analysis.detectedPatterns().isEmpty());
        assertTrue(analysis.feedback().contains("line 1"));
    }

    @Test
    void missingColonOnLoopHeaderIsSyntaxError() {
        var analysis = analyzer.analyze("for i in range(3)\n    print(i)\n", "w", "m", 0, 10, 30, 0, ExecutionOutcome.clean());
        assertEquals(ErrorKind.SYNTAX, analysis.errorKind());
        assertTrue(analysis.detectedPatterns().isEmpty());
    }

    @Test
    void handlesDegenerateSourcesWithoutThrowing() {
        for (String code : new String[]{"", "x", "# just a comment", "\n\n\n"}) {
            var analysis = assertDoesNotThrow(() -> analyzer.analyze(code, "w", "m", 10, 10, 5, 0, ExecutionOutcome.clean()));
            assertTrue(analysis.detectedPatterns().isEmpty(), code);
            assertEquals(ErrorKind.NONE, analysis.errorKind(), code);
        }
    }

    @Test
    void nullSourceIsSyntaxError() {
        var analysis = analyzer.analyze(null, "w", "m", 0, 10, 5, 0, ExecutionOutcome.clean());
        assertEquals(ErrorKind.SYNTAX, analysis.errorKind());
        assertTrue(analysis.detectedPatterns().isEmpty());
    }

    @Test
    void timeoutWinsOverEveryOtherSignal() {
        var analysis = analyzer.analyze("while True print(1)", "w", "m", 0, 10, 900, 1, new ExecutionOutcome(true, true));
        assertEquals(ErrorKind.TIMEOUT, analysis.errorKind());
        assertTrue(analysis.feedback().startsWith("Execution timed out"));
    }

    @Test
    void graderSyntaxFlagWithZeroScoreIsSyntax() {
        var analysis = analyzer.analyze("x = 1", "w", "m", 0, 10, 60, 0, new ExecutionOutcome(true, false));
        assertEquals(ErrorKind.SYNTAX, analysis.errorKind());

        var partial = analyzer.analyze("x = 1", "w", "m", 4, 10, 60, 0, new ExecutionOutcome(true, false));
        assertEquals(ErrorKind.LOGIC, partial.errorKind());
    }

    @Test
    void logicFeedbackFollowsScoreRatio() {
        String code = "def f(a):\n    return a\n";
        assertTrue(analyzer.analyze(code, "w", "m", 3, 10, 60, 0, null).feedback()
                .startsWith("Significant logic errors detected."));
        assertTrue(analyzer.analyze(code, "w", "m", 6, 10, 60, 0, null).feedback()
                .startsWith("Some logic errors detected."));
        var nearly = analyzer.analyze(code, "w", "m", 9, 10, 60, 0, null);
        assertEquals(ErrorKind.LOGIC, nearly.errorKind());
        assertTrue(nearly.feedback().startsWith("Good attempt!"));
        assertTrue(nearly.feedback().endsWith("Constructs used: function definition."));
    }

    @Test
    void continuedStringInCrlfSourceStillParses() {
        String code = "s = \"abc\\\r\ndef\"\r\nfor c in s:\r\n    print(c)\r\n";
        var analysis = analyzer.analyze(code, "w", "m", 10, 10, 30, 0, ExecutionOutcome.clean());
        assertEquals(ErrorKind.NONE, analysis.errorKind());
        assertEquals(Set.of(PatternTag.FOR_LOOP), analysis.detectedPatterns());
    }
}
