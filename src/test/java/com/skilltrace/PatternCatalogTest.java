package com.skilltrace;

import com.skilltrace.analysis.PatternCatalog;
import com.skilltrace.analysis.PatternTag;
import com.skilltrace.analysis.PythonSourceScanner;
import com.skilltrace.analysis.ScannedSource;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PatternCatalogTest {
    private final PythonSourceScanner scanner = new PythonSourceScanner();

    @Test
    void registeringNewTagLeavesExistingDetectorsAlone() {
        PatternTag generatorFunction = new PatternTag("generator_function");
        PatternCatalog catalog = PatternCatalog.defaultCatalog()
                .with(generatorFunction, s -> s.containsKeyword("yield"));

        String code = """
                def countdown(n):
                    while n > 0:
                        yield n
                        n -= 1
                """;
        Set<PatternTag> found = catalog.detect(scanner.scan(code));

        assertEquals(Set.of(generatorFunction, PatternTag.FUNCTION_DEFINITION, PatternTag.WHILE_LOOP), found);
        assertEquals(13, catalog.tags().size());
        assertEquals(12, PatternCatalog.defaultCatalog().tags().size());
    }

    @Test
    void failingDetectorIsSkipped() {
        PatternCatalog catalog = PatternCatalog.defaultCatalog()
                .with(new PatternTag("broken"), s -> {
                    throw new IllegalStateException("boom");
                });

        Set<PatternTag> found = assertDoesNotThrow(() -> catalog.detect(scanner.scan("for i in range(3):\n    pass\n")));
        assertEquals(Set.of(PatternTag.FOR_LOOP), found);
    }

    @Test
    void laterRegistrationReplacesTag() {
        PatternCatalog catalog = PatternCatalog.defaultCatalog().with(PatternTag.LAMBDA, s -> false);
        assertTrue(catalog.detect(scanner.scan("key = lambda p: p[0]")).isEmpty());
        assertEquals(12, catalog.tags().size());
    }

    @Test
    void detectsStatementsBehindAsync() {
        String code = """
                async def fetch(session):
                    async with session.get(URL) as response:
                        try:
                            return await response.text()
                        except TimeoutError:
                            return None
                """;
        Set<PatternTag> found = PatternCatalog.defaultCatalog().detect(scanner.scan(code));
        assertEquals(Set.of(PatternTag.FUNCTION_DEFINITION, PatternTag.WITH_STATEMENT, PatternTag.TRY_EXCEPT), found);
    }

    @Test
    void lambdaColonDoesNotMakeAKeyedComprehension() {
        PatternCatalog catalog = PatternCatalog.defaultCatalog();

        Set<PatternTag> list = catalog.detect(scanner.scan("handlers = [lambda x: x for _ in range(2)]"));
        assertTrue(list.contains(PatternTag.LAMBDA));
        assertTrue(list.contains(PatternTag.LIST_COMPREHENSION));

        Set<PatternTag> set = catalog.detect(scanner.scan("fns = {lambda v: v for _ in range(2)}"));
        assertTrue(set.contains(PatternTag.SET_COMPREHENSION));
        assertFalse(set.contains(PatternTag.DICT_COMPREHENSION));

        Set<PatternTag> dict = catalog.detect(scanner.scan("table = {k: lambda v: v for k in keys}"));
        assertTrue(dict.contains(PatternTag.DICT_COMPREHENSION));
        assertFalse(dict.contains(PatternTag.SET_COMPREHENSION));
    }

    @Test
    void unparsedSourceYieldsNothing() {
        ScannedSource failed = scanner.scan("def broken(:\n");
        assertFalse(failed.parsed());
        assertTrue(PatternCatalog.defaultCatalog().detect(failed).isEmpty());
        assertTrue(PatternCatalog.empty().detect(scanner.scan("for i in x:\n    pass\n")).isEmpty());
    }

    @Test
    void tagIdsAreLowercaseWordCharactersOnly() {
        assertThrows(IllegalArgumentException.class, () -> new PatternTag("walrus,assign"));
        assertThrows(IllegalArgumentException.class, () -> new PatternTag("Walrus"));
        assertThrows(IllegalArgumentException.class, () -> new PatternTag("walrus assign"));
        assertThrows(IllegalArgumentException.class, () -> new PatternTag(""));
        assertEquals("walrus assign", new PatternTag("walrus_assign").label());
    }
}
