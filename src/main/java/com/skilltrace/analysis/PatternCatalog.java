package com.skilltrace.analysis;

import com.skilltrace.analysis.ScannedSource.LogicalLine;
import com.skilltrace.analysis.ScannedSource.Token;
import com.skilltrace.analysis.ScannedSource.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

public final class PatternCatalog {
    private static final Logger log = LoggerFactory.getLogger(PatternCatalog.class);

    private final List<Detector> detectors;

    private PatternCatalog(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public static PatternCatalog empty() {
        return new PatternCatalog(List.of());
    }

    public static PatternCatalog defaultCatalog() {
        return empty()
                .with(PatternTag.LIST_COMPREHENSION, s -> hasComprehension(s, "[", Shape.ANY))
                .with(PatternTag.DICT_COMPREHENSION, s -> hasComprehension(s, "{", Shape.KEYED))
                .with(PatternTag.SET_COMPREHENSION, s -> hasComprehension(s, "{", Shape.UNKEYED))
                .with(PatternTag.GENERATOR_EXPRESSION, s -> hasComprehension(s, "(", Shape.ANY))
                .with(PatternTag.FOR_LOOP, s -> s.anyStatementStartsWith("for"))
                .with(PatternTag.WHILE_LOOP, s -> s.anyStatementStartsWith("while"))
                .with(PatternTag.CLASS_DEFINITION, s -> s.anyStatementStartsWith("class"))
                .with(PatternTag.FUNCTION_DEFINITION, s -> s.anyStatementStartsWith("def"))
                .with(PatternTag.PROPERTY_DECORATOR, PatternCatalog::hasPropertyDecorator)
                .with(PatternTag.TRY_EXCEPT, s -> s.anyStatementStartsWith("try"))
                .with(PatternTag.WITH_STATEMENT, s -> s.anyStatementStartsWith("with"))
                .with(PatternTag.LAMBDA, s -> s.containsKeyword("lambda"));
    }

    public PatternCatalog with(PatternTag tag, Predicate<ScannedSource> predicate) {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(predicate, "predicate");
        List<Detector> next = new ArrayList<>(detectors.stream().filter(d -> !d.tag().equals(tag)).toList());
        next.add(new Detector(tag, predicate));
        return new PatternCatalog(next);
    }

    public Set<PatternTag> tags() {
        Set<PatternTag> tags = new TreeSet<>();
        detectors.forEach(d -> tags.add(d.tag()));
        return Collections.unmodifiableSet(tags);
    }

    public Set<PatternTag> detect(ScannedSource source) {
        if (source == null || !source.parsed()) return Set.of();
        Set<PatternTag> found = new TreeSet<>();
        for (Detector detector : detectors) {
            try {
                if (detector.predicate().test(source)) {
                    found.add(detector.tag());
                }
            } catch (RuntimeException e) {
                log.warn("Pattern detector {} failed, treating as not detected: {}", detector.tag().id(), e.toString());
            }
        }
        return Collections.unmodifiableSet(found);
    }

    private enum Shape { ANY, KEYED, UNKEYED }

    private static boolean hasComprehension(ScannedSource source, String bracket, Shape shape) {
        for (int openIndex : source.openings(bracket)) {
            boolean colonBeforeFor = false;
            int lambdaColons = 0;
            for (Token t : source.directChildren(openIndex)) {
                if (t.is(TokenKind.KEYWORD, "lambda")) {
                    lambdaColons++;
                    continue;
                }
                if (t.is(TokenKind.OP, ":")) {
                    if (lambdaColons > 0) {
                        lambdaColons--;
                    } else {
                        colonBeforeFor = true;
                    }
                }
                if (t.is(TokenKind.KEYWORD, "for")) {
                    boolean matches = switch (shape) {
                        case ANY -> true;
                        case KEYED -> colonBeforeFor;
                        case UNKEYED -> !colonBeforeFor;
                    };
                    if (matches) return true;
                    break;
                }
            }
        }
        return false;
    }

    private static boolean hasPropertyDecorator(ScannedSource source) {
        List<LogicalLine> lines = source.lines();
        for (int i = 0; i < lines.size(); i++) {
            List<Token> tokens = source.lineTokens(lines.get(i));
            boolean propertyLine = tokens.size() == 2
                    && tokens.get(0).is(TokenKind.OP, "@")
                    && tokens.get(1).is(TokenKind.NAME, "property");
            if (!propertyLine) continue;
            for (int j = i + 1; j < lines.size(); j++) {
                List<Token> next = source.lineTokens(lines.get(j));
                if (next.get(0).is(TokenKind.OP, "@")) continue;
                if ("def".equals(source.statementKeyword(lines.get(j)))) return true;
                break;
            }
        }
        return false;
    }

    private record Detector(PatternTag tag, Predicate<ScannedSource> predicate) {}
}
