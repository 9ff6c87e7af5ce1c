package com.skilltrace.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record ScannedSource(boolean parsed,
                            String error,
                            int errorLine,
                            List<Token> tokens,
                            List<LogicalLine> lines,
                            Map<Integer, Integer> brackets) {

    public enum TokenKind { NAME, KEYWORD, NUMBER, STRING, OP, OPEN, CLOSE }

    /**
     * @param depth bracket nesting level; the contents of a bracket opened at depth {@code d}
     *              sit at {@code d + 1}
     */
    public record Token(TokenKind kind, String text, int line, int depth) {
        public boolean is(TokenKind k, String value) {
            return kind == k && text.equals(value);
        }
    }

    /** Half-open token range {@code [start, end)}. */
    public record LogicalLine(int start, int end) {
        public boolean isEmpty() {
            return start >= end;
        }
    }

    public ScannedSource {
        tokens = List.copyOf(tokens);
        lines = List.copyOf(lines);
        brackets = Map.copyOf(brackets);
    }

    public static ScannedSource failed(String error, int line) {
        return new ScannedSource(false, error, line, List.of(), List.of(), Map.of());
    }

    public List<Token> lineTokens(LogicalLine line) {
        return tokens.subList(line.start(), line.end());
    }

    public String statementKeyword(LogicalLine line) {
        if (line.isEmpty()) return null;
        Token first = tokens.get(line.start());
        if (first.kind() != TokenKind.KEYWORD) return null;
        if ("async".equals(first.text()) && line.end() - line.start() > 1) {
            Token second = tokens.get(line.start() + 1);
            return second.kind() == TokenKind.KEYWORD ? second.text() : null;
        }
        return first.text();
    }

    public boolean anyStatementStartsWith(String keyword) {
        return lines.stream().anyMatch(l -> keyword.equals(statementKeyword(l)));
    }

    public boolean containsKeyword(String keyword) {
        return tokens.stream().anyMatch(t -> t.is(TokenKind.KEYWORD, keyword));
    }

    public List<Integer> openings(String bracket) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is(TokenKind.OPEN, bracket)) out.add(i);
        }
        return out;
    }

    /** Tokens directly inside the bracket opened at {@code openIndex}, nested brackets excluded. */
    public List<Token> directChildren(int openIndex) {
        Integer close = brackets.get(openIndex);
        if (close == null) return List.of();
        int inner = tokens.get(openIndex).depth() + 1;
        return tokens.subList(openIndex + 1, close).stream()
                .filter(t -> t.depth() == inner && t.kind() != TokenKind.CLOSE)
                .toList();
    }
}
