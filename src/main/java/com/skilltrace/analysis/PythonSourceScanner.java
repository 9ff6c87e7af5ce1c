package com.skilltrace.analysis;

import com.skilltrace.analysis.ScannedSource.LogicalLine;
import com.skilltrace.analysis.ScannedSource.Token;
import com.skilltrace.analysis.ScannedSource.TokenKind;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class PythonSourceScanner {
    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final Set<String> COMPOUND_HEADERS = Set.of(
            "class", "def", "for", "while", "if", "elif", "else", "try", "except", "finally", "with");

    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final Map<Character, Character> PAIRS = Map.of(')', '(', ']', '[', '}', '{');

    public ScannedSource scan(String code) {
        if (code == null) {
            return ScannedSource.failed("no source submitted", 0);
        }
        return new Pass(code).run();
    }

    private static final class Pass {
        private final String src;
        private final List<Token> tokens = new ArrayList<>();
        private final List<LogicalLine> lines = new ArrayList<>();
        private final Map<Integer, Integer> brackets = new HashMap<>();
        private final Deque<Integer> open = new ArrayDeque<>();
        private int pos;
        private int line = 1;
        private int lineStart;
        private boolean continuation;

        private Pass(String src) {
            this.src = src;
        }

        private ScannedSource run() {
            try {
                while (pos < src.length()) {
                    step();
                }
                if (!open.isEmpty()) {
                    Token unclosed = tokens.get(open.peek());
                    throw new ScanError("'" + unclosed.text() + "' was never closed", unclosed.line());
                }
                closeLine();
            } catch (ScanError e) {
                return ScannedSource.failed(e.getMessage(), e.line);
            }
            return new ScannedSource(true, null, 0, tokens, lines, brackets);
        }

        private void step() {
            char c = src.charAt(pos);
            if (c == '\n') {
                pos++;
                line++;
                if (open.isEmpty() && !continuation) closeLine();
                continuation = false;
                return;
            }
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                pos++;
                return;
            }
            if (c == '\\') {
                int next = pos + 1;
                if (next < src.length() && src.charAt(next) == '\r') next++;
                if (next >= src.length() || src.charAt(next) != '\n') {
                    throw new ScanError("unexpected character after line continuation", line);
                }
                continuation = true;
                pos = next;
                return;
            }
            if (c == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n') pos++;
                return;
            }
            if (c == '"' || c == '\'') {
                readString();
                return;
            }
            if (Character.isUnicodeIdentifierStart(c) || c == '_') {
                readWord();
                return;
            }
            if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
                int start = pos;
                while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_' || src.charAt(pos) == '.')) {
                    pos++;
                }
                add(TokenKind.NUMBER, src.substring(start, pos));
                return;
            }
            if (c == '(' || c == '[' || c == '{') {
                tokens.add(new Token(TokenKind.OPEN, String.valueOf(c), line, open.size()));
                open.push(tokens.size() - 1);
                pos++;
                return;
            }
            if (PAIRS.containsKey(c)) {
                if (open.isEmpty()) {
                    throw new ScanError("unmatched '" + c + "'", line);
                }
                int openIndex = open.pop();
                String opened = tokens.get(openIndex).text();
                if (opened.charAt(0) != PAIRS.get(c)) {
                    throw new ScanError("closing '" + c + "' does not match '" + opened + "'", line);
                }
                tokens.add(new Token(TokenKind.CLOSE, String.valueOf(c), line, open.size()));
                brackets.put(openIndex, tokens.size() - 1);
                pos++;
                return;
            }
            readOperator(c);
        }

        private void readWord() {
            int start = pos;
            pos++;
            while (pos < src.length() && Character.isUnicodeIdentifierPart(src.charAt(pos))) pos++;
            String word = src.substring(start, pos);
            if (pos < src.length() && (src.charAt(pos) == '"' || src.charAt(pos) == '\'')
                    && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
                readString();
                return;
            }
            add(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.NAME, word);
        }

        private void readString() {
            char quote = src.charAt(pos);
            int startLine = line;
            boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
            pos += triple ? 3 : 1;
            while (true) {
                if (pos >= src.length()) {
                    throw new ScanError("unterminated string literal", startLine);
                }
                char c = src.charAt(pos);
                if (c == '\\') {
                    int next = pos + 1;
                    if (next < src.length() && src.charAt(next) == '\r') next++;
                    if (next < src.length() && src.charAt(next) == '\n') {
                        line++;
                        pos = next + 1;
                    } else {
                        pos += 2;
                    }
                    continue;
                }
                if (c == '\n') {
                    if (!triple) throw new ScanError("unterminated string literal", startLine);
                    line++;
                    pos++;
                    continue;
                }
                if (c == quote) {
                    if (!triple) {
                        pos++;
                        break;
                    }
                    if (src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                        pos += 3;
                        break;
                    }
                }
                pos++;
            }
            add(TokenKind.STRING, "<str>");
        }

        private void readOperator(char c) {
            String text = String.valueOf(c);
            if (pos + 1 < src.length()) {
                char n = src.charAt(pos + 1);
                if ((c == ':' && n == '=') || (c == '-' && n == '>')) {
                    text = src.substring(pos, pos + 2);
                }
            }
            pos += text.length();
            add(TokenKind.OP, text);
        }

        private void add(TokenKind kind, String text) {
            tokens.add(new Token(kind, text, line, open.size()));
        }

        private void closeLine() {
            LogicalLine logical = new LogicalLine(lineStart, tokens.size());
            lineStart = tokens.size();
            if (logical.isEmpty()) return;
            Token first = tokens.get(logical.start());
            String keyword = first.kind() == TokenKind.KEYWORD ? first.text() : null;
            if ("async".equals(keyword) && logical.end() - logical.start() > 1) {
                keyword = tokens.get(logical.start() + 1).text();
            }
            if (keyword != null && COMPOUND_HEADERS.contains(keyword)) {
                boolean hasColon = tokens.subList(logical.start(), logical.end()).stream()
                        .anyMatch(t -> t.depth() == 0 && t.is(TokenKind.OP, ":"));
                if (!hasColon) {
                    throw new ScanError("expected ':' after '" + keyword + "' statement", first.line());
                }
            }
            lines.add(logical);
        }
    }

    private static final class ScanError extends RuntimeException {
        private final int line;

        private ScanError(String message, int line) {
            super(message, null, false, false);
            this.line = line;
        }
    }
}
