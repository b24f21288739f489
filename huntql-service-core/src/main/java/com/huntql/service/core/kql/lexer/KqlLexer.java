package com.huntql.service.core.kql.lexer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Hand-written KQL tokenizer.
 *
 * Recognized forms:
 *  - keywords (case-insensitive), identifiers, {@code $left}/{@code $right}, {@code ['bracketed name']}
 *  - operators {@code == != <> < <= > >= =~ !~ + - * / % | = , ( ) [ ] .} and {@code !contains !has !in ...}
 *  - "double", 'single' and {@literal @}"verbatim" strings
 *  - numbers, timespans ({@code 1d}, {@code 2h30m}, {@code 1.5h}, {@code 100ms})
 *  - {@code datetime(...)}, {@code guid(...)}, {@code timespan(...)} and bare GUIDs
 *  - {@code //} and {@code /* *}{@code /} comments (dropped from the stream, counted for positions)
 *
 * Lexing stops at the first error.
 */
public final class KqlLexer {

    /** Words emitted as {@link TokenKind#KEYWORD}. Position in the grammar decides whether they act as keywords. */
    public static final Set<String> KEYWORDS = Set.of(
            "where", "project", "extend", "summarize", "by", "order", "sort", "top", "limit", "take",
            "distinct", "join", "union", "and", "or", "not", "in", "contains", "startswith", "endswith",
            "matches", "has", "asc", "desc", "on", "kind", "case", "when", "then", "else");

    private static final Set<String> NEGATED_WORD_OPERATORS =
            Set.of("contains", "has", "startswith", "endswith", "in");

    private static final Pattern GUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    // longest spellings first so "ms" wins over "m"
    private static final String[] TIMESPAN_UNITS = {
        "microseconds", "microsecond", "milliseconds", "millisecond", "seconds", "second", "minutes", "minute",
        "hours", "hour", "days", "day", "ticks", "tick", "ms", "us", "d", "h", "m", "s"
    };

    public List<Token> tokenize(String text) {
        return new Scanner(text == null ? "" : text).scanAll();
    }

    /** Tokens up to (not including) the first lexical error, terminated by an end-of-input token. */
    public List<Token> tokenizePartial(String text) {
        Scanner scanner = new Scanner(text == null ? "" : text);
        try {
            return scanner.scanAll();
        } catch (LexException e) {
            List<Token> partial = new ArrayList<>(scanner.tokens);
            partial.add(new Token(TokenKind.END_OF_INPUT, "", null, e.offset(), e.offset(), e.line(), e.column()));
            return partial;
        }
    }

    /** Re-joins the token stream with single spaces and lower-cased keywords; comments are gone already. */
    public String normalize(String text) {
        return normalize(tokenize(text));
    }

    public String normalize(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (token.kind() == TokenKind.END_OF_INPUT) break;
            if (!sb.isEmpty()) sb.append(' ');
            sb.append(token.canonicalText());
        }
        return sb.toString();
    }

    static Duration timespanUnit(String unit) {
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "d", "day", "days" -> Duration.ofDays(1);
            case "h", "hour", "hours" -> Duration.ofHours(1);
            case "m", "minute", "minutes" -> Duration.ofMinutes(1);
            case "s", "second", "seconds" -> Duration.ofSeconds(1);
            case "ms", "millisecond", "milliseconds" -> Duration.ofMillis(1);
            case "us", "microsecond", "microseconds" -> Duration.ofNanos(1_000);
            case "tick", "ticks" -> Duration.ofNanos(100);
            default -> null;
        };
    }

    private static final class Scanner {
        private final String src;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;
        private int line = 1;
        private int col = 1;

        // start of the token being scanned
        private int startPos;
        private int startLine;
        private int startCol;

        Scanner(String src) {
            this.src = src;
        }

        List<Token> scanAll() {
            while (true) {
                skipWhitespaceAndComments();
                if (atEnd()) break;
                mark();
                scanToken();
            }
            tokens.add(new Token(TokenKind.END_OF_INPUT, "", null, pos, pos, line, col));
            return tokens;
        }

        private void scanToken() {
            char c = peek();
            if (c == '"' || c == '\'') {
                scanString(false);
            } else if (c == '@' && (peekAt(1) == '"' || peekAt(1) == '\'')) {
                advance();
                scanString(true);
            } else if (isHex(c) && matchesGuidHere()) {
                String text = src.substring(pos, pos + 36);
                advanceBy(36);
                emit(TokenKind.GUID_LITERAL, text, UUID.fromString(text));
            } else if (isDigit(c)) {
                scanNumberOrTimespan();
            } else if (isIdentStart(c)) {
                scanWord();
            } else if (c == '$') {
                scanDollarIdentifier();
            } else if (c == '[' && bracketedIdentifierAhead()) {
                scanBracketedIdentifier();
            } else {
                scanOperator();
            }
        }

        // ------------------------------------------------------------------ whitespace / comments

        private void skipWhitespaceAndComments() {
            while (!atEnd()) {
                char c = peek();
                if (Character.isWhitespace(c)) {
                    advance();
                } else if (c == '/' && peekAt(1) == '/') {
                    while (!atEnd() && peek() != '\n') advance();
                } else if (c == '/' && peekAt(1) == '*') {
                    mark();
                    advanceBy(2);
                    boolean closed = false;
                    while (!atEnd()) {
                        if (peek() == '*' && peekAt(1) == '/') {
                            advanceBy(2);
                            closed = true;
                            break;
                        }
                        advance();
                    }
                    if (!closed) throw errorAtStart("Unterminated block comment");
                } else {
                    return;
                }
            }
        }

        // ------------------------------------------------------------------ strings

        private void scanString(boolean verbatim) {
            char quote = advance();
            StringBuilder value = new StringBuilder();
            while (true) {
                if (atEnd()) throw errorAtStart("Unterminated string literal");
                char c = advance();
                if (c == quote) {
                    if (verbatim && peek() == quote) {
                        advance();
                        value.append(quote);
                        continue;
                    }
                    break;
                }
                if (!verbatim && c == '\\') {
                    if (atEnd()) throw errorAtStart("Unterminated string literal");
                    value.append(unescape(advance()));
                } else if (!verbatim && c == '\n') {
                    throw errorAtStart("Unterminated string literal");
                } else {
                    value.append(c);
                }
            }
            String decoded = value.toString();
            emit(TokenKind.STRING_LITERAL, decoded, decoded);
        }

        private String unescape(char escaped) {
            return switch (escaped) {
                case 'n' -> "\n";
                case 't' -> "\t";
                case 'r' -> "\r";
                case '0' -> "\0";
                case 'u' -> {
                    if (pos + 4 > src.length()) throw errorHere("Invalid unicode escape");
                    String hex = src.substring(pos, pos + 4);
                    try {
                        int cp = Integer.parseInt(hex, 16);
                        advanceBy(4);
                        yield String.valueOf((char) cp);
                    } catch (NumberFormatException e) {
                        throw errorHere("Invalid unicode escape");
                    }
                }
                default -> String.valueOf(escaped);
            };
        }

        // ------------------------------------------------------------------ numbers / timespans

        private void scanNumberOrTimespan() {
            Duration total = Duration.ZERO;
            boolean timespan = false;
            while (true) {
                int numberStart = pos;
                boolean decimal = scanDigits();
                String number = src.substring(numberStart, pos);
                if (!isIdentStart(peek())) {
                    if (timespan) throw errorAtStart("Invalid timespan literal");
                    emitNumber(number, decimal);
                    return;
                }
                String unit = matchTimespanUnit();
                if (unit == null) throw errorAtStart("Invalid numeric literal");
                try {
                    total = total.plus(scale(new BigDecimal(number), timespanUnit(unit)));
                } catch (ArithmeticException e) {
                    throw errorAtStart("Timespan literal out of range");
                }
                timespan = true;
                if (!isDigit(peek())) break;
            }
            if (isIdentPart(peek())) throw errorAtStart("Invalid timespan literal");
            emit(TokenKind.TIMESPAN_LITERAL, src.substring(startPos, pos), total);
        }

        /** Scans digits with optional fraction/exponent, returns true when the number is not integral. */
        private boolean scanDigits() {
            boolean decimal = false;
            while (isDigit(peek())) advance();
            if (peek() == '.' && isDigit(peekAt(1))) {
                decimal = true;
                advance();
                while (isDigit(peek())) advance();
            }
            if ((peek() == 'e' || peek() == 'E')
                    && (isDigit(peekAt(1)) || ((peekAt(1) == '+' || peekAt(1) == '-') && isDigit(peekAt(2))))) {
                decimal = true;
                advanceBy(2);
                while (isDigit(peek())) advance();
            }
            return decimal;
        }

        private void emitNumber(String number, boolean decimal) {
            if (decimal) {
                emit(TokenKind.NUMERIC_LITERAL, number, Double.valueOf(number));
                return;
            }
            try {
                emit(TokenKind.NUMERIC_LITERAL, number, Long.valueOf(number));
            } catch (NumberFormatException e) {
                throw errorAtStart("Numeric literal out of range");
            }
        }

        private String matchTimespanUnit() {
            for (String unit : TIMESPAN_UNITS) {
                int end = pos + unit.length();
                if (end <= src.length()
                        && src.regionMatches(true, pos, unit, 0, unit.length())
                        && !(end < src.length() && Character.isLetter(src.charAt(end)))) {
                    advanceBy(unit.length());
                    return unit;
                }
            }
            return null;
        }

        private Duration scale(BigDecimal amount, Duration unit) {
            BigDecimal nanos = amount.multiply(BigDecimal.valueOf(unit.toNanos())).setScale(0, RoundingMode.HALF_UP);
            return Duration.ofNanos(nanos.longValueExact());
        }

        // ------------------------------------------------------------------ words

        private void scanWord() {
            while (isIdentPart(peek())) advance();
            String word = src.substring(startPos, pos);
            String lower = word.toLowerCase(Locale.ROOT);

            if (nextNonSpaceIs('(')) {
                switch (lower) {
                    case "datetime" -> {
                        scanDatetimeBody();
                        return;
                    }
                    case "guid" -> {
                        scanGuidBody();
                        return;
                    }
                    case "timespan", "time" -> {
                        scanTimespanBody();
                        return;
                    }
                    default -> {
                        // function call, handled by the parser
                    }
                }
            }

            if (lower.equals("matches")) {
                int save = pos;
                int saveLine = line;
                int saveCol = col;
                while (!atEnd() && (peek() == ' ' || peek() == '\t')) advance();
                int regexStart = pos;
                while (isIdentPart(peek())) advance();
                if (src.substring(regexStart, pos).equalsIgnoreCase("regex")) {
                    emit(TokenKind.KEYWORD, word + " " + src.substring(regexStart, pos), null);
                    return;
                }
                pos = save;
                line = saveLine;
                col = saveCol;
            }

            emit(KEYWORDS.contains(lower) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, word, null);
        }

        private String parenthesisedBody(String what) {
            while (peek() != '(') advance();
            advance();
            int bodyStart = pos;
            while (!atEnd() && peek() != ')' && peek() != '\n') advance();
            if (atEnd() || peek() != ')') throw errorAtStart("Unterminated " + what + " literal");
            String body = src.substring(bodyStart, pos).trim();
            advance();
            if (body.length() >= 2
                    && (body.charAt(0) == '"' || body.charAt(0) == '\'')
                    && body.charAt(body.length() - 1) == body.charAt(0)) {
                body = body.substring(1, body.length() - 1).trim();
            }
            return body;
        }

        private void scanDatetimeBody() {
            String body = parenthesisedBody("datetime");
            Instant instant = parseInstant(body);
            if (instant == null) throw errorAtStart("Invalid datetime literal '" + body + "'");
            emit(TokenKind.DATETIME_LITERAL, src.substring(startPos, pos), instant);
        }

        private void scanGuidBody() {
            String body = parenthesisedBody("guid");
            if (!GUID.matcher(body).matches()) throw errorAtStart("Invalid guid literal '" + body + "'");
            emit(TokenKind.GUID_LITERAL, src.substring(startPos, pos), UUID.fromString(body));
        }

        private void scanTimespanBody() {
            String body = parenthesisedBody("timespan");
            Duration duration = parseTimespanText(body);
            if (duration == null) throw errorAtStart("Invalid timespan literal '" + body + "'");
            emit(TokenKind.TIMESPAN_LITERAL, src.substring(startPos, pos), duration);
        }

        private void scanDollarIdentifier() {
            advance();
            if (!isIdentStart(peek())) throw errorAtStart("Unexpected character '$'");
            while (isIdentPart(peek())) advance();
            emit(TokenKind.IDENTIFIER, src.substring(startPos, pos), null);
        }

        private boolean bracketedIdentifierAhead() {
            int i = pos + 1;
            while (i < src.length() && src.charAt(i) == ' ') i++;
            return i < src.length() && (src.charAt(i) == '\'' || src.charAt(i) == '"');
        }

        private void scanBracketedIdentifier() {
            advance();
            while (peek() == ' ') advance();
            char quote = advance();
            int nameStart = pos;
            while (!atEnd() && peek() != quote && peek() != '\n') advance();
            if (atEnd() || peek() != quote) throw errorAtStart("Unterminated bracketed identifier");
            String name = src.substring(nameStart, pos);
            advance();
            while (peek() == ' ') advance();
            if (peek() != ']') throw errorAtStart("Unterminated bracketed identifier");
            advance();
            emit(TokenKind.IDENTIFIER, name, name);
        }

        // ------------------------------------------------------------------ operators

        private void scanOperator() {
            char c = peek();
            char n = peekAt(1);
            String two = "" + c + n;
            switch (two) {
                case "==", "!=", "<=", ">=", "=~", "!~", "<>" -> {
                    advanceBy(2);
                    emit(TokenKind.OPERATOR, two.equals("<>") ? "!=" : two, null);
                    return;
                }
                default -> {
                    // single character operators below
                }
            }
            if (c == '!') {
                int wordStart = pos + 1;
                int wordEnd = wordStart;
                while (wordEnd < src.length() && isIdentPart(src.charAt(wordEnd))) wordEnd++;
                String word = src.substring(wordStart, wordEnd).toLowerCase(Locale.ROOT);
                if (NEGATED_WORD_OPERATORS.contains(word)) {
                    advanceBy(1 + word.length());
                    emit(TokenKind.OPERATOR, "!" + word, null);
                    return;
                }
                throw errorAtStart("Unexpected character '!'");
            }
            if ("<>=+-*/%|,()[].;".indexOf(c) >= 0) {
                advance();
                emit(TokenKind.OPERATOR, String.valueOf(c), null);
                return;
            }
            throw errorAtStart("Unexpected character '" + c + "'");
        }

        // ------------------------------------------------------------------ helpers

        private boolean matchesGuidHere() {
            if (pos + 36 > src.length()) return false;
            if (!GUID.matcher(src.substring(pos, pos + 36)).matches()) return false;
            return pos + 36 == src.length() || !isIdentPart(src.charAt(pos + 36));
        }

        private boolean nextNonSpaceIs(char expected) {
            int i = pos;
            while (i < src.length() && (src.charAt(i) == ' ' || src.charAt(i) == '\t')) i++;
            return i < src.length() && src.charAt(i) == expected;
        }

        private void mark() {
            startPos = pos;
            startLine = line;
            startCol = col;
        }

        private void emit(TokenKind kind, String text, Object value) {
            tokens.add(new Token(kind, text, value, startPos, pos, startLine, startCol));
        }

        private LexException errorAtStart(String message) {
            return new LexException(message, startPos, startLine, startCol);
        }

        private LexException errorHere(String message) {
            return new LexException(message, pos, line, col);
        }

        private boolean atEnd() {
            return pos >= src.length();
        }

        private char peek() {
            return atEnd() ? '\0' : src.charAt(pos);
        }

        private char peekAt(int ahead) {
            int i = pos + ahead;
            return i < src.length() ? src.charAt(i) : '\0';
        }

        private char advance() {
            char c = src.charAt(pos++);
            if (c == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
            return c;
        }

        private void advanceBy(int count) {
            for (int i = 0; i < count && !atEnd(); i++) advance();
        }
    }

    static Instant parseInstant(String text) {
        String t = text.trim();
        if (t.isEmpty()) return null;
        try {
            return Instant.parse(t);
        } catch (DateTimeParseException ignored) {
            // try the other accepted shapes
        }
        try {
            return OffsetDateTime.parse(t).toInstant();
        } catch (DateTimeParseException ignored) {
            // next
        }
        try {
            return LocalDateTime.parse(t.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // next
        }
        try {
            return LocalDate.parse(t).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    static Duration parseTimespanText(String text) {
        List<Token> tokens;
        try {
            tokens = new Scanner(text).scanAll();
        } catch (LexException e) {
            return null;
        }
        if (tokens.size() != 2 || tokens.get(0).kind() != TokenKind.TIMESPAN_LITERAL) return null;
        return (Duration) tokens.get(0).value();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHex(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
