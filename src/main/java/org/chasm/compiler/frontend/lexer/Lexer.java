package org.chasm.compiler.frontend.lexer;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.api.SourceInfo;
import org.chasm.compiler.isa.Architecture;
import org.chasm.compiler.isa.IInstructionSet;
import org.chasm.compiler.isa.ImmediateFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * The first lexical error aborts the scan.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "define", TokenType.DEFINE,
            "config", TokenType.CONFIG,
            "default", TokenType.DEFAULT,
            "sprite", TokenType.SPRITE,
            "raw", TokenType.RAW,
            "proc", TokenType.PROC,
            "endp", TokenType.ENDP
    );

    private final SourceCursor cursor;
    private final IInstructionSet instructionSet;
    private List<Token> tokens;
    private int start = 0;
    private SourceInfo startPosition;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this(source, logicalFileName, Architecture.instructionSet());
    }

    /**
     * Creates a new Lexer with an explicit instruction set used to recognize mnemonics.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     * @param instructionSet The instruction set that defines the mnemonics.
     */
    public Lexer(String source, String logicalFileName, IInstructionSet instructionSet) {
        this.cursor = new SourceCursor(source, logicalFileName);
        this.instructionSet = instructionSet;
    }

    /**
     * Performs the tokenization of the entire source code. The source is scanned once;
     * later calls return the same tokens.
     * @return The recognized tokens, always terminated by an {@link TokenType#END_OF_FILE} token.
     * @throws CompilationException on the first invalid digit, oversized constant or unknown character.
     */
    public List<Token> scanTokens() throws CompilationException {
        if (tokens != null) {
            return tokens;
        }
        List<Token> scanned = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            scanned.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        LOG.debug("Scanned {} tokens from {}", scanned.size(), cursor.fileName());
        tokens = List.copyOf(scanned);
        return tokens;
    }

    /**
     * Skips whitespace and comments and reads the next token.
     * @return The next token, or an end-of-file token once the source is exhausted.
     * @throws CompilationException if the next characters do not form a valid token.
     */
    Token nextToken() throws CompilationException {
        skipWhitespaceAndComments();
        start = cursor.offset();
        startPosition = cursor.position();
        if (cursor.isAtEnd()) {
            return makeToken(TokenType.END_OF_FILE, null);
        }

        char c = cursor.advance();
        switch (c) {
            case '[': return makeToken(TokenType.BRACKET_OPEN, null);
            case ']': return makeToken(TokenType.BRACKET_CLOSE, null);
            case '(': return makeToken(TokenType.PAREN_OPEN, null);
            case ')': return makeToken(TokenType.PAREN_CLOSE, null);
            case ':': return makeToken(TokenType.COLON, null);
            case ',': return makeToken(TokenType.COMMA, null);
            case '=': return makeToken(TokenType.EQUAL, null);
            case '.': return makeToken(TokenType.DOT, null);
            case '@': return makeToken(TokenType.AT, null);
            case '$': return makeToken(TokenType.DOLLAR, null);
            case '#': return makeToken(TokenType.HASH, null);
            case '\'': return asciiByte();
            default:
                if (isDigit(c)) return number(c);
                if (isAlpha(c)) return word();
                throw undefinedCharacter(c, startPosition);
        }
    }

    private void skipWhitespaceAndComments() {
        while (!cursor.isAtEnd()) {
            char c = cursor.peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                cursor.advance();
            } else if (c == ';') {
                // A comment goes until the end of the line.
                while (!cursor.isAtEnd() && cursor.peek() != '\n') cursor.advance();
            } else {
                return;
            }
        }
    }

    private Token word() {
        while (isAlphaNumeric(cursor.peek())) cursor.advance();
        String text = cursor.textFrom(start);
        String lower = text.toLowerCase(Locale.ROOT);

        TokenType type = KEYWORDS.get(lower);
        if (type == null) {
            if (instructionSet.resolveRegisterToken(text).isPresent()) {
                type = TokenType.REGISTER;
            } else if (instructionSet.isMnemonic(text)) {
                type = TokenType.INSTRUCTION;
            } else {
                type = TokenType.IDENTIFIER;
            }
        }
        return makeToken(type, null);
    }

    private Token number(char first) throws CompilationException {
        int radix = 10;
        if (first == '0' && (cursor.peek() == 'x' || cursor.peek() == 'X')) {
            radix = 16;
            cursor.advance();
        } else if (first == '0' && (cursor.peek() == 'b' || cursor.peek() == 'B')) {
            radix = 2;
            cursor.advance();
        }
        int digitsStart = radix == 10 ? start : cursor.offset();

        // Hex digits (A-F) are alphanumeric, so the whole run is read and validated afterwards.
        while (isAlphaNumeric(cursor.peek())) cursor.advance();
        String digits = cursor.textFrom(digitsStart);
        String lexeme = cursor.textFrom(start);

        if (digits.isEmpty()) {
            String found = cursor.isAtEnd() ? "end of input" : String.valueOf(cursor.peek());
            throw invalidDigit(found, radix);
        }

        long value = 0;
        boolean tooLarge = false;
        for (int i = 0; i < digits.length(); i++) {
            char d = digits.charAt(i);
            int digit = Character.digit(d, radix);
            if (digit < 0) {
                throw invalidDigit(String.valueOf(d), radix);
            }
            if (!tooLarge) {
                value = value * radix + digit;
                tooLarge = value > ImmediateFormat.IMM16.max();
            }
        }
        if (tooLarge) {
            throw new CompilationException(CompilerErrorCode.NUMERIC_CONSTANT_TOO_LARGE,
                    String.format("Numeric constant \"%s\" is too large for a 16-bit value", lexeme), startPosition);
        }
        return makeToken(TokenType.NUMBER, (int) value);
    }

    private Token asciiByte() throws CompilationException {
        if (cursor.isAtEnd() || cursor.peek() == '\'' || cursor.peek() == '\n') {
            throw undefinedCharacter('\'', startPosition);
        }
        SourceInfo charPosition = cursor.position();
        char c = cursor.advance();
        if (c > 0x7F) {
            throw undefinedCharacter(c, charPosition);
        }
        if (cursor.peek() != '\'') {
            throw undefinedCharacter('\'', startPosition);
        }
        cursor.advance();
        return makeToken(TokenType.NUMBER, (int) c);
    }

    private Token makeToken(TokenType type, Integer value) {
        return new Token(type, cursor.textFrom(start), value,
                startPosition.lineNumber(), startPosition.columnNumber(), cursor.fileName());
    }

    private CompilationException invalidDigit(String digit, int radix) {
        return new CompilationException(CompilerErrorCode.INVALID_DIGIT_FOR_BASE,
                String.format("Invalid digit \"%s\" for numeric base %d", digit, radix), startPosition);
    }

    private static CompilationException undefinedCharacter(char c, SourceInfo position) {
        return new CompilationException(CompilerErrorCode.UNDEFINED_CHARACTER_TOKEN,
                String.format("Character \"%s\" cannot match any token", c), position);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
