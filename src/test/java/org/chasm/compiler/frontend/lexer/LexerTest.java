package org.chasm.compiler.frontend.lexer;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts source strings into a stream of tokens,
 * classifying keywords, registers, mnemonics and numbers, and that it rejects malformed input.
 */
@Tag("unit")
public class LexerTest {

    private static List<Token> scan(String source) throws CompilationException {
        return new Lexer(source, "test.asm").scanTokens();
    }

    private static List<TokenType> types(String source) throws CompilationException {
        return scan(source).stream().map(Token::type).collect(Collectors.toList());
    }

    /**
     * Verifies that a line mixing keywords, identifiers, numbers and a comment is tokenized
     * in order and terminated by an end-of-file token.
     */
    @Test
    void testLexerTokenization() throws CompilationException {
        List<Token> tokens = scan("define SPEED 42 ; frames per step\nld v0, SPEED");

        assertThat(tokens).hasSize(8);
        assertThat(tokens.get(0)).extracting(Token::type, Token::text).containsExactly(TokenType.DEFINE, "define");
        assertThat(tokens.get(1)).extracting(Token::type, Token::text).containsExactly(TokenType.IDENTIFIER, "SPEED");
        assertThat(tokens.get(2)).extracting(Token::type, Token::text, Token::value).containsExactly(TokenType.NUMBER, "42", 42);
        assertThat(tokens.get(3)).extracting(Token::type, Token::text).containsExactly(TokenType.INSTRUCTION, "ld");
        assertThat(tokens.get(4)).extracting(Token::type, Token::text).containsExactly(TokenType.REGISTER, "v0");
        assertThat(tokens.get(5).type()).isEqualTo(TokenType.COMMA);
        assertThat(tokens.get(6)).extracting(Token::type, Token::text).containsExactly(TokenType.IDENTIFIER, "SPEED");
        assertThat(tokens.get(7).type()).isEqualTo(TokenType.END_OF_FILE);
    }

    @Test
    void emptySourceYieldsOnlyEndOfFile() throws CompilationException {
        assertThat(types("")).containsExactly(TokenType.END_OF_FILE);
        assertThat(types("   ; only a comment\n\t\n")).containsExactly(TokenType.END_OF_FILE);
    }

    @Test
    void recognizesPunctuationAndSigils() throws CompilationException {
        assertThat(types("[ ] ( ) : , = . @ $ #")).containsExactly(
                TokenType.BRACKET_OPEN, TokenType.BRACKET_CLOSE, TokenType.PAREN_OPEN, TokenType.PAREN_CLOSE,
                TokenType.COLON, TokenType.COMMA, TokenType.EQUAL, TokenType.DOT,
                TokenType.AT, TokenType.DOLLAR, TokenType.HASH, TokenType.END_OF_FILE);
    }

    @Test
    void keywordsRegistersAndMnemonicsAreCaseInsensitive() throws CompilationException {
        assertThat(types("DEFINE Config DEFAULT Sprite RAW Proc ENDP")).containsExactly(
                TokenType.DEFINE, TokenType.CONFIG, TokenType.DEFAULT, TokenType.SPRITE,
                TokenType.RAW, TokenType.PROC, TokenType.ENDP, TokenType.END_OF_FILE);
        assertThat(types("VF dt ST I")).containsExactly(
                TokenType.REGISTER, TokenType.REGISTER, TokenType.REGISTER, TokenType.REGISTER, TokenType.END_OF_FILE);
        assertThat(types("CLS Jmp drw")).containsExactly(
                TokenType.INSTRUCTION, TokenType.INSTRUCTION, TokenType.INSTRUCTION, TokenType.END_OF_FILE);
    }

    @Test
    void wordsThatAreNotReservedBecomeIdentifiers() throws CompilationException {
        List<Token> tokens = scan("player_x vg loop2 _tmp");
        assertThat(tokens).extracting(Token::type).containsOnly(TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(tokens).extracting(Token::text).startsWith("player_x", "vg", "loop2", "_tmp");
    }

    @Test
    void parsesHexBinaryAndDecimalLiterals() throws CompilationException {
        List<Token> tokens = scan("0x1F 0XfF 0b101 255 0 0xFFFF");
        assertThat(tokens).extracting(Token::value).containsExactly(31, 255, 5, 255, 0, 65535, null);
        assertThat(tokens.get(0).text()).isEqualTo("0x1F");
    }

    @Test
    void asciiLiteralBecomesNumber() throws CompilationException {
        List<Token> tokens = scan("'A' ' '");
        assertThat(tokens.get(0)).extracting(Token::type, Token::text, Token::value).containsExactly(TokenType.NUMBER, "'A'", 65);
        assertThat(tokens.get(1).value()).isEqualTo(32);
    }

    @Test
    void tracksLinesAndColumns() throws CompilationException {
        List<Token> tokens = scan("cls\n  jmp @start");
        assertThat(tokens.get(1).source()).isEqualTo(new SourceInfo("test.asm", 2, 3));
        assertThat(tokens.get(2).source()).isEqualTo(new SourceInfo("test.asm", 2, 7));
        assertThat(tokens.get(3).source()).isEqualTo(new SourceInfo("test.asm", 2, 8));
    }

    /**
     * 70000 does not fit into a 16-bit word and must be rejected while scanning.
     */
    @Test
    void rejectsConstantAbove16Bits() {
        assertThatThrownBy(() -> scan("define X 70000"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("70000")
                .extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.NUMERIC_CONSTANT_TOO_LARGE);
    }

    @Test
    void rejectsInvalidDigitsForBase() {
        assertThatThrownBy(() -> scan("0b102"))
                .hasMessageContaining("Invalid digit \"2\" for numeric base 2")
                .extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.INVALID_DIGIT_FOR_BASE);
        assertThatThrownBy(() -> scan("12ab"))
                .hasMessageContaining("Invalid digit \"a\" for numeric base 10");
        assertThatThrownBy(() -> scan("0xG1"))
                .hasMessageContaining("Invalid digit \"G\" for numeric base 16");
    }

    @Test
    void rejectsPrefixWithoutDigits() {
        assertThatThrownBy(() -> scan("0x"))
                .hasMessageContaining("Invalid digit \"end of input\" for numeric base 16");
        assertThatThrownBy(() -> scan("ld v0, 0x,"))
                .hasMessageContaining("Invalid digit \",\" for numeric base 16");
    }

    @Test
    void rejectsUnknownCharacterWithPosition() {
        assertThatThrownBy(() -> scan("cls\nld v0, %1"))
                .isInstanceOf(CompilationException.class)
                .satisfies(e -> {
                    CompilationException ce = (CompilationException) e;
                    assertThat(ce.getErrorCode()).isEqualTo(CompilerErrorCode.UNDEFINED_CHARACTER_TOKEN);
                    assertThat(ce.getSourceInfo()).isEqualTo(new SourceInfo("test.asm", 2, 8));
                    assertThat(ce.getDetail()).isEqualTo("Character \"%\" cannot match any token");
                });
    }

    @Test
    void rejectsMalformedAsciiLiterals() {
        assertThatThrownBy(() -> scan("''")).extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.UNDEFINED_CHARACTER_TOKEN);
        assertThatThrownBy(() -> scan("'ab'")).extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.UNDEFINED_CHARACTER_TOKEN);
        assertThatThrownBy(() -> scan("'é'")).extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.UNDEFINED_CHARACTER_TOKEN);
    }

    @Test
    void scansTheSourceOnlyOnce() throws CompilationException {
        Lexer lexer = new Lexer("cls\nret", "test.asm");

        List<Token> first = lexer.scanTokens();
        List<Token> second = lexer.scanTokens();

        assertThat(second).isEqualTo(first).hasSize(3);
        assertThat(second).extracting(Token::type)
                .containsExactly(TokenType.INSTRUCTION, TokenType.INSTRUCTION, TokenType.END_OF_FILE);
    }
}
