package org.chasm.compiler.frontend.parser;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.frontend.lexer.Token;
import org.chasm.compiler.frontend.lexer.TokenType;
import org.chasm.compiler.frontend.parser.ast.AbstractTree;
import org.chasm.compiler.frontend.parser.ast.ConfigStatement;
import org.chasm.compiler.frontend.parser.ast.DefineStatement;
import org.chasm.compiler.frontend.parser.ast.InstructionStatement;
import org.chasm.compiler.frontend.parser.ast.LabelStatement;
import org.chasm.compiler.frontend.parser.ast.Operand;
import org.chasm.compiler.frontend.parser.ast.ProcedureStatement;
import org.chasm.compiler.frontend.parser.ast.RawStatement;
import org.chasm.compiler.frontend.parser.ast.SpriteStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.isa.Architecture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The recursive-descent parser for the assembly language. It consumes the tokens
 * produced by the {@link org.chasm.compiler.frontend.lexer.Lexer} and builds an {@link AbstractTree}.
 * Dispatch uses one token of lookahead. The parser validates shape only; symbols are
 * checked later by the {@link org.chasm.compiler.frontend.semantics.SymbolSanitizer}.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final TokenType[] OPERAND_STARTERS = {
            TokenType.REGISTER, TokenType.IDENTIFIER, TokenType.NUMBER,
            TokenType.AT, TokenType.DOLLAR, TokenType.HASH, TokenType.BRACKET_OPEN
    };

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by an end-of-file token.
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses the entire token stream.
     * @return The tree of all top-level statements, in source order.
     * @throws CompilationException on the first syntax error.
     */
    public AbstractTree parse() throws CompilationException {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(primaryStatement());
        }
        LOG.debug("Parsed {} top-level statements", statements.size());
        return new AbstractTree(statements);
    }

    private Statement primaryStatement() throws CompilationException {
        switch (peek().type()) {
            case DEFINE: return define();
            case CONFIG: return config();
            case SPRITE: return sprite();
            case RAW: return raw();
            case DOT: return label();
            case PROC: return procedure();
            case INSTRUCTION: return instruction();
            default:
                throw unexpected(peek(), TokenType.DEFINE, TokenType.CONFIG, TokenType.SPRITE, TokenType.RAW,
                        TokenType.DOT, TokenType.PROC, TokenType.INSTRUCTION);
        }
    }

    private Statement define() throws CompilationException {
        consume(TokenType.DEFINE);
        Token name = consume(TokenType.IDENTIFIER);
        Token value = consume(TokenType.NUMBER, TokenType.DEFAULT);
        return new DefineStatement(name, value);
    }

    private Statement config() throws CompilationException {
        consume(TokenType.CONFIG);
        Token name = consume(TokenType.IDENTIFIER);
        consume(TokenType.EQUAL);
        Token value = consume(TokenType.NUMBER, TokenType.DEFAULT);
        return new ConfigStatement(name, value);
    }

    private Statement sprite() throws CompilationException {
        consume(TokenType.SPRITE);
        Token name = consume(TokenType.IDENTIFIER);
        consume(TokenType.BRACKET_OPEN);

        List<Integer> rows = new ArrayList<>();
        do {
            Token row = consume(TokenType.NUMBER);
            if (rows.size() >= Architecture.MAX_SPRITE_ROWS) {
                throw new CompilationException(CompilerErrorCode.SPRITE_TOO_LARGE,
                        String.format("Sprite \"%s\" has too many rows (more than %d)", name.text(), Architecture.MAX_SPRITE_ROWS),
                        row.source());
            }
            if (!Architecture.SPRITE_ROW_FORMAT.matches(row.intValue())) {
                throw new CompilationException(CompilerErrorCode.SPRITE_ROW_OUT_OF_RANGE,
                        String.format("Sprite \"%s\" row %s exceeds %d", name.text(), row.text(), Architecture.SPRITE_ROW_FORMAT.max()),
                        row.source());
            }
            rows.add(row.intValue());
        } while (match(TokenType.COMMA));

        consume(TokenType.BRACKET_CLOSE);
        return new SpriteStatement(name, rows);
    }

    private Statement raw() throws CompilationException {
        consume(TokenType.RAW);
        consume(TokenType.PAREN_OPEN);
        Token value = consume(TokenType.NUMBER, TokenType.IDENTIFIER);
        consume(TokenType.PAREN_CLOSE);
        return new RawStatement(value);
    }

    private Statement label() throws CompilationException {
        consume(TokenType.DOT);
        Token name = consume(TokenType.IDENTIFIER);
        consume(TokenType.COLON);

        List<Statement> body = new ArrayList<>();
        while (true) {
            switch (peek().type()) {
                case DOT:
                case ENDP:
                case PROC:
                case SPRITE:
                case END_OF_FILE:
                    // The enclosing scope decides whether this token is legal there.
                    return new LabelStatement(name, body);
                case DEFINE: body.add(define()); break;
                case CONFIG: body.add(config()); break;
                case RAW: body.add(raw()); break;
                case INSTRUCTION: body.add(instruction()); break;
                default:
                    throw unexpected(peek(), TokenType.DEFINE, TokenType.CONFIG, TokenType.RAW, TokenType.INSTRUCTION,
                            TokenType.DOT, TokenType.ENDP);
            }
        }
    }

    private Statement procedure() throws CompilationException {
        consume(TokenType.PROC);
        Token name = consume(TokenType.IDENTIFIER);

        List<Statement> body = new ArrayList<>();
        boolean closed = false;
        while (!closed) {
            Token next = peek();
            switch (next.type()) {
                case ENDP: closed = true; break;
                case DEFINE: body.add(define()); break;
                case CONFIG: body.add(config()); break;
                case RAW: body.add(raw()); break;
                case INSTRUCTION: body.add(instruction()); break;
                case DOT: body.add(label()); break;
                case PROC:
                    throw new CompilationException(CompilerErrorCode.NESTED_PROCEDURE,
                            String.format("Cannot define procedure \"%s\" inside procedure \"%s\"",
                                    peekNext().text(), name.text()),
                            next.source());
                case END_OF_FILE:
                    throw new CompilationException(CompilerErrorCode.UNEXPECTED_END_OF_INPUT,
                            String.format("Found end of file before endp of procedure \"%s\"", name.text()),
                            next.source());
                default:
                    throw unexpected(next, TokenType.DEFINE, TokenType.CONFIG, TokenType.RAW, TokenType.INSTRUCTION,
                            TokenType.DOT, TokenType.ENDP);
            }
        }

        consume(TokenType.ENDP);
        Token endName = consume(TokenType.IDENTIFIER);
        if (!endName.text().equals(name.text())) {
            throw new CompilationException(CompilerErrorCode.UNMATCHING_PROCEDURE_NAMES,
                    String.format("Procedure \"%s\" declared at %s is closed as \"%s\"",
                            name.text(), name.source(), endName.text()),
                    endName.source());
        }
        return new ProcedureStatement(name, endName, body);
    }

    private Statement instruction() throws CompilationException {
        Token mnemonic = consume(TokenType.INSTRUCTION);
        List<Operand> operands = new ArrayList<>();
        if (checkAny(OPERAND_STARTERS)) {
            do {
                operands.add(operand());
            } while (match(TokenType.COMMA));
        }
        return new InstructionStatement(mnemonic, operands);
    }

    private Operand operand() throws CompilationException {
        Token token = consume(OPERAND_STARTERS);
        switch (token.type()) {
            case REGISTER:
                return new Operand.Reg(token);
            case AT:
                return new Operand.LabelRef(consume(TokenType.IDENTIFIER));
            case DOLLAR:
                return new Operand.ProcedureRef(consume(TokenType.IDENTIFIER));
            case HASH:
                return new Operand.SpriteRef(consume(TokenType.IDENTIFIER));
            case BRACKET_OPEN: {
                Token inner = consume(TokenType.IDENTIFIER, TokenType.NUMBER);
                consume(TokenType.BRACKET_CLOSE);
                return new Operand.Indirect(inner);
            }
            default:
                return new Operand.Immediate(token);
        }
    }

    private CompilationException unexpected(Token found, TokenType... expected) {
        String expectedNames = Arrays.stream(expected)
                .map(TokenType::displayName)
                .collect(Collectors.joining(", ", "(", ")"));
        String foundText = found.type() == TokenType.END_OF_FILE
                ? "end of file"
                : String.format("\"%s\" (%s)", found.text(), found.type().displayName());
        return new CompilationException(CompilerErrorCode.UNEXPECTED_TOKEN,
                String.format("Unexpected %s, expected one of %s", foundText, expectedNames),
                found.source());
    }

    /**
     * Consumes the current token if it is of one of the expected types.
     * @param types The accepted token types.
     * @return The consumed token.
     * @throws CompilationException if the current token has another type.
     */
    private Token consume(TokenType... types) throws CompilationException {
        if (checkAny(types)) return advance();
        throw unexpected(peek(), types);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : peek();
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
