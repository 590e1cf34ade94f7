package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.frontend.lexer.Token;

/**
 * A statement that emits one word verbatim (<code>raw(value)</code>).
 *
 * @param value A numeric token or an identifier naming any declared symbol.
 */
public record RawStatement(Token value) implements Statement {

    @Override
    public int priority() {
        return PRIORITY_CODE;
    }

    @Override
    public Token anchor() {
        return value;
    }
}
