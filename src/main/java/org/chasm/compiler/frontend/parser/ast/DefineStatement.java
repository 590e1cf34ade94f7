package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.frontend.lexer.Token;
import org.chasm.compiler.frontend.lexer.TokenType;

/**
 * A statement that represents a <code>define</code> declaration.
 *
 * @param name  The token of the constant name.
 * @param value The numeric token, or the <code>default</code> keyword token.
 */
public record DefineStatement(Token name, Token value) implements Statement {

    /**
     * @return true if the value is requested from the architecture defaults.
     */
    public boolean isDefault() {
        return value.type() == TokenType.DEFAULT;
    }

    @Override
    public int priority() {
        return PRIORITY_DECLARATION;
    }

    @Override
    public Token anchor() {
        return name;
    }
}
