package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.api.SourceInfo;
import org.chasm.compiler.frontend.lexer.Token;
import org.chasm.compiler.frontend.lexer.TokenType;

/**
 * A statement that represents a <code>config name = value</code> declaration of a target-configuration value.
 *
 * @param name  The token of the config name.
 * @param value The numeric token, or the <code>default</code> keyword token.
 */
public record ConfigStatement(Token name, Token value) implements Statement {

    /**
     * @return true if the value is requested from the architecture defaults.
     */
    public boolean isDefault() {
        return value.type() == TokenType.DEFAULT;
    }

    /**
     * @return The position of the declaration.
     */
    public SourceInfo source() {
        return name.source();
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
