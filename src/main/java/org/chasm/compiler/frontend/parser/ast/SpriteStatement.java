package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A statement that represents a sprite literal (<code>sprite name [r0, r1, ...]</code>).
 *
 * @param name The token of the sprite name.
 * @param rows The pixel rows, one byte each, top to bottom.
 */
public record SpriteStatement(Token name, List<Integer> rows) implements Statement {

    public SpriteStatement {
        rows = List.copyOf(rows);
    }

    @Override
    public int priority() {
        return PRIORITY_DATA;
    }

    @Override
    public Token anchor() {
        return name;
    }
}
