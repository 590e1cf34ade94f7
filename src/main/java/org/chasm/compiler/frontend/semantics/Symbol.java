package org.chasm.compiler.frontend.semantics;

import org.chasm.compiler.frontend.lexer.Token;

/**
 * Represents a single symbol (a constant, a config value, a label, a procedure or a sprite)
 * in the symbol table.
 *
 * @param name The token of the symbol, containing name, line, and column.
 * @param kind The kind of the symbol.
 * @param value The resolved value of a define or config, null for symbols that get an address during layout.
 */
public record Symbol(Token name, Kind kind, Integer value) {
    /**
     * The kind of a symbol in the symbol table.
     */
    public enum Kind {
        /** A compile-time constant defined with <code>define</code>. */
        DEFINE,
        /** A target-configuration value defined with <code>config</code>. */
        CONFIG,
        /** A label defined with <code>.name:</code>. */
        LABEL,
        /** A procedure defined with <code>proc</code>. */
        PROCEDURE,
        /** A sprite literal defined with <code>sprite</code>. */
        SPRITE;

        /**
         * @return true if symbols of this kind are placed in memory and resolve to an address.
         */
        public boolean isAddressed() {
            return this == LABEL || this == PROCEDURE || this == SPRITE;
        }
    }

    /**
     * Constructor for symbols that receive their address during layout.
     * @param name The symbol's name token.
     * @param kind The symbol's kind.
     */
    public Symbol(Token name, Kind kind) {
        this(name, kind, null);
    }

    /**
     * @return The symbol name as written in the source.
     */
    public String text() {
        return name.text();
    }
}
