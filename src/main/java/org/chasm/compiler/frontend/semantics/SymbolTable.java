package org.chasm.compiler.frontend.semantics;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.frontend.lexer.Token;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The symbol table of a compilation. All symbols share one flat, case-sensitive namespace.
 * <p>
 * Constants and config values are complete once declared. Labels, procedures and sprites
 * are declared during semantic analysis and bound to an address during layout.
 */
public class SymbolTable {

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Map<String, Integer> addresses = new LinkedHashMap<>();

    /**
     * Declares a new symbol.
     * @param symbol The symbol to declare.
     * @throws CompilationException if any symbol with the same name was declared before.
     */
    public void define(Symbol symbol) throws CompilationException {
        Symbol existing = symbols.get(symbol.text());
        if (existing != null) {
            throw new CompilationException(CompilerErrorCode.SYMBOL_ALREADY_DEFINED,
                    String.format("Symbol \"%s\" is already defined at %s", symbol.text(), existing.name().source()),
                    symbol.name().source());
        }
        symbols.put(symbol.text(), symbol);
    }

    /**
     * Resolves a symbol by name.
     * @param name The exact name.
     * @return The symbol, or empty if nothing of that name was declared.
     */
    public Optional<Symbol> resolve(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * Resolves a reference and checks that it names a symbol of an accepted kind.
     * @param reference The identifier token of the reference.
     * @param accepted The symbol kinds the referencing construct accepts.
     * @return The resolved symbol.
     * @throws CompilationException with {@link CompilerErrorCode#UNDEFINED_SYMBOL} if the name is unknown,
     *         or {@link CompilerErrorCode#WRONG_SYMBOL_KIND} if it names a symbol of another kind.
     */
    public Symbol require(Token reference, Set<Symbol.Kind> accepted) throws CompilationException {
        Symbol symbol = symbols.get(reference.text());
        if (symbol == null) {
            throw new CompilationException(CompilerErrorCode.UNDEFINED_SYMBOL,
                    String.format("Symbol \"%s\" is not defined", reference.text()),
                    reference.source());
        }
        if (!accepted.contains(symbol.kind())) {
            String expected = accepted.stream().map(k -> k.name().toLowerCase()).collect(Collectors.joining(" or "));
            throw new CompilationException(CompilerErrorCode.WRONG_SYMBOL_KIND,
                    String.format("Symbol \"%s\" is a %s, expected a %s",
                            reference.text(), symbol.kind().name().toLowerCase(), expected),
                    reference.source());
        }
        return symbol;
    }

    /**
     * Convenience overload of {@link #require(Token, Set)} accepting every kind.
     * @param reference The identifier token of the reference.
     * @return The resolved symbol.
     * @throws CompilationException if the name is unknown.
     */
    public Symbol require(Token reference) throws CompilationException {
        return require(reference, EnumSet.allOf(Symbol.Kind.class));
    }

    /**
     * Binds a label, procedure or sprite to its memory address.
     * @param name The symbol name.
     * @param address The byte address.
     */
    public void bindAddress(String name, int address) {
        Symbol symbol = symbols.get(name);
        if (symbol == null || !symbol.kind().isAddressed()) {
            throw new IllegalArgumentException("Cannot bind an address to " + name);
        }
        addresses.put(name, address);
    }

    /**
     * Returns the numeric value a symbol stands for: the value of a define or config,
     * or the bound address of a label, procedure or sprite.
     * @param name The symbol name.
     * @return The value.
     * @throws IllegalStateException if the symbol is unknown or its address is not bound yet.
     */
    public int valueOf(String name) {
        Symbol symbol = symbols.get(name);
        if (symbol == null) {
            throw new IllegalStateException("Unknown symbol " + name);
        }
        if (symbol.kind().isAddressed()) {
            Integer address = addresses.get(name);
            if (address == null) {
                throw new IllegalStateException("Address of " + name + " has not been laid out");
            }
            return address;
        }
        return symbol.value();
    }

    /**
     * @return All declared symbols in declaration order.
     */
    public Collection<Symbol> symbols() {
        return symbols.values();
    }

    /**
     * @return The bound addresses of labels, procedures and sprites, in binding order.
     */
    public Map<String, Integer> symbolAddresses() {
        return new LinkedHashMap<>(addresses);
    }

    /**
     * @return The resolved values of all config symbols, in declaration order.
     */
    public Map<String, Integer> configValues() {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Symbol symbol : symbols.values()) {
            if (symbol.kind() == Symbol.Kind.CONFIG) {
                result.put(symbol.text(), symbol.value());
            }
        }
        return result;
    }

    /**
     * @return The number of declared symbols.
     */
    public int size() {
        return symbols.size();
    }
}
