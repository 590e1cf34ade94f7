package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A statement that represents a procedure definition (<code>proc name</code> ... <code>endp name</code>).
 *
 * @param name The token containing the name after <code>proc</code>.
 * @param endName The token containing the name after <code>endp</code>; it matches {@code name}.
 * @param body The statements of the procedure.
 */
public record ProcedureStatement(Token name, Token endName, List<Statement> body) implements Statement {

    public ProcedureStatement {
        body = List.copyOf(body);
    }

    @Override
    public int priority() {
        return PRIORITY_PROCEDURE;
    }

    @Override
    public Token anchor() {
        return name;
    }

    @Override
    public List<Statement> getChildren() {
        return body;
    }

    @Override
    public Statement reconstructWithChildren(List<Statement> newChildren) {
        return new ProcedureStatement(name, endName, newChildren);
    }
}
