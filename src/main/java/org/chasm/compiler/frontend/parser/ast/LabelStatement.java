package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A statement that represents a label definition (<code>.name:</code>) and the statements it scopes.
 *
 * @param name The token containing the name of the label.
 * @param body The statements following the label up to the next label or the end of the enclosing scope.
 */
public record LabelStatement(Token name, List<Statement> body) implements Statement {

    public LabelStatement {
        body = List.copyOf(body);
    }

    @Override
    public int priority() {
        return PRIORITY_CODE;
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
        return new LabelStatement(name, newChildren);
    }
}
