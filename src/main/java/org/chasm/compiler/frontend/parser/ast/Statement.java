package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.frontend.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all statement nodes in the Abstract Syntax Tree (AST).
 * The set of statement kinds is closed; every phase handles each of them explicitly.
 */
public sealed interface Statement permits DefineStatement, ConfigStatement, SpriteStatement, RawStatement,
        LabelStatement, ProcedureStatement, InstructionStatement {

    /** Priority of declarations that only bind values. */
    int PRIORITY_DECLARATION = 3;
    /** Priority of the main program flow. */
    int PRIORITY_CODE = 2;
    /** Priority of procedures, laid out after the main flow. */
    int PRIORITY_PROCEDURE = 1;
    /** Priority of sprite data, packed after all code. */
    int PRIORITY_DATA = 0;

    /**
     * Returns the rank used to stably reorder statements before layout.
     * Higher priorities are laid out first.
     * @return The priority of this statement kind.
     */
    int priority();

    /**
     * @return The token that identifies this statement in diagnostics.
     */
    Token anchor();

    /**
     * Returns the statements nested in this one, in order.
     * This allows generic passes to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return The nested statements, empty for statements without a body.
     */
    default List<Statement> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this statement with the given nested statements.
     *
     * @param newChildren The new nested statements.
     * @return A new statement with the new body, or this statement if it has no body.
     */
    default Statement reconstructWithChildren(List<Statement> newChildren) {
        return this;
    }
}
