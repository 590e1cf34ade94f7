package org.chasm.compiler.backend;

import org.chasm.compiler.frontend.parser.ast.Statement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reorders statements by descending priority before layout: declarations first, then the main
 * program flow, then procedures, then sprite data. Every statement list is reordered on its own,
 * nested bodies included. Statements of equal priority keep their source order.
 */
public class StatementOrderer {

    private static final Comparator<Statement> BY_PRIORITY =
            Comparator.comparingInt(Statement::priority).reversed();

    /**
     * Orders a statement list and all nested bodies.
     * @param statements The statements in source order.
     * @return A new list in layout order; the input is not modified.
     */
    public List<Statement> order(List<Statement> statements) {
        List<Statement> ordered = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            List<Statement> children = statement.getChildren();
            ordered.add(children.isEmpty() ? statement : statement.reconstructWithChildren(order(children)));
        }
        // List.sort is a stable merge sort.
        ordered.sort(BY_PRIORITY);
        return ordered;
    }
}
