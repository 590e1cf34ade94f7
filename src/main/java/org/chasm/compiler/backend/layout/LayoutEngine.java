package org.chasm.compiler.backend.layout;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.parser.ast.InstructionStatement;
import org.chasm.compiler.frontend.parser.ast.LabelStatement;
import org.chasm.compiler.frontend.parser.ast.ProcedureStatement;
import org.chasm.compiler.frontend.parser.ast.RawStatement;
import org.chasm.compiler.frontend.parser.ast.SpriteStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.SymbolTable;
import org.chasm.compiler.isa.Architecture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Assigns memory addresses to ordered statements. Instructions and raw words take one word each,
 * sprites take one byte per row. Labels and procedures get the address of the next placed item.
 * This pass does not encode anything.
 */
public final class LayoutEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutEngine.class);

    /**
     * Lays out the given statements from the program load address.
     * @param statements The statements in layout order.
     * @param symbolTable The sanitized symbol table; label, procedure and sprite addresses are bound in it.
     * @return The result of the layout process.
     * @throws CompilationException if the program does not fit into memory.
     */
    public LayoutResult layout(List<Statement> statements, SymbolTable symbolTable) throws CompilationException {
        return layout(statements, symbolTable, new LayoutContext());
    }

    /**
     * Lays out the given statements with an explicit context.
     * @param statements The statements in layout order.
     * @param symbolTable The sanitized symbol table.
     * @param ctx The layout context that defines base address and memory size.
     * @return The result of the layout process.
     * @throws CompilationException if the program does not fit into memory.
     */
    public LayoutResult layout(List<Statement> statements, SymbolTable symbolTable, LayoutContext ctx) throws CompilationException {
        place(statements, symbolTable, ctx);
        LOG.debug("Laid out {} bytes from 0x{}", ctx.address() - ctx.baseAddress(), Integer.toHexString(ctx.baseAddress()));
        return new LayoutResult(ctx.baseAddress(), ctx.address(), new LinkedHashMap<>(ctx.sourceMap()));
    }

    private void place(List<Statement> statements, SymbolTable symbolTable, LayoutContext ctx) throws CompilationException {
        for (Statement statement : statements) {
            if (statement instanceof InstructionStatement || statement instanceof RawStatement) {
                ctx.place(Architecture.WORD_SIZE, statement.anchor().source());
            } else if (statement instanceof SpriteStatement sprite) {
                int address = ctx.place(sprite.rows().size(), sprite.name().source());
                symbolTable.bindAddress(sprite.name().text(), address);
            } else if (statement instanceof LabelStatement label) {
                symbolTable.bindAddress(label.name().text(), ctx.address());
                place(label.body(), symbolTable, ctx);
            } else if (statement instanceof ProcedureStatement procedure) {
                symbolTable.bindAddress(procedure.name().text(), ctx.address());
                place(procedure.body(), symbolTable, ctx);
            }
            // define and config occupy no memory
        }
    }
}
