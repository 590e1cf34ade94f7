package org.chasm.compiler.backend.layout;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.api.SourceInfo;
import org.chasm.compiler.backend.StatementOrderer;
import org.chasm.compiler.frontend.lexer.Lexer;
import org.chasm.compiler.frontend.parser.Parser;
import org.chasm.compiler.frontend.parser.ast.AbstractTree;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.SymbolTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for the {@link LayoutEngine}. Programs are parsed, sanitized and ordered
 * the same way the generator does before the layout runs.
 */
@Tag("unit")
public class LayoutEngineTest {

    private SymbolTable symbolTable;

    private List<Statement> prepare(String source) throws CompilationException {
        AbstractTree tree = new Parser(new Lexer(source, "test.asm").scanTokens()).parse();
        symbolTable = tree.sanitize();
        return new StatementOrderer().order(tree.statements());
    }

    @Test
    void placesCodeFromLoadAddressAndDataAfterIt() throws CompilationException {
        List<Statement> ordered = prepare(String.join("\n",
                "sprite face [1, 2, 3]",
                "cls",
                "proc draw",
                "  ret",
                "endp draw",
                ".loop:",
                "  jmp @loop",
                "sprite dot [0x80]"));

        LayoutResult layout = new LayoutEngine().layout(ordered, symbolTable);

        assertThat(layout.baseAddress()).isEqualTo(0x200);
        // cls, jmp, ret = 6 bytes of code, then 3 + 1 sprite bytes
        assertThat(layout.endAddress()).isEqualTo(0x20A);
        assertThat(layout.size()).isEqualTo(10);
        assertThat(symbolTable.symbolAddresses()).containsOnly(
                entry("loop", 0x202),
                entry("draw", 0x204),
                entry("face", 0x206),
                entry("dot", 0x209));
    }

    @Test
    void labelAtEndGetsEndAddress() throws CompilationException {
        List<Statement> ordered = prepare("cls\n.end:");
        LayoutResult layout = new LayoutEngine().layout(ordered, symbolTable);
        assertThat(symbolTable.valueOf("end")).isEqualTo(layout.endAddress()).isEqualTo(0x202);
    }

    @Test
    void declarationsOccupyNoMemory() throws CompilationException {
        List<Statement> ordered = prepare("define A 1\nconfig B = 2\n.l:\n  define C 3");
        LayoutResult layout = new LayoutEngine().layout(ordered, symbolTable);
        assertThat(layout.size()).isZero();
        assertThat(symbolTable.valueOf("l")).isEqualTo(0x200);
    }

    @Test
    void recordsSourceOfEveryPlacedItem() throws CompilationException {
        List<Statement> ordered = prepare("cls\nsprite s [1]\nraw(7)");
        LayoutResult layout = new LayoutEngine().layout(ordered, symbolTable);
        assertThat(layout.sourceMap()).containsExactly(
                entry(0x200, new SourceInfo("test.asm", 1, 1)),
                entry(0x202, new SourceInfo("test.asm", 3, 5)),
                entry(0x204, new SourceInfo("test.asm", 2, 8)));
    }

    @Test
    void rejectsProgramsBeyondMemory() throws CompilationException {
        List<Statement> ordered = prepare("cls\ncls\ncls");
        assertThatThrownBy(() -> new LayoutEngine().layout(ordered, symbolTable, new LayoutContext(0x200, 0x204)))
                .isInstanceOf(CompilationException.class)
                .satisfies(e -> {
                    CompilationException ce = (CompilationException) e;
                    assertThat(ce.getErrorCode()).isEqualTo(CompilerErrorCode.PROGRAM_TOO_LARGE);
                    assertThat(ce.getSourceInfo().lineNumber()).isEqualTo(3);
                });
    }
}
