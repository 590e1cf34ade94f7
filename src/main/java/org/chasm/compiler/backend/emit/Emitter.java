package org.chasm.compiler.backend.emit;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.api.ProgramArtifact;
import org.chasm.compiler.api.SourceInfo;
import org.chasm.compiler.backend.layout.LayoutResult;
import org.chasm.compiler.frontend.lexer.Token;
import org.chasm.compiler.frontend.lexer.TokenType;
import org.chasm.compiler.frontend.parser.ast.InstructionStatement;
import org.chasm.compiler.frontend.parser.ast.Operand;
import org.chasm.compiler.frontend.parser.ast.RawStatement;
import org.chasm.compiler.frontend.parser.ast.SpriteStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.SymbolTable;
import org.chasm.compiler.isa.IInstructionSet;
import org.chasm.compiler.isa.ImmediateFormat;
import org.chasm.compiler.isa.OpcodeTemplate;
import org.chasm.compiler.isa.Register;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The Emitter is the final stage of the compiler backend. It walks the statements in the
 * order they were laid out, encodes every instruction through the instruction table and
 * produces the final, self-contained {@link ProgramArtifact}.
 */
public class Emitter {

    /**
     * Emits the program artifact.
     *
     * @param programName The name of the program.
     * @param statements The statements in layout order.
     * @param layout The layout result.
     * @param symbolTable The symbol table with all addresses bound.
     * @param isa The instruction table used to encode instructions.
     * @return The compiled {@link ProgramArtifact}.
     * @throws CompilationException if an instruction has no matching encoding or an operand does not fit its field.
     */
    public ProgramArtifact emit(String programName,
                                List<Statement> statements,
                                LayoutResult layout,
                                SymbolTable symbolTable,
                                IInstructionSet isa) throws CompilationException {
        byte[] image = new byte[layout.size()];
        int written = write(statements, symbolTable, isa, image, 0);
        if (written != image.length) {
            throw new IllegalStateException("Emitted " + written + " bytes but layout reserved " + image.length);
        }

        List<Integer> words = new ArrayList<>((image.length + 1) / 2);
        for (int i = 0; i < image.length; i += 2) {
            int high = image[i] & 0xFF;
            int low = i + 1 < image.length ? image[i + 1] & 0xFF : 0;
            words.add(high << 8 | low);
        }

        Map<Integer, SourceInfo> sourceMap = new TreeMap<>();
        layout.sourceMap().forEach((address, source) ->
                sourceMap.putIfAbsent((address - layout.baseAddress()) / 2, source));

        return new ProgramArtifact(programName, layout.baseAddress(), words,
                symbolTable.symbolAddresses(), symbolTable.configValues(), sourceMap);
    }

    private int write(List<Statement> statements, SymbolTable symbolTable, IInstructionSet isa,
                      byte[] image, int offset) throws CompilationException {
        for (Statement statement : statements) {
            if (statement instanceof InstructionStatement instruction) {
                offset = putWord(image, offset, encode(instruction, symbolTable, isa));
            } else if (statement instanceof RawStatement raw) {
                offset = putWord(image, offset, valueOf(raw.value(), symbolTable));
            } else if (statement instanceof SpriteStatement sprite) {
                for (int row : sprite.rows()) {
                    image[offset++] = (byte) row;
                }
            } else {
                offset = write(statement.getChildren(), symbolTable, isa, image, offset);
            }
        }
        return offset;
    }

    private static int putWord(byte[] image, int offset, int word) {
        image[offset] = (byte) (word >>> 8);
        image[offset + 1] = (byte) word;
        return offset + 2;
    }

    /**
     * Encodes one instruction into its machine word.
     * @param instruction The instruction.
     * @param symbolTable The symbol table with all addresses bound.
     * @param isa The instruction table.
     * @return The 16-bit word.
     * @throws CompilationException if no template accepts the operands or a value does not fit its field.
     */
    int encode(InstructionStatement instruction, SymbolTable symbolTable, IInstructionSet isa) throws CompilationException {
        String mnemonic = instruction.mnemonic().text();
        List<ResolvedOperand> operands = new ArrayList<>();
        for (Operand operand : instruction.operands()) {
            operands.add(resolve(operand, symbolTable, isa));
        }

        OpcodeTemplate template = isa.select(mnemonic, operands).orElseThrow(() -> new CompilationException(
                CompilerErrorCode.OPERAND_MISMATCH,
                String.format("Operands (%s) do not match any form of %s: %s",
                        operands.stream().map(ResolvedOperand::describe).collect(Collectors.joining(", ")),
                        mnemonic,
                        isa.getTemplates(mnemonic).stream().map(OpcodeTemplate::signature).collect(Collectors.joining(" | "))),
                instruction.mnemonic().source()));

        int word = template.baseWord();
        for (int i = 0; i < template.slots().size(); i++) {
            OpcodeTemplate.Slot slot = template.slots().get(i);
            if (slot.shift() < 0) continue;
            ResolvedOperand operand = operands.get(i);
            ImmediateFormat format = slot.kind().format();
            if (format != null && !format.matches(operand.value())) {
                throw new CompilationException(CompilerErrorCode.IMMEDIATE_OUT_OF_RANGE,
                        String.format("Value %d of operand \"%s\" does not fit %s (max %d)",
                                operand.value(), operand.describe(), format, format.max()),
                        operand.operand().source());
            }
            word |= operand.value() << slot.shift();
        }
        return word;
    }

    private static ResolvedOperand resolve(Operand operand, SymbolTable symbolTable, IInstructionSet isa) {
        if (operand instanceof Operand.Reg) {
            Register register = isa.resolveRegisterToken(operand.token().text())
                    .orElseThrow(() -> new IllegalStateException("Unknown register " + operand.token().text()));
            return new ResolvedOperand(operand, register, Math.max(register.index(), 0));
        }
        return new ResolvedOperand(operand, null, valueOf(operand.token(), symbolTable));
    }

    private static int valueOf(Token token, SymbolTable symbolTable) {
        if (token.type() == TokenType.IDENTIFIER) {
            return symbolTable.valueOf(token.text());
        }
        return token.intValue();
    }
}
