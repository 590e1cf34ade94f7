package org.chasm.compiler.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class Chip8InstructionSetTest {

    private final IInstructionSet isa = Chip8InstructionSet.getInstance();

    @Test
    void mnemonicsAreCaseInsensitive() {
        assertThat(isa.isMnemonic("drw")).isTrue();
        assertThat(isa.isMnemonic("DRW")).isTrue();
        assertThat(isa.isMnemonic("mov")).isFalse();
        assertThat(isa.getTemplates("Ld")).hasSize(6);
        assertThat(isa.getTemplates("unknown")).isEmpty();
    }

    @Test
    void listsEveryMnemonicOnce() {
        assertThat(isa.mnemonics()).hasSize(27).contains("cls", "jmpv0", "wkey", "ldm");
    }

    @Test
    void selectsFirstTemplateAcceptingTheOperands() {
        Predicate<OperandKind> generalRegister = k -> k == OperandKind.VX;
        Predicate<OperandKind> anyValue = OperandKind::isValue;

        assertThat(isa.select("ld", List.of(generalRegister, anyValue)))
                .get().extracting(OpcodeTemplate::baseWord).isEqualTo(0x6000);
        assertThat(isa.select("ld", List.of(generalRegister, generalRegister)))
                .get().extracting(OpcodeTemplate::baseWord).isEqualTo(0x8000);
        assertThat(isa.select("cls", List.of(generalRegister))).isEmpty();
    }

    @Test
    void describesTemplates() {
        OpcodeTemplate drw = isa.getTemplates("drw").get(0);
        assertThat(drw.signature()).isEqualTo("drw VX, VX, N4");
        assertThat(drw.kinds()).containsExactly(OperandKind.VX, OperandKind.VX, OperandKind.N4);
        assertThat(isa.getTemplates("cls").get(0).signature()).isEqualTo("cls");
    }

    @Test
    void resolvesRegisters() {
        assertThat(isa.resolveRegisterToken("vA")).contains(Register.VA);
        assertThat(isa.resolveRegisterToken("dt")).contains(Register.DT);
        assertThat(isa.resolveRegisterToken("v16")).isEmpty();
        assertThat(Register.VF.index()).isEqualTo(15);
        assertThat(Register.I.isGeneralPurpose()).isFalse();
    }

    @Test
    void immediateFormatsBoundValues() {
        assertThat(ImmediateFormat.IMM4.max()).isEqualTo(15);
        assertThat(ImmediateFormat.IMM12.matches(4095)).isTrue();
        assertThat(ImmediateFormat.IMM12.matches(4096)).isFalse();
        assertThat(ImmediateFormat.IMM8.matches(-1)).isFalse();
    }

    @Test
    void architectureDefaultsMatchConstants() {
        assertThat(Architecture.defaultValue("LOAD_ADDRESS")).contains(Architecture.LOAD_ADDRESS);
        assertThat(Architecture.defaultValue("SCREEN_WIDTH")).contains(64);
        assertThat(Architecture.defaultValue("screen_width")).isEmpty();
        assertThat(Architecture.defaults()).hasSize(10);
    }
}
