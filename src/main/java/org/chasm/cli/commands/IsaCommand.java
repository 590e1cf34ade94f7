package org.chasm.cli.commands;

import org.chasm.compiler.isa.Architecture;
import org.chasm.compiler.isa.IInstructionSet;
import org.chasm.compiler.isa.OpcodeTemplate;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "isa", mixinStandardHelpOptions = true, description = "Prints the instruction table and the architecture defaults.")
public class IsaCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        IInstructionSet isa = Architecture.instructionSet();
        for (String mnemonic : isa.mnemonics()) {
            for (OpcodeTemplate template : isa.getTemplates(mnemonic)) {
                out.printf("%04X  %s%n", template.baseWord(), template.signature());
            }
        }
        out.println();
        Architecture.defaults().forEach((name, value) -> out.printf("%-16s %d%n", name, value));
        out.flush();
        return 0;
    }
}
