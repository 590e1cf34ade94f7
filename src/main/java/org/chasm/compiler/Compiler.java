package org.chasm.compiler;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.ICompiler;
import org.chasm.compiler.api.ProgramArtifact;
import org.chasm.compiler.diagnostics.CompilerLogger;
import org.chasm.compiler.frontend.lexer.Lexer;
import org.chasm.compiler.frontend.lexer.Token;
import org.chasm.compiler.frontend.parser.Parser;
import org.chasm.compiler.frontend.parser.ast.AbstractTree;
import org.chasm.compiler.isa.Architecture;
import org.chasm.compiler.isa.IInstructionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the entire compilation
 * pipeline from source code to a program artifact. It is not thread-safe, but every
 * call builds fresh phase objects.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final IInstructionSet isa;
    private int verbosity = -1;

    public Compiler() {
        this(Architecture.instructionSet());
    }

    /**
     * Creates a compiler for a specific instruction table.
     * @param isa The instruction table used by the lexer and the encoder.
     */
    public Compiler(IInstructionSet isa) {
        this.isa = isa;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ProgramArtifact compile(String source, String programName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        LOG.debug("Compiling {}", programName);

        // Phase 1: Lexical Analysis
        Lexer lexer = new Lexer(source, programName, isa);
        List<Token> tokens = lexer.scanTokens();

        // Phase 2: Parsing (builds the abstract tree)
        Parser parser = new Parser(tokens);
        AbstractTree tree = parser.parse();

        // Phase 3 and 4: Symbol resolution, then ordering, layout and encoding
        ProgramArtifact artifact = tree.generate(programName, isa);

        LOG.info("{} compiled to {} words at 0x{}", programName, artifact.words().size(),
                String.format("%03X", artifact.baseAddress()));
        return artifact;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
