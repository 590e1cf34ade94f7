package org.chasm.cli.commands;

import com.typesafe.config.Config;
import org.chasm.cli.CommandLineInterface;
import org.chasm.cli.output.ArtifactWriter;
import org.chasm.cli.output.OutputFormat;
import org.chasm.compiler.Compiler;
import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.ProgramArtifact;
import org.chasm.compiler.diagnostics.CompilerLogger;
import org.chasm.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles an assembly file to a program image.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-i", "--input"}, required = true, description = "The assembly file to compile.")
    private File input;

    @Option(names = {"-o", "--output"}, description = "The output file (default: chasm.output.file).")
    private File output;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default: chasm.output.format).")
    private OutputFormat format;

    @Option(names = {"-v", "--verbose"}, description = "Log every compiler phase.")
    private boolean verbose;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        Path target = output != null ? output.toPath() : Path.of(config.getString("chasm.output.file"));
        OutputFormat outputFormat = format != null ? format
                : config.getEnum(OutputFormat.class, "chasm.output.format");

        Compiler compiler = new Compiler();
        compiler.setVerbosity(verbose ? CompilerLogger.DEBUG : config.getInt("chasm.compiler.verbosity"));

        ProgramArtifact artifact;
        try {
            artifact = compiler.compile(input.toPath());
        } catch (CompilationException e) {
            log.error("{}", Diagnostic.from(e));
            return 1;
        }

        try {
            ArtifactWriter.write(artifact, outputFormat, target);
        } catch (IOException e) {
            log.error("Could not write {}: {}", target, e.getMessage());
            return 1;
        }
        log.info("Wrote {} words to {} ({})", artifact.words().size(), target, outputFormat);
        return 0;
    }
}
