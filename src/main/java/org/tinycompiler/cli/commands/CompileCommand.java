package org.tinycompiler.cli.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tinycompiler.cli.CommandLineInterface;
import org.tinycompiler.compiler.CompilationResult;
import org.tinycompiler.compiler.Compiler;
import org.tinycompiler.compiler.api.CompilationException;
import org.tinycompiler.compiler.api.CompilerOptions;
import org.tinycompiler.compiler.diagnostics.CompilerLogger;
import org.tinycompiler.compiler.util.AstDumper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Compiles a call-expression program into C-style code.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_COMPILATION_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    @Parameters(paramLabel = "FILE", arity = "0..1", description = "The source file to compile.")
    private File file;

    @Option(names = {"-e", "--expression"}, paramLabel = "TEXT", description = "Source text to compile instead of a file.")
    private String expression;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write the generated code to this file instead of stdout.")
    private File output;

    @Option(names = "--dump-trees", description = "Print the source and target trees before the generated code.")
    private boolean dumpTrees;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if ((file == null) == (expression == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Specify exactly one of FILE or --expression");
        }

        CompilerOptions options = CompilerOptions.fromConfig(parent.getConfig());
        if (options.verbosity() >= 0) {
            CompilerLogger.setLevel(options.verbosity());
        }
        boolean dump = dumpTrees || options.dumpTrees();
        Compiler compiler = new Compiler(options.withDumpTrees(false));

        String programName;
        String source;
        if (file != null) {
            programName = file.getPath();
            try {
                source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                LOG.error("Cannot read source file {}: {}", programName, e.getMessage());
                return EXIT_IO_ERROR;
            }
        } else {
            programName = "<expression>";
            source = expression;
        }

        CompilationResult result;
        try {
            result = compiler.compileToResult(source, programName);
        } catch (CompilationException e) {
            LOG.error("{} error in {} at {}: {}", e.getKind(), programName, e.getSourceInfo(), e.getMessage());
            return EXIT_COMPILATION_ERROR;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (dump) {
            out.print(AstDumper.dump(result.sourceAst()));
            out.print(AstDumper.dump(result.targetAst()));
        }

        if (output != null) {
            try {
                Files.writeString(output.toPath(), result.code(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                LOG.error("Cannot write output file {}: {}", output.getPath(), e.getMessage());
                return EXIT_IO_ERROR;
            }
            LOG.info("Wrote {}", output.getPath());
        } else {
            out.print(result.code());
        }
        out.flush();
        return 0;
    }
}
