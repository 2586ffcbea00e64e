package org.tinycompiler.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.tinycompiler.compiler.diagnostics.CompilerLogger;
import org.tinycompiler.junit.extensions.logging.ExpectLog;
import org.tinycompiler.junit.extensions.logging.LogLevel;
import org.tinycompiler.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link CommandLineInterface} and its compile subcommand.
 * The commands run in-process with captured output streams.
 */
@ExtendWith(LogWatchExtension.class)
public class CommandLineInterfaceTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    @Tag("unit")
    void testNoSubcommandPrintsUsage() {
        // Act
        int exitCode = commandLine.execute();

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: tinyc").contains("compile");
    }

    @Test
    @Tag("unit")
    void testCompilesExpressionToStdout() {
        // Act
        int exitCode = commandLine.execute("compile", "-e", "(add 2 (subtract 4 2))");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("int main()\n{\n  add(2, subtract(4, 2));\n}\n");
    }

    @Test
    @Tag("unit")
    void testCompilesFileToOutputFile(@TempDir Path dir) throws Exception {
        // Arrange
        Path source = dir.resolve("prog.lisp");
        Path target = dir.resolve("prog.c");
        Files.writeString(source, "(add 2 2)\n(subtract 4 2)\n", StandardCharsets.UTF_8);

        // Act
        int exitCode = commandLine.execute("compile", source.toString(), "-o", target.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(target, StandardCharsets.UTF_8))
                .isEqualTo("int main()\n{\n  add(2, 2);\n  subtract(4, 2);\n}\n");
    }

    @Test
    @Tag("unit")
    void testDumpTreesPrintsBothTreesFirst() {
        // Act
        int exitCode = commandLine.execute("compile", "--dump-trees", "-e", "(f 1)");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(String.join("\n",
                "Program",
                "  CallExpression f",
                "    NumberLiteral 1",
                "Program",
                "  ExpressionStatement",
                "    CallExpression",
                "      Identifier f",
                "      NumberLiteral 1",
                "int main()",
                "{",
                "  f(1);",
                "}",
                ""));
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "LEXICAL error in <expression> at <expression>:1:6.*")
    void testCompilationErrorExitsWithOne() {
        // Act
        int exitCode = commandLine.execute("compile", "-e", "(add @ 2)");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Cannot read source file .*")
    void testUnreadableFileExitsWithTwo(@TempDir Path dir) {
        // Act
        int exitCode = commandLine.execute("compile", dir.resolve("missing.lisp").toString());

        // Assert
        assertThat(exitCode).isEqualTo(2);
    }

    /**
     * Exactly one of FILE and --expression must be given.
     */
    @Test
    @Tag("unit")
    void testInputIsRequiredOnce(@TempDir Path dir) {
        // Act
        int neither = commandLine.execute("compile");
        int both = commandLine.execute("compile", dir.resolve("a.lisp").toString(), "-e", "(f)");

        // Assert
        assertThat(neither).isEqualTo(2);
        assertThat(both).isEqualTo(2);
        assertThat(err.toString()).contains("Specify exactly one of FILE or --expression");
    }

    @Test
    @Tag("unit")
    void testMissingConfigFileIsAUsageError(@TempDir Path dir) {
        // Act
        int exitCode = commandLine.execute("-c", dir.resolve("nope.conf").toString(), "compile", "-e", "(f)");

        // Assert
        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Failed to load configuration");
    }

    /**
     * Verifies that the emitter indent is taken from an explicit configuration file.
     */
    @Test
    @Tag("unit")
    void testConfigFileChangesIndent(@TempDir Path dir) throws Exception {
        // Arrange
        Path config = dir.resolve("custom.conf");
        Files.writeString(config, "tinycompiler.emitter.indent = \"    \"\n", StandardCharsets.UTF_8);

        // Act
        int exitCode = commandLine.execute("-c", config.toString(), "compile", "-e", "(f 1)");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("int main()\n{\n    f(1);\n}\n");
    }

    /**
     * Verifies that the configured compiler verbosity is applied by the driver.
     */
    @Test
    @Tag("unit")
    void testConfigFileSetsVerbosity(@TempDir Path dir) throws Exception {
        // Arrange
        Path config = dir.resolve("verbose.conf");
        Files.writeString(config, "tinycompiler.compiler.verbosity = 3\n", StandardCharsets.UTF_8);

        try {
            // Act
            int exitCode = commandLine.execute("-c", config.toString(), "compile", "-e", "(f 1)");

            // Assert
            assertThat(exitCode).isZero();
            assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.DEBUG);
        } finally {
            CompilerLogger.setLevel(CompilerLogger.INFO);
        }
    }
}
