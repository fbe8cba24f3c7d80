package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.parser.ParserBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

public class Main {

    static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_TARGET_NOT_FOUND = 1;
    static final int EXIT_IO_ERROR = 2;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CLIEntryPoint()).execute(args);
        System.exit(exitCode);
    }

    @CommandLine.Command(subcommands = {Extractor.class}, mixinStandardHelpOptions = true, version = "0.1")
    public static class CLIEntryPoint implements Runnable {
        @Override
        public void run() {
            CommandLine.usage(this, System.out);
        }
    }

    @CommandLine.Command(name = "extract", mixinStandardHelpOptions = true, version = "0.1",
            description = "Extract the call flow of a class into <target>_flow.java and <target>_flow.json")
    static class Extractor implements Callable<Integer> {
        @CommandLine.Option(
                names = {"-p", "--project"},
                paramLabel = "PROJECT",
                description = "The root directory of the Java project to scan.",
                required = true
        )
        Path projectRoot;

        @CommandLine.Option(
                names = {"-t", "--target"},
                paramLabel = "TARGET",
                description = "The entry class of the flow, by simple name (e.g. CreateAccount) or qualified name.",
                required = true
        )
        String target;

        @CommandLine.Option(
                names = {"-o", "--out"},
                paramLabel = "OUT",
                description = "The directory the flow files are written to. Defaults to the current folder.",
                defaultValue = "."
        )
        Path outputDir;

        @CommandLine.Option(
                names = {"-r", "--regex-parser"},
                description = "Use the regex parser instead of Spoon."
        )
        boolean regexParser;

        @CommandLine.Option(
                names = {"-m", "--max-classes"},
                paramLabel = "MAX-CLASSES",
                description = "Stop the flow after this many classes. 0 means no limit.",
                defaultValue = "0"
        )
        int maxClasses;

        @CommandLine.Option(
                names = {"-f", "--full-classes"},
                description = "Write whole class bodies instead of the methods reached by the flow."
        )
        boolean fullClasses;

        @CommandLine.Option(
                names = {"-s", "--include-supertypes"},
                description = "Also follow the superclasses and interfaces of visited classes."
        )
        boolean includeSupertypes;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            if (maxClasses < 0) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "--max-classes must not be negative: " + maxClasses);
            }
            ExtractionOptions options = new ExtractionOptions(
                    projectRoot,
                    target,
                    outputDir,
                    regexParser ? ParserBackend.REGEX : ParserBackend.SPOON,
                    maxClasses,
                    fullClasses ? RenderMode.FULL_CLASS : RenderMode.REACHED_METHODS,
                    includeSupertypes
            );
            return execute(new FlowExtractor(), options);
        }

        static int execute(FlowExtractor extractor, ExtractionOptions options) {
            try {
                extractor.run(options);
                return EXIT_OK;
            } catch (TargetNotFoundException e) {
                log.error(e.getMessage());
                return EXIT_TARGET_NOT_FOUND;
            } catch (IOException e) {
                log.error("I/O error while extracting the flow of {}", options.target(), e);
                return EXIT_IO_ERROR;
            } catch (IllegalArgumentException e) {
                // Missing or unreadable project root
                log.error(e.getMessage());
                return EXIT_IO_ERROR;
            }
        }
    }
}
