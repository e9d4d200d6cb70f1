package com.github.errfix.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.github.errfix.DefaultProcessor;
import com.github.errfix.DefaultSourceReader;
import com.github.errfix.DiffWriter;
import com.github.errfix.ErrFix;
import com.github.errfix.ErrFixException;
import com.github.errfix.config.ConfigurationException;
import com.github.errfix.config.ErrFixConfiguration;
import com.github.errfix.config.ErrFixConfigurationLoader;
import org.jspecify.annotations.Nullable;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: errfix [-w] [-q] [-e] [path ...]
 * <p>
 * Rewrites the given Go files and directories, or standard input when no path is
 * given, and prints a unified diff of the changes. Exits with 1 when processing
 * fails, or when {@code -e} is set and something changed; with 2 on a usage error.
 */
@Command(name = "errfix", mixinStandardHelpOptions = true, version = "errfix 1.0.0",
        description = "Replaces Go's stack-less errors with github.com/pkg/errors.")
public class ErrFixCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ErrFixCommand.class);

    static final String STDIN_NAME = "<standard input>";

    @Spec
    private CommandSpec spec;

    @Option(names = {"-w", "--write"}, description = "Write result to (source) file instead of stdout")
    private boolean write;

    @Option(names = {"-q", "--quiet"}, description = "Quiet (no output)")
    private boolean quiet;

    @Option(names = {"-e", "--exit-code"}, description = "Set exit status to 1 if any changes are found")
    private boolean exitCode;

    @Option(names = "--concurrency", paramLabel = "<n>",
            description = "Maximum number of files processed at once (default: from .errfix.yaml, else 8)")
    private @Nullable Integer concurrency;

    @Option(names = "--config", paramLabel = "<file>",
            description = "Configuration file (default: .errfix.yaml in the working directory)")
    private @Nullable Path config;

    @Option(names = "--verbose", description = "Log each processed file")
    private boolean verbose;

    @Parameters(paramLabel = "path", arity = "0..*", description = "Go files or directories to process")
    private List<Path> paths = new ArrayList<>();

    private final InputStream stdin;

    public ErrFixCommand() {
        this(System.in);
    }

    ErrFixCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new ErrFixCommand()).execute(args));
    }

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ErrFixConfiguration configuration;
        try {
            configuration = loadConfiguration();
        } catch (ConfigurationException e) {
            err.println("errfix: " + e.getMessage());
            err.flush();
            return CommandLine.ExitCode.SOFTWARE;
        }

        DefaultSourceReader.Builder reader = DefaultSourceReader.builder().exclude(configuration.getExclude());
        if (paths.isEmpty()) {
            reader.stream(STDIN_NAME, stdin);
        } else {
            reader.paths(paths);
        }
        DiffWriter writer = new DiffWriter(write);
        ErrFix errFix = new ErrFix(reader.build(), new DefaultProcessor(), writer, configuration.getConcurrency());

        int status = CommandLine.ExitCode.OK;
        try {
            int processed = errFix.process();
            LOG.info("Processed {} file(s)", processed);
        } catch (ErrFixException e) {
            err.println(e.getMessage());
            err.flush();
            status = CommandLine.ExitCode.SOFTWARE;
        }

        String diff = writer.getDiff();
        if (!quiet) {
            out.print(diff);
            out.flush();
        }
        if (status == CommandLine.ExitCode.OK && exitCode && !diff.isEmpty()) {
            status = 1;
        }
        return status;
    }

    private ErrFixConfiguration loadConfiguration() {
        ErrFixConfiguration loaded = config != null
                ? ErrFixConfigurationLoader.loadFile(config)
                : ErrFixConfigurationLoader.load(Path.of(""));
        if (concurrency == null) {
            return loaded;
        }
        if (concurrency < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--concurrency must be at least 1, was " + concurrency);
        }
        return loaded.withConcurrency(concurrency);
    }

    private static void enableDebugLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).getLogger("com.github.errfix").setLevel(Level.DEBUG);
        }
    }
}
