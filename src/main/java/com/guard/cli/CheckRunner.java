package com.guard.cli;

import com.guard.exception.ApiGuardException;
import com.guard.model.Violation;
import com.guard.service.api.CompatibilityChecker;
import com.guard.service.api.ViolationReporter;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * The command-line entry point: {@code api-change-guard <spec1> <spec2> [usage-log] [--verbose]}.
 * <p>
 * The two spec documents may be given in either order. On success the JSON report is the only
 * thing written to standard output and the exit code is 0, whether or not violations were found.
 * Any failure prints a diagnostic on standard error, nothing on standard output, and exits non-zero.
 */
@Slf4j
@Component
@Profile("!test") // Tests drive the runner directly instead of on context startup
public class CheckRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "usage: api-change-guard <spec1> <spec2> [usage-log] [--verbose]";

    private static final String APP_LOGGER = "com.guard";

    private final CompatibilityChecker checker;
    private final ViolationReporter reporter;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public CheckRunner(CompatibilityChecker checker, ViolationReporter reporter) {
        this(checker, reporter, System.out, System.err);
    }

    CheckRunner(CompatibilityChecker checker, ViolationReporter reporter, PrintStream out, PrintStream err) {
        this.checker = checker;
        this.reporter = reporter;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean verbose = args.containsOption("verbose");
        exitCode = execute(args.getNonOptionArgs(), verbose);
    }

    /**
     * Runs one check for the given positional arguments and returns the process exit code.
     */
    int execute(List<String> positional, boolean verbose) {
        if (positional.size() < 2 || positional.size() > 3) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ch.qos.logback.classic.Logger appLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(APP_LOGGER);
        ch.qos.logback.classic.Level originalLevel = appLogger.getLevel();
        if (verbose) {
            appLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        try {
            Path first = Paths.get(positional.get(0));
            Path second = Paths.get(positional.get(1));
            Path usageLog = positional.size() == 3 ? Paths.get(positional.get(2)) : null;

            List<Violation> violations = checker.check(first, second, usageLog);
            out.println(reporter.toJson(violations));
            out.flush();
            return EXIT_OK;
        } catch (ApiGuardException e) {
            log.debug("Compatibility check aborted", e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Unexpected failure during compatibility check", e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            if (verbose) {
                appLogger.setLevel(originalLevel);
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
