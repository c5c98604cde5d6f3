package de.mirkosertic.boolquery;

import de.mirkosertic.boolquery.config.ApplicationConfig;
import de.mirkosertic.boolquery.config.BuildInfo;
import de.mirkosertic.boolquery.config.LoggingConfigurator;
import de.mirkosertic.boolquery.parser.QuerySyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Command line front end: compiles one query and tests each given text against it.
 * <p>
 * Prints {@code true} or {@code false} per text on stdout. Exit code is 0 if at least one text
 * matched, 1 if none did and 2 for usage errors and malformed queries.
 */
@CommandLine.Command(
        name = "boolquery",
        mixinStandardHelpOptions = true,
        versionProvider = BoolQueryApplication.VersionProvider.class,
        description = {
                "Tests texts against a boolean query of quoted literals combined with &, | and !",
                "Use -- to end option parsing when a text equals an option name."})
public class BoolQueryApplication implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(BoolQueryApplication.class);

    static final int EXIT_MATCH = 0;
    static final int EXIT_NO_MATCH = 1;
    static final int EXIT_INVALID = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = {"-v", "--verbose"},
            description = "Log debug output to stderr")
    boolean verbose;

    @CommandLine.Parameters(
            index = "0",
            paramLabel = "QUERY",
            description = "The query, e.g. '\"error\" & !\"timeout\"'")
    String query;

    @CommandLine.Parameters(
            index = "1..*",
            arity = "1..*",
            paramLabel = "TEXT",
            description = "One or more texts to test")
    List<String> texts = new ArrayList<>();

    private final Supplier<MatcherOptions> optionsSupplier;

    public BoolQueryApplication() {
        this(() -> ApplicationConfig.load().toMatcherOptions());
    }

    BoolQueryApplication(final Supplier<MatcherOptions> optionsSupplier) {
        this.optionsSupplier = optionsSupplier;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine(new BoolQueryApplication()).execute(args));
    }

    /**
     * Texts starting with {@code -} are taken as TEXT arguments unless they name a known option.
     */
    static CommandLine createCommandLine(final BoolQueryApplication application) {
        final CommandLine commandLine = new CommandLine(application);
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        return commandLine;
    }

    @Override
    public Integer call() {
        LoggingConfigurator.configure(verbose);

        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final MatcherOptions options;
        try {
            options = optionsSupplier.get();
        } catch (final IllegalArgumentException e) {
            logger.debug("Invalid configuration", e);
            err.println("boolquery: invalid configuration: " + e.getMessage());
            err.flush();
            return EXIT_INVALID;
        }

        final Matcher matcher;
        try {
            matcher = Matcher.from(query, options);
        } catch (final QuerySyntaxException e) {
            logger.debug("Rejected query '{}'", query, e);
            printSyntaxError(err, e);
            return EXIT_INVALID;
        }

        int matches = 0;
        for (final String text : texts) {
            final boolean matched = matcher.query(text);
            if (matched) {
                matches++;
            }
            out.println(matched);
        }
        out.flush();

        logger.info("{} of {} text(s) matched {}", matches, texts.size(), matcher);
        return matches > 0 ? EXIT_MATCH : EXIT_NO_MATCH;
    }

    private static void printSyntaxError(final PrintWriter err, final QuerySyntaxException e) {
        err.println("boolquery: " + e.getMessage());
        final String shownQuery = e.getQuery().replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
        if (shownQuery.length() <= 200) {
            err.println("  " + shownQuery);
            err.println("  " + " ".repeat(Math.min(e.getPosition(), shownQuery.length())) + "^");
        }
        err.flush();
    }

    public static class VersionProvider implements CommandLine.IVersionProvider {

        @Override
        public String[] getVersion() {
            return new String[] {BuildInfo.describe()};
        }
    }
}
