package com.neptune.query.api.cli;

import java.util.concurrent.Callable;

import org.slf4j.LoggerFactory;

import com.neptune.query.api.cli.commands.BucketsCommand;
import com.neptune.query.api.cli.commands.MetricsCommand;
import com.neptune.query.api.clients.NeptuneApiBase;
import com.neptune.query.api.clients.NeptuneApiClient;
import com.neptune.query.api.config.NeptuneQueryConfig;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Command-line access to Neptune retrieval.
 *
 * Usage:
 *   neptune-query --help
 *   neptune-query metrics --project ws/proj -m loss,accuracy
 *   neptune-query buckets --project ws/proj -m loss --buckets 20
 */
@Command(
    name = "neptune-query",
    description = "Fetch runs and metrics from Neptune",
    mixinStandardHelpOptions = true,
    version = "neptune-query 1.0.0",
    subcommands = {
        MetricsCommand.class,
        BucketsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class NeptuneQueryCliMain implements Callable<Integer> {

    static final String LOGGER_ROOT = "com.neptune.query";

    @Option(names = {"-v", "--verbose"}, description = "Print stack traces on errors")
    private boolean verbose;

    @Option(names = {"--debug"}, description = "Enable debug logging (shows API calls and other debug info)")
    private boolean debug;

    @Option(names = {"--apiToken"}, description = "Neptune API token (overrides config)")
    public String apiToken;

    @Option(names = {"--apiUrl"}, description = "Neptune API URL (overrides config)")
    public String apiUrl;

    @Option(names = {"--project"}, description = "Project as workspace/project (overrides config)")
    public String project;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        NeptuneQueryCliMain main = new NeptuneQueryCliMain();
        CommandLine cmd = new CommandLine(main);
        try {
            ParseResult parseResult = cmd.parseArgs(args);
            if (CommandLine.printHelpIfRequested(parseResult)) {
                return 0;
            }
        } catch (CommandLine.ParameterException e) {
            System.err.println(e.getMessage());
            e.getCommandLine().usage(System.err);
            return 2;
        }

        setLogLevel(LOGGER_ROOT, main.debug ? "DEBUG" : "WARN");
        GlobalConfig.setRootCommand(main);
        return new CommandLine(main).execute(args);
    }

    static void setLogLevel(String loggerName, String levelStr) {
        Logger logger = (Logger) LoggerFactory.getLogger(loggerName);
        Level level = Level.toLevel(levelStr, Level.INFO);
        logger.setLevel(level);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Options of the root command shared with the subcommands.
     */
    public static class GlobalConfig {
        private static NeptuneQueryCliMain rootCommand;

        static void setRootCommand(NeptuneQueryCliMain root) {
            rootCommand = root;
        }

        public static boolean isVerbose() {
            return rootCommand != null && rootCommand.verbose;
        }

        /**
         * The project from the command line, else from configuration.
         */
        public static String getProject(String override) {
            if (override != null) {
                return override;
            }
            if (rootCommand != null && rootCommand.project != null) {
                return rootCommand.project;
            }
            return NeptuneQueryConfig.getInstance().getProject();
        }

        /**
         * Creates a client from configuration, with command-line options taking precedence.
         *
         * @throws IllegalStateException when no API token is available
         */
        public static NeptuneApiClient createClient() {
            NeptuneQueryConfig config = NeptuneQueryConfig.getInstance();
            String token = rootCommand != null && rootCommand.apiToken != null ? rootCommand.apiToken : config.getApiToken();
            String url = rootCommand != null && rootCommand.apiUrl != null ? rootCommand.apiUrl : config.getApiUrl();
            if (token == null || token.trim().isEmpty()) {
                throw new IllegalStateException("Neptune API token is required. Set --apiToken or NEPTUNE_API_TOKEN");
            }
            return new NeptuneApiClient(new NeptuneApiBase(url, config.getLimits()), token, config.getQueryMetadata());
        }
    }
}
