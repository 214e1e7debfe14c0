package com.mimecast.pdbconf;

import com.mimecast.pdbconf.config.ConfigException;
import com.mimecast.pdbconf.config.ResolvedConfig;
import com.mimecast.pdbconf.main.Config;
import com.mimecast.pdbconf.main.ConfigJson;
import com.mimecast.pdbconf.main.ConfigResolver;
import com.mimecast.pdbconf.main.RawConfigReader;
import com.mimecast.pdbconf.main.Resolution;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Resolves a configuration file and prints the resolved configuration as JSON.
 * <p>Exits with status 1 on an invalid configuration or a fatal retired setting.
 *
 * @see ConfigResolver
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "pdbconf.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "PuppetDB configuration resolver";

    private final String[] args;
    private final PrintStream out;
    private final PrintStream err;
    private final ConfigResolver resolver;
    private int status = 0;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        Main main = new Main(args, System.out, System.err, new ConfigResolver());
        main.run();
        System.exit(main.getStatus());
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args     String array.
     * @param out      Output stream.
     * @param err      Error stream.
     * @param resolver ConfigResolver instance.
     */
    Main(String[] args, PrintStream out, PrintStream err, ConfigResolver resolver) {
        this.args = args;
        this.out = out;
        this.err = err;
        this.resolver = resolver;
    }

    /**
     * Runs the command.
     */
    void run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            status = 1;
            return;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help") || !cmd.hasOption("config")) {
            optionsUsage(options());
            status = cmd.hasOption("help") ? 0 : 1;
            return;
        }

        String path = cmd.getOptionValue("config");
        try {
            Map<String, Object> document = RawConfigReader.read(Path.of(path));
            Resolution resolution = resolver.resolve(document);

            if (resolution.isFatal()) {
                for (String issue : resolution.getFatalIssues()) {
                    err.println(issue);
                }
                status = 1;
                return;
            }

            ResolvedConfig config = resolution.getConfig().orElseThrow();
            Config.init(config);
            out.println(ConfigJson.toJson(config, config.getDeveloper().isPrettyPrint()));

        } catch (IOException e) {
            log.error("Unable to read config file {}: {}", path, e.getMessage());
            err.println("Unable to read config file " + path + ": " + e.getMessage());
            status = 1;
        } catch (ConfigException e) {
            log.error("Invalid config: {}", e.getMessage());
            err.println(e.getMessage());
            status = 1;
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Configuration file path");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void optionsUsage(Options options) {
        out.println(USAGE);
        out.println(" " + DESCRIPTION);
        out.println();

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            // Should not happen with ByteArrayOutputStream.
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        out.println(baos);
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            err.println("Options error: " + e.getMessage());
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Gets exit status.
     *
     * @return Status code.
     */
    int getStatus() {
        return status;
    }
}
