package com.strv.newsletter;

import com.strv.newsletter.main.Config;
import com.strv.newsletter.main.Dispatcher;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Starts the email dispatch service and keeps it running until the JVM is asked to terminate.
 * <br>Without --config all defaults apply, which means the console mail sender.
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "newsletter-dispatch.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Newsletter email dispatch service";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args).run();
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Parses arguments and runs the service.
     */
    void run() {
        Options options = options();
        Optional<CommandLine> opt = parseArgs(options);
        if (opt.isEmpty() || opt.get().hasOption("help")) {
            optionsUsage(options);
            return;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("config")) {
            String path = cmd.getOptionValue("config");
            try {
                Config.init(path);
            } catch (IOException e) {
                log.fatal("Unable to read configuration: path={}, error={}", path, e.getMessage());
                return;
            }
        }

        Dispatcher dispatcher = new Dispatcher(Config.getDispatch());
        try {
            dispatcher.start();
        } catch (IOException | RuntimeException e) {
            log.fatal("Unable to start dispatcher: {}", e.getMessage(), e);
            dispatcher.shutdown();
            return;
        }
        dispatcher.registerShutdownHook();

        try {
            dispatcher.awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted, shutting down");
            dispatcher.shutdown();
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Path to dispatch configuration file (JSON5)");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void optionsUsage(Options options) {
        StringWriter writer = new StringWriter();
        new HelpFormatter().printHelp(new PrintWriter(writer), HelpFormatter.DEFAULT_WIDTH,
                USAGE, " " + DESCRIPTION, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, "", true);
        System.out.println(writer);
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
            System.out.println("Options error: " + e.getMessage());
            System.out.println();
        }

        return Optional.ofNullable(cmd);
    }
}
