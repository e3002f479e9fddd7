package clusterwatch;

import clusterwatch.api.ClusterApiServer;
import clusterwatch.config.ClusterWatchConfig;
import clusterwatch.config.Dependencies;
import clusterwatch.config.IniConfigLoader;
import clusterwatch.consumer.ConsumerLoop;
import clusterwatch.consumer.WorkerProcess;
import clusterwatch.producer.ProducerLoop;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point.
 *
 * <pre>
 * clusterwatch worker  [--mock] [--interval N]   changesets to stdout
 * clusterwatch monitor [--worker-cmd CMD]        run a worker, replicate into the store
 * clusterwatch api     [--port N]                serve the store over HTTP
 * </pre>
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Options options = options();
        CommandLine cli;
        try {
            cli = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(options);
            return EXIT_USAGE;
        }

        List<String> commands = cli.getArgList();
        if (cli.hasOption("help") || commands.size() != 1) {
            printHelp(options);
            return cli.hasOption("help") ? EXIT_OK : EXIT_USAGE;
        }

        ClusterWatchConfig config;
        try {
            config = configure(cli);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        String command = commands.get(0);
        try (Dependencies deps = Dependencies.create(config)) {
            switch (command) {
                case "worker":
                    return worker(deps);
                case "monitor":
                    return monitor(deps);
                case "api":
                    return api(deps);
                default:
                    System.err.println("Unknown command: " + command);
                    printHelp(options);
                    return EXIT_USAGE;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("{} failed", command, e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Defaults, then environment, then the INI file, then command-line flags.
     */
    static ClusterWatchConfig configure(CommandLine cli) throws IOException {
        ClusterWatchConfig config = ClusterWatchConfig.fromEnv();
        if (cli.hasOption("config")) {
            config = IniConfigLoader.load(new File(cli.getOptionValue("config")), config);
        }
        if (cli.hasOption("mock")) {
            config.withMock(true);
        }
        if (cli.hasOption("interval")) {
            config.withProducerInterval(Duration.ofSeconds(parsePositive("interval", cli.getOptionValue("interval"))));
        }
        if (cli.hasOption("worker-cmd")) {
            config.withWorkerCommand(cli.getOptionValue("worker-cmd"));
        }
        if (cli.hasOption("db-url")) {
            config.withDatabaseUrl(cli.getOptionValue("db-url"));
        }
        if (cli.hasOption("port")) {
            config.withApiPort(parsePositive("port", cli.getOptionValue("port")));
        }
        return config;
    }

    private static int worker(Dependencies deps) throws InterruptedException {
        AtomicReference<ProducerLoop> self = new AtomicReference<>();
        ProducerLoop loop = deps.producerLoop(line -> {
            System.out.println(line);
            System.out.flush();
            if (System.out.checkError()) {
                // stop() waits for this tick to finish, so it cannot run on the tick thread
                log.error("stdout is closed, stopping worker");
                new Thread(self.get()::stop, "clusterwatch-stopper").start();
            }
        });
        self.set(loop);
        Runtime.getRuntime().addShutdownHook(new Thread(loop::stop, "clusterwatch-shutdown"));
        loop.start(deps.config().producerInterval());
        loop.awaitStop();
        return EXIT_OK;
    }

    private static int monitor(Dependencies deps) throws IOException, InterruptedException {
        ConsumerLoop consumer = deps.consumerLoop();
        try (WorkerProcess worker = WorkerProcess.start(deps.config().workerCommand())) {
            Runtime.getRuntime().addShutdownHook(new Thread(worker::close, "clusterwatch-shutdown"));
            consumer.run(worker.stdout(), worker.stderr());
            int exit = worker.waitFor(5);
            log.info("Worker exited with code {}", exit);
            return exit == 0 ? EXIT_OK : EXIT_FAILURE;
        }
    }

    private static int api(Dependencies deps) throws InterruptedException {
        ClusterApiServer server = deps.apiServer();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "clusterwatch-shutdown"));
        server.start(deps.config().apiHost(), deps.config().apiPort());
        server.awaitClose();
        return EXIT_OK;
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("file")
                .desc("INI configuration file").build());
        options.addOption(Option.builder().longOpt("mock")
                .desc("worker: generate a synthetic cluster instead of calling scontrol").build());
        options.addOption(Option.builder("i").longOpt("interval").hasArg().argName("seconds")
                .desc("worker: seconds between snapshots").build());
        options.addOption(Option.builder("w").longOpt("worker-cmd").hasArg().argName("command")
                .desc("monitor: command that starts the worker").build());
        options.addOption(Option.builder().longOpt("db-url").hasArg().argName("jdbc-url")
                .desc("monitor/api: JDBC URL of the store").build());
        options.addOption(Option.builder("p").longOpt("port").hasArg().argName("port")
                .desc("api: HTTP port").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this help").build());
        return options;
    }

    private static int parsePositive(String name, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number: " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException("--" + name + " must be positive: " + value);
        }
        return parsed;
    }

    private static void printHelp(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(System.err, true);
        formatter.printHelp(writer, 100, "clusterwatch worker|monitor|api [options]", null, options, 2, 4, null);
        writer.flush();
    }
}
