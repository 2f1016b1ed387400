package com.proxymirror.cli;

import com.proxymirror.host.Document;
import com.proxymirror.host.IntentionDispatcher;
import com.proxymirror.intention.IntentionAction;
import com.proxymirror.intention.IntentionOutcome;
import com.proxymirror.intention.MirrorConventions;
import com.proxymirror.intention.ProxyDelegateIntention;
import com.proxymirror.jackson.ConventionsLoader;
import com.proxymirror.json.TreeJsonProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the view-state proxy intention on a file from the command line.
 *
 * <p>Usage: {@code ProxyMirrorCli [options] <file>}. The edited source is printed to
 * stdout unless {@code --in-place} is given.</p>
 */
public class ProxyMirrorCli {
    private static final Logger logger = LoggerFactory.getLogger(ProxyMirrorCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NOT_APPLICABLE = 2;

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Config config;
        try {
            config = Config.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_ERROR;
        }
        if (config.help) {
            printUsage(out);
            return EXIT_OK;
        }

        try {
            return new ProxyMirrorCli(config, out, err).execute();
        } catch (IOException | RuntimeException e) {
            err.println("Error: " + e.getMessage());
            logger.debug("Run failed", e);
            return EXIT_ERROR;
        }
    }

    ProxyMirrorCli(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    int execute() throws IOException {
        Document document = new Document(Files.readString(config.file));

        if (config.dumpTree) {
            out.println(TreeJsonProvider.getProvider().getSerializer().serializePretty(document.file()));
            return EXIT_OK;
        }

        int offset = config.offset != null ? config.offset : document.offsetOf(config.line, config.column);
        MirrorConventions conventions = new ConventionsLoader().load(config.conventionsPath);
        IntentionDispatcher dispatcher = new IntentionDispatcher(List.of(new ProxyDelegateIntention(conventions)));
        List<IntentionAction> available = dispatcher.availableAt(document, offset);

        if (config.list) {
            for (IntentionAction intention : available) {
                out.println(intention.getText() + " (" + intention.getFamilyName() + ")");
            }
            return EXIT_OK;
        }
        if (available.isEmpty()) {
            err.println("No intention available at offset " + offset);
            return EXIT_NOT_APPLICABLE;
        }

        IntentionOutcome outcome = dispatcher.invoke(document, offset, available.get(0));
        logger.debug("{} finished with {}", config.file, outcome);
        if (outcome == IntentionOutcome.NOT_APPLICABLE) {
            err.println("No intention available at offset " + offset);
            return EXIT_NOT_APPLICABLE;
        }
        if (!outcome.changedTree()) {
            err.println(describe(outcome, conventions));
        }

        if (!config.inPlace) {
            out.print(document.text());
        } else if (outcome.changedTree()) {
            Files.writeString(config.file, document.text());
        }
        return EXIT_OK;
    }

    private static String describe(IntentionOutcome outcome, MirrorConventions conventions) {
        return switch (outcome) {
            case NO_PRESENTER_CLASS -> "No class containing '" + conventions.presenterNameMarker() + "' found; nothing changed";
            case NO_PROXY_PROPERTY -> "Presenter has no '" + conventions.proxyPropertyName() + "' property; nothing changed";
            case ALREADY_MIRRORED -> "Property is already mirrored; nothing changed";
            default -> outcome.name();
        };
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: ProxyMirrorCli [options] <file>");
        stream.println();
        stream.println("Mirrors the State property under the caret into the presenter's view-state proxy.");
        stream.println();
        stream.println("Options:");
        stream.println("  --line=N --column=N   Caret position, 1-based");
        stream.println("  --offset=N            Caret position as a 0-based character offset");
        stream.println("  --config=PATH         JSON file with naming conventions");
        stream.println("  --in-place            Write the result back to the file");
        stream.println("  --dump-tree           Print the syntax tree as JSON and exit");
        stream.println("  --list                List the intentions available at the caret");
        stream.println("  --help, -h            Show this help");
        stream.println();
        stream.println("Exit codes: 0 success or nothing to do, 2 not applicable at the caret, 1 error");
    }

    static class Config {
        Path file;
        Integer line;
        Integer column;
        Integer offset;
        Path conventionsPath;
        boolean inPlace = false;
        boolean dumpTree = false;
        boolean list = false;
        boolean help = false;

        /**
         * @throws IllegalArgumentException on unknown options or a missing caret or file
         */
        static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                    return config;
                } else if (arg.startsWith("--line=")) {
                    config.line = parseInt("--line", arg.substring(7));
                } else if (arg.startsWith("--column=")) {
                    config.column = parseInt("--column", arg.substring(9));
                } else if (arg.startsWith("--offset=")) {
                    config.offset = parseInt("--offset", arg.substring(9));
                } else if (arg.startsWith("--config=")) {
                    config.conventionsPath = Path.of(arg.substring(9));
                } else if (arg.equals("--in-place")) {
                    config.inPlace = true;
                } else if (arg.equals("--dump-tree")) {
                    config.dumpTree = true;
                } else if (arg.equals("--list")) {
                    config.list = true;
                } else if (!arg.startsWith("-")) {
                    if (config.file != null) {
                        throw new IllegalArgumentException("Only one file may be given");
                    }
                    config.file = Path.of(arg);
                } else {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }

            if (config.file == null) {
                throw new IllegalArgumentException("No file specified");
            }
            if (!config.dumpTree) {
                boolean lineAndColumn = config.line != null && config.column != null;
                if (config.offset == null && !lineAndColumn) {
                    throw new IllegalArgumentException("Specify --offset or both --line and --column");
                }
                if (config.offset != null && (config.line != null || config.column != null)) {
                    throw new IllegalArgumentException("--offset cannot be combined with --line/--column");
                }
            }
            return config;
        }

        private static int parseInt(String option, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects a number, got '" + value + "'", e);
            }
        }
    }
}
