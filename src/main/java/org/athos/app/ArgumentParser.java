package org.athos.app;

import java.util.ArrayList;
import java.util.List;

/**
 * The ArgumentParser class parses command-line arguments into
 * {@link CommandLineOptions}.
 * <pre>
 *   athos [--unfold N] [--cfg] &lt;file.c&gt; &lt;config.yaml&gt;
 * </pre>
 */
public class ArgumentParser {

    public static final String USAGE = String.join("\n",
            "Usage: athos [options] <file.c> <config.yaml>",
            "",
            "  --unfold N   unfold the main loop N times and print the code",
            "  --cfg        print the control-flow graph in DOT format",
            "  --version    print the version",
            "  -h, --help   print this help",
            "");

    /**
     * Parses the command-line arguments.
     *
     * @param args The command-line arguments to parse.
     * @return The options derived from the arguments.
     * @throws IllegalArgumentException if an argument is unknown or invalid.
     */
    public static CommandLineOptions parseArguments(String[] args) {
        CommandLineOptions options = new CommandLineOptions();
        List<String> positional = new ArrayList<>();
        boolean readingPositional = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingPositional || !arg.startsWith("-") || arg.equals("-")) {
                positional.add(arg);
                continue;
            }
            switch (arg) {
                case "--":
                    // Everything after "--" is a file name
                    readingPositional = true;
                    break;
                case "-h", "--help":
                    options.help = true;
                    break;
                case "--version":
                    options.version = true;
                    break;
                case "--cfg":
                    options.printCfg = true;
                    break;
                case "--unfold":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for --unfold");
                    }
                    options.unfold = parsePositive(args[++i]);
                    break;
                default:
                    if (arg.startsWith("--unfold=")) {
                        options.unfold = parsePositive(arg.substring("--unfold=".length()));
                    } else {
                        throw new IllegalArgumentException("Unrecognized switch: " + arg);
                    }
            }
        }

        if (options.help || options.version) {
            return options;
        }
        if (positional.size() != 2) {
            throw new IllegalArgumentException("Expected <file.c> and <config.yaml>, got " + positional.size() + " arguments");
        }
        options.fileName = positional.get(0);
        options.configFile = positional.get(1);
        return options;
    }

    private static int parsePositive(String value) {
        int number;
        try {
            number = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(value + " is an invalid positive int value", e);
        }
        if (number < 1) {
            throw new IllegalArgumentException(value + " is an invalid positive int value");
        }
        return number;
    }

    /**
     * Options selected on the command line.
     */
    public static class CommandLineOptions {
        public String fileName;
        public String configFile;
        // Number of unfoldings, null when not requested
        public Integer unfold;
        public boolean printCfg;
        public boolean help;
        public boolean version;
    }
}
