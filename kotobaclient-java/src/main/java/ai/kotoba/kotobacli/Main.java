// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.kotobacli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;

import java.util.Arrays;

/**
 * The kotoba tool tokenizes Japanese text and builds binary dictionaries.
 */
public class Main {

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0)
            System.exit(status);
    }

    /** Runs the command given by the arguments and returns the exit status */
    static int run(String[] args) {
        var parser = new DefaultParser();
        CommandLine global;
        try {
            global = parser.parse(CommandLineOptions.createGlobalOptions(), args, true);
        } catch (ParseException e) {
            System.err.println("Parsing failed. Reason: " + e.getMessage());
            CommandLineOptions.printGlobalHelp();
            return 1;
        }

        String[] remaining = global.getArgs();
        if (remaining.length == 0 || global.hasOption(CommandLineOptions.HELP_OPTION)) {
            CommandLineOptions.printGlobalHelp();
            return 0;
        }

        String sub = remaining[0];
        String[] subArgs = Arrays.copyOfRange(remaining, 1, remaining.length);
        switch (sub) {
            case "tokenize":
                return runTokenize(subArgs);
            case "build-dictionary":
                return runBuildDictionary(subArgs);
            default:
                System.err.println("Error: Unknown command `" + sub + "`");
                CommandLineOptions.printGlobalHelp();
                return 1;
        }
    }

    static int runTokenize(String[] commandLineArgs) {
        try {
            if (CommandLineOptions.Utils.hasHelpOption(commandLineArgs)) {
                CommandLineOptions.printTokenizeHelp();
                return 0;
            }
            CommandLine commandLine = new DefaultParser().parse(CommandLineOptions.createTokenizeOptions(), commandLineArgs);
            ClientParameters params = CommandLineOptions.parseTokenizeCommandLineArguments(commandLine);
            return new TokenizeCommand(params).run();
        } catch (ParseException e) {
            System.err.printf("Error: %s.\n", e.getMessage());
            CommandLineOptions.printTokenizeHelp();
            return 1;
        }
    }

    static int runBuildDictionary(String[] commandLineArgs) {
        try {
            if (CommandLineOptions.Utils.hasHelpOption(commandLineArgs)) {
                CommandLineOptions.printBuildDictionaryHelp();
                return 0;
            }
            CommandLine commandLine = new DefaultParser().parse(CommandLineOptions.createBuildDictionaryOptions(), commandLineArgs);
            BuildDictionaryParameters params = CommandLineOptions.parseBuildDictionaryCommandLineArguments(commandLine);
            return new BuildDictionaryCommand(params).run();
        } catch (ParseException e) {
            System.err.printf("Error: %s.\n", e.getMessage());
            CommandLineOptions.printBuildDictionaryHelp();
            return 1;
        }
    }

}
