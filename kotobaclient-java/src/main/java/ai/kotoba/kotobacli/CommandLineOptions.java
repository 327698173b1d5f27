// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.kotobacli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the command line arguments of the kotoba tool and prints its help pages.
 */
public class CommandLineOptions {

    public static final String HELP_OPTION = "help";
    public static final String DICTIONARY_OPTION = "dictionary";
    public static final String TEXT_OPTION = "text";
    public static final String FORMAT_OPTION = "format";
    public static final String INPUT_OPTION = "input";
    public static final String OUTPUT_OPTION = "output";
    public static final String ENCODING_OPTION = "encoding";

    static final String JSON_FORMAT = "json";
    static final String TEXT_FORMAT = "text";

    /** Options for selecting subcommand */
    static Options createGlobalOptions() {
        Options options = new Options();
        options.addOption(Option.builder("h")
                .longOpt(HELP_OPTION)
                .desc("Show available commands.")
                .build());
        return options;
    }

    /** Map command name to description */
    static Map<String, String> registeredCommands() {
        Map<String, String> commands = new LinkedHashMap<>();
        commands.put("tokenize", "Tokenize Japanese text with a binary dictionary.");
        commands.put("build-dictionary", "Build a binary dictionary from MeCab seed files.");
        return commands;
    }

    private static HelpFormatter helpFormatter() {
        HelpFormatter fmt = new HelpFormatter();
        fmt.setWidth(100);
        fmt.setLeftPadding(2);
        fmt.setDescPadding(2);
        fmt.setOptionComparator(Comparator.comparing(Option::getLongOpt));
        return fmt;
    }

    static void printGlobalHelp() {
        StringBuilder header = new StringBuilder("Commands:\n");
        registeredCommands().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(String.CASE_INSENSITIVE_ORDER))
                .forEach(e -> header.append(String.format("  %-18s %s%n", e.getKey(), e.getValue())));
        header.append("\nOptions:");
        helpFormatter().printHelp("kotoba <command> [options]", header.toString(), createGlobalOptions(), "", false);
    }

    /** Options for tokenize command */
    static Options createTokenizeOptions() {
        Options options = new Options();

        options.addOption(Option.builder("h")
                .longOpt(HELP_OPTION)
                .desc("Show this help and exit.")
                .build());

        options.addOption(Option.builder("d")
                .longOpt(DICTIONARY_OPTION)
                .required()
                .hasArg()
                .argName("DIR")
                .desc("Directory of the binary dictionary.")
                .build());

        options.addOption(Option.builder("t")
                .longOpt(TEXT_OPTION)
                .hasArg()
                .argName("TEXT")
                .desc("Text to tokenize. If not given, each line of standard input is tokenized.")
                .build());

        options.addOption(Option.builder("f")
                .longOpt(FORMAT_OPTION)
                .hasArg()
                .argName("json|text")
                .desc("Output format (default: text).")
                .build());

        return options;
    }

    public static void printTokenizeHelp() {
        helpFormatter().printHelp("kotoba tokenize [options]", "Options:", createTokenizeOptions(), "", false);
    }

    /**
     * Parse tokenize command options to ClientParameters.
     *
     * @throws ParseException if the format is not json or text
     */
    public static ClientParameters parseTokenizeCommandLineArguments(CommandLine cl) throws ParseException {
        String format = cl.getOptionValue(FORMAT_OPTION, TEXT_FORMAT);
        if ( ! List.of(JSON_FORMAT, TEXT_FORMAT).contains(format))
            throw new ParseException("Unknown format '" + format + "', must be json or text");

        return new ClientParameters.Builder()
                .setHelp(cl.hasOption(HELP_OPTION))
                .setDictionaryDirectory(cl.getOptionValue(DICTIONARY_OPTION))
                .setText(cl.getOptionValue(TEXT_OPTION))
                .setFormat(format)
                .build();
    }

    /** Options for build-dictionary command */
    static Options createBuildDictionaryOptions() {
        Options options = new Options();

        options.addOption(Option.builder("h")
                .longOpt(HELP_OPTION)
                .desc("Show this help and exit.")
                .build());

        options.addOption(Option.builder("i")
                .longOpt(INPUT_OPTION)
                .required()
                .hasArg()
                .argName("DIR")
                .desc("Directory of *.csv, matrix.def, char.def and unk.def.")
                .build());

        options.addOption(Option.builder("o")
                .longOpt(OUTPUT_OPTION)
                .required()
                .hasArg()
                .argName("DIR")
                .desc("Directory to write the binary dictionary to.")
                .build());

        options.addOption(Option.builder("e")
                .longOpt(ENCODING_OPTION)
                .hasArg()
                .argName("NAME")
                .desc("Encoding of the seed files (default: UTF-8).")
                .build());

        return options;
    }

    public static void printBuildDictionaryHelp() {
        helpFormatter().printHelp("kotoba build-dictionary [options]", "Options:", createBuildDictionaryOptions(), "", false);
    }

    /**
     * Parse build-dictionary command options to BuildDictionaryParameters.
     *
     * @throws ParseException if the encoding is not supported
     */
    public static BuildDictionaryParameters parseBuildDictionaryCommandLineArguments(CommandLine cl) throws ParseException {
        try {
            return BuildDictionaryParameters.builder()
                    .inputDirectory(cl.getOptionValue(INPUT_OPTION))
                    .outputDirectory(cl.getOptionValue(OUTPUT_OPTION))
                    .encoding(cl.getOptionValue(ENCODING_OPTION))
                    .build();
        }
        catch (IllegalArgumentException e) {
            throw new ParseException("Unsupported encoding '" + cl.getOptionValue(ENCODING_OPTION) + "'");
        }
    }

    /**
     * Utils for parsing command line manually,
     * for instance to check for --help when there are required options.
     */
    static class Utils {

        static boolean hasHelpOption(String[] args) {
            for (var arg : args) {
                if (List.of("--help", "-h").contains(arg))
                    return true;
            }
            return false;
        }

    }

}
