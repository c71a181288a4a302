package com.jsonflatten.cli;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.jsonflatten.cli.config.ConfigReader;
import com.jsonflatten.cli.config.FlattenConfig;
import com.jsonflatten.cli.io.FlatJsonWriter;
import com.jsonflatten.core.FlattenOptions;
import com.jsonflatten.core.JsonFlattener;
import com.jsonflatten.core.JsonTextCodec;
import com.jsonflatten.core.SeparatorStyle;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Command line entry point.
 *
 * Usage:
 *   java -jar jsonflatten-cli.jar flatten \
 *     [--input  <file.json>]          (default: stdin)
 *     [--output <file.json>]          (default: stdout)
 *     [--config <flatten.json>]
 *     [--style  dot|path|rails|underscore]
 *     [--before <s>] [--middle <s>] [--after <s>]
 *     [--prefix <s>] [--depth <n>] [--keep-arrays] [--pretty]
 *
 * Flags override the config file, which overrides the defaults.
 */
public class FlattenMain {

    public static void main(String[] args) {
        try {
            run(args, System.in, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[json-flatten] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar jsonflatten-cli.jar flatten [--input <file>] [--output <file>] "
                    + "[--config <file>] [--style <name>] [--before <s>] [--middle <s>] [--after <s>] "
                    + "[--prefix <s>] [--depth <n>] [--keep-arrays] [--pretty]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[json-flatten] FATAL: " + e.getMessage());
            System.exit(1);
        } catch (StackOverflowError e) {
            // Gson still writes kept sub-trees recursively
            System.err.println("[json-flatten] FATAL: input nested too deeply to encode");
            System.exit(1);
        }
    }

    static void run(String[] args, InputStream stdin, PrintStream stdout) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("flatten")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String inputPath = null;
        String outputPath = null;
        String configPath = null;
        String styleName = null;
        String before = null;
        String middle = null;
        String after = null;
        String prefix = null;
        String depth = null;
        boolean keepArrays = false;
        boolean pretty = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"       -> inputPath  = requireNext(args, i++, "--input");
                case "--output"      -> outputPath = requireNext(args, i++, "--output");
                case "--config"      -> configPath = requireNext(args, i++, "--config");
                case "--style"       -> styleName  = requireNext(args, i++, "--style");
                case "--before"      -> before     = requireNext(args, i++, "--before");
                case "--middle"      -> middle     = requireNext(args, i++, "--middle");
                case "--after"       -> after      = requireNext(args, i++, "--after");
                case "--prefix"      -> prefix     = requireNext(args, i++, "--prefix");
                case "--depth"       -> depth      = requireNext(args, i++, "--depth");
                case "--keep-arrays" -> keepArrays = true;
                case "--pretty"      -> pretty     = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        // 1. Resolve options: defaults < config file < flags
        FlattenOptions options = FlattenOptions.defaults();
        if (configPath != null) {
            System.err.println("[json-flatten] Reading config: " + configPath);
            FlattenConfig config = new ConfigReader().read(Paths.get(configPath));
            options = config.toOptions();
            pretty = pretty || config.isPrettyPrint();
        }
        if (before != null || middle != null || after != null) {
            options = options.withStyle(new SeparatorStyle(before, middle, after));
        } else if (styleName != null) {
            options = options.withStyle(parseStyle(styleName));
        }
        if (prefix != null) {
            options = options.withPrefix(prefix);
        }
        if (depth != null) {
            options = options.withDepth(parseDepth(depth));
        }
        if (keepArrays) {
            options = options.withPreserveSequences(true);
        }

        // 2. Read and decode input
        String text = inputPath != null ? readFile(Paths.get(inputPath)) : readStream(stdin);
        JsonObject nested = JsonTextCodec.decodeMapping(text);

        // 3. Flatten
        Map<String, JsonElement> flat = JsonFlattener.flatten(nested, options);
        System.err.println("[json-flatten] Flattened " + nested.size() + " top-level members into "
                + flat.size() + " keys (depth=" + options.depth()
                + ", preserve_arrays=" + options.preserveSequences() + ")");

        // 4. Write output
        FlatJsonWriter writer = new FlatJsonWriter(pretty);
        if (outputPath != null) {
            Path output = Paths.get(outputPath);
            writer.write(flat, output);
            System.err.println("[json-flatten] Output written: " + output);
        } else {
            writer.write(flat, stdout);
        }
    }

    private static SeparatorStyle parseStyle(String name) {
        try {
            return SeparatorStyle.named(name);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static int parseDepth(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--depth requires an integer, got: " + value);
        }
    }

    private static String readFile(Path path) {
        System.err.println("[json-flatten] Reading input: " + path);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputException("Failed to read input " + path + ": " + e.getMessage(), e);
        }
    }

    private static String readStream(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputException("Failed to read stdin: " + e.getMessage(), e);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }

    static class InputException extends RuntimeException {
        InputException(String msg, Throwable cause) { super(msg, cause); }
    }
}
