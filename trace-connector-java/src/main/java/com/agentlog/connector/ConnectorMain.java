package com.agentlog.connector;

import com.agentlog.ontology.run.Run;
import com.agentlog.ontology.run.Step;
import com.agentlog.ontology.run.StepTree;
import com.agentlog.ontology.serial.OntologySerializer;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point for the trace connector.
 *
 * Usage:
 *   java -jar trace-connector-java.jar convert \
 *     --input  <trace.json> \
 *     [--output <run.json>] \
 *     [--config <connector.json>] \
 *     [--tree]
 *
 * Without --output the run document goes to stdout. --tree prints the step
 * tree instead of (or, with --output, in addition to) the document.
 */
public class ConnectorMain {

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[trace-connector] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar trace-connector-java.jar convert " +
                               "--input <trace.json> [--output <run.json>] [--config <connector.json>] [--tree]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[trace-connector] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args, PrintStream stdout) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("convert")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String inputPath = null;
        String outputPath = null;
        String configPath = null;
        boolean printTree = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"  -> inputPath  = requireNext(args, i++, "--input");
                case "--output" -> outputPath = requireNext(args, i++, "--output");
                case "--config" -> configPath = requireNext(args, i++, "--config");
                case "--tree"   -> printTree  = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (inputPath == null) throw new UsageException("--input is required");

        ConnectorConfig config = configPath != null
                ? new ConnectorConfigReader().read(Paths.get(configPath))
                : ConnectorConfig.defaults();

        Path input = Paths.get(inputPath);
        System.err.println("[trace-connector] Reading trace: " + input);
        JsonObject trace = new TraceReader().read(input);

        Run run = new OpenAiTraceConnector(config, Clock.systemUTC()).convert(trace);
        System.err.println("[trace-connector] Converted run " + run.id + ": "
                + StepTree.countSteps(run) + " steps, status " + run.status.tag());

        if (printTree) {
            printTree(run, stdout);
        }

        String json = new OntologySerializer().toJson(run);
        if (outputPath != null) {
            Path output = Paths.get(outputPath);
            try {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(output, json, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + output + ": " + e.getMessage(), e);
            }
            System.err.println("[trace-connector] Run written: " + output);
        } else if (!printTree) {
            stdout.println(json);
        }
    }

    static void printTree(Run run, PrintStream out) {
        out.println(run.name + " [" + run.status.tag() + "]");
        printSteps(run.steps, 1, out);
    }

    private static void printSteps(List<Step> steps, int depth, PrintStream out) {
        for (Step step : steps) {
            String duration = step.duration != null ? String.format(Locale.ROOT, " %.3fs", step.duration) : "";
            out.println("  ".repeat(depth) + "- " + step.name + " (" + step.id + ")" + duration);
            printSteps(step.subSteps, depth + 1, out);
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
}
