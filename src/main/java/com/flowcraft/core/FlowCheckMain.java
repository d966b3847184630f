package com.flowcraft.core;

import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.PathStep;
import com.flowcraft.core.io.FlowFormatException;
import com.flowcraft.core.io.FlowJsonReader;
import com.flowcraft.core.io.SerializerBackend;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command-line entry point: checks a JSON flow file and prints its canonical
 * document.
 *
 * <pre>
 * FlowCheckMain [--format yaml|plain] &lt;flow.json&gt;
 * </pre>
 *
 * Exit codes: 0 valid, 1 invalid, 2 bad usage or unreadable input.
 */
public final class FlowCheckMain {
    private static final Logger log = LogManager.getLogger(FlowCheckMain.class);

    static final int EXIT_VALID = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;

    private FlowCheckMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        SerializerBackend backend = null;
        String file = null;
        for (int i = 0; i < args.length; i++) {
            if ("--format".equals(args[i])) {
                if (i + 1 == args.length) {
                    log.error("Missing value for --format");
                    return EXIT_USAGE;
                }
                try {
                    backend = SerializerBackend.fromString(args[++i]);
                } catch (IllegalArgumentException e) {
                    log.error(e.getMessage());
                    return EXIT_USAGE;
                }
            } else if (file == null) {
                file = args[i];
            } else {
                log.error("Unexpected argument: {}", args[i]);
                return EXIT_USAGE;
            }
        }
        if (file == null) {
            log.error("Usage: FlowCheckMain [--format yaml|plain] <flow.json>");
            return EXIT_USAGE;
        }

        Flow flow;
        try {
            flow = new FlowJsonReader().read(Path.of(file));
        } catch (IOException | FlowFormatException e) {
            log.error("Failed to load flow from {}: {}", file, e.getMessage());
            return EXIT_USAGE;
        }

        FlowCheck check = backend != null ? new FlowCheck(backend) : new FlowCheck();
        FlowCheck.Report report = check.analyze(flow);
        report.errors().forEach(e -> log.error("error: {}", e));
        report.warnings().forEach(w -> log.warn("warning: {}", w));
        for (List<PathStep> path : report.paths())
            log.info("path: {}", describe(path));

        out.print(check.serialize(flow));
        out.flush();
        return report.valid() ? EXIT_VALID : EXIT_INVALID;
    }

    /** Renders a path as {@code start -[yes]-> action -> end}. */
    static String describe(List<PathStep> path) {
        StringBuilder sb = new StringBuilder();
        for (PathStep step : path) {
            if (sb.length() > 0)
                sb.append(step.hasVia() ? " -[" + step.via() + "]-> " : " -> ");
            sb.append(step.nodeId());
        }
        return sb.toString();
    }
}
