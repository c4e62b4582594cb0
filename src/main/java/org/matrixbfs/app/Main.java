package org.matrixbfs.app;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Parameter;
import com.martiansoftware.jsap.SimpleJSAP;
import org.matrixbfs.core.time.Stopwatch;
import org.matrixbfs.fanout.AllVerticesResult;
import org.matrixbfs.fanout.FanOutConfig;
import org.matrixbfs.fanout.FanOutException;
import org.matrixbfs.fanout.FanOutOrchestrator;
import org.matrixbfs.fanout.SingleVertexResult;
import org.matrixbfs.graph.AdjacencyGraph;
import org.matrixbfs.graph.GraphException;
import org.matrixbfs.io.GraphFormatException;
import org.matrixbfs.io.GraphTextFormat;
import org.matrixbfs.io.RandomGraphGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line entry point: loads or generates a graph and runs a breadth-first search from
 * every vertex.
 */
public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_GRAPH = 2;
    static final int EXIT_FAN_OUT = 3;

    /**
     * Launches the CLI and exits with a non-zero status on failure.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs the CLI, printing results to {@code out}.
     *
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out) {
        FanOutConfig defaults = FanOutConfig.defaults();
        JSAPResult options;
        try {
            SimpleJSAP jsap = new SimpleJSAP(Main.class.getName(),
                    "Runs a breadth-first search from every vertex of a graph on a bounded worker pool.",
                    new Parameter[] {
                            new FlaggedOption("graph", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'g', "graph", "Graph file in adjacency-matrix text format."),
                            new FlaggedOption("random", JSAP.INTEGER_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'r', "random", "Generate a random symmetric graph with this many vertices."),
                            new FlaggedOption("seed", JSAP.LONG_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 's', "seed", "Seed for the random graph."),
                            new FlaggedOption("workers", JSAP.INTEGER_PARSER, Integer.toString(defaults.getWorkerCount()), JSAP.NOT_REQUIRED, 'w', "workers", "Number of concurrent workers."),
                            new FlaggedOption("output", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'o', "output", "Save the graph to this file."),
                    });
            options = jsap.parse(args);
            if (jsap.messagePrinted()) {
                return EXIT_USAGE;
            }
        } catch (JSAPException ex) {
            LOGGER.error("Cannot set up command-line options", ex);
            return EXIT_USAGE;
        }

        if (options.userSpecified("graph") == options.userSpecified("random")) {
            LOGGER.error("Exactly one of --graph or --random must be given");
            return EXIT_USAGE;
        }
        int workers = options.getInt("workers");
        if (workers < 1) {
            LOGGER.error("--workers must be at least 1, got {}", workers);
            return EXIT_USAGE;
        }

        AdjacencyGraph graph;
        try {
            graph = loadGraph(options);
            if (options.userSpecified("output")) {
                GraphTextFormat.write(graph, Path.of(options.getString("output")));
            }
        } catch (IOException | GraphFormatException | GraphException ex) {
            LOGGER.error("Cannot obtain graph: {}", ex.getMessage());
            return EXIT_GRAPH;
        }

        FanOutOrchestrator orchestrator = FanOutOrchestrator.builder().config(defaults).build();
        AllVerticesResult result;
        try {
            result = orchestrator.traverseFromAllVertices(graph, workers);
        } catch (FanOutException ex) {
            LOGGER.error("Traversal failed: {}", ex.getMessage(), ex);
            return EXIT_FAN_OUT;
        }

        print(result, out);
        return EXIT_OK;
    }

    private static AdjacencyGraph loadGraph(JSAPResult options) throws IOException {
        if (options.userSpecified("graph")) {
            Path file = Path.of(options.getString("graph"));
            LOGGER.info("Loading graph {}...", file);
            return GraphTextFormat.read(file);
        }
        RandomGraphGenerator generator = options.userSpecified("seed")
                ? new RandomGraphGenerator(options.getLong("seed"))
                : new RandomGraphGenerator();
        return generator.withRandomEdges(options.getInt("random"));
    }

    private static void print(AllVerticesResult result, PrintStream out) {
        for (SingleVertexResult vertexResult : result.getResults()) {
            out.println("vertex " + vertexResult.getStartVertex()
                    + "\tworker " + vertexResult.getWorkerId()
                    + "\t" + Stopwatch.formatMillis(vertexResult.getElapsed()) + " ms"
                    + "\t" + vertexResult.getTraversal());
        }
        out.println("vertices " + result.getResults().size()
                + "\tworkers " + result.workersUsed() + "/" + result.getWorkerCount()
                + "\ttotal " + Stopwatch.formatMillis(result.getTotalElapsed()) + " ms");
    }
}
