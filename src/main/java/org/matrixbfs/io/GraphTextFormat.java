package org.matrixbfs.io;

import lombok.experimental.UtilityClass;
import org.matrixbfs.graph.AdjacencyGraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Plain-text adjacency-matrix format.
 *
 * <pre>
 * 3
 * 0 1 0
 * 1 0 1
 * 0 0 1
 * </pre>
 *
 * <p>The first line holds the vertex count {@code N}; each of the following {@code N} lines holds
 * one matrix row as {@code N} space-separated 0/1 values. {@link #serialize(AdjacencyGraph)} writes
 * no trailing newline; {@link #parse(String)} tolerates one.</p>
 */
@UtilityClass
public class GraphTextFormat {

    private static final String CELL_SEPARATOR = " ";
    private static final String LINE_SEPARATOR = "\n";

    /**
     * Parses a graph from text.
     *
     * @throws GraphFormatException with {@link GraphFormatException#REASON_INVALID_FORMAT} on any
     *                              header, line-count, row-width or cell-value violation.
     */
    public static AdjacencyGraph parse(String text) {
        Objects.requireNonNull(text, "text");
        return parse(text.lines().toList());
    }

    /**
     * Parses a graph from already split lines.
     */
    public static AdjacencyGraph parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        if (lines.isEmpty()) {
            throw invalid("missing vertex count line");
        }

        int vertexCount = parseVertexCount(lines.get(0));
        long expectedLines = vertexCount + 1L;
        if (lines.size() != expectedLines) {
            throw invalid("expected " + expectedLines + " lines for " + vertexCount
                    + " vertices, found " + lines.size());
        }

        int[][] matrix = new int[vertexCount][];
        for (int i = 0; i < vertexCount; i++) {
            matrix[i] = parseRow(lines.get(i + 1), i, vertexCount);
        }
        return AdjacencyGraph.fromMatrix(matrix);
    }

    /**
     * Reads a UTF-8 graph file.
     *
     * @throws IOException when the file cannot be read.
     */
    public static AdjacencyGraph read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        try {
            return parse(lines);
        } catch (GraphFormatException ex) {
            throw new GraphFormatException(
                    ex.reasonCode(),
                    "graph file '" + file + "' has invalid format",
                    ex
            );
        }
    }

    /**
     * Renders a graph in the text format.
     */
    public static String serialize(AdjacencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        StringBuilder text = new StringBuilder().append(graph.vertexCount());
        for (int v = 0; v < graph.vertexCount(); v++) {
            text.append(LINE_SEPARATOR);
            int[] row = graph.row(v);
            for (int j = 0; j < row.length; j++) {
                if (j > 0) {
                    text.append(CELL_SEPARATOR);
                }
                text.append(row[j]);
            }
        }
        return text.toString();
    }

    /**
     * Writes a graph to a UTF-8 file, replacing existing content.
     */
    public static void write(AdjacencyGraph graph, Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Files.writeString(file, serialize(graph), StandardCharsets.UTF_8);
    }

    private static int parseVertexCount(String header) {
        int vertexCount;
        try {
            vertexCount = Integer.parseInt(header.trim());
        } catch (NumberFormatException ex) {
            throw new GraphFormatException(
                    GraphFormatException.REASON_INVALID_FORMAT,
                    "vertex count line is not an integer: '" + header + "'",
                    ex
            );
        }
        if (vertexCount < 0) {
            throw invalid("vertex count cannot be negative: " + vertexCount);
        }
        return vertexCount;
    }

    private static int[] parseRow(String line, int rowIndex, int vertexCount) {
        String trimmed = line.trim();
        String[] cells = trimmed.isEmpty() ? new String[0] : trimmed.split(CELL_SEPARATOR);
        if (cells.length != vertexCount) {
            throw invalid("row " + rowIndex + " has " + cells.length + " values, expected " + vertexCount);
        }
        int[] row = new int[vertexCount];
        for (int j = 0; j < vertexCount; j++) {
            String cell = cells[j];
            if ("0".equals(cell)) {
                row[j] = 0;
            } else if ("1".equals(cell)) {
                row[j] = 1;
            } else {
                throw invalid("row " + rowIndex + " column " + j + " holds '" + cell + "', expected 0 or 1");
            }
        }
        return row;
    }

    private static GraphFormatException invalid(String message) {
        return new GraphFormatException(GraphFormatException.REASON_INVALID_FORMAT, message);
    }
}
