package nl.bytesoflife.lanterncad.ind;

import nl.bytesoflife.lanterncad.LanternCadException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the block grammar written by {@link IndWriter}. Blocks of each kind must be numbered
 * 1, 2, 3, ... in file order, and pathway and monitor references must point at blocks that
 * exist.
 */
public class IndParser {

    private static final Pattern BLOCK_START = Pattern.compile("(segment|pathway|monitor|launch_field)\\s+(\\d+)");
    private static final Pattern BLOCK_END = Pattern.compile("end\\s+(segment|pathway|monitor|launch_field)");
    private static final Pattern PROPERTY = Pattern.compile("([^=\\s][^=]*?)\\s*=\\s*(.*)");
    private static final Pattern INDEX = Pattern.compile("\\d+");

    private String[] lines;
    private int lineNo;

    public IndDocument parse(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public IndDocument parse(String text) {
        this.lines = text.split("\r?\n", -1);
        this.lineNo = 0;

        Map<String, String> globals = new LinkedHashMap<>();
        List<IndDocument.Block> segments = new ArrayList<>();
        List<IndDocument.PathwayBlock> pathways = new ArrayList<>();
        List<IndDocument.Block> monitors = new ArrayList<>();
        List<IndDocument.Block> launchFields = new ArrayList<>();

        while (lineNo < lines.length) {
            String line = lines[lineNo++].strip();
            if (line.isEmpty() || line.startsWith("#")) continue;

            Matcher start = BLOCK_START.matcher(line);
            if (start.matches()) {
                String kind = start.group(1);
                int index = Integer.parseInt(start.group(2));
                switch (kind) {
                    case "segment" -> segments.add(readBlock(kind, expectIndex(kind, index, segments.size())));
                    case "monitor" -> monitors.add(readBlock(kind, expectIndex(kind, index, monitors.size())));
                    case "launch_field" -> launchFields.add(readBlock(kind, expectIndex(kind, index, launchFields.size())));
                    default -> pathways.add(readPathway(expectIndex(kind, index, pathways.size())));
                }
                continue;
            }

            Matcher property = PROPERTY.matcher(line);
            if (property.matches()) {
                globals.put(property.group(1), property.group(2));
                continue;
            }
            throw new ParseException("Unexpected line '" + line + "'", lineNo);
        }

        checkReferences(segments, pathways, monitors, launchFields);
        return new IndDocument(globals, segments, pathways, monitors, launchFields);
    }

    private IndDocument.Block readBlock(String kind, int index) {
        Map<String, String> properties = new LinkedHashMap<>();
        while (lineNo < lines.length) {
            String line = lines[lineNo++].strip();
            if (line.isEmpty()) continue;
            if (isEnd(line, kind)) {
                return new IndDocument.Block(index, properties);
            }
            Matcher property = PROPERTY.matcher(line);
            if (!property.matches()) {
                throw new ParseException("Expected 'key = value' in " + kind + " " + index + ", got '" + line + "'", lineNo);
            }
            properties.put(property.group(1), property.group(2));
        }
        throw new ParseException("Unexpected end of input, expected 'end " + kind + "'", lineNo);
    }

    private IndDocument.PathwayBlock readPathway(int index) {
        List<Integer> segments = new ArrayList<>();
        while (lineNo < lines.length) {
            String line = lines[lineNo++].strip();
            if (line.isEmpty()) continue;
            if (isEnd(line, "pathway")) {
                return new IndDocument.PathwayBlock(index, segments);
            }
            if (!INDEX.matcher(line).matches()) {
                throw new ParseException("Expected a segment number in pathway " + index + ", got '" + line + "'", lineNo);
            }
            segments.add(Integer.parseInt(line));
        }
        throw new ParseException("Unexpected end of input, expected 'end pathway'", lineNo);
    }

    private boolean isEnd(String line, String kind) {
        Matcher end = BLOCK_END.matcher(line);
        if (!end.matches()) return false;
        if (!end.group(1).equals(kind)) {
            throw new ParseException("'" + line + "' closes a " + kind + " block", lineNo);
        }
        return true;
    }

    private int expectIndex(String kind, int index, int parsedSoFar) {
        if (index != parsedSoFar + 1) {
            throw new ParseException("Expected " + kind + " " + (parsedSoFar + 1) + ", found " + kind + " " + index, lineNo);
        }
        return index;
    }

    private void checkReferences(List<IndDocument.Block> segments, List<IndDocument.PathwayBlock> pathways,
                                 List<IndDocument.Block> monitors, List<IndDocument.Block> launchFields) {
        for (IndDocument.PathwayBlock pathway : pathways) {
            for (int segment : pathway.segments()) {
                if (segment < 1 || segment > segments.size()) {
                    throw new ParseException("Pathway " + pathway.index() + " refers to missing segment " + segment, 0);
                }
            }
        }
        for (IndDocument.Block monitor : monitors) {
            checkPathwayReference("Monitor " + monitor.index(), monitor.get("pathway"), pathways.size());
        }
        for (IndDocument.Block launch : launchFields) {
            checkPathwayReference("Launch field " + launch.index(), launch.get("launch_pathway"), pathways.size());
        }
    }

    private void checkPathwayReference(String owner, String value, int pathwayCount) {
        if (value == null) return;
        if (!INDEX.matcher(value).matches()) {
            throw new ParseException(owner + " has a non-numeric pathway reference '" + value + "'", 0);
        }
        int pathway = Integer.parseInt(value);
        if (pathway < 1 || pathway > pathwayCount) {
            throw new ParseException(owner + " refers to missing pathway " + pathway, 0);
        }
    }

    public static class ParseException extends LanternCadException {
        private final int line;

        public ParseException(String message, int line) {
            super(line > 0 ? "Line " + line + ": " + message : message);
            this.line = line;
        }

        /** 1-based line number, or 0 when the problem is not tied to one line. */
        public int getLine() {
            return line;
        }
    }
}
