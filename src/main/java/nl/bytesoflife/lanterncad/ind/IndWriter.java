package nl.bytesoflife.lanterncad.ind;

import nl.bytesoflife.lanterncad.circuit.CircuitView;
import nl.bytesoflife.lanterncad.circuit.EntryId;
import nl.bytesoflife.lanterncad.circuit.LaunchField;
import nl.bytesoflife.lanterncad.circuit.Monitor;
import nl.bytesoflife.lanterncad.circuit.Pathway;
import nl.bytesoflife.lanterncad.circuit.RelativePosition;
import nl.bytesoflife.lanterncad.circuit.Segment;
import nl.bytesoflife.lanterncad.circuit.SegmentId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a frozen circuit in the block grammar of the {@code .ind} design format:
 * <pre>
 * # Global parameters
 * key = value
 *
 * # Segments
 * segment 1
 * 	key = value
 * end segment
 *
 * # Pathways
 * pathway 1
 * 	1
 * end pathway
 * </pre>
 * followed by {@code # Monitors} and {@code # Launch Fields} blocks of the same shape. A block
 * with no entries is left out. Entries are numbered from 1 in insertion order, and
 * references to segments and pathways are written as those numbers.
 */
public class IndWriter implements DesignWriter {

    private static final Logger log = LoggerFactory.getLogger(IndWriter.class);

    @Override
    public String extension() {
        return "ind";
    }

    @Override
    public String serialize(CircuitView circuit) {
        if (!circuit.isFrozen()) {
            throw new SerializationException("Circuit must be frozen before it is written");
        }
        Map<EntryId, Integer> indices = new IdentityHashMap<>();
        index(indices, circuit.getSegments().stream().map(Segment::getId).toList());
        index(indices, circuit.getPathways().stream().map(Pathway::getId).toList());
        index(indices, circuit.getMonitors().stream().map(Monitor::getId).toList());

        StringBuilder sb = new StringBuilder();
        sb.append("# Global parameters\n");
        for (Map.Entry<String, Object> entry : circuit.getGlobalParameters().entrySet()) {
            sb.append(entry.getKey()).append(" = ").append(format(entry.getValue(), indices)).append('\n');
        }
        sb.append('\n');

        List<Segment> segments = circuit.getSegments();
        if (!segments.isEmpty()) {
            sb.append("# Segments\n");
            for (int i = 0; i < segments.size(); i++) {
                block(sb, "segment", i + 1, segments.get(i).getProperties(), indices);
            }
        }

        List<Pathway> pathways = circuit.getPathways();
        if (!pathways.isEmpty()) {
            sb.append("# Pathways\n");
            for (int i = 0; i < pathways.size(); i++) {
                sb.append("pathway ").append(i + 1).append('\n');
                for (SegmentId segment : pathways.get(i).getSegments()) {
                    sb.append('\t').append(resolve(segment, indices)).append('\n');
                }
                sb.append("end pathway\n\n");
            }
        }

        List<Monitor> monitors = circuit.getMonitors();
        if (!monitors.isEmpty()) {
            sb.append("# Monitors\n");
            for (int i = 0; i < monitors.size(); i++) {
                block(sb, "monitor", i + 1, monitors.get(i).getProperties(), indices);
            }
        }

        List<LaunchField> launchFields = circuit.getLaunchFields();
        if (!launchFields.isEmpty()) {
            sb.append("# Launch Fields\n");
            for (int i = 0; i < launchFields.size(); i++) {
                block(sb, "launch_field", i + 1, launchFields.get(i).getProperties(), indices);
            }
        }

        log.debug("Serialized circuit: {} segments, {} pathways, {} monitors, {} launch fields",
                segments.size(), pathways.size(), monitors.size(), launchFields.size());
        return sb.toString();
    }

    /**
     * Writes the circuit to {@code file}, creating missing parent directories. The text is
     * rendered completely before the file is opened; if writing fails the partial file is
     * removed and the exception rethrown.
     *
     * @return number of bytes written
     */
    @Override
    public long write(CircuitView circuit, Path file) throws IOException {
        byte[] content = serialize(circuit).getBytes(StandardCharsets.UTF_8);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            Files.write(file, content);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        log.info("Circuit written to {} ({} bytes)", file, content.length);
        return content.length;
    }

    private void block(StringBuilder sb, String kind, int index, Map<String, Object> properties,
                       Map<EntryId, Integer> indices) {
        sb.append(kind).append(' ').append(index).append('\n');
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            sb.append('\t').append(entry.getKey()).append(" = ")
                    .append(format(entry.getValue(), indices)).append('\n');
        }
        sb.append("end ").append(kind).append("\n\n");
    }

    private static void index(Map<EntryId, Integer> indices, List<? extends EntryId> ids) {
        for (int i = 0; i < ids.size(); i++) {
            indices.put(ids.get(i), i + 1);
        }
    }

    private static String format(Object value, Map<EntryId, Integer> indices) {
        if (value instanceof Number n) {
            return IndValues.formatNumber(n);
        }
        if (value instanceof EntryId id) {
            return Integer.toString(resolve(id, indices));
        }
        if (value instanceof RelativePosition relative) {
            return relative.variable() + " rel begin segment " + resolve(relative.segment(), indices);
        }
        return String.valueOf(value);
    }

    private static int resolve(EntryId id, Map<EntryId, Integer> indices) {
        Integer index = indices.get(id);
        if (index == null) {
            throw new SerializationException("Reference to " + id + " has no written index");
        }
        return index;
    }
}
