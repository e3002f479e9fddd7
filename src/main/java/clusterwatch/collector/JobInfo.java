package clusterwatch.collector;

import clusterwatch.parser.Decoders;
import clusterwatch.parser.FieldValue;
import clusterwatch.parser.RecordParseException;
import clusterwatch.parser.RecordReader;
import clusterwatch.parser.ResourceQuantity;
import clusterwatch.parser.ValueDecoder;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One block of {@code scontrol show jobs --details}.
 *
 * scontrol prints timestamps without a zone ({@code 2026-01-31T12:44:31}); they are read in
 * the collector's configured zone. {@code Unknown}, {@code N/A} and {@code None} start times
 * read as absent.
 */
public record JobInfo(
        long jobId,
        String name,
        String user,
        String partition,
        String state,
        String timeLimit,
        Instant submitTime,
        Instant startTime,
        String nodeList,
        Map<String, ResourceQuantity> reqTres,
        Map<String, ResourceQuantity> allocTres,
        List<NodeDetail> details) {

    private static final Set<String> NO_TIME = Set.of("Unknown", "N/A", "None");

    /**
     * One per-node line of the {@code --details} output, e.g.
     * {@code Nodes=node[01-02] CPU_IDs=0-3 Mem=8192 GRES=gpu:1(IDX:0)}.
     *
     * @param memoryMb memory per node in megabytes
     * @param gres     GRES spec, or null when the line has none
     */
    public record NodeDetail(String nodes, String cpuIds, long memoryMb, String gres) {
    }

    public static JobInfo from(RecordReader record, ZoneId zone) throws RecordParseException {
        return new JobInfo(
                record.require("JobId", Decoders.longValue()),
                record.optional("JobName", Decoders.string()).orElse(""),
                record.require("UserId", userName()),
                record.require("Partition", Decoders.string()),
                record.optional("JobState", Decoders.string()).orElse("UNKNOWN"),
                record.optional("TimeLimit", Decoders.string()).orElse(null),
                record.require("SubmitTime", timestamp(zone)),
                record.optional("StartTime", optionalTimestamp(zone)).flatMap(t -> t).orElse(null),
                record.optional("NodeList", Decoders.string()).orElse(null),
                record.optional("ReqTRES", Decoders.quantityMap()).orElse(Map.of()),
                record.optional("AllocTRES", Decoders.quantityMap()).orElse(Map.of()),
                details(record));
    }

    /** {@code UserId=alice(1000)} yields {@code alice}. */
    static ValueDecoder<String> userName() {
        return value -> {
            String text = value.text();
            int paren = text.indexOf('(');
            return paren > 0 ? text.substring(0, paren) : text;
        };
    }

    static ValueDecoder<Instant> timestamp(ZoneId zone) {
        return value -> {
            String text = value.text();
            try {
                return LocalDateTime.parse(text).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                throw new RecordParseException("Expected a timestamp", value.key(), text, e);
            }
        };
    }

    private static ValueDecoder<Optional<Instant>> optionalTimestamp(ZoneId zone) {
        ValueDecoder<Instant> strict = timestamp(zone);
        return value -> NO_TIME.contains(value.text())
                ? Optional.empty()
                : Optional.of(strict.decode(value));
    }

    /**
     * Zip the repeated {@code Nodes}/{@code CPU_IDs}/{@code Mem}/{@code GRES} keys back into lines.
     * {@code GRES=(null)} is dropped by the parser, so GRES is only attached when every line has one.
     */
    private static List<NodeDetail> details(RecordReader record) throws RecordParseException {
        List<String> nodes = record.repeated("Nodes");
        if (nodes.isEmpty()) {
            return List.of();
        }
        List<String> cpuIds = record.repeated("CPU_IDs");
        List<String> mems = record.repeated("Mem");
        List<String> gres = record.repeated("GRES");
        if (cpuIds.size() != nodes.size() || mems.size() != nodes.size()) {
            throw new RecordParseException("Job detail lines are incomplete", "Nodes", String.join(" ", nodes));
        }
        boolean withGres = gres.size() == nodes.size();

        List<NodeDetail> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            long memoryMb = Decoders.longValue().decode(FieldValue.single("Mem", mems.get(i)));
            result.add(new NodeDetail(nodes.get(i), cpuIds.get(i), memoryMb, withGres ? gres.get(i) : null));
        }
        return result;
    }
}
