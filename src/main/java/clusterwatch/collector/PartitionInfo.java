package clusterwatch.collector;

import clusterwatch.parser.Decoders;
import clusterwatch.parser.RecordParseException;
import clusterwatch.parser.RecordReader;

import java.util.Optional;

/**
 * One block of {@code scontrol show partitions}.
 *
 * @param totalCpus {@code TotalCPUs} when scontrol reports it
 */
public record PartitionInfo(String name, String state, Optional<Integer> totalCpus) {

    public static PartitionInfo from(RecordReader record) throws RecordParseException {
        return new PartitionInfo(
                record.require("PartitionName", Decoders.string()),
                record.optional("State", Decoders.string()).orElse("UNKNOWN"),
                record.optional("TotalCPUs", Decoders.integer()));
    }
}
