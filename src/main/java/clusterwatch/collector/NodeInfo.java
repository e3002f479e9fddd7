package clusterwatch.collector;

import clusterwatch.parser.Decoders;
import clusterwatch.parser.RecordParseException;
import clusterwatch.parser.RecordReader;
import clusterwatch.parser.ResourceQuantity;

import java.util.List;
import java.util.Map;

/**
 * One block of {@code scontrol show nodes}, reduced to the fields the model needs.
 *
 * @param cfgTres   configured trackable resources ({@code CfgTRES})
 * @param allocTres allocated trackable resources ({@code AllocTRES}); empty when nothing runs
 */
public record NodeInfo(
        String name,
        String state,
        int cpus,
        int cpuAlloc,
        long realMemory,
        long allocMemory,
        List<String> partitions,
        Map<String, ResourceQuantity> cfgTres,
        Map<String, ResourceQuantity> allocTres) {

    public static NodeInfo from(RecordReader record) throws RecordParseException {
        return new NodeInfo(
                record.require("NodeName", Decoders.string()),
                record.optional("State", Decoders.string()).orElse("UNKNOWN"),
                record.require("CPUTot", Decoders.integer()),
                record.optional("CPUAlloc", Decoders.integer()).orElse(0),
                record.require("RealMemory", Decoders.longValue()),
                record.optional("AllocMem", Decoders.longValue()).orElse(0L),
                record.optional("Partitions", Decoders.stringList()).orElse(List.of()),
                record.optional("CfgTRES", Decoders.quantityMap()).orElse(Map.of()),
                record.optional("AllocTRES", Decoders.quantityMap()).orElse(Map.of()));
    }
}
