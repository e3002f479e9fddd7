package clusterwatch.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SlurmRecordParserTest {

    private static final String NODE = """
            NodeName=node4504 Arch=x86_64 CoresPerSocket=32
               CPUAlloc=0 CPUEfctv=64 CPUTot=64 CPULoad=0.04
               AvailableFeatures=node4504,rocky8
               Gres=gpu:l40s:4(S:0-1)
               OS=Linux 4.18.0-372.9.1.el8.x86_64 #1 SMP Tue May 10 14:48:47 UTC 2022
               RealMemory=1031314 AllocMem=0 FreeMem=77430 Sockets=2 Boards=1
               State=IDLE ThreadsPerCore=2 TmpDisk=0 Weight=1 Owner=N/A MCS_label=N/A
               Partitions=mit_preemptable
               LastBusyTime=2026-01-29T15:08:03 ResumeAfterTime=None
               CfgTRES=cpu=64,mem=1031314M,billing=64,gres/gpu=4,gres/gpu:l40s=4
               AllocTRES=
               CurrentWatts=0 AveWatts=0
            """;

    private static final String JOB = """
            JobId=8601779 JobName=8445fb49-9088-4fd5-b463-65b76bf6c4bb
               UserId=cysteine(135712) GroupId=cysteine(100135712) MCS_label=N/A
               JobState=RUNNING Reason=None Dependency=(null)
               Partition=sched_mit_hill AllocNode:Sid=node2429:26654
               NumNodes=1 NumCPUs=1 NumTasks=1 CPUs/Task=1 ReqB:S:C:T=0:0:*:*
               ReqTRES=cpu=1,mem=15000M,node=1,billing=1
               Features=(null) DelayBoot=00:00:00
            """;

    @Test
    void parsesSimpleRecord() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("NodeName=x State=IDLE");

        assertEquals(List.of("NodeName", "State"), List.copyOf(block.keys()));
        assertEquals("x", block.require("NodeName", Decoders.string()));
        assertEquals("IDLE", block.require("State", Decoders.string()));
    }

    @Test
    void valueRunsToNextKeyAndKeepsInnerSpaces() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock(NODE);

        assertEquals("Linux 4.18.0-372.9.1.el8.x86_64 #1 SMP Tue May 10 14:48:47 UTC 2022",
                block.require("OS", Decoders.string()));
        assertEquals("gpu:l40s:4(S:0-1)", block.require("Gres", Decoders.string()));
        assertEquals(32, block.require("CoresPerSocket", Decoders.integer()));
        assertEquals(0.04, block.require("CPULoad", Decoders.doubleValue()), 1e-9);
    }

    @Test
    void nestedMapIsNotSplitIntoTopLevelKeys() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock(NODE);

        assertFalse(block.has("cpu"));
        assertFalse(block.has("mem"));
        Map<String, ResourceQuantity> tres = block.require("CfgTRES", Decoders.quantityMap());
        assertEquals(64, tres.get("cpu").value());
        assertEquals(1_031_314_000_000L, tres.get("mem").value());
        assertEquals(4, tres.get("gres/gpu").value());
        assertEquals(4, tres.get("gres/gpu:l40s").value());
    }

    @Test
    void overflowingQuantityNamesTheNestedKey() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("NodeName=big CfgTRES=cpu=8,mem=10000000000T");

        RecordParseException e = assertThrows(RecordParseException.class,
                () -> block.require("CfgTRES", Decoders.quantityMap()));
        assertEquals("CfgTRES.mem", e.key());
        assertEquals("10000000000T", e.value());
    }

    @Test
    void sentinelValuesReadAsAbsent() throws Exception {
        RecordBlock node = SlurmRecordParser.parseBlock(NODE);
        RecordBlock job = SlurmRecordParser.parseBlock(JOB);

        assertTrue(node.optional("AllocTRES", Decoders.quantityMap()).isEmpty());
        assertTrue(node.optional("ResumeAfterTime", Decoders.string()).isEmpty());
        assertTrue(job.optional("Reason", Decoders.string()).isEmpty());
        assertTrue(job.optional("Dependency", Decoders.string()).isEmpty());
        assertTrue(job.optional("Features", Decoders.string()).isEmpty());
    }

    @Test
    void absentRequiredFieldNamesTheKey() throws Exception {
        RecordBlock job = SlurmRecordParser.parseBlock(JOB);

        RecordParseException e = assertThrows(RecordParseException.class,
                () -> job.require("Reason", Decoders.string()));
        assertEquals("Reason", e.key());
    }

    @Test
    void keysWithPunctuationAreRecognized() throws Exception {
        RecordBlock job = SlurmRecordParser.parseBlock(JOB);

        assertEquals("node2429:26654", job.require("AllocNode:Sid", Decoders.string()));
        assertEquals(1, job.require("CPUs/Task", Decoders.integer()));
        assertEquals("0:0:*:*", job.require("ReqB:S:C:T", Decoders.string()));
        assertEquals("cysteine(135712)", job.require("UserId", Decoders.string()));
    }

    @Test
    void multipleBlocksParseInDocumentOrder() throws Exception {
        String text = "NodeName=a State=IDLE\n\nNodeName=b State=DOWN\n";

        List<String> names = SlurmRecordParser.parseRecords(text,
                record -> record.require("NodeName", Decoders.string()));

        assertEquals(List.of("a", "b"), names);
    }

    @Test
    void blankLinesWithWhitespaceSeparateBlocks() {
        List<String> blocks = SlurmRecordParser.splitBlocks("A=1\n   \nB=2\r\n\r\nC=3\n\n\n");

        assertEquals(List.of("A=1", "B=2", "C=3"), blocks);
    }

    @Test
    void singleBlockYieldsOneElementList() throws Exception {
        List<String> names = SlurmRecordParser.parseRecords("NodeName=x",
                record -> record.require("NodeName", Decoders.string()));

        assertEquals(List.of("x"), names);
    }

    @Test
    void parseRecordRejectsMultipleBlocks() {
        assertThrows(RecordParseException.class, () -> SlurmRecordParser.parseRecord("A=1\n\nA=2",
                record -> record.require("A", Decoders.string())));
        assertThrows(RecordParseException.class, () -> SlurmRecordParser.parseRecord("  ",
                record -> record.require("A", Decoders.string())));
    }

    @Test
    void blockWithoutKeyIsRejected() {
        RecordParseException e = assertThrows(RecordParseException.class,
                () -> SlurmRecordParser.parseBlock("No jobs in the system"));
        assertTrue(e.getMessage().startsWith("No Key=Value field"));
    }

    @Test
    void repeatedKeysAccumulate() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("""
                JobId=7
                  Nodes=node01 CPU_IDs=0-3 Mem=100
                  Nodes=node02 CPU_IDs=0-1 Mem=50
                """);

        assertEquals(List.of("node01", "node02"), block.repeated("Nodes"));
        assertEquals(List.of("0-3", "0-1"), block.require("CPU_IDs", Decoders.stringList()));
        assertThrows(RecordParseException.class, () -> block.require("Mem", Decoders.string()));
        assertThrows(RecordParseException.class, () -> block.scalar("Nodes"));
    }

    @Test
    void sequenceOfSingleValueSplitsOnCommas() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("Partitions=gpu,standard, debug,");

        assertEquals(List.of("gpu", "standard", "debug"), block.require("Partitions", Decoders.stringList()));
        assertEquals(List.of(), block.repeated("Missing"));
    }

    @Test
    void trailingCommasAreTrimmed() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("Name=foo, Other=bar");

        assertEquals("foo", block.require("Name", Decoders.string()));
    }

    @Test
    void numberCoercionFailureNamesKeyAndValue() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("CPUTot=lots");

        RecordParseException e = assertThrows(RecordParseException.class,
                () -> block.require("CPUTot", Decoders.integer()));
        assertEquals("CPUTot", e.key());
        assertEquals("lots", e.value());
    }

    @Test
    void booleanAcceptsDigitsAndWords() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("A=1 B=0 C=TRUE D=false E=yes");

        assertTrue(block.require("A", Decoders.bool()));
        assertFalse(block.require("B", Decoders.bool()));
        assertTrue(block.require("C", Decoders.bool()));
        assertFalse(block.require("D", Decoders.bool()));
        assertThrows(RecordParseException.class, () -> block.require("E", Decoders.bool()));
    }

    @Test
    void mapPieceWithoutEqualsIsAnError() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("CfgTRES=cpu=4,broken");

        RecordParseException e = assertThrows(RecordParseException.class,
                () -> block.require("CfgTRES", Decoders.quantityMap()));
        assertEquals("broken", e.value());
    }

    @Test
    void badQuantityInsideMapNamesSubKey() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("AllocTRES=cpu=4,mem=lotsM");

        RecordParseException e = assertThrows(RecordParseException.class,
                () -> block.require("AllocTRES", Decoders.quantityMap()));
        assertEquals("AllocTRES.mem", e.key());
    }

    @Test
    void mappedDecoderDelegatesUnknownHandlingToFunction() throws Exception {
        RecordBlock block = SlurmRecordParser.parseBlock("State=WEIRD");

        String mapped = block.require("State", Decoders.mapped(s -> s.equals("IDLE") ? "idle" : "other"));
        assertEquals("other", mapped);
    }
}
