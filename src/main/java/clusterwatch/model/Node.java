package clusterwatch.model;

import clusterwatch.table.Keyed;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Compute node as seen by the scheduler. Memory is in megabytes.
 * Idle CPUs and free memory are derived, never read from scontrol.
 */
public record Node(
        @JsonProperty("name") String name,
        @JsonProperty("status") NodeStatus status,
        @JsonProperty("cpus") int cpus,
        @JsonProperty("cpus_alloc") int cpusAlloc,
        @JsonProperty("cpus_idle") int cpusIdle,
        @JsonProperty("memory") long memory,
        @JsonProperty("memory_alloc") long memoryAlloc,
        @JsonProperty("memory_free") long memoryFree,
        @JsonProperty("partitions") List<String> partitions,
        @JsonProperty("updated_at") Instant updatedAt) implements Keyed<String> {

    public Node {
        Objects.requireNonNull(name, "name is required");
        status = status == null ? NodeStatus.UNKNOWN : status;
        partitions = partitions == null ? List.of() : List.copyOf(partitions);
    }

    @Override
    public String key() {
        return name;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private NodeStatus status = NodeStatus.UNKNOWN;
        private int cpus;
        private int cpusAlloc;
        private long memory;
        private long memoryAlloc;
        private List<String> partitions = List.of();
        private Instant updatedAt;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(NodeStatus status) {
            this.status = status;
            return this;
        }

        public Builder cpus(int cpus) {
            this.cpus = cpus;
            return this;
        }

        public Builder cpusAlloc(int cpusAlloc) {
            this.cpusAlloc = cpusAlloc;
            return this;
        }

        public Builder memory(long memory) {
            this.memory = memory;
            return this;
        }

        public Builder memoryAlloc(long memoryAlloc) {
            this.memoryAlloc = memoryAlloc;
            return this;
        }

        public Builder partitions(List<String> partitions) {
            this.partitions = partitions;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Node build() {
            return new Node(name, status, cpus, cpusAlloc,
                    Quantities.saturatingSubtract(cpus, cpusAlloc),
                    memory, memoryAlloc,
                    Quantities.saturatingSubtract(memory, memoryAlloc),
                    partitions, updatedAt);
        }
    }
}
