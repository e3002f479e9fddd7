package clusterwatch.model;

import clusterwatch.table.Keyed;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Scheduler partition with CPU and memory totals aggregated over its nodes.
 */
public record Partition(
        @JsonProperty("name") String name,
        @JsonProperty("status") PartitionStatus status,
        @JsonProperty("total_cpus") int totalCpus,
        @JsonProperty("total_cpus_alloc") int totalCpusAlloc,
        @JsonProperty("total_cpus_idle") int totalCpusIdle,
        @JsonProperty("total_memory") long totalMemory,
        @JsonProperty("total_memory_alloc") long totalMemoryAlloc,
        @JsonProperty("total_memory_free") long totalMemoryFree,
        @JsonProperty("updated_at") Instant updatedAt) implements Keyed<String> {

    public Partition {
        Objects.requireNonNull(name, "name is required");
        status = status == null ? PartitionStatus.UNKNOWN : status;
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
        private PartitionStatus status = PartitionStatus.UNKNOWN;
        private int totalCpus;
        private int totalCpusAlloc;
        private long totalMemory;
        private long totalMemoryAlloc;
        private Instant updatedAt;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(PartitionStatus status) {
            this.status = status;
            return this;
        }

        public Builder totalCpus(int totalCpus) {
            this.totalCpus = totalCpus;
            return this;
        }

        public Builder totalCpusAlloc(int totalCpusAlloc) {
            this.totalCpusAlloc = totalCpusAlloc;
            return this;
        }

        public Builder totalMemory(long totalMemory) {
            this.totalMemory = totalMemory;
            return this;
        }

        public Builder totalMemoryAlloc(long totalMemoryAlloc) {
            this.totalMemoryAlloc = totalMemoryAlloc;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Partition build() {
            return new Partition(name, status, totalCpus, totalCpusAlloc,
                    Quantities.saturatingSubtract(totalCpus, totalCpusAlloc),
                    totalMemory, totalMemoryAlloc,
                    Quantities.saturatingSubtract(totalMemory, totalMemoryAlloc),
                    updatedAt);
        }
    }
}
