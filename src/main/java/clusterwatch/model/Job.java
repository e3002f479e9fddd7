package clusterwatch.model;

import clusterwatch.table.Keyed;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Scheduler job. {@code timeLimit} and {@code startTime} are null when the scheduler
 * reports none (pending jobs have no start time).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
        @JsonProperty("job_id") long jobId,
        @JsonProperty("user") String user,
        @JsonProperty("partition") String partition,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("time_limit") String timeLimit,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("submit_time") Instant submitTime,
        @JsonProperty("updated_at") Instant updatedAt) implements Keyed<Long> {

    public Job {
        Objects.requireNonNull(user, "user is required");
        Objects.requireNonNull(partition, "partition is required");
        status = status == null ? JobStatus.UNKNOWN : status;
    }

    @Override
    public Long key() {
        return jobId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long jobId;
        private String user;
        private String partition;
        private JobStatus status = JobStatus.UNKNOWN;
        private String timeLimit;
        private Instant startTime;
        private Instant submitTime;
        private Instant updatedAt;

        public Builder jobId(long jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder partition(String partition) {
            this.partition = partition;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder timeLimit(String timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder submitTime(Instant submitTime) {
            this.submitTime = submitTime;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(jobId, user, partition, status, timeLimit, startTime, submitTime, updatedAt);
        }
    }
}
