package clusterwatch.model;

import clusterwatch.table.Keyed;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Requested and allocated quantity of one resource type for one job.
 */
public record JobResource(
        @JsonProperty("job") long job,
        @JsonProperty("resource") String resource,
        @JsonProperty("requested") long requested,
        @JsonProperty("allocated") long allocated) implements Keyed<JobResourceKey> {

    public JobResource {
        Objects.requireNonNull(resource, "resource is required");
    }

    @Override
    public JobResourceKey key() {
        return new JobResourceKey(job, resource);
    }
}
