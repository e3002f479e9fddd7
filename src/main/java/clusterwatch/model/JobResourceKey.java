package clusterwatch.model;

import java.util.Objects;

/**
 * Key of {@link JobResource}: (job id, resource type).
 */
public record JobResourceKey(long job, String resource) {

    public JobResourceKey {
        Objects.requireNonNull(resource, "resource is required");
    }
}
