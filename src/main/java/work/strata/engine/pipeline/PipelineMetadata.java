package work.strata.engine.pipeline;

import java.util.Objects;

/**
 * Describes where the rows of a pipeline came from (a codec, a command).
 */
public record PipelineMetadata(String dataSource) {
    public PipelineMetadata {
        Objects.requireNonNull(dataSource, "dataSource");
    }
}
