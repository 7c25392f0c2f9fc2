package org.databaseclone.clone.worker;

import java.nio.file.Path;

import org.databaseclone.clone.diff.IdentifierFieldMapping;
import org.databaseclone.clone.schema.PollPolicy;
import org.databaseclone.clone.schema.ReadinessTimeoutPolicy;
import org.databaseclone.clone.snapshot.SnapshotStore;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Settings for one clone run; fixed for the run's lifetime. */
@Value
@Builder(toBuilder = true)
public class CloneOptions {
    public static final int DEFAULT_BATCH_SIZE = 100;

    @NonNull
    @Builder.Default
    CloneMode mode = CloneMode.FULL;
    @Builder.Default
    int batchSize = DEFAULT_BATCH_SIZE;
    @NonNull
    @Builder.Default
    Path snapshotPath = Path.of(SnapshotStore.DEFAULT_FILE_NAME);
    @NonNull
    @Builder.Default
    IdentifierFieldMapping identifierFields = IdentifierFieldMapping.empty();
    @NonNull
    @Builder.Default
    PollPolicy attributePollPolicy = PollPolicy.ATTRIBUTE_DEFAULT;
    @NonNull
    @Builder.Default
    PollPolicy indexPollPolicy = PollPolicy.INDEX_DEFAULT;
    @NonNull
    @Builder.Default
    ReadinessTimeoutPolicy readinessTimeoutPolicy = ReadinessTimeoutPolicy.FAIL;
}
