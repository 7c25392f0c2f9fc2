package org.databaseclone.clone.worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/** Document copy counters, with failures grouped by collection name. */
@Getter
@ToString
public class DocumentResults {
    private int success;
    private int failed;
    private int skipped;
    @Getter(AccessLevel.NONE)
    private final Map<String, List<DocumentFailure>> failuresByCollection = new LinkedHashMap<>();

    void recordSuccess() {
        success++;
    }

    void recordSkipped(int count) {
        skipped += count;
    }

    void recordFailure(String collectionName, DocumentFailure failure) {
        failed++;
        failuresByCollection.computeIfAbsent(collectionName, k -> new ArrayList<>()).add(failure);
    }

    public Map<String, List<DocumentFailure>> getFailuresByCollection() {
        return Collections.unmodifiableMap(failuresByCollection);
    }
}
