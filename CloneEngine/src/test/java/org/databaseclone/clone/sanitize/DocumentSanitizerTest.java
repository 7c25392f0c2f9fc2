package org.databaseclone.clone.sanitize;

import java.util.List;
import java.util.Map;

import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.FieldValue;

import org.junit.jupiter.api.Test;

import static org.databaseclone.clone.TestDocuments.document;
import static org.databaseclone.clone.TestDocuments.map;
import static org.databaseclone.clone.TestDocuments.value;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;

class DocumentSanitizerTest {
    private final DocumentSanitizer sanitizer = new DocumentSanitizer();

    private static Document withServiceFields(Object... userFields) {
        var all = new Object[14 + userFields.length];
        var service = new Object[] {
            "$id", "doc1",
            "$collectionId", "books",
            "$databaseId", "src",
            "$createdAt", "2024-01-01T00:00:00.000+00:00",
            "$updatedAt", "2024-01-02T00:00:00.000+00:00",
            "$permissions", List.of("read(\"any\")"),
            "$sequence", 7
        };
        System.arraycopy(service, 0, all, 0, service.length);
        System.arraycopy(userFields, 0, all, service.length, userFields.length);
        return document(all);
    }

    @Test
    void sanitize_removesEveryServiceField() {
        var result = sanitizer.sanitize(withServiceFields("title", "Dune", "pages", 412));

        for (var field : Document.SERVICE_FIELDS) {
            assertThat(result.entries(), not(hasKey(field)));
        }
        assertThat(result, equalTo(map("title", "Dune", "pages", 412)));
    }

    @Test
    void sanitize_keepsFieldOrder() {
        var result = sanitizer.sanitize(withServiceFields("z", 1, "a", 2, "m", 3));

        assertThat(result.entries().keySet(), contains("z", "a", "m"));
    }

    @Test
    void sanitize_collapsesRelationshipExpansionToId() {
        var author = Map.of("$id", "author-9", "$collectionId", "authors", "name", "Frank Herbert");

        var result = sanitizer.sanitize(withServiceFields("author", author));

        assertThat(result.get("author").get(), equalTo(FieldValue.of("author-9")));
    }

    @Test
    void sanitize_collapsesRelationshipExpansionsInsideLists() {
        var first = Map.of("$id", "t1", "$collectionId", "tags");
        var second = Map.of("$id", "t2", "$collectionId", "tags");

        var result = sanitizer.sanitize(withServiceFields("tags", List.of(first, second, "loose")));

        assertThat(result.get("tags").get(), equalTo(value(List.of("t1", "t2", "loose"))));
    }

    @Test
    void sanitize_stripsServiceFieldsFromNestedObjects() {
        var nested = map("$id", "inner", "$createdAt", "yesterday", "street", "Main", "geo", map("$sequence", 3, "lat", 1.5));

        var result = sanitizer.sanitize(withServiceFields("address", nested));

        assertThat(result.get("address").get(), equalTo(map("street", "Main", "geo", map("lat", 1.5))));
    }

    @Test
    void sanitize_leavesScalarsAndNullsUnchanged() {
        var result = sanitizer.sanitize(withServiceFields("flag", true, "missing", null, "ratio", 0.25));

        assertThat(result, equalTo(map("flag", true, "missing", null, "ratio", 0.25)));
    }
}
