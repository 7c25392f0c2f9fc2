package org.databaseclone.clone.export;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.FieldValue;
import org.databaseclone.clone.models.FieldValues;

import lombok.experimental.UtilityClass;

@UtilityClass
public class CsvFormatter {
    private static final Comparator<String> HEADER_ORDER = Comparator
        .comparing((String key) -> !key.startsWith("$"))
        .thenComparing(Comparator.naturalOrder());

    /**
     * One header row and one row per document, lines separated by {@code \n}.  Columns are the
     * union of the documents' keys with service fields first.
     */
    public static String toCsv(List<Document> documents, boolean includeServiceFields) {
        if (documents.isEmpty()) {
            return "";
        }
        var headers = headers(documents, includeServiceFields);
        var lines = new ArrayList<String>(documents.size() + 1);
        lines.add(headers.stream().map(CsvFormatter::escapeField).collect(Collectors.joining(",")));
        for (var document : documents) {
            lines.add(headers.stream()
                .map(h -> escapeField(document.get(h)))
                .collect(Collectors.joining(",")));
        }
        return String.join("\n", lines);
    }

    static List<String> headers(List<Document> documents, boolean includeServiceFields) {
        var keys = new LinkedHashSet<String>();
        for (var document : documents) {
            document.getFields().entries().keySet().stream()
                .filter(k -> includeServiceFields || !Document.SERVICE_FIELDS.contains(k))
                .forEach(keys::add);
        }
        return keys.stream().sorted(HEADER_ORDER).collect(Collectors.toList());
    }

    public static String escapeField(FieldValue value) {
        return escapeField(FieldValues.asText(value));
    }

    public static String escapeField(String text) {
        if (text == null) {
            return "";
        }
        if (text.contains(",") || text.contains("\"") || text.contains("\n") || text.contains("\r")
            || text.startsWith(" ") || text.endsWith(" ")) {
            return "\"" + text.replace("\"", "\"\"") + "\"";
        }
        return text;
    }
}
