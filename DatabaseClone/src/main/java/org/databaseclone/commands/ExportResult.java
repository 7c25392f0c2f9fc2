package org.databaseclone.commands;

import org.databaseclone.cli.Format;
import org.databaseclone.clone.export.CsvExporter;
import org.databaseclone.clone.models.DatabaseInfo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class ExportResult implements Result {
    private final DatabaseInfo source;
    private final CsvExporter.ExportResult export;
    private final String errorMessage;
    private final int exitCode;

    @Override
    public String asCliOutput() {
        var sb = new StringBuilder();
        if (source != null) {
            sb.append("Source: " + source.name() + " (" + source.id() + ")" + System.lineSeparator());
        }
        if (export != null) {
            sb.append("CSV Export:" + System.lineSeparator());
            sb.append(Format.indentToLevel(1) + "Export directory: " + export.exportDir().toAbsolutePath() + System.lineSeparator());
            sb.append(Format.indentToLevel(1) + "Total records: " + export.totalRecords() + System.lineSeparator());
            sb.append(Format.indentToLevel(1) + "Files created:" + System.lineSeparator());
            for (var collection : export.collections()) {
                sb.append(Format.indentToLevel(2));
                if (collection.file() != null) {
                    sb.append("- " + collection.file().getFileName() + " (" + collection.recordCount() + " records)");
                } else {
                    sb.append("- " + collection.name() + ": No records to export");
                }
                sb.append(System.lineSeparator());
            }
        }
        sb.append("Results:" + System.lineSeparator());
        if (errorMessage != null) {
            sb.append(Format.indentToLevel(1) + "Issue(s) detected" + System.lineSeparator());
            sb.append("Issues:" + System.lineSeparator());
            sb.append(Format.indentToLevel(1) + errorMessage + System.lineSeparator());
        } else {
            sb.append(Format.indentToLevel(1) + getExitCode() + " issue(s) detected" + System.lineSeparator());
        }
        return sb.toString();
    }

    @Override
    public JsonNode asJsonOutput() {
        var root = JsonNodeFactory.instance.objectNode();
        if (source != null) {
            root.putObject("source").put("id", source.id()).put("name", source.name());
        }
        if (export != null) {
            root.put("exportDir", export.exportDir().toAbsolutePath().toString());
            root.put("totalRecords", export.totalRecords());
            var collections = root.putArray("collections");
            for (var collection : export.collections()) {
                var obj = collections.addObject();
                obj.put("name", collection.name());
                obj.put("recordCount", collection.recordCount());
                if (collection.file() != null) {
                    obj.put("file", collection.file().toString());
                }
            }
        }
        root.put("errorCode", getExitCode());
        if (errorMessage != null) {
            root.put("errorMessage", errorMessage);
        }
        return root;
    }
}
