package org.databaseclone.commands;

import org.databaseclone.cli.CloneSummary;
import org.databaseclone.cli.Format;
import org.databaseclone.clone.models.DatabaseInfo;
import org.databaseclone.clone.worker.CloneMode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class CloneResult implements Result {
    private final DatabaseInfo source;
    private final DatabaseInfo destination;
    private final CloneMode mode;
    private final CloneSummary summary;
    private final boolean cancelled;
    private final String errorMessage;
    private final int exitCode;

    public int getExitCode() {
        if (cancelled) {
            return CommandBase.CANCELLED_CODE;
        }
        return Math.max(exitCode, CommandBase.errorCountExitCode(issueCount()));
    }

    private int issueCount() {
        return summary == null ? 0 : summary.getErrorCount();
    }

    @Override
    public String asCliOutput() {
        var sb = new StringBuilder();
        if (cancelled) {
            return "Clone cancelled by user." + System.lineSeparator();
        }
        if (source != null) {
            sb.append("Source:      " + describe(source) + System.lineSeparator());
        }
        if (destination != null) {
            sb.append("Destination: " + describe(destination) + System.lineSeparator());
        }
        if (summary != null) {
            sb.append(summary.asCliOutput()).append(System.lineSeparator());
        }

        sb.append("Results:" + System.lineSeparator());
        if (errorMessage != null) {
            sb.append(Format.indentToLevel(1) + "Issue(s) detected" + System.lineSeparator());
            sb.append("Issues:" + System.lineSeparator());
            sb.append(Format.indentToLevel(1) + errorMessage + System.lineSeparator());
        } else {
            sb.append(Format.indentToLevel(1) + issueCount() + " issue(s) detected" + System.lineSeparator());
            if (summary != null && !summary.getAllErrors().isEmpty()) {
                sb.append("Issues:" + System.lineSeparator());
                summary.getAllErrors().forEach(err -> sb.append(Format.indentToLevel(1) + err + System.lineSeparator()));
            }
        }
        return sb.toString();
    }

    @Override
    public JsonNode asJsonOutput() {
        var root = JsonNodeFactory.instance.objectNode();
        if (source != null) {
            root.putObject("source").put("id", source.id()).put("name", source.name());
        }
        if (destination != null) {
            root.putObject("destination").put("id", destination.id()).put("name", destination.name());
        }
        if (mode != null) {
            root.put("mode", mode.getLabel());
        }
        root.put("cancelled", cancelled);
        if (summary != null) {
            root.set("summary", summary.asJsonOutput());
        }
        var errors = root.putArray("errors");
        if (summary != null) {
            summary.getAllErrors().forEach(errors::add);
        }
        root.put("errorCode", getExitCode());
        if (errorMessage != null) {
            root.put("errorMessage", errorMessage);
        }
        return root;
    }

    private static String describe(DatabaseInfo database) {
        return database.name() + " (" + database.id() + ")";
    }
}
