package org.databaseclone.clone.common;

import java.util.Optional;

import org.databaseclone.clone.common.http.HttpResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

/**
 * The database service rejected a request.  The service answers failures with a body of the form
 * {@code {"message": ..., "code": ..., "type": ...}}, which is surfaced here.
 */
@Getter
public class DatabaseApiException extends CloneException {
    private static final ObjectMapper objectMapper = ObjectMapperFactory.createDefaultMapper();

    private final int statusCode;
    private final String errorType;

    public DatabaseApiException(int statusCode, String errorType, String message) {
        super(message);
        this.statusCode = statusCode;
        this.errorType = errorType;
    }

    public static DatabaseApiException fromResponse(String operation, HttpResponse response) {
        var message = Optional.<String>empty();
        String type = null;
        if (response.body != null && !response.body.isBlank()) {
            try {
                var node = objectMapper.readTree(response.body);
                if (node.hasNonNull("message")) {
                    message = Optional.of(node.get("message").asText());
                }
                if (node.hasNonNull("type")) {
                    type = node.get("type").asText();
                }
            } catch (JsonProcessingException e) {
                message = Optional.of(response.body);
            }
        }
        return new DatabaseApiException(
            response.statusCode,
            type,
            message.orElse(operation + " failed with status " + response.statusCode + " " + response.statusText)
        );
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
