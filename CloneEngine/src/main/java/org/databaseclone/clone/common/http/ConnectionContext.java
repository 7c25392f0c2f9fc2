package org.databaseclone.clone.common.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Stores the connection context for the database service: its REST endpoint, the project the
 * databases live in and how requests are authenticated.
 */
@Getter
@EqualsAndHashCode(exclude = {"requestTransformer"})
@ToString(exclude = {"requestTransformer"})
public class ConnectionContext {
    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final String projectId;
    private final RequestTransformer requestTransformer;

    private ConnectionContext(IParams params) {
        if (params.getEndpoint() == null) {
            throw new IllegalArgumentException("No endpoint was found");
        }
        if (params.getProjectId() == null || params.getApiKey() == null) {
            throw new IllegalArgumentException("Both project id and api key must be provided");
        }

        this.insecure = params.isInsecure();
        this.projectId = params.getProjectId();

        try {
            // e.g. https://cloud.appwrite.io/v1, trailing slashes are dropped so paths can be appended
            uri = new URI(params.getEndpoint().replaceAll("/+$", ""));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format", e);
        }

        if ("http".equals(uri.getScheme())) {
            protocol = Protocol.HTTP;
        } else if ("https".equals(uri.getScheme())) {
            protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol");
        }

        requestTransformer = new ApiKeyAuthTransformer(params.getProjectId(), params.getApiKey());
    }

    public interface IParams {
        String getEndpoint();

        String getProjectId();

        String getApiKey();

        boolean isInsecure();

        default ConnectionContext toConnectionContext() {
            return new ConnectionContext(this);
        }
    }
}
