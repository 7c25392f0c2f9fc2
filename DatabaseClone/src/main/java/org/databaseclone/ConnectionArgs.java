package org.databaseclone;

import org.databaseclone.clone.common.http.ConnectionContext;

import com.beust.jcommander.Parameter;
import lombok.Getter;
import lombok.ToString;

/** Connection to the document service; source and destination databases live in the same project. */
@Getter
@ToString(exclude = "apiKey")
public class ConnectionArgs implements ConnectionContext.IParams {
    @Parameter(names = {"--endpoint"}, description = "The service endpoint, e.g. https://cloud.appwrite.io/v1")
    public String endpoint;

    @Parameter(names = {"--project-id", "--projectId"}, description = "The project that holds both databases")
    public String projectId;

    @Parameter(names = {"--api-key", "--apiKey"}, description = "An API key with database read and write scopes")
    public String apiKey;

    @Parameter(names = {"--insecure"}, description = "Trust any certificate presented by the endpoint")
    public boolean insecure;
}
