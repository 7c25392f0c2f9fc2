package org.databaseclone.clone.common.http;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConnectionContextTest {

    private static ConnectionContext.IParams params(String endpoint, String projectId, String apiKey) {
        return new ConnectionContext.IParams() {
            @Override
            public String getEndpoint() {
                return endpoint;
            }

            @Override
            public String getProjectId() {
                return projectId;
            }

            @Override
            public String getApiKey() {
                return apiKey;
            }

            @Override
            public boolean isInsecure() {
                return false;
            }
        };
    }

    @Test
    void toConnectionContext_parsesEndpoint() {
        var context = params("https://cloud.example.com/v1/", "proj", "secret").toConnectionContext();

        assertThat(context.getProtocol(), equalTo(ConnectionContext.Protocol.HTTPS));
        assertThat(context.getUri().toString(), equalTo("https://cloud.example.com/v1"));
        assertThat(context.getProjectId(), equalTo("proj"));
        assertThat(context.toString(), not(containsString("secret")));
    }

    @Test
    void toConnectionContext_rejectsMissingValues() {
        assertThrows(IllegalArgumentException.class, () -> params(null, "proj", "secret").toConnectionContext());
        assertThrows(IllegalArgumentException.class, () -> params("https://x/v1", null, "secret").toConnectionContext());
        assertThrows(IllegalArgumentException.class, () -> params("ftp://x/v1", "proj", "secret").toConnectionContext());
    }

    @Test
    void apiKeyTransformer_addsProjectAndKeyHeaders() {
        var transformer = new ApiKeyAuthTransformer("proj", "secret");

        StepVerifier.create(transformer.transform("GET", "databases/db1", Map.of("User-Agent", List.of("test")), Mono.empty()))
            .assertNext(request -> {
                assertThat(request.getHeaders().get(ApiKeyAuthTransformer.PROJECT_HEADER_NAME), equalTo(List.of("proj")));
                assertThat(request.getHeaders().get(ApiKeyAuthTransformer.API_KEY_HEADER_NAME), equalTo(List.of("secret")));
                assertThat(request.getHeaders().get("User-Agent"), equalTo(List.of("test")));
            })
            .verifyComplete();
    }
}
