package org.databaseclone.clone.common.http;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import reactor.core.publisher.Mono;

/** Adds the project and server API key headers the database service authenticates with */
@AllArgsConstructor
public class ApiKeyAuthTransformer implements RequestTransformer {
    public static final String PROJECT_HEADER_NAME = "X-Appwrite-Project";
    public static final String API_KEY_HEADER_NAME = "X-Appwrite-Key";

    @NonNull
    private final String projectId;
    @NonNull
    private final String apiKey;

    @Override
    public Mono<TransformedRequest> transform(String method, String path, Map<String, List<String>> headers, Mono<ByteBuffer> body) {
        var newHeaders = new HashMap<>(headers);
        newHeaders.put(PROJECT_HEADER_NAME, List.of(projectId));
        newHeaders.put(API_KEY_HEADER_NAME, List.of(apiKey));
        return Mono.just(new TransformedRequest(newHeaders, body));
    }
}
