package org.databaseclone.clone.common;

import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.databaseclone.clone.common.http.HttpResponse;
import org.databaseclone.clone.models.AttributeMetadata;
import org.databaseclone.clone.models.AttributeType;
import org.databaseclone.clone.models.CollectionMetadata;
import org.databaseclone.clone.models.DatabaseInfo;
import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.FieldValue;
import org.databaseclone.clone.models.FieldValues;
import org.databaseclone.clone.models.IndexMetadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;
import reactor.core.publisher.Mono;

/**
 * {@link DatabaseClient} speaking the service's REST API through a {@link RestClient}.  Requests
 * are sent once; a failed request surfaces as a {@link DatabaseApiException}.
 */
@Slf4j
public class RestDatabaseClient implements DatabaseClient {
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private final RestClient client;

    public RestDatabaseClient(RestClient client) {
        this.client = client;
    }

    @Override
    public Optional<DatabaseInfo> getDatabase(String databaseId) {
        var path = databasePath(databaseId);
        log.info("Starting getDatabase for path={}", path);
        var response = execute("Get database " + databaseId, client.getAsync(path).flatMap(resp -> {
            if (resp.isSuccessful() || resp.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
                return Mono.just(resp);
            }
            return Mono.error(DatabaseApiException.fromResponse("Get database " + databaseId, resp));
        }));
        if (response.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
            log.info("Database {} was not found", databaseId);
            return Optional.empty();
        }
        return Optional.of(DatabaseInfo.fromJson(readBody(response)));
    }

    @Override
    public List<CollectionMetadata> listCollections(String databaseId, PageRequest page) {
        var path = databasePath(databaseId) + "/collections?" + Queries.toQueryString(page);
        return list("collections", path, CollectionMetadata::fromJson);
    }

    @Override
    public void createCollection(String databaseId, CollectionMetadata collection) {
        var body = OBJECT_MAPPER.createObjectNode();
        body.put("collectionId", collection.id());
        body.put("name", collection.name());
        var permissions = body.putArray("permissions");
        collection.permissions().forEach(permissions::add);
        body.put("documentSecurity", collection.documentSecurity());
        body.put("enabled", collection.enabled());
        create("collection " + collection.id(), databasePath(databaseId) + "/collections", body, true);
    }

    @Override
    public void deleteCollection(String databaseId, String collectionId) {
        var path = collectionPath(databaseId, collectionId);
        log.info("Starting deleteCollection for path={}", path);
        long startTime = System.currentTimeMillis();
        var operation = "Delete collection " + collectionId;
        var response = execute(operation, client.deleteAsync(path).flatMap(resp -> resp.isSuccessful()
            ? Mono.just(resp)
            : Mono.error(DatabaseApiException.fromResponse(operation, resp))));
        log.info("Completed deleteCollection for path={} in {} ms with statusCode={}",
            path, System.currentTimeMillis() - startTime, response.statusCode);
    }

    @Override
    public List<AttributeMetadata> listAttributes(String databaseId, String collectionId, PageRequest page) {
        var path = collectionPath(databaseId, collectionId) + "/attributes?" + Queries.toQueryString(page);
        return list("attributes", path, AttributeMetadata::fromJson);
    }

    @Override
    public void createAttribute(String databaseId, String collectionId, AttributeMetadata attribute) {
        if (attribute.getType() == AttributeType.UNKNOWN) {
            throw new CloneException("Unknown type: " + attribute.getRawType());
        }
        var path = collectionPath(databaseId, collectionId) + "/attributes/" + attribute.getType().getWireName();
        create("attribute " + attribute.getKey(), path, attributeBody(attribute), true);
    }

    /** Each attribute type has its own create call taking only the parameters relevant to it. */
    static ObjectNode attributeBody(AttributeMetadata attribute) {
        var body = OBJECT_MAPPER.createObjectNode();
        if (attribute.getType() == AttributeType.RELATIONSHIP) {
            body.put("relatedCollectionId", attribute.getRelatedCollection());
            body.put("type", attribute.getRelationType());
            body.put("twoWay", attribute.isTwoWay());
            body.put("key", attribute.getKey());
            if (attribute.getTwoWayKey() != null) {
                body.put("twoWayKey", attribute.getTwoWayKey());
            }
            body.put("onDelete", attribute.getOnDelete() != null ? attribute.getOnDelete() : "restrict");
            return body;
        }

        body.put("key", attribute.getKey());
        switch (attribute.getType()) {
            case STRING:
                body.put("size", attribute.getSize() != null ? attribute.getSize() : 255);
                break;
            case INTEGER:
            case FLOAT:
                if (attribute.getMin() != null) {
                    body.put("min", attribute.getMin());
                }
                if (attribute.getMax() != null) {
                    body.put("max", attribute.getMax());
                }
                break;
            case ENUM:
                var elements = body.putArray("elements");
                attribute.getElements().forEach(elements::add);
                break;
            default:
                break;
        }
        body.put("required", attribute.isRequired());
        if (!attribute.getDefaultValue().isNull()) {
            body.set("default", FieldValues.toJson(attribute.getDefaultValue()));
        }
        body.put("array", attribute.isArray());
        return body;
    }

    @Override
    public List<IndexMetadata> listIndexes(String databaseId, String collectionId, PageRequest page) {
        var path = collectionPath(databaseId, collectionId) + "/indexes?" + Queries.toQueryString(page);
        return list("indexes", path, IndexMetadata::fromJson);
    }

    @Override
    public void createIndex(String databaseId, String collectionId, IndexMetadata index) {
        var body = OBJECT_MAPPER.createObjectNode();
        body.put("key", index.key());
        body.put("type", index.type());
        var attributes = body.putArray("attributes");
        index.attributes().forEach(attributes::add);
        var orders = body.putArray("orders");
        index.orders().forEach(orders::add);
        create("index " + index.key(), collectionPath(databaseId, collectionId) + "/indexes", body, true);
    }

    @Override
    public List<Document> listDocuments(String databaseId, String collectionId, PageRequest page) {
        var path = collectionPath(databaseId, collectionId) + "/documents?" + Queries.toQueryString(page);
        return list("documents", path, Document::fromJson);
    }

    @Override
    public void createDocument(String databaseId, String collectionId, String documentId, FieldValue.MapValue data) {
        var body = OBJECT_MAPPER.createObjectNode();
        body.put("documentId", documentId);
        body.set("data", FieldValues.toJson(data));
        create("document " + documentId, collectionPath(databaseId, collectionId) + "/documents", body, false);
    }

    private void create(String description, String path, ObjectNode body, boolean verbose) {
        if (verbose) {
            log.info("Starting create {} for path={}", description, path);
        } else {
            log.atDebug().setMessage("Starting create {} for path={}").addArgument(description).addArgument(path).log();
        }
        long startTime = System.currentTimeMillis();
        var operation = "Create " + description;
        var response = execute(operation, client.postAsync(path, body.toString()).flatMap(resp -> resp.isSuccessful()
            ? Mono.just(resp)
            : Mono.error(DatabaseApiException.fromResponse(operation, resp))));
        log.atLevel(verbose ? Level.INFO : Level.DEBUG)
            .setMessage("Completed create {} in {} ms with statusCode={}")
            .addArgument(description)
            .addArgument(System.currentTimeMillis() - startTime)
            .addArgument(response.statusCode)
            .log();
    }

    private <T> List<T> list(String field, String path, Function<JsonNode, T> parser) {
        log.atDebug().setMessage("Listing {} from path={}").addArgument(field).addArgument(path).log();
        var operation = "List " + field;
        var response = execute(operation, client.getAsync(path).flatMap(resp -> resp.isSuccessful()
            ? Mono.just(resp)
            : Mono.error(DatabaseApiException.fromResponse(operation, resp))));
        var items = new ArrayList<T>();
        readBody(response).path(field).forEach(node -> items.add(parser.apply(node)));
        return items;
    }

    private HttpResponse execute(String operation, Mono<HttpResponse> request) {
        try {
            return request
                .doOnError(e -> log.error(e.getMessage()))
                .block();
        } catch (CloneException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CloneException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private static JsonNode readBody(HttpResponse response) {
        try {
            return OBJECT_MAPPER.readTree(response.body == null ? "{}" : response.body);
        } catch (JsonProcessingException e) {
            throw new CloneException("Unable to parse response body: " + getString(response), e);
        }
    }

    private static String getString(HttpResponse resp) {
        return "Response Code: "
            + resp.statusCode
            + ", Response Message: "
            + resp.statusText
            + ", Response Body: "
            + resp.body;
    }

    private static String databasePath(String databaseId) {
        return "databases/" + databaseId;
    }

    private static String collectionPath(String databaseId, String collectionId) {
        return databasePath(databaseId) + "/collections/" + collectionId;
    }
}
