package org.databaseclone.clone.common;

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.databaseclone.clone.common.http.HttpResponse;
import org.databaseclone.clone.models.AttributeMetadata;
import org.databaseclone.clone.models.AttributeType;
import org.databaseclone.clone.models.CollectionMetadata;
import org.databaseclone.clone.models.FieldValue;
import org.databaseclone.clone.models.IndexMetadata;
import org.databaseclone.clone.models.SchemaStatus;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static org.databaseclone.clone.TestDocuments.map;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RestDatabaseClientTest {
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    @Mock
    RestClient restClient;

    RestDatabaseClient databaseClient;

    @BeforeEach
    void setUp() {
        databaseClient = new RestDatabaseClient(restClient);
    }

    private static HttpResponse ok(String body) {
        return new HttpResponse(200, "OK", null, body);
    }

    private String capturedPost(String path) {
        var body = ArgumentCaptor.forClass(String.class);
        verify(restClient).postAsync(eq(path), body.capture());
        return body.getValue();
    }

    @Test
    void listCollections_sendsLimitAndCursorQueries() {
        var path = ArgumentCaptor.forClass(String.class);
        when(restClient.getAsync(path.capture())).thenReturn(Mono.just(ok(
            "{\"total\":1,\"collections\":[{\"$id\":\"books\",\"name\":\"Books\",\"permissions\":[\"read(\\\"any\\\")\"],"
                + "\"documentSecurity\":true,\"enabled\":true}]}")));

        var result = databaseClient.listCollections("db1", new PageRequest(25, "authors"));

        assertThat(result, contains(new CollectionMetadata("books", "Books", List.of("read(\"any\")"), true, true)));
        var decoded = URLDecoder.decode(path.getValue(), StandardCharsets.UTF_8);
        assertThat(decoded, equalTo("databases/db1/collections?queries[]={\"method\":\"limit\",\"values\":[25]}"
            + "&queries[]={\"method\":\"cursorAfter\",\"values\":[\"authors\"]}"));
    }

    @Test
    void listDocuments_firstPageHasNoCursor() {
        var path = ArgumentCaptor.forClass(String.class);
        when(restClient.getAsync(path.capture())).thenReturn(Mono.just(ok(
            "{\"total\":1,\"documents\":[{\"$id\":\"d1\",\"$collectionId\":\"books\",\"price\":9.50}]}")));

        var documents = databaseClient.listDocuments("db1", "books", PageRequest.first(100));

        assertThat(URLDecoder.decode(path.getValue(), StandardCharsets.UTF_8),
            equalTo("databases/db1/collections/books/documents?queries[]={\"method\":\"limit\",\"values\":[100]}"));
        assertThat(documents.get(0).getId(), equalTo("d1"));
        assertThat(documents.get(0).get("price"), equalTo(new FieldValue.NumberValue(new BigDecimal("9.50"))));
    }

    @Test
    void listAttributes_mapsStringFormats() {
        when(restClient.getAsync(anyString())).thenReturn(Mono.just(ok(
            "{\"attributes\":["
                + "{\"key\":\"contact\",\"type\":\"string\",\"format\":\"email\",\"status\":\"available\",\"required\":true,\"array\":false},"
                + "{\"key\":\"kind\",\"type\":\"string\",\"format\":\"enum\",\"elements\":[\"a\",\"b\"],\"status\":\"processing\"},"
                + "{\"key\":\"ratio\",\"type\":\"double\",\"min\":0,\"max\":1.5,\"status\":\"available\"}"
                + "]}")));

        var attributes = databaseClient.listAttributes("db1", "c1", PageRequest.first(100));

        assertThat(attributes.get(0).getType(), equalTo(AttributeType.EMAIL));
        assertThat(attributes.get(0).isRequired(), equalTo(true));
        assertThat(attributes.get(1).getType(), equalTo(AttributeType.ENUM));
        assertThat(attributes.get(1).getElements(), contains("a", "b"));
        assertThat(attributes.get(1).getStatus(), equalTo(SchemaStatus.PROCESSING));
        assertThat(attributes.get(2).getType(), equalTo(AttributeType.FLOAT));
        assertThat(attributes.get(2).getMax(), equalTo(new BigDecimal("1.5")));
    }

    @Test
    void createCollection_postsSettings() throws Exception {
        when(restClient.postAsync(anyString(), anyString())).thenReturn(Mono.just(new HttpResponse(201, "Created", null, "{}")));

        databaseClient.createCollection("db1", new CollectionMetadata("books", "Books", List.of("read(\"any\")"), false, true));

        var body = OBJECT_MAPPER.readTree(capturedPost("databases/db1/collections"));
        assertThat(body, equalTo(OBJECT_MAPPER.readTree(
            "{\"collectionId\":\"books\",\"name\":\"Books\",\"permissions\":[\"read(\\\"any\\\")\"],"
                + "\"documentSecurity\":false,\"enabled\":true}")));
    }

    @Test
    void createAttribute_usesTypeSpecificPathAndDefaults() throws Exception {
        when(restClient.postAsync(anyString(), anyString())).thenReturn(Mono.just(new HttpResponse(202, "Accepted", null, "{}")));

        databaseClient.createAttribute("db1", "books", AttributeMetadata.builder()
            .key("title").type(AttributeType.STRING).rawType("string").build());

        var body = OBJECT_MAPPER.readTree(capturedPost("databases/db1/collections/books/attributes/string"));
        assertThat(body, equalTo(OBJECT_MAPPER.readTree("{\"key\":\"title\",\"size\":255,\"required\":false,\"array\":false}")));
    }

    @Test
    void createAttribute_relationshipBody() throws Exception {
        when(restClient.postAsync(anyString(), anyString())).thenReturn(Mono.just(new HttpResponse(202, "Accepted", null, "{}")));

        databaseClient.createAttribute("db1", "books", AttributeMetadata.builder()
            .key("author").type(AttributeType.RELATIONSHIP).rawType("relationship")
            .relatedCollection("authors").relationType("manyToOne").twoWay(true).twoWayKey("books")
            .build());

        var body = OBJECT_MAPPER.readTree(capturedPost("databases/db1/collections/books/attributes/relationship"));
        assertThat(body, equalTo(OBJECT_MAPPER.readTree(
            "{\"relatedCollectionId\":\"authors\",\"type\":\"manyToOne\",\"twoWay\":true,\"key\":\"author\","
                + "\"twoWayKey\":\"books\",\"onDelete\":\"restrict\"}")));
    }

    @Test
    void createIndex_postsKeysAndOrders() throws Exception {
        when(restClient.postAsync(anyString(), anyString())).thenReturn(Mono.just(new HttpResponse(202, "Accepted", null, "{}")));

        databaseClient.createIndex("db1", "books",
            new IndexMetadata("by_title", "unique", List.of("title"), List.of("DESC"), SchemaStatus.AVAILABLE));

        var body = OBJECT_MAPPER.readTree(capturedPost("databases/db1/collections/books/indexes"));
        assertThat(body, equalTo(OBJECT_MAPPER.readTree(
            "{\"key\":\"by_title\",\"type\":\"unique\",\"attributes\":[\"title\"],\"orders\":[\"DESC\"]}")));
    }

    @Test
    void createDocument_wrapsDataWithId() throws Exception {
        when(restClient.postAsync(anyString(), anyString())).thenReturn(Mono.just(new HttpResponse(201, "Created", null, "{}")));

        databaseClient.createDocument("db1", "books", "new-1", map("title", "Dune", "author", "a1"));

        var body = OBJECT_MAPPER.readTree(capturedPost("databases/db1/collections/books/documents"));
        assertThat(body, equalTo(OBJECT_MAPPER.readTree(
            "{\"documentId\":\"new-1\",\"data\":{\"title\":\"Dune\",\"author\":\"a1\"}}")));
    }

    @Test
    void errorResponseBecomesDatabaseApiException() {
        when(restClient.postAsync(anyString(), anyString())).thenReturn(Mono.just(new HttpResponse(400, "Bad Request", null,
            "{\"message\":\"Invalid document structure: Missing required attribute \\\"title\\\"\",\"code\":400,"
                + "\"type\":\"document_invalid_structure\"}")));

        var thrown = assertThrows(DatabaseApiException.class,
            () -> databaseClient.createDocument("db1", "books", "new-1", FieldValue.MapValue.EMPTY));

        assertThat(thrown.getStatusCode(), equalTo(400));
        assertThat(thrown.getErrorType(), equalTo("document_invalid_structure"));
        assertThat(thrown.getMessage(), equalTo("Invalid document structure: Missing required attribute \"title\""));
    }

    @Test
    void getDatabase_notFoundIsEmpty() {
        when(restClient.getAsync("databases/missing")).thenReturn(Mono.just(new HttpResponse(404, "Not Found", null,
            "{\"message\":\"Database not found\",\"code\":404,\"type\":\"database_not_found\"}")));

        assertThat(databaseClient.getDatabase("missing").isPresent(), equalTo(false));
    }

    @Test
    void getDatabase_found() {
        when(restClient.getAsync("databases/db1")).thenReturn(Mono.just(ok("{\"$id\":\"db1\",\"name\":\"Main\"}")));

        var database = databaseClient.getDatabase("db1").orElseThrow();

        assertThat(database.name(), equalTo("Main"));
    }

    @Test
    void transportErrorBecomesCloneException() {
        when(restClient.deleteAsync(any())).thenReturn(Mono.error(new IllegalStateException("Connection refused")));

        var thrown = assertThrows(CloneException.class, () -> databaseClient.deleteCollection("db1", "books"));

        assertThat(thrown.getMessage(), equalTo("Delete collection books failed: Connection refused"));
        assertThat(thrown.getCause(), instanceOf(IllegalStateException.class));
    }
}
