package org.databaseclone.commands;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.databaseclone.cli.ConfirmationPrompt;
import org.databaseclone.clone.common.DatabaseClient;
import org.databaseclone.clone.memory.InMemoryDatabaseClient;
import org.databaseclone.clone.models.CollectionMetadata;
import org.databaseclone.clone.models.FieldValue;
import org.databaseclone.clone.schema.PollPolicy;
import org.databaseclone.clone.schema.ReadinessTimeoutPolicy;
import org.databaseclone.clone.worker.CloneMode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class CloneTest {

    @TempDir
    Path tempDir;

    private InMemoryDatabaseClient client;
    private CloneArgs args;

    @BeforeEach
    void setUp() {
        client = new InMemoryDatabaseClient()
            .addDatabase("src", "Source")
            .addDatabase("dst", "Destination");
        client.addCollection("src", new CollectionMetadata("books", "Books", List.of(), false, true));
        client.addDocument("src", "books", "b1", new FieldValue.MapValue(Map.of("title", FieldValue.of("Dune"))));
        client.addDocument("src", "books", "b2", new FieldValue.MapValue(Map.of("title", FieldValue.of("Emma"))));
        client.addCollection("dst", new CollectionMetadata("stale", "Stale", List.of(), false, true));

        args = new CloneArgs();
        args.connectionArgs.endpoint = "http://localhost/v1";
        args.connectionArgs.projectId = "project";
        args.connectionArgs.apiKey = "key";
        args.sourceDatabaseId = "src";
        args.destDatabaseId = "dst";
        args.snapshotPath = tempDir.resolve("cache.json").toString();
    }

    private Clone inMemoryClone(ConfirmationPrompt prompt) {
        return new Clone(args, prompt) {
            @Override
            protected DatabaseClient createClient() {
                return client;
            }
        };
    }

    /** Answers the questions in order and records what was asked. */
    static class ScriptedPrompt implements ConfirmationPrompt {
        final List<String> questions = new ArrayList<>();
        final List<String> messages = new ArrayList<>();
        private final List<Boolean> answers;

        ScriptedPrompt(Boolean... answers) {
            this.answers = List.of(answers);
        }

        @Override
        public boolean confirm(String question) {
            questions.add(question);
            return questions.size() <= answers.size() && answers.get(questions.size() - 1);
        }

        @Override
        public void inform(String message) {
            messages.add(message);
        }
    }

    @Test
    void clone_failsInvalidParameters() {
        var meta = new Clone(new CloneArgs(), new ScriptedPrompt());

        var result = meta.execute();

        assertThat(result.getExitCode(), equalTo(Clone.INVALID_PARAMETER_CODE));
        assertThat(result.getErrorMessage(), equalTo("Invalid parameter: Missing required parameter(s): "
            + "--endpoint (APPWRITE_ENDPOINT), --project-id (APPWRITE_PROJECT_ID), --api-key (APPWRITE_API_KEY), "
            + "--source-database-id (SOURCE_DATABASE_ID), --dest-database-id (DEST_DATABASE_ID)"));
    }

    @Test
    void clone_failsUnexpectedExceptionInnerMessage() {
        var clone = spy(new Clone(args, new ScriptedPrompt()));
        doThrow(new RuntimeException("Outer", new RuntimeException("Inner"))).when(clone).createClient();

        var result = clone.execute();

        assertThat(result.getExitCode(), equalTo(Clone.UNEXPECTED_FAILURE_CODE));
        assertThat(result.getErrorMessage(), equalTo("Unexpected failure: Outer, inner cause: Inner"));
    }

    @Test
    void clone_failsWhenSourceDatabaseIsMissing() {
        args.sourceDatabaseId = "nope";

        var result = inMemoryClone(new ScriptedPrompt(true, true, true)).execute();

        assertThat(result.getExitCode(), equalTo(Clone.DATABASE_NOT_FOUND_CODE));
        assertThat(result.getErrorMessage(), equalTo("Source database \"nope\" not found"));
        assertThat(client.getMutations(), empty());
    }

    @Test
    void clone_failsWhenDestinationDatabaseIsMissing() {
        args.destDatabaseId = "nope";

        var result = inMemoryClone(new ScriptedPrompt(true, true, true)).execute();

        assertThat(result.getExitCode(), equalTo(Clone.DATABASE_NOT_FOUND_CODE));
        assertThat(result.getErrorMessage(), equalTo("Destination database \"nope\" not found"));
    }

    @Test
    void clone_declinedConfirmationChangesNothing() {
        var prompt = new ScriptedPrompt(true, false);

        var result = inMemoryClone(prompt).execute();

        assertThat(result.isCancelled(), equalTo(true));
        assertThat(result.getExitCode(), equalTo(0));
        assertThat(result.asCliOutput(), containsString("Clone cancelled by user."));
        assertThat(prompt.questions, hasSize(2));
        assertThat(prompt.questions.get(1), containsString("\"dst\" the correct DESTINATION"));
        assertThat(client.getMutations(), empty());
    }

    @Test
    void clone_runsAfterThreeConfirmations() {
        var prompt = new ScriptedPrompt(true, true, true);

        var result = inMemoryClone(prompt).execute();

        assertThat(prompt.questions, hasSize(3));
        assertThat(prompt.messages.get(0), containsString("ALL existing collections in the destination will be DELETED"));
        assertThat(result.getExitCode(), equalTo(0));
        assertThat(result.getErrorMessage(), equalTo(null));
        assertThat(result.getSummary().getResult().getDroppedCount(), equalTo(1L));
        assertThat(client.getDocuments("dst", "books"), hasSize(2));
        assertThat(Files.exists(tempDir.resolve("cache.json")), equalTo(false));
    }

    @Test
    void clone_yesSkipsConfirmations() {
        args.yes = true;
        var prompt = new ScriptedPrompt();

        var result = inMemoryClone(prompt).execute();

        assertThat(prompt.questions, empty());
        assertThat(result.getExitCode(), equalTo(0));
    }

    @Test
    void clone_missingOnlyDoesNotWarnAboutDeletion() {
        args.cloneMode = CloneMode.MISSING_ONLY;
        var prompt = new ScriptedPrompt(true, true, true);
        client.addCollection("dst", new CollectionMetadata("books", "Books", List.of(), false, true));

        var result = inMemoryClone(prompt).execute();

        assertThat(prompt.messages.get(0).contains("DELETED"), equalTo(false));
        assertThat(result.getExitCode(), equalTo(0));
        assertThat(client.getCollections("dst"), hasSize(2));
        assertThat(client.getDocuments("dst", "books"), hasSize(2));
    }

    @Test
    void clone_documentFailuresBecomeTheExitCode() {
        args.yes = true;
        client.rejectDocumentsWhere(data -> "Emma".equals(data.getString("title").orElse(null)));

        var result = inMemoryClone(new ScriptedPrompt()).execute();

        assertThat(result.getExitCode(), equalTo(1));
        assertThat(result.asCliOutput(), containsString("Documents failed: 1"));
        assertThat(result.asJsonOutput().get("errors").size(), equalTo(1));
        assertThat(result.asJsonOutput().get("summary").get("documents").get("success").asInt(), equalTo(1));
    }

    @Test
    void clone_errorCountAboveProcessStatusRangeIsClamped() {
        args.yes = true;
        args.cloneMode = CloneMode.DATA_ONLY;
        for (int i = 0; i < 254; i++) {
            client.addDocument("src", "books", "extra" + i, new FieldValue.MapValue(Map.of("title", FieldValue.of("Book " + i))));
        }
        client.addCollection("dst", new CollectionMetadata("books", "Books", List.of(), false, true));
        client.rejectDocumentsWhere(data -> true);

        var result = inMemoryClone(new ScriptedPrompt()).execute();

        assertThat(result.getSummary().getErrorCount(), equalTo(256));
        assertThat(result.getExitCode(), equalTo(Clone.MAX_ERROR_COUNT_CODE));
        assertThat(result.asCliOutput(), containsString("256 issue(s) detected"));
        assertThat(result.asJsonOutput().get("errors").size(), equalTo(256));
    }

    @Nested
    class BuildingOptions {
        @Test
        void configFileFillsWhatTheCommandLineLeavesOut() throws Exception {
            var configFile = tempDir.resolve("clone.yml");
            Files.writeString(configFile, String.join("\n",
                "unique_identifier_fields:",
                "  books: isbn",
                "  orders: order_number",
                "batch_size: 7",
                "readiness_timeout_policy: continue",
                "attribute_poll:",
                "  max_attempts: 2",
                "  interval_millis: 10",
                ""));
            args.configFile = configFile.toString();
            args.identifierFields = List.of("books=sku");
            var clone = inMemoryClone(new ScriptedPrompt());

            var options = clone.buildOptions(clone.loadConfig());

            assertThat(options.getBatchSize(), equalTo(7));
            assertThat(options.getIdentifierFields().asMap(), equalTo(Map.of("books", "sku", "orders", "order_number")));
            assertThat(options.getReadinessTimeoutPolicy(), equalTo(ReadinessTimeoutPolicy.CONTINUE));
            assertThat(options.getAttributePollPolicy(), equalTo(new PollPolicy(2, Duration.ofMillis(10))));
            assertThat(options.getIndexPollPolicy(), equalTo(PollPolicy.INDEX_DEFAULT));
            assertThat(options.getSnapshotPath(), equalTo(tempDir.resolve("cache.json")));
        }

        @Test
        void commandLineBatchSizeWins() throws Exception {
            var configFile = tempDir.resolve("clone.yml");
            Files.writeString(configFile, "batch_size: 7\n");
            args.configFile = configFile.toString();
            args.batchSize = 50;
            var clone = inMemoryClone(new ScriptedPrompt());

            assertThat(clone.buildOptions(clone.loadConfig()).getBatchSize(), equalTo(50));
        }

        @Test
        void malformedIdentifierFieldIsAnInvalidParameter() {
            args.identifierFields = List.of("books");

            var result = inMemoryClone(new ScriptedPrompt()).execute();

            assertThat(result.getExitCode(), equalTo(Clone.INVALID_PARAMETER_CODE));
            assertThat(result.getErrorMessage(), containsString("--identifier-field expects collectionId=field, was books"));
        }

        @Test
        void unknownTimeoutPolicyIsAnInvalidParameter() {
            args.readinessTimeoutPolicy = "sometimes";

            var result = inMemoryClone(new ScriptedPrompt()).execute();

            assertThat(result.getExitCode(), equalTo(Clone.INVALID_PARAMETER_CODE));
        }

        @Test
        void missingConfigFileIsAnInvalidParameter() {
            args.configFile = tempDir.resolve("absent.yml").toString();

            var result = inMemoryClone(new ScriptedPrompt()).execute();

            assertThat(result.getExitCode(), equalTo(Clone.INVALID_PARAMETER_CODE));
            assertThat(result.getErrorMessage(), containsString("Unable to read config file"));
        }

        @Test
        void zeroBatchSizeIsAnInvalidParameter() {
            args.batchSize = 0;

            var result = inMemoryClone(new ScriptedPrompt()).execute();

            assertThat(result.getExitCode(), equalTo(Clone.INVALID_PARAMETER_CODE));
        }
    }
}
