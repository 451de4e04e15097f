package com.homepurse.analysis.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.homepurse.analysis.ai.LanguageModelException;
import com.homepurse.analysis.ai.OpenAiResponsesClient;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SqlGeneratorTest {

    @Mock
    OpenAiResponsesClient client;

    ExecutorService executor;
    SqlGenerator generator;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        generator = new SqlGenerator(client, new ObjectMapper(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void parsesJsonReplyWithReason() {
        GeneratedSql sql = generator.parseReply(
                "{\"sql\": \"SELECT SUM(amount) FROM household_expenses\", \"reason\": \"sum of all expenses\"}");

        assertThat(sql.sql()).isEqualTo("SELECT SUM(amount) FROM household_expenses");
        assertThat(sql.reason()).isEqualTo("sum of all expenses");
    }

    @Test
    void parsesFencedAndWrappedJson() {
        GeneratedSql fenced = generator.parseReply("```json\n{\"sql\": \"SELECT 1\"}\n```");
        GeneratedSql wrapped = generator.parseReply("Here you go: {\"sql\": \"SELECT 2\", \"reason\": \"\"} done");

        assertThat(fenced.sql()).isEqualTo("SELECT 1");
        assertThat(fenced.reason()).isNull();
        assertThat(wrapped.sql()).isEqualTo("SELECT 2");
        assertThat(wrapped.reason()).isNull();
    }

    @Test
    void acceptsBareSqlReply() {
        GeneratedSql sql = generator.parseReply("WITH t AS (SELECT 1 AS x) SELECT x FROM t");

        assertThat(sql.sql()).startsWith("WITH t AS");
        assertThat(sql.reason()).isNull();
    }

    @Test
    void rejectsRepliesWithoutSql() {
        assertThatThrownBy(() -> generator.parseReply("{\"reason\": \"I cannot help\"}"))
                .isInstanceOf(SqlGenerationException.class)
                .hasMessageContaining("\"sql\"");
        assertThatThrownBy(() -> generator.parseReply("Sorry, I do not know."))
                .isInstanceOf(SqlGenerationException.class);
        assertThatThrownBy(() -> generator.parseReply("  "))
                .isInstanceOf(SqlGenerationException.class);
    }

    @Test
    void generateRunsOnExecutorAndParses() throws Exception {
        when(client.generateText(anyList(), anyInt())).thenReturn("{\"sql\": \"SELECT 1\", \"reason\": \"r\"}");

        GeneratedSql sql = generator.generate(new PromptComposer().generation("q", AgentFixtures.schemaContext()))
                .get(5, TimeUnit.SECONDS);

        assertThat(sql).isEqualTo(new GeneratedSql("SELECT 1", "r"));
    }

    @Test
    void generateSurfacesClientFailure() {
        when(client.generateText(anyList(), anyInt())).thenThrow(new LanguageModelException("Model provider returned HTTP 500"));

        assertThatThrownBy(() -> generator.generate(new PromptComposer().generation("q", AgentFixtures.schemaContext()))
                .get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(LanguageModelException.class);
    }
}
