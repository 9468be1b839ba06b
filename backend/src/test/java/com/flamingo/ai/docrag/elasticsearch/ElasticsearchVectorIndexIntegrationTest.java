package com.flamingo.ai.docrag.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.index.IndexMatch;
import com.flamingo.ai.docrag.index.StoredChunk;
import com.flamingo.ai.docrag.index.VectorRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the Elasticsearch index against a real cluster: mapping creation, filtered kNN search,
 * distance conversion and per-document deletes. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Elasticsearch vector index integration")
class ElasticsearchVectorIndexIntegrationTest {

  @Container
  private static final ElasticsearchContainer ELASTICSEARCH_CONTAINER =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.0.3")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("xpack.security.http.ssl.enabled", "false")
          .withStartupTimeout(Duration.ofMinutes(2));

  private Rest5Client restClient;
  private ElasticsearchVectorIndex index;

  @BeforeEach
  void setUp() {
    restClient =
        Rest5Client.builder(
                new HttpHost(
                    "http",
                    ELASTICSEARCH_CONTAINER.getHost(),
                    ELASTICSEARCH_CONTAINER.getMappedPort(9200)))
            .build();
    ElasticsearchClient client =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));

    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimensions(3);
    ragConfig.getIndex().setName("docrag-test-" + UUID.randomUUID());
    index = new ElasticsearchVectorIndex(client, ragConfig, new SimpleMeterRegistry());
    index.connect();
  }

  @AfterEach
  void tearDown() throws Exception {
    restClient.close();
  }

  @Test
  void shouldReturnOnlyChunksOfRequestedDocument_inDistanceOrder() {
    index.insert(
        List.of(
            record("doc_a", 0, "alpha near", 1f, 0f, 0f),
            record("doc_a", 1, "alpha far", 0f, 1f, 0f),
            record("doc_b", 0, "beta exact", 1f, 0f, 0f)));

    List<IndexMatch> matches = index.search(new float[] {1f, 0f, 0f}, 5, "doc_a", false);

    assertThat(matches).extracting(IndexMatch::documentId).containsOnly("doc_a");
    assertThat(matches).extracting(IndexMatch::text).containsExactly("alpha near", "alpha far");
    assertThat(matches.get(0).distance()).isCloseTo(0.0, within(1e-4));
    assertThat(matches.get(1).distance()).isCloseTo(2.0, within(1e-4));
    assertThat(matches.get(0).hasVector()).isFalse();
  }

  @Test
  void shouldReturnStoredVector_whenRequested() {
    index.insert(List.of(record("doc_a", 0, "alpha", 0.6f, 0.8f, 0f)));

    List<IndexMatch> matches = index.search(new float[] {0.6f, 0.8f, 0f}, 1, "doc_a", true);

    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).vector()).containsExactly(0.6f, 0.8f, 0f);
  }

  @Test
  void shouldDeleteOnlyTheGivenDocument() {
    index.insert(
        List.of(
            record("doc_a", 0, "alpha", 1f, 0f, 0f),
            record("doc_a", 1, "alpha two", 0f, 1f, 0f),
            record("doc_b", 0, "beta", 0f, 0f, 1f)));

    long deleted = index.deleteByDocument("doc_a");

    assertThat(deleted).isEqualTo(2);
    assertThat(index.countByDocument("doc_a")).isZero();
    assertThat(index.countByDocument("doc_b")).isEqualTo(1);
  }

  @Test
  void shouldInspectInSequenceOrder() {
    index.insert(
        List.of(
            record("doc_a", 1, "second", 0f, 1f, 0f), record("doc_a", 0, "first", 1f, 0f, 0f)));

    List<StoredChunk> chunks = index.inspect("doc_a", 10, false);

    assertThat(chunks).extracting(StoredChunk::text).containsExactly("first", "second");
    assertThat(chunks.get(0).vectorDimensions()).isEqualTo(3);
    assertThat(chunks.get(0).vector()).isNull();
  }

  private static VectorRecord record(
      String documentId, int sequence, String text, float x, float y, float z) {
    return new VectorRecord(
        documentId + "_" + sequence, documentId, sequence, text, new float[] {x, y, z});
  }
}
