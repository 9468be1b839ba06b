package com.flamingo.ai.docrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorIndexOptionsType;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.VectorIndexException;
import com.flamingo.ai.docrag.index.AbstractVectorIndex;
import com.flamingo.ai.docrag.index.IndexMatch;
import com.flamingo.ai.docrag.index.StoredChunk;
import com.flamingo.ai.docrag.index.VectorRecord;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * {@link com.flamingo.ai.docrag.index.VectorIndex} backed by an Elasticsearch {@code dense_vector}
 * field with an HNSW graph and {@code l2_norm} similarity.
 *
 * <p>Elasticsearch scores {@code l2_norm} kNN hits as {@code 1 / (1 + d)} where {@code d} is the
 * squared Euclidean distance, so distances are recovered as {@code 1 / score - 1}.
 */
@Component
@ConditionalOnProperty(
    prefix = "rag.index",
    name = "type",
    havingValue = "elasticsearch",
    matchIfMissing = true)
@Slf4j
public class ElasticsearchVectorIndex extends AbstractVectorIndex {

  static final String FIELD_FILE_ID = "fileId";
  static final String FIELD_CHUNK_ID = "chunkId";
  static final String FIELD_SEQUENCE_INDEX = "sequenceIndex";
  static final String FIELD_CHUNK_TEXT = "chunkText";
  static final String FIELD_EMBEDDING = "embedding";

  private final ElasticsearchClient elasticsearchClient;

  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient, RagConfig ragConfig, MeterRegistry meterRegistry) {
    super(ragConfig, meterRegistry);
    this.elasticsearchClient = elasticsearchClient;
  }

  public String getIndexName() {
    return ragConfig.getIndex().getName();
  }

  @Override
  protected String getMetricPrefix() {
    return "vector_index.elasticsearch";
  }

  @Override
  protected void doConnect() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        validateMappings();
      }
    } catch (IOException | RuntimeException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage());
      throw new VectorIndexException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  @VisibleForTesting
  Map<String, Property> defineIndexProperties() {
    RagConfig.Index index = ragConfig.getIndex();
    Map<String, Property> properties = new HashMap<>();
    properties.put(FIELD_FILE_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_CHUNK_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_SEQUENCE_INDEX, Property.of(p -> p.integer(i -> i)));
    properties.put(FIELD_CHUNK_TEXT, Property.of(p -> p.text(t -> t)));
    properties.put(
        FIELD_EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    d ->
                        d.dims(getDimensions())
                            .index(true)
                            .similarity(DenseVectorSimilarity.L2Norm)
                            .indexOptions(
                                o ->
                                    o.type(DenseVectorIndexOptionsType.Hnsw)
                                        .m(index.getHnswM())
                                        .efConstruction(index.getHnswEfConstruction())))));
    return properties;
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /** Fails fast when an existing index has a different field type or vector dimensionality. */
  private void validateMappings() throws IOException {
    Map<String, Property> expected = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actual = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expected.entrySet()) {
      Property found = actual.get(entry.getKey());
      if (found == null) {
        mismatches.add("missing field '" + entry.getKey() + "'");
      } else if (found._kind() != entry.getValue()._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), found._kind()));
      }
    }
    Property embedding = actual.get(FIELD_EMBEDDING);
    if (embedding != null
        && embedding.isDenseVector()
        && embedding.denseVector().dims() != null
        && embedding.denseVector().dims() != getDimensions()) {
      mismatches.add(
          String.format(
              "field '%s' has %d dimensions, expected %d",
              FIELD_EMBEDDING, embedding.denseVector().dims(), getDimensions()));
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has an incompatible mapping: "
              + String.join("; ", mismatches)
              + ". Delete the index and restart the application.");
    }
    log.debug("Index '{}' mapping verified.", getIndexName());
  }

  @Override
  @Timed(value = "vector_index.insert", description = "Time to index chunk vectors")
  @CircuitBreaker(name = "elasticsearch")
  public void insert(List<VectorRecord> records) {
    ensureReady();
    if (records.isEmpty()) {
      return;
    }
    validateRecords(records);

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (VectorRecord record : records) {
      Map<String, Object> document = toDocument(record);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(record.chunkId()).document(document)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (IOException | RuntimeException e) {
      log.error("Bulk indexing to {} failed: {}", getIndexName(), e.getMessage());
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      rollback(records);
      throw new VectorIndexException("Failed to index " + records.size() + " vectors", e);
    }

    if (response.errors()) {
      String firstError =
          response.items().stream()
              .filter(item -> item.error() != null)
              .findFirst()
              .map(BulkResponseItem::error)
              .map(error -> error.type() + ": " + error.reason())
              .orElse("unknown");
      log.error("Some vectors failed to index in {}: {}", getIndexName(), firstError);
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      rollback(records);
      throw new VectorIndexException("Bulk indexing rejected: " + firstError);
    }

    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(records.size());
    log.debug("Indexed {} vectors to {}", records.size(), getIndexName());
  }

  /** Removes every document touched by a failed batch so no partial state stays visible. */
  private void rollback(List<VectorRecord> records) {
    Set<String> documentIds = new LinkedHashSet<>();
    records.forEach(r -> documentIds.add(r.documentId()));
    for (String documentId : documentIds) {
      try {
        deleteByDocument(documentId);
      } catch (VectorIndexException e) {
        log.warn("Rollback of document {} failed: {}", documentId, e.getMessage());
      }
    }
  }

  @Override
  @Timed(value = "vector_index.search", description = "Time for filtered vector search")
  @CircuitBreaker(name = "elasticsearch")
  public List<IndexMatch> search(
      float[] queryVector, int topK, String documentId, boolean includeVectors) {
    ensureReady();
    validateQuery(queryVector, topK, documentId);

    SearchRequest request = buildVectorSearchRequest(queryVector, topK, documentId, includeVectors);
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<IndexMatch> matches = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        IndexMatch match = toMatch(hit, includeVectors);
        if (match != null) {
          matches.add(match);
        }
      }
      log.debug(
          "Vector search on {} for document {} returned {} of topK={}",
          getIndexName(),
          documentId,
          matches.size(),
          topK);
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return matches;
    } catch (IOException | RuntimeException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage());
      throw new VectorIndexException("Vector search failed", e);
    }
  }

  @VisibleForTesting
  SearchRequest buildVectorSearchRequest(
      float[] queryVector, int topK, String documentId, boolean includeVectors) {
    List<Float> vector = toFloatList(queryVector);
    int numCandidates = Math.max(topK, ragConfig.getIndex().getNumCandidates());
    return SearchRequest.of(
        s ->
            s.index(getIndexName())
                .knn(
                    k ->
                        k.field(FIELD_EMBEDDING)
                            .queryVector(vector)
                            .k(topK)
                            .numCandidates(numCandidates)
                            .filter(f -> f.term(t -> t.field(FIELD_FILE_ID).value(documentId))))
                .size(topK)
                .source(
                    src ->
                        includeVectors
                            ? src.fetch(true)
                            : src.filter(f -> f.excludes(FIELD_EMBEDDING))));
  }

  @Override
  @Timed(value = "vector_index.delete", description = "Time to delete a document's vectors")
  public long deleteByDocument(String documentId) {
    requireDocumentId(documentId);
    try {
      DeleteByQueryResponse response =
          elasticsearchClient.deleteByQuery(
              d -> d.index(getIndexName()).query(byDocument(documentId)).refresh(true));
      long deleted = response.deleted() != null ? response.deleted() : 0L;
      log.info("Deleted {} vectors of document {} from {}", deleted, documentId, getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
      return deleted;
    } catch (IOException | RuntimeException e) {
      log.error(
          "Failed to delete vectors of document {} from {}: {}",
          documentId,
          getIndexName(),
          e.getMessage());
      throw new VectorIndexException("Failed to delete vectors of document " + documentId, e);
    }
  }

  @Override
  public long countByDocument(String documentId) {
    requireDocumentId(documentId);
    ensureReady();
    try {
      return elasticsearchClient
          .count(c -> c.index(getIndexName()).query(byDocument(documentId)))
          .count();
    } catch (IOException | RuntimeException e) {
      throw new VectorIndexException("Failed to count vectors of document " + documentId, e);
    }
  }

  @Override
  public List<StoredChunk> inspect(String documentId, int limit, boolean includeVectors) {
    ensureReady();
    Query query =
        documentId != null ? byDocument(documentId) : Query.of(q -> q.matchAll(m -> m));
    try {
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s ->
                  s.index(getIndexName())
                      .query(query)
                      .size(Math.max(0, limit))
                      .sort(so -> so.field(f -> f.field(FIELD_FILE_ID).order(SortOrder.Asc)))
                      .sort(
                          so ->
                              so.field(
                                  f -> f.field(FIELD_SEQUENCE_INDEX).order(SortOrder.Asc))),
              Map.class);
      List<StoredChunk> chunks = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        IndexMatch match = toMatch(hit, true);
        if (match == null) {
          continue;
        }
        chunks.add(
            new StoredChunk(
                match.chunkId(),
                match.documentId(),
                match.sequenceIndex(),
                match.text(),
                match.hasVector() ? match.vector().length : 0,
                includeVectors ? match.vector() : null));
      }
      return chunks;
    } catch (IOException | RuntimeException e) {
      throw new VectorIndexException("Failed to inspect vectors", e);
    }
  }

  private static Query byDocument(String documentId) {
    return Query.of(q -> q.term(t -> t.field(FIELD_FILE_ID).value(documentId)));
  }

  private static Map<String, Object> toDocument(VectorRecord record) {
    Map<String, Object> document = new HashMap<>();
    document.put(FIELD_FILE_ID, record.documentId());
    document.put(FIELD_CHUNK_ID, record.chunkId());
    document.put(FIELD_SEQUENCE_INDEX, record.sequenceIndex());
    document.put(FIELD_CHUNK_TEXT, record.text());
    document.put(FIELD_EMBEDDING, toFloatList(record.vector()));
    return document;
  }

  @SuppressWarnings("unchecked")
  private static IndexMatch toMatch(Hit<Map> hit, boolean includeVectors) {
    Map<String, Object> source = hit.source();
    if (source == null) {
      return null;
    }
    Object sequence = source.get(FIELD_SEQUENCE_INDEX);
    float[] vector = null;
    if (includeVectors && source.get(FIELD_EMBEDDING) instanceof List<?> values) {
      vector = new float[values.size()];
      for (int i = 0; i < values.size(); i++) {
        vector[i] = ((Number) values.get(i)).floatValue();
      }
    }
    return new IndexMatch(
        hit.id(),
        (String) source.get(FIELD_FILE_ID),
        sequence instanceof Number n ? n.intValue() : 0,
        (String) source.get(FIELD_CHUNK_TEXT),
        hit.score() != null ? distanceFromScore(hit.score()) : Double.NaN,
        vector);
  }

  /** Inverts Elasticsearch's {@code l2_norm} score {@code 1 / (1 + d)}. */
  @VisibleForTesting
  static double distanceFromScore(double score) {
    if (score <= 0) {
      return Double.POSITIVE_INFINITY;
    }
    return Math.max(0.0, 1.0 / score - 1.0);
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
