package com.flamingo.ai.docrag.index;

import com.flamingo.ai.docrag.config.RagConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Exact-search {@link VectorIndex} held in process memory.
 *
 * <p>Vectors are partitioned by document id. Each partition is an immutable list replaced
 * atomically, so concurrent ingestions of different documents never contend and a search sees
 * either none or all of a document's vectors.
 */
@Component
@ConditionalOnProperty(prefix = "rag.index", name = "type", havingValue = "in-memory")
@Slf4j
public class InMemoryVectorIndex extends AbstractVectorIndex {

  private final Map<String, List<VectorRecord>> partitions = new ConcurrentHashMap<>();

  public InMemoryVectorIndex(RagConfig ragConfig, MeterRegistry meterRegistry) {
    super(ragConfig, meterRegistry);
  }

  @Override
  protected String getMetricPrefix() {
    return "vector_index.in_memory";
  }

  @Override
  protected void doConnect() {
    log.info("Using in-memory vector index with {} dimensions", getDimensions());
  }

  @Override
  public void insert(List<VectorRecord> records) {
    ensureReady();
    if (records.isEmpty()) {
      return;
    }
    validateRecords(records);

    Map<String, List<VectorRecord>> byDocument = new LinkedHashMap<>();
    for (VectorRecord record : records) {
      byDocument.computeIfAbsent(record.documentId(), id -> new ArrayList<>()).add(record);
    }
    byDocument.forEach(
        (documentId, added) ->
            partitions.merge(
                documentId,
                List.copyOf(added),
                (existing, incoming) -> {
                  Map<String, VectorRecord> merged = new LinkedHashMap<>();
                  existing.forEach(r -> merged.put(r.chunkId(), r));
                  incoming.forEach(r -> merged.put(r.chunkId(), r));
                  return List.copyOf(merged.values());
                }));

    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(records.size());
    log.debug("Indexed {} vectors in memory", records.size());
  }

  @Override
  public List<IndexMatch> search(
      float[] queryVector, int topK, String documentId, boolean includeVectors) {
    ensureReady();
    validateQuery(queryVector, topK, documentId);

    List<VectorRecord> partition = partitions.getOrDefault(documentId, List.of());
    List<IndexMatch> matches = new ArrayList<>(partition.size());
    for (VectorRecord record : partition) {
      matches.add(
          new IndexMatch(
              record.chunkId(),
              record.documentId(),
              record.sequenceIndex(),
              record.text(),
              VectorMath.squaredEuclidean(queryVector, record.vector()),
              includeVectors ? record.vector().clone() : null));
    }
    matches.sort(
        Comparator.comparingDouble(IndexMatch::distance)
            .thenComparingInt(IndexMatch::sequenceIndex));

    meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
    return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : matches;
  }

  @Override
  public long deleteByDocument(String documentId) {
    requireDocumentId(documentId);
    List<VectorRecord> removed = partitions.remove(documentId);
    long count = removed == null ? 0 : removed.size();
    if (count > 0) {
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(count);
      log.info("Deleted {} in-memory vectors for document {}", count, documentId);
    }
    return count;
  }

  @Override
  public long countByDocument(String documentId) {
    requireDocumentId(documentId);
    return partitions.getOrDefault(documentId, List.of()).size();
  }

  @Override
  public List<StoredChunk> inspect(String documentId, int limit, boolean includeVectors) {
    List<VectorRecord> all = new ArrayList<>();
    if (documentId != null) {
      all.addAll(partitions.getOrDefault(documentId, List.of()));
    } else {
      partitions.values().forEach(all::addAll);
    }
    all.sort(
        Comparator.comparing(VectorRecord::documentId)
            .thenComparingInt(VectorRecord::sequenceIndex));

    List<StoredChunk> result = new ArrayList<>();
    for (VectorRecord record : all.subList(0, Math.max(0, Math.min(limit, all.size())))) {
      result.add(
          new StoredChunk(
              record.chunkId(),
              record.documentId(),
              record.sequenceIndex(),
              record.text(),
              record.vector().length,
              includeVectors ? record.vector().clone() : null));
    }
    return Collections.unmodifiableList(result);
  }
}
