package com.flamingo.ai.docrag.service.document;

/** Totals across all registered documents. */
public record DocumentStatistics(
    long totalFiles,
    long totalChunks,
    long totalVectors,
    long totalSizeBytes,
    double totalSizeMb) {

  static DocumentStatistics of(long files, long chunks, long vectors, long sizeBytes) {
    double megabytes = Math.round(sizeBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    return new DocumentStatistics(files, chunks, vectors, sizeBytes, megabytes);
  }
}
