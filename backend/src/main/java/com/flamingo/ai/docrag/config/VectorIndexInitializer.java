package com.flamingo.ai.docrag.config;

import com.flamingo.ai.docrag.exception.VectorIndexException;
import com.flamingo.ai.docrag.index.VectorIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Connects the vector index on startup, creating or validating its storage.
 *
 * <p>An unreachable index does not fail startup: the index reconnects on first use and requests
 * report an index error until it does.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class VectorIndexInitializer implements CommandLineRunner {

  private final VectorIndex vectorIndex;

  @Override
  public void run(String... args) {
    try {
      vectorIndex.connect();
      log.info(
          "Vector index ready ({}, {} dimensions)",
          vectorIndex.getClass().getSimpleName(),
          vectorIndex.getDimensions());
    } catch (VectorIndexException e) {
      log.error("Vector index not available at startup: {}", e.getMessage());
    }
  }
}
