package com.flamingo.ai.docrag.api.rest;

import com.flamingo.ai.docrag.domain.repository.DocumentRepository;
import com.flamingo.ai.docrag.index.VectorIndex;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final VectorIndex vectorIndex;
  private final DocumentRepository documentRepository;

  /** Reports UP when the vector index is connected, DEGRADED otherwise. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    boolean indexReady = vectorIndex.isReady();
    Map<String, Object> health = new HashMap<>();
    health.put("status", indexReady ? "UP" : "DEGRADED");
    health.put("index_ready", indexReady);
    health.put("index_dimensions", vectorIndex.getDimensions());
    health.put("total_documents", documentRepository.count());
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "docrag");
    return ResponseEntity.ok(health);
  }
}
