package com.flamingo.ai.docrag.api.rest;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.docrag.config.RagConfig;
import com.flamingo.ai.docrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.docrag.index.InMemoryVectorIndex;
import com.flamingo.ai.docrag.index.VectorIndex;
import com.flamingo.ai.docrag.index.VectorRecord;
import com.flamingo.ai.docrag.service.inspection.VectorInspectionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class VectorInspectionControllerTest {

  @Mock private VectorIndex unavailableIndex;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimensions(2);
    InMemoryVectorIndex index = new InMemoryVectorIndex(ragConfig, new SimpleMeterRegistry());
    index.connect();
    index.insert(
        List.of(
            new VectorRecord("file_1_0", "file_1", 0, "x".repeat(150), new float[] {1f, 0f}),
            new VectorRecord("file_1_1", "file_1", 1, "short text", new float[] {0f, 1f})));

    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new VectorInspectionController(new VectorInspectionService(index)))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  void shouldReturnPreviewsWithoutVectors_byDefault() throws Exception {
    mockMvc
        .perform(get("/api/inspect-vectors").param("file_id", "file_1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(2))
        .andExpect(jsonPath("$.vectors[0].id").value("file_1_0"))
        .andExpect(jsonPath("$.vectors[0].vector_dim").value(2))
        .andExpect(jsonPath("$.vectors[0].chunk_length").value(150))
        .andExpect(jsonPath("$.vectors[0].preview").value("x".repeat(100) + "..."))
        .andExpect(jsonPath("$.vectors[1].preview").value("short text"))
        .andExpect(jsonPath("$.vectors[0].full_content").doesNotExist())
        .andExpect(jsonPath("$.vectors[0].embedding").doesNotExist());
  }

  @Test
  void shouldIncludeContentAndVectors_whenRequested() throws Exception {
    mockMvc
        .perform(
            get("/api/inspect-vectors")
                .param("limit", "1")
                .param("full_content", "true")
                .param("show_vectors", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.show_vectors").value(true))
        .andExpect(jsonPath("$.vectors[0].full_content").value("x".repeat(150)))
        .andExpect(jsonPath("$.vectors[0].embedding", hasSize(2)))
        .andExpect(jsonPath("$.vectors[0].vector_values_count").value(2));
  }

  @Test
  void shouldRejectLimitOutOfRange() throws Exception {
    mockMvc
        .perform(get("/api/inspect-vectors").param("limit", "0"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldReturnServiceUnavailable_whenIndexFails() throws Exception {
    when(unavailableIndex.inspect(null, 10, false))
        .thenThrow(new IllegalStateException("connection refused"));
    MockMvc failing =
        MockMvcBuilders.standaloneSetup(
                new VectorInspectionController(new VectorInspectionService(unavailableIndex)))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();

    failing.perform(get("/api/inspect-vectors")).andExpect(status().isServiceUnavailable());
  }
}
