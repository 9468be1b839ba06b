package com.flamingo.ai.docrag.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.exception.ApiError;
import com.flamingo.ai.docrag.exception.DocumentNotFoundException;
import com.flamingo.ai.docrag.exception.EmptyDocumentException;
import com.flamingo.ai.docrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.docrag.service.document.DocumentService;
import com.flamingo.ai.docrag.service.document.DocumentStatistics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.multipart.MultipartFile;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentController")
class DocumentControllerTest {

  @Mock private DocumentService documentService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new DocumentController(documentService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  void shouldAcceptUpload_andReportProcessing() throws Exception {
    when(documentService.uploadDocument(any(MultipartFile.class)))
        .thenReturn(
            Document.builder()
                .fileId("file_20240101_120000_abcd1234")
                .fileName("notes.txt")
                .fileType("Text")
                .fileSize(11L)
                .build());

    mockMvc
        .perform(
            multipart("/api/documents")
                .file(
                    new MockMultipartFile(
                        "file", "notes.txt", "text/plain", "Some notes.".getBytes())))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.file_id").value("file_20240101_120000_abcd1234"))
        .andExpect(jsonPath("$.status").value("PROCESSING"))
        .andExpect(jsonPath("$.chunks_count").value(0));
  }

  @Test
  void shouldReturnBadRequest_whenNoTextExtracted() throws Exception {
    when(documentService.uploadDocument(any(MultipartFile.class)))
        .thenThrow(new EmptyDocumentException("file_1"));

    mockMvc
        .perform(
            multipart("/api/documents")
                .file(new MockMultipartFile("file", "scan.pdf", "application/pdf", new byte[] {1})))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_EMPTY));
  }

  @Test
  void shouldReturnNotFound_whenDocumentUnknown() throws Exception {
    when(documentService.getDocument("missing"))
        .thenThrow(new DocumentNotFoundException("missing"));

    mockMvc
        .perform(get("/api/documents/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_NOT_FOUND))
        .andExpect(jsonPath("$.path").value("/api/documents/missing"));
  }

  @Test
  void shouldReturnStatistics() throws Exception {
    when(documentService.getStatistics())
        .thenReturn(new DocumentStatistics(2, 14, 14, 2_097_152, 2.0));

    mockMvc
        .perform(get("/api/documents/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_files").value(2))
        .andExpect(jsonPath("$.total_vectors").value(14))
        .andExpect(jsonPath("$.total_size_mb").value(2.0));
  }

  @Test
  void shouldDeleteDocument() throws Exception {
    mockMvc.perform(delete("/api/documents/file_1")).andExpect(status().isNoContent());

    verify(documentService).deleteDocument("file_1");
  }

  @Test
  void shouldReturnNotFound_whenDeletingUnknownDocument() throws Exception {
    doThrow(new DocumentNotFoundException("file_9")).when(documentService).deleteDocument("file_9");

    mockMvc.perform(delete("/api/documents/file_9")).andExpect(status().isNotFound());
  }
}
