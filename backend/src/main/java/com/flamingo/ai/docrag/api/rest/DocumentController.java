package com.flamingo.ai.docrag.api.rest;

import com.flamingo.ai.docrag.api.dto.response.DocumentResponse;
import com.flamingo.ai.docrag.api.dto.response.DocumentStatsResponse;
import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.service.document.DocumentService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document management. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Uploads a document; ingestion continues in the background. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(@RequestParam("file") MultipartFile file) {
    Document document = documentService.uploadDocument(file);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(DocumentResponse.fromEntity(document));
  }

  /** Lists documents, newest first. */
  @GetMapping
  public ResponseEntity<List<DocumentResponse>> listDocuments(
      @RequestParam(defaultValue = "100") int limit) {
    List<DocumentResponse> responses =
        documentService.listDocuments(limit).stream().map(DocumentResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }

  @GetMapping("/stats")
  public ResponseEntity<DocumentStatsResponse> getStatistics() {
    return ResponseEntity.ok(DocumentStatsResponse.from(documentService.getStatistics()));
  }

  /** Gets a document, including its ingestion status. */
  @GetMapping("/{fileId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable String fileId) {
    Document document = documentService.getDocument(fileId);
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }

  /** Deletes a document and its vectors. */
  @DeleteMapping("/{fileId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable String fileId) {
    documentService.deleteDocument(fileId);
    return ResponseEntity.noContent().build();
  }
}
