package com.flamingo.ai.docrag.api.rest;

import com.flamingo.ai.docrag.api.dto.response.InspectedVectorResponse;
import com.flamingo.ai.docrag.api.dto.response.VectorInspectionResponse;
import com.flamingo.ai.docrag.service.inspection.VectorInspectionService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for inspecting stored chunks and vectors. */
@RestController
@RequestMapping("/api/inspect-vectors")
@RequiredArgsConstructor
public class VectorInspectionController {

  private final VectorInspectionService inspectionService;

  @GetMapping
  public ResponseEntity<VectorInspectionResponse> inspect(
      @RequestParam(name = "file_id", required = false) String fileId,
      @RequestParam(defaultValue = "10") int limit,
      @RequestParam(name = "full_content", defaultValue = "false") boolean fullContent,
      @RequestParam(name = "show_vectors", defaultValue = "false") boolean showVectors) {
    List<InspectedVectorResponse> vectors =
        inspectionService.inspect(fileId, limit, showVectors).stream()
            .map(chunk -> InspectedVectorResponse.from(chunk, fullContent, showVectors))
            .toList();
    return ResponseEntity.ok(
        VectorInspectionResponse.builder()
            .count(vectors.size())
            .fullContent(fullContent)
            .showVectors(showVectors)
            .vectors(vectors)
            .build());
  }
}
