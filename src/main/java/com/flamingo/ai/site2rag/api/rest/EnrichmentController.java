package com.flamingo.ai.site2rag.api.rest;

import com.flamingo.ai.site2rag.api.dto.request.EnrichDocumentRequest;
import com.flamingo.ai.site2rag.api.dto.response.EnrichDocumentResponse;
import com.flamingo.ai.site2rag.service.enrichment.ContextEnrichmentService;
import com.flamingo.ai.site2rag.service.enrichment.model.EnrichmentResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document enrichment. */
@RestController
@RequestMapping("/api/enrichment")
@RequiredArgsConstructor
@Slf4j
public class EnrichmentController {

  private final ContextEnrichmentService contextEnrichmentService;

  /** Enriches the blocks of one document and returns them in input order. */
  @PostMapping("/documents")
  public ResponseEntity<EnrichDocumentResponse> enrichDocument(
      @Valid @RequestBody EnrichDocumentRequest request) {
    log.info(
        "Enriching document '{}' with {} blocks", request.getTitle(), request.getBlocks().size());
    EnrichmentResult result =
        contextEnrichmentService.enrich(request.toSourceBlocks(), request.toMetadata());
    return ResponseEntity.ok(EnrichDocumentResponse.from(result));
  }
}
