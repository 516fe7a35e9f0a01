package com.flamingo.ai.site2rag.service.enrichment;

import com.flamingo.ai.site2rag.service.enrichment.model.CancellationToken;
import com.flamingo.ai.site2rag.service.enrichment.model.DocumentMetadata;
import com.flamingo.ai.site2rag.service.enrichment.model.EnrichmentResult;
import com.flamingo.ai.site2rag.service.enrichment.model.ProgressListener;
import com.flamingo.ai.site2rag.service.enrichment.model.SourceBlock;
import java.util.List;

/** Adds [[...]] context disambiguations to the blocks of one document. */
public interface ContextEnrichmentService {

  /**
   * Enriches a document.
   *
   * @param blocks document blocks in order
   * @param metadata document title, URL and description
   * @return one output block per input block, in input order, plus run summary
   */
  EnrichmentResult enrich(List<SourceBlock> blocks, DocumentMetadata metadata);

  /**
   * Enriches a document, reporting progress and honoring cancellation.
   *
   * @param blocks document blocks in order
   * @param metadata document title, URL and description
   * @param progressListener called after every completed batch
   * @param cancellationToken once cancelled, remaining blocks keep their original text
   * @return one output block per input block, in input order, plus run summary
   * @throws com.flamingo.ai.site2rag.exception.SessionSetupException if no session can be set up
   */
  EnrichmentResult enrich(
      List<SourceBlock> blocks,
      DocumentMetadata metadata,
      ProgressListener progressListener,
      CancellationToken cancellationToken);
}
