package dev.archivist.api;

import dev.archivist.query.SearchMode;
import dev.archivist.retrieval.RetrievalOrchestrator;
import dev.archivist.retrieval.RetrievalRequest;
import dev.archivist.retrieval.RetrievalResponse;
import dev.archivist.retrieval.RetrievalStatus;
import jakarta.validation.Valid;
import java.util.Objects;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter for the retrieval engine.
 *
 * <p>Every envelope status except {@link RetrievalStatus#FAILED} is a 200; {@code FAILED} is a 503
 * carrying the same envelope. Invalid requests are rejected with 400 before retrieval starts.
 */
@RestController
@RequestMapping("/api")
public class RetrievalController {

  private final RetrievalOrchestrator orchestrator;

  public RetrievalController(RetrievalOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping("/retrieve")
  public ResponseEntity<RetrieveResponseBody> retrieve(@Valid @RequestBody RetrieveRequestBody body) {
    RetrievalRequest request =
        new RetrievalRequest(
            body.query(),
            body.userId(),
            Objects.requireNonNullElse(body.k(), RetrievalRequest.DEFAULT_K),
            SearchMode.parseOrDefault(body.searchType()),
            body.minScore());
    RetrievalResponse response = orchestrator.retrieve(request);
    HttpStatus status =
        response.status() == RetrievalStatus.FAILED ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
    return ResponseEntity.status(status).body(RetrieveResponseBody.from(response));
  }
}
