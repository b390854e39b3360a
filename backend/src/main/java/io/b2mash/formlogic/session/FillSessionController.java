package io.b2mash.formlogic.session;

import io.b2mash.formlogic.condition.FieldState;
import io.b2mash.formlogic.session.dto.AnswersRequest;
import io.b2mash.formlogic.session.dto.RenderedPageResponse;
import io.b2mash.formlogic.session.dto.SessionResponseEntry;
import io.b2mash.formlogic.session.dto.SessionStatusResponse;
import io.b2mash.formlogic.session.dto.StartSessionRequest;
import io.b2mash.formlogic.session.dto.SubmitPageResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class FillSessionController {

  private final FillSessionService fillSessionService;

  public FillSessionController(FillSessionService fillSessionService) {
    this.fillSessionService = fillSessionService;
  }

  @PostMapping
  public ResponseEntity<SessionStatusResponse> start(
      @Valid @RequestBody StartSessionRequest request) {
    var response = fillSessionService.start(request.formId(), request.sessionId());
    return ResponseEntity.created(URI.create("/api/sessions/" + response.sessionId()))
        .body(response);
  }

  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionStatusResponse> status(@PathVariable String sessionId) {
    return ResponseEntity.ok(fillSessionService.getStatus(sessionId));
  }

  @GetMapping("/{sessionId}/page")
  public ResponseEntity<RenderedPageResponse> currentPage(@PathVariable String sessionId) {
    return ResponseEntity.ok(fillSessionService.renderCurrentPage(sessionId));
  }

  @PutMapping("/{sessionId}/answers")
  public ResponseEntity<List<FieldState>> updateAnswers(
      @PathVariable String sessionId, @Valid @RequestBody AnswersRequest request) {
    return ResponseEntity.ok(fillSessionService.updateAnswers(sessionId, request.answers()));
  }

  @PostMapping("/{sessionId}/submit")
  public ResponseEntity<SubmitPageResponse> submit(
      @PathVariable String sessionId, @Valid @RequestBody AnswersRequest request) {
    return ResponseEntity.ok(fillSessionService.submitPage(sessionId, request.answers()));
  }

  @GetMapping("/{sessionId}/responses")
  public ResponseEntity<List<SessionResponseEntry>> responses(@PathVariable String sessionId) {
    return ResponseEntity.ok(fillSessionService.getResponses(sessionId));
  }

  @PostMapping("/{sessionId}/complete")
  public ResponseEntity<SessionStatusResponse> complete(@PathVariable String sessionId) {
    return ResponseEntity.ok(fillSessionService.complete(sessionId));
  }
}
