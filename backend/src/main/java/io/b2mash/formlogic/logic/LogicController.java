package io.b2mash.formlogic.logic;

import io.b2mash.formlogic.condition.FieldState;
import io.b2mash.formlogic.condition.FieldStateProjector;
import io.b2mash.formlogic.logic.dto.FieldStatesRequest;
import io.b2mash.formlogic.logic.dto.InterpolateRequest;
import io.b2mash.formlogic.logic.dto.NextPageRequest;
import io.b2mash.formlogic.logic.dto.ReferenceTextRequest;
import io.b2mash.formlogic.logic.dto.TextResponse;
import io.b2mash.formlogic.navigation.NavigationDecision;
import io.b2mash.formlogic.navigation.NavigationResolver;
import io.b2mash.formlogic.reference.ReferenceHighlighter;
import io.b2mash.formlogic.reference.ReferenceInterpolator;
import io.b2mash.formlogic.reference.ReferenceSegment;
import io.b2mash.formlogic.reference.ReferenceTokenCodec;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Stateless evaluation endpoints. The caller sends the structure and answers inline; nothing is
 * stored between requests.
 */
@RestController
@RequestMapping("/api/logic")
public class LogicController {

  private final FieldStateProjector fieldStateProjector;
  private final NavigationResolver navigationResolver;
  private final ReferenceInterpolator referenceInterpolator;
  private final ReferenceTokenCodec referenceTokenCodec;
  private final ReferenceHighlighter referenceHighlighter;

  public LogicController(
      FieldStateProjector fieldStateProjector,
      NavigationResolver navigationResolver,
      ReferenceInterpolator referenceInterpolator,
      ReferenceTokenCodec referenceTokenCodec,
      ReferenceHighlighter referenceHighlighter) {
    this.fieldStateProjector = fieldStateProjector;
    this.navigationResolver = navigationResolver;
    this.referenceInterpolator = referenceInterpolator;
    this.referenceTokenCodec = referenceTokenCodec;
    this.referenceHighlighter = referenceHighlighter;
  }

  @PostMapping("/field-states")
  public ResponseEntity<List<FieldState>> fieldStates(
      @Valid @RequestBody FieldStatesRequest request) {
    var form = request.form();
    var page = form.requirePage(request.pageId());
    return ResponseEntity.ok(fieldStateProjector.project(form, page, request.answers()));
  }

  @PostMapping("/next-page")
  public ResponseEntity<NavigationDecision> nextPage(@Valid @RequestBody NextPageRequest request) {
    var form = request.form();
    var page = form.requirePage(request.currentPageId());
    return ResponseEntity.ok(navigationResolver.resolve(form, page, request.answers()));
  }

  @PostMapping("/interpolate")
  public ResponseEntity<TextResponse> interpolate(@Valid @RequestBody InterpolateRequest request) {
    return ResponseEntity.ok(
        new TextResponse(
            referenceInterpolator.interpolate(
                request.text(), request.fields(), request.answers())));
  }

  @PostMapping("/references/encode")
  public ResponseEntity<TextResponse> encode(@Valid @RequestBody ReferenceTextRequest request) {
    return ResponseEntity.ok(
        new TextResponse(referenceTokenCodec.encode(request.text(), request.fields())));
  }

  @PostMapping("/references/decode")
  public ResponseEntity<TextResponse> decode(@Valid @RequestBody ReferenceTextRequest request) {
    return ResponseEntity.ok(
        new TextResponse(referenceTokenCodec.decode(request.text(), request.fields())));
  }

  @PostMapping("/references/segments")
  public ResponseEntity<List<ReferenceSegment>> segments(
      @Valid @RequestBody ReferenceTextRequest request) {
    return ResponseEntity.ok(referenceHighlighter.segments(request.text(), request.fields()));
  }
}
