package io.b2mash.formlogic.form;

import io.b2mash.formlogic.form.dto.FormSummaryResponse;
import io.b2mash.formlogic.reference.ReferenceSuggester;
import io.b2mash.formlogic.reference.ReferenceSuggestion;
import io.b2mash.formlogic.structure.FormStructure;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/forms")
public class FormController {

  private final FormRegistry formRegistry;
  private final ReferenceSuggester referenceSuggester;

  public FormController(FormRegistry formRegistry, ReferenceSuggester referenceSuggester) {
    this.formRegistry = formRegistry;
    this.referenceSuggester = referenceSuggester;
  }

  @GetMapping
  public ResponseEntity<List<FormSummaryResponse>> list() {
    return ResponseEntity.ok(formRegistry.list().stream().map(FormSummaryResponse::from).toList());
  }

  @GetMapping("/{formId}")
  public ResponseEntity<FormStructure> get(@PathVariable long formId) {
    return ResponseEntity.ok(formRegistry.require(formId));
  }

  @GetMapping("/{formId}/reference-suggestions")
  public ResponseEntity<List<ReferenceSuggestion>> referenceSuggestions(
      @PathVariable long formId,
      @RequestParam(required = false) String query,
      @RequestParam(required = false) Long excludeFieldId) {
    var form = formRegistry.require(formId);
    return ResponseEntity.ok(referenceSuggester.suggest(form, query, excludeFieldId));
  }
}
