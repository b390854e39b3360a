package io.b2mash.formlogic.form;

import io.b2mash.formlogic.exception.ResourceNotFoundException;
import io.b2mash.formlogic.structure.FormStructure;
import io.b2mash.formlogic.structure.StructureValidator;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-only form structures known to this instance, keyed by form id. A structure is validated
 * once on registration and never mutated afterwards; re-registering an id replaces the snapshot.
 */
@Service
public class FormRegistry {

  private static final Logger log = LoggerFactory.getLogger(FormRegistry.class);

  private final StructureValidator structureValidator;
  private final Map<Long, FormStructure> forms = new ConcurrentHashMap<>();

  public FormRegistry(StructureValidator structureValidator) {
    this.structureValidator = structureValidator;
  }

  public FormStructure register(FormStructure form) {
    structureValidator.validate(form);
    var previous = forms.put(form.id(), form);
    if (previous != null) {
      log.info("Replaced form {} ({})", form.id(), form.title());
    } else {
      log.info(
          "Registered form {} ({}) with {} pages", form.id(), form.title(), form.pages().size());
    }
    return form;
  }

  public Optional<FormStructure> find(long formId) {
    return Optional.ofNullable(forms.get(formId));
  }

  public FormStructure require(long formId) {
    return find(formId).orElseThrow(() -> new ResourceNotFoundException("Form", formId));
  }

  public List<FormStructure> list() {
    return forms.values().stream().sorted(Comparator.comparingLong(FormStructure::id)).toList();
  }
}
