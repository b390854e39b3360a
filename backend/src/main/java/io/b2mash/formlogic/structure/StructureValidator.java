package io.b2mash.formlogic.structure;

import io.b2mash.formlogic.exception.StructuralReferenceException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks the structural invariants of a form snapshot before it is registered with the engine.
 *
 * <ul>
 *   <li>Field names, field ids and page ids are unique within the form
 *   <li>Every condition names an existing field other than its owner
 *   <li>Exactly one page is flagged {@code is_first}
 *   <li>At most one navigation rule per page is the default
 *   <li>Conditioned navigation rules name an existing source field and target page
 * </ul>
 */
@Component
public class StructureValidator {

  public List<String> findViolations(FormStructure form) {
    var violations = new ArrayList<String>();
    var fields = form.allFields();

    Set<String> names = new HashSet<>();
    Set<Long> fieldIds = new HashSet<>();
    for (var field : fields) {
      if (field.name() == null || field.name().isBlank()) {
        violations.add("Field " + field.id() + " has no name");
      } else if (!names.add(field.name())) {
        violations.add("Duplicate field name '" + field.name() + "'");
      }
      if (!fieldIds.add(field.id())) {
        violations.add("Duplicate field id " + field.id());
      }
    }

    Set<Long> pageIds = new HashSet<>();
    for (var page : form.pages()) {
      if (!pageIds.add(page.id())) {
        violations.add("Duplicate page id " + page.id());
      }
    }

    for (var field : fields) {
      for (var rule : field.conditions()) {
        String source = rule.sourceFieldName();
        if (source == null || !names.contains(source)) {
          violations.add(
              "Condition on field '"
                  + field.name()
                  + "' references unknown field '"
                  + source
                  + "'");
        } else if (source.equals(field.name())) {
          violations.add("Condition on field '" + field.name() + "' references itself");
        }
      }
    }

    long firstPages = form.pages().stream().filter(FormPage::isFirst).count();
    if (!form.pages().isEmpty() && firstPages != 1) {
      violations.add("Expected exactly one first page but found " + firstPages);
    }

    for (var page : form.pages()) {
      long defaults = page.navigationRules().stream().filter(NavigationRule::isDefault).count();
      if (defaults > 1) {
        violations.add("Page " + page.id() + " has " + defaults + " default navigation rules");
      }
      for (var rule : page.navigationRules()) {
        if (!rule.isDefault()) {
          if (rule.sourceFieldId() == null || !fieldIds.contains(rule.sourceFieldId())) {
            violations.add(
                "Navigation rule on page "
                    + page.id()
                    + " references unknown source field "
                    + rule.sourceFieldId());
          }
          if (rule.targetPageId() == null) {
            violations.add("Conditioned navigation rule on page " + page.id() + " has no target");
          }
        }
        if (rule.targetPageId() != null && !pageIds.contains(rule.targetPageId())) {
          violations.add(
              "Navigation rule on page "
                  + page.id()
                  + " targets unknown page "
                  + rule.targetPageId());
        }
      }
    }

    return violations;
  }

  public void validate(FormStructure form) {
    var violations = findViolations(form);
    if (!violations.isEmpty()) {
      throw new StructuralReferenceException(
          "form", form.id(), String.join("; ", violations));
    }
  }
}
