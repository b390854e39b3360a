package io.b2mash.formlogic.condition;

import io.b2mash.formlogic.exception.StructuralReferenceException;
import io.b2mash.formlogic.structure.FormField;
import io.b2mash.formlogic.structure.FormPage;
import io.b2mash.formlogic.structure.FormStructure;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Projects the render state of every field on a page. Fields with condition rules take their state
 * from {@link ConditionResolver}; fields without rules pass their authoring baseline through.
 *
 * <p>Pure: the same page and answers always give the same states. {@code is_skipped} is carried
 * along for navigation and required-answer checks; rendering ignores it.
 */
@Component
public class FieldStateProjector {

  private final ConditionResolver conditionResolver;

  public FieldStateProjector(ConditionResolver conditionResolver) {
    this.conditionResolver = conditionResolver;
  }

  public List<FieldState> project(FormStructure form, FormPage page, Map<String, Object> answers) {
    Set<String> knownNames =
        form.allFields().stream().map(FormField::name).collect(Collectors.toSet());
    return page.fields().stream().map(field -> project(field, knownNames, answers)).toList();
  }

  private FieldState project(FormField field, Set<String> knownNames, Map<String, Object> answers) {
    if (!field.hasConditions()) {
      return new FieldState(
          field.id(), field.name(), field.isVisible(), field.isRequired(), true, false);
    }
    for (var rule : field.conditions()) {
      String source = rule.sourceFieldName();
      if (source == null || !knownNames.contains(source)) {
        throw new StructuralReferenceException(
            "field",
            source,
            "Condition on field '" + field.name() + "' references unknown field '" + source + "'");
      }
      if (source.equals(field.name())) {
        throw new StructuralReferenceException(
            "field", source, "Condition on field '" + field.name() + "' references itself");
      }
    }
    var effect = conditionResolver.resolve(field.conditions(), answers);
    return new FieldState(
        field.id(),
        field.name(),
        effect.isVisible(),
        effect.require(),
        effect.isEnabled(),
        effect.skip());
  }
}
