package io.b2mash.formlogic.condition;

import static io.b2mash.formlogic.testutil.TestForms.field;
import static io.b2mash.formlogic.testutil.TestForms.form;
import static io.b2mash.formlogic.testutil.TestForms.hiddenField;
import static io.b2mash.formlogic.testutil.TestForms.page;
import static io.b2mash.formlogic.testutil.TestForms.requiredField;
import static io.b2mash.formlogic.testutil.TestForms.when;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.formlogic.exception.StructuralReferenceException;
import io.b2mash.formlogic.structure.FieldType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldStateProjectorTest {

  private final FieldStateProjector projector =
      new FieldStateProjector(new ConditionResolver(new OperatorEvaluator()));

  @Test
  void fieldsWithoutRulesPassBaselineThrough() {
    var p1 =
        page(
            1,
            1,
            true,
            List.of(
                requiredField(1, "name", FieldType.TEXT),
                hiddenField(2, "internal_code", FieldType.TEXT)));
    var form = form(1, p1);

    var states = projector.project(form, p1, Map.of());

    assertThat(states)
        .containsExactly(
            new FieldState(1, "name", true, true, true, false),
            new FieldState(2, "internal_code", false, false, true, false));
  }

  @Test
  void conditionedFieldTakesResolvedState() {
    var p1 =
        page(
            1,
            1,
            true,
            List.of(
                field(1, "how_heard", FieldType.SELECT),
                field(
                    2,
                    "other_source",
                    FieldType.TEXT,
                    when("how_heard", "equals", "other", "show"),
                    when("how_heard", "equals", "other", "require"))));
    var form = form(1, p1);

    var before = projector.project(form, p1, Map.of("how_heard", "search"));
    var after = projector.project(form, p1, Map.of("how_heard", "other"));

    assertThat(before.get(1).isVisible()).isFalse();
    assertThat(before.get(1).isRequired()).isFalse();
    assertThat(after.get(1).isVisible()).isTrue();
    assertThat(after.get(1).isRequired()).isTrue();
  }

  @Test
  void conditionsMayReferenceFieldsOnEarlierPages() {
    var p1 = page(1, 1, true, List.of(field(1, "age", FieldType.NUMBER)));
    var p2 =
        page(
            2,
            2,
            false,
            List.of(
                field(2, "guardian", FieldType.TEXT, when("age", "less_than", "18", "show"))));
    var form = form(1, p1, p2);

    var states = projector.project(form, p2, Map.of("age", 12));

    assertThat(states).extracting(FieldState::isVisible).containsExactly(true);
  }

  @Test
  void skipIsSurfacedAndDisableApplied() {
    var p1 =
        page(
            1,
            1,
            true,
            List.of(
                field(1, "has_pet", FieldType.RADIO),
                field(
                    2,
                    "pet_name",
                    FieldType.TEXT,
                    when("has_pet", "equals", "no", "skip"),
                    when("has_pet", "equals", "no", "disable"))));
    var form = form(1, p1);

    var state = projector.project(form, p1, Map.of("has_pet", "no")).get(1);

    assertThat(state.isSkipped()).isTrue();
    assertThat(state.isEnabled()).isFalse();
    assertThat(state.isVisible()).isTrue();
  }

  @Test
  void projectionIsIdempotent() {
    var p1 =
        page(
            1,
            1,
            true,
            List.of(
                field(1, "a", FieldType.TEXT),
                field(2, "b", FieldType.TEXT, when("a", "is_not_empty", null, "show"))));
    var form = form(1, p1);
    Map<String, Object> answers = Map.of("a", "x");

    assertThat(projector.project(form, p1, answers))
        .isEqualTo(projector.project(form, p1, answers));
  }

  @Test
  void conditionOnUnknownFieldIsStructuralError() {
    var p1 =
        page(
            1,
            1,
            true,
            List.of(field(1, "b", FieldType.TEXT, when("ghost", "equals", "1", "show"))));
    var form = form(1, p1);

    assertThatThrownBy(() -> projector.project(form, p1, Map.of()))
        .isInstanceOfSatisfying(
            StructuralReferenceException.class,
            e -> assertThat(e.getReference()).isEqualTo("ghost"));
  }

  @Test
  void selfReferencingConditionIsStructuralError() {
    var p1 =
        page(
            1,
            1,
            true,
            List.of(field(1, "loop", FieldType.TEXT, when("loop", "equals", "1", "show"))));
    var form = form(1, p1);

    assertThatThrownBy(() -> projector.project(form, p1, Map.of()))
        .isInstanceOf(StructuralReferenceException.class);
  }
}
