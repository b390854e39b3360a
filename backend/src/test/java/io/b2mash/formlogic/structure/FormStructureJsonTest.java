package io.b2mash.formlogic.structure;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.formlogic.condition.ConditionAction;
import io.b2mash.formlogic.condition.ConditionOperator;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

class FormStructureJsonTest {

  private final ObjectMapper objectMapper = JsonMapper.builder().build();

  private static final String FORM_JSON =
      """
      {
        "id": 5,
        "title": "Survey",
        "pages": [
          {
            "id": 2, "title": "Second", "order": 2, "is_first": false,
            "fields": [], "navigation_rules": []
          },
          {
            "id": 1, "title": "First", "order": 1, "is_first": true,
            "fields": [
              {"id": 11, "name": "why", "label": "Why?", "field_type": "text", "order": 2,
               "conditions": [
                 {"source_field_name": "pick", "operator": "EQUALS", "value": "b",
                  "action": "show"},
                 {"source_field_name": "pick", "operator": "starts_with", "value": "b",
                  "action": "hide"}
               ]},
              {"id": 10, "name": "pick", "label": "Pick", "field_type": "select", "order": 1,
               "is_required": true, "options": {"choices": ["a", "b"]}}
            ],
            "navigation_rules": [
              {"source_field_id": 10, "operator": "equals", "value": "a",
               "target_page_id": 2, "is_default": false},
              {"target_page_id": null, "is_default": true}
            ]
          }
        ]
      }
      """;

  @Test
  void readsStructureInStructuralOrder() {
    var form = objectMapper.readValue(FORM_JSON, FormStructure.class);

    assertThat(form.pages()).extracting(FormPage::id).containsExactly(1L, 2L);
    var first = form.firstPage().orElseThrow();
    assertThat(first.fields()).extracting(FormField::name).containsExactly("pick", "why");
    assertThat(first.defaultRule().orElseThrow().targetPageId()).isNull();
  }

  @Test
  void absentVisibilityDefaultsToVisible() {
    var form = objectMapper.readValue(FORM_JSON, FormStructure.class);

    var pick = form.findFieldByName("pick").orElseThrow();
    assertThat(pick.isVisible()).isTrue();
    assertThat(pick.isRequired()).isTrue();
    assertThat(pick.options()).isInstanceOf(FieldOptions.Choices.class);
  }

  @Test
  void operatorsAreReadLenientlyAndUnknownOnesBecomeNull() {
    var form = objectMapper.readValue(FORM_JSON, FormStructure.class);

    var conditions = form.findFieldByName("why").orElseThrow().conditions();
    assertThat(conditions.get(0).operator()).isEqualTo(ConditionOperator.EQUALS);
    assertThat(conditions.get(0).action()).isEqualTo(ConditionAction.SHOW);
    assertThat(conditions.get(1).operator()).isNull();
  }

  @Test
  void writesBoundaryNames() {
    var form = objectMapper.readValue(FORM_JSON, FormStructure.class);

    var json = objectMapper.writeValueAsString(form);

    assertThat(json)
        .contains("\"is_first\":true")
        .contains("\"field_type\":\"select\"")
        .contains("\"source_field_name\":\"pick\"")
        .contains("\"is_default\":true")
        .contains("\"choices\":[{\"value\":\"a\",\"label\":\"a\"}")
        .doesNotContain("\"paragraph\"");
  }

  @Test
  void writtenStructureReadsBackEqual() {
    var form = objectMapper.readValue(FORM_JSON, FormStructure.class);

    var copy = objectMapper.readValue(objectMapper.writeValueAsString(form), FormStructure.class);

    assertThat(copy).isEqualTo(form);
  }
}
