package io.b2mash.formlogic.logic;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class LogicControllerTest {

  private static final String FORM =
      """
      {
        "id": 1,
        "title": "Inline",
        "pages": [
          {
            "id": 1, "title": "Start", "order": 1, "is_first": true,
            "fields": [
              {"id": 1, "name": "role", "label": "Role", "field_type": "text", "order": 1},
              {"id": 2, "name": "team", "label": "Team", "field_type": "text", "order": 2,
               "conditions": [
                 {"source_field_name": "role", "operator": "equals", "value": "manager",
                  "action": "show"},
                 {"source_field_name": "role", "operator": "equals", "value": "manager",
                  "action": "require"}
               ]}
            ],
            "navigation_rules": [
              {"source_field_id": 1, "operator": "equals", "value": "x",
               "target_page_id": 2, "is_default": false},
              {"target_page_id": 3, "is_default": true}
            ]
          },
          {"id": 2, "title": "Two", "order": 2, "is_first": false,
           "fields": [], "navigation_rules": []},
          {"id": 3, "title": "Three", "order": 3, "is_first": false,
           "fields": [], "navigation_rules": []}
        ]
      }
      """;

  private static final String FIELDS =
      """
      [
        {"id": 11, "name": "name", "field_type": "text"},
        {"id": 12, "name": "age", "field_type": "number"},
        {"id": 13, "name": "role", "field_type": "text"},
        {"id": 14, "name": "role2", "field_type": "text"}
      ]
      """;

  @Autowired private MockMvc mockMvc;

  @Test
  void fieldStates_hiddenUntilShowRuleMatches() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/field-states")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"form": %s, "page_id": 1, "answers": {"role": "engineer"}}
                    """
                        .formatted(FORM)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[1].name").value("team"))
        .andExpect(jsonPath("$[1].is_visible").value(false))
        .andExpect(jsonPath("$[1].is_required").value(false))
        .andExpect(jsonPath("$[0].is_visible").value(true))
        .andExpect(jsonPath("$[0].is_enabled").value(true));
  }

  @Test
  void fieldStates_showAndRequireOnMatch() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/field-states")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"form": %s, "page_id": 1, "answers": {"role": "Manager"}}
                    """
                        .formatted(FORM)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[1].is_visible").value(true))
        .andExpect(jsonPath("$[1].is_required").value(true))
        .andExpect(jsonPath("$[1].is_skipped").value(false));
  }

  @Test
  void fieldStates_unknownPageReturns422() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/field-states")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"form": %s, "page_id": 99, "answers": {}}
                    """
                        .formatted(FORM)))
        .andExpect(status().is(422))
        .andExpect(jsonPath("$.title").value("Inconsistent form structure"))
        .andExpect(jsonPath("$.referenceKind").value("page"))
        .andExpect(jsonPath("$.reference").value("99"));
  }

  @Test
  void fieldStates_missingFormReturns400() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/field-states")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"page_id\": 1}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void nextPage_ruleMatch() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/next-page")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"form": %s, "current_page_id": 1, "answers": {"role": "x"}}
                    """
                        .formatted(FORM)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.next_page_id").value(2))
        .andExpect(jsonPath("$.is_complete").value(false))
        .andExpect(jsonPath("$.reason").value("RULE_MATCH"));
  }

  @Test
  void nextPage_defaultRule() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/next-page")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"form": %s, "current_page_id": 1, "answers": {"role": "y"}}
                    """
                        .formatted(FORM)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.next_page_id").value(3))
        .andExpect(jsonPath("$.reason").value("DEFAULT_RULE"));
  }

  @Test
  void nextPage_lastPageCompletes() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/next-page")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"form": %s, "current_page_id": 3}
                    """
                        .formatted(FORM)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.is_complete").value(true))
        .andExpect(jsonPath("$.next_page_id").isEmpty());
  }

  @Test
  void interpolate_replacesKnownReferences() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/interpolate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text": "Hello @name, you are @age", "fields": %s,
                     "answers": {"name": "Amy", "age": ""}}
                    """
                        .formatted(FIELDS)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.text").value("Hello Amy, you are "));
  }

  @Test
  void encodeAndDecode() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/references/encode")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text": "@role2 ok, @Name", "fields": %s}
                    """
                        .formatted(FIELDS)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.text").value("@#14 ok, @#11"));

    mockMvc
        .perform(
            post("/api/logic/references/decode")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text": "@#14 ok, @#11, @#77", "fields": %s}
                    """
                        .formatted(FIELDS)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.text").value("@role2 ok, @name, @#77"));
  }

  @Test
  void segments_markReferences() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/references/segments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text": "Hi @name!", "fields": %s}
                    """
                        .formatted(FIELDS)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(3))
        .andExpect(jsonPath("$[0].kind").value("TEXT"))
        .andExpect(jsonPath("$[1].kind").value("REFERENCE"))
        .andExpect(jsonPath("$[1].field_id").value(11))
        .andExpect(jsonPath("$[1].text").value("@name"))
        .andExpect(jsonPath("$[2].text").value("!"));
  }

  @Test
  void interpolate_missingTextReturns400() throws Exception {
    mockMvc
        .perform(
            post("/api/logic/interpolate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fields\": []}"))
        .andExpect(status().isBadRequest());
  }
}
