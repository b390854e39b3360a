package io.b2mash.formlogic.structure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * One field of a form page, as handed over by the authoring layer. {@code isRequired} and {@code
 * isVisible} are authoring-time baselines; condition rules override them at run time.
 *
 * <p>For paragraph fields {@code defaultValue} holds the paragraph body, stored with {@code @#id}
 * reference tokens.
 */
public record FormField(
    @JsonProperty("id") long id,
    @JsonProperty("name") String name,
    @JsonProperty("label") String label,
    @JsonProperty("field_type") FieldType fieldType,
    @JsonProperty("placeholder") String placeholder,
    @JsonProperty("help_text") String helpText,
    @JsonProperty("order") int order,
    @JsonProperty("is_required") boolean isRequired,
    @JsonProperty("is_visible") boolean isVisible,
    @JsonProperty("default_value") String defaultValue,
    @JsonProperty("options") FieldOptions options,
    @JsonProperty("conditions") List<ConditionRule> conditions) {

  public FormField {
    options = options != null ? options : FieldOptions.NONE;
    conditions = conditions != null ? List.copyOf(conditions) : List.of();
  }

  @JsonCreator
  static FormField fromJson(
      @JsonProperty("id") long id,
      @JsonProperty("name") String name,
      @JsonProperty("label") String label,
      @JsonProperty("field_type") FieldType fieldType,
      @JsonProperty("placeholder") String placeholder,
      @JsonProperty("help_text") String helpText,
      @JsonProperty("order") Integer order,
      @JsonProperty("is_required") Boolean isRequired,
      @JsonProperty("is_visible") Boolean isVisible,
      @JsonProperty("default_value") String defaultValue,
      @JsonProperty("options") Map<String, Object> options,
      @JsonProperty("conditions") List<ConditionRule> conditions) {
    return new FormField(
        id,
        name,
        label,
        fieldType,
        placeholder,
        helpText,
        order != null ? order : 0,
        isRequired != null && isRequired,
        isVisible == null || isVisible,
        defaultValue,
        FieldOptions.from(fieldType, options),
        conditions);
  }

  public boolean hasConditions() {
    return !conditions.isEmpty();
  }

  @JsonIgnore
  public boolean isParagraph() {
    return fieldType == FieldType.PARAGRAPH;
  }
}
