package io.b2mash.formlogic.structure;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.formlogic.structure.FieldOptions.Attachment;
import io.b2mash.formlogic.structure.FieldOptions.Choice;
import io.b2mash.formlogic.structure.FieldOptions.Choices;
import io.b2mash.formlogic.structure.FieldOptions.Range;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldOptionsTest {

  @Test
  void choiceFieldsReadChoices() {
    var options =
        FieldOptions.from(
            FieldType.RADIO,
            Map.of("choices", List.of(Map.of("value", "new", "label", "New customer"), "other")));

    assertThat(options)
        .isEqualTo(
            new Choices(List.of(new Choice("new", "New customer"), new Choice("other", "other"))));
  }

  @Test
  void choiceFieldWithoutOptionsGetsEmptyChoices() {
    assertThat(FieldOptions.from(FieldType.SELECT, null)).isEqualTo(new Choices(List.of()));
  }

  @Test
  void ratingFieldsReadRangeWithDefaults() {
    assertThat(FieldOptions.from(FieldType.RATING, Map.of("min", 0, "max", "10")))
        .isEqualTo(new Range(0, 10));
    assertThat(FieldOptions.from(FieldType.RATING, Map.of()))
        .isEqualTo(new Range(FieldOptions.DEFAULT_RATING_MIN, FieldOptions.DEFAULT_RATING_MAX));
  }

  @Test
  void fileFieldsReadAttachment() {
    var options =
        FieldOptions.from(
            FieldType.FILE,
            Map.of("attachment", Map.of("type", "image", "url", "https://cdn.example/logo.png")));

    assertThat(options).isEqualTo(new Attachment("image", "https://cdn.example/logo.png"));
  }

  @Test
  void otherFieldTypesIgnoreOptions() {
    assertThat(FieldOptions.from(FieldType.TEXT, Map.of("choices", List.of("a"))))
        .isSameAs(FieldOptions.NONE);
    assertThat(FieldOptions.from(null, Map.of())).isSameAs(FieldOptions.NONE);
  }
}
