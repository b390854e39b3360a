package io.b2mash.formlogic.session;

import static io.b2mash.formlogic.testutil.TestForms.field;
import static io.b2mash.formlogic.testutil.TestForms.page;
import static io.b2mash.formlogic.testutil.TestForms.paragraph;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.formlogic.structure.FieldType;
import java.util.List;
import org.junit.jupiter.api.Test;

class VisitedFieldRegistryTest {

  @Test
  void recordsAnswerFieldsOncePerName() {
    var registry = new VisitedFieldRegistry();
    var first =
        page(
            1,
            1,
            true,
            List.of(field(1, "a", FieldType.TEXT), paragraph(2, "intro", "hello")));

    var added = registry.recordPage(first);
    var again = registry.recordPage(first);

    assertThat(added).containsExactly("a");
    assertThat(again).isEmpty();
    assertThat(registry.fieldNames()).containsExactly("a");
    assertThat(registry.hasReached("intro")).isFalse();
  }

  @Test
  void keepsVisitOrderAcrossPages() {
    var registry = new VisitedFieldRegistry();

    registry.recordPage(page(3, 3, false, List.of(field(3, "c", FieldType.TEXT))));
    registry.recordPage(page(1, 1, true, List.of(field(1, "a", FieldType.TEXT))));

    assertThat(registry.pageIds()).containsExactly(3L, 1L);
    assertThat(registry.fieldNames()).containsExactly("c", "a");
    assertThat(registry.hasVisited(3)).isTrue();
    assertThat(registry.hasVisited(2)).isFalse();
  }
}
