package io.b2mash.formlogic.reference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits editing text into plain and reference segments so the authoring surface can highlight
 * the references that will bind. Concatenating the segment texts gives back the input.
 */
@Component
public class ReferenceHighlighter {

  public List<ReferenceSegment> segments(String text, Collection<ReferenceField> fields) {
    var segments = new ArrayList<ReferenceSegment>();
    if (text == null || text.isEmpty()) {
      return segments;
    }
    int cursor = 0;
    for (var match : ReferenceScanner.of(fields).scanNames(text)) {
      if (match.start() > cursor) {
        segments.add(ReferenceSegment.text(text.substring(cursor, match.start())));
      }
      segments.add(
          ReferenceSegment.reference(text.substring(match.start(), match.end()), match.field()));
      cursor = match.end();
    }
    if (cursor < text.length()) {
      segments.add(ReferenceSegment.text(text.substring(cursor)));
    }
    return segments;
  }
}
