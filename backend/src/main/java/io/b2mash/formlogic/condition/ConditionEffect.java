package io.b2mash.formlogic.condition;

/**
 * Aggregate outcome of folding one field's condition rules over the answer set. {@code show} and
 * {@code hide} (and {@code enable} and {@code disable}) are kept as separate flags so callers can
 * see which side the last matching rule landed on.
 */
public record ConditionEffect(
    boolean show, boolean hide, boolean enable, boolean disable, boolean require, boolean skip) {

  public boolean isVisible() {
    return show && !hide;
  }

  public boolean isEnabled() {
    return enable && !disable;
  }
}
