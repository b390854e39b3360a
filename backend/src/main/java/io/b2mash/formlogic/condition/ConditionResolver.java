package io.b2mash.formlogic.condition;

import io.b2mash.formlogic.structure.ConditionRule;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Folds the ordered condition rules of one field into a {@link ConditionEffect}.
 *
 * <p>Visibility baseline: a rule list with at least one {@code show} and no {@code hide} starts
 * hidden (opt-in); anything else starts visible. {@code enable} starts true, {@code require} and
 * {@code skip} start false. Every rule is evaluated in list order and each match applies its
 * action, so a later visibility match overrides an earlier one while {@code require} and {@code
 * skip} only ever switch on within a fold. Nothing carries over between calls.
 */
@Component
public class ConditionResolver {

  private static final Logger log = LoggerFactory.getLogger(ConditionResolver.class);

  private final OperatorEvaluator operatorEvaluator;

  public ConditionResolver(OperatorEvaluator operatorEvaluator) {
    this.operatorEvaluator = operatorEvaluator;
  }

  public ConditionEffect resolve(List<ConditionRule> rules, Map<String, Object> answers) {
    boolean hasShow = rules.stream().anyMatch(r -> r.action() == ConditionAction.SHOW);
    boolean hasHide = rules.stream().anyMatch(r -> r.action() == ConditionAction.HIDE);

    boolean show = !(hasShow && !hasHide);
    boolean hide = !show;
    boolean enable = true;
    boolean disable = false;
    boolean require = false;
    boolean skip = false;

    for (var rule : rules) {
      Object value = answers.get(rule.sourceFieldName());
      if (!operatorEvaluator.evaluate(rule.operator(), value, rule.value())) {
        continue;
      }
      if (rule.action() == null) {
        log.debug("Ignoring matched rule on '{}' with unknown action", rule.sourceFieldName());
        continue;
      }
      switch (rule.action()) {
        case SHOW -> {
          show = true;
          hide = false;
        }
        case HIDE -> {
          show = false;
          hide = true;
        }
        case ENABLE -> {
          enable = true;
          disable = false;
        }
        case DISABLE -> {
          enable = false;
          disable = true;
        }
        case REQUIRE -> require = true;
        case SKIP -> skip = true;
      }
    }

    return new ConditionEffect(show, hide, enable, disable, require, skip);
  }
}
