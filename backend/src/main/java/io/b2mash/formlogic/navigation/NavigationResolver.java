package io.b2mash.formlogic.navigation;

import io.b2mash.formlogic.condition.OperatorEvaluator;
import io.b2mash.formlogic.exception.StructuralReferenceException;
import io.b2mash.formlogic.navigation.NavigationDecision.Reason;
import io.b2mash.formlogic.structure.FormPage;
import io.b2mash.formlogic.structure.FormStructure;
import io.b2mash.formlogic.structure.NavigationRule;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides where a respondent goes after submitting a page.
 *
 * <ol>
 *   <li>Non-default rules of the page, in list order; the first whose predicate holds wins.
 *   <li>The page's default rule, if any. A default rule without a target completes the form.
 *   <li>The next page in structural order, or completion when the page is the last one.
 * </ol>
 *
 * A rule naming a field or page the form does not contain is a structural error, raised when the
 * rule is reached.
 */
@Component
public class NavigationResolver {

  private static final Logger log = LoggerFactory.getLogger(NavigationResolver.class);

  private final OperatorEvaluator operatorEvaluator;

  public NavigationResolver(OperatorEvaluator operatorEvaluator) {
    this.operatorEvaluator = operatorEvaluator;
  }

  public NavigationDecision resolve(
      FormStructure form, FormPage currentPage, Map<String, Object> answers) {
    for (var rule : currentPage.navigationRules()) {
      if (rule.isDefault()) {
        continue;
      }
      if (matches(form, rule, answers)) {
        long target = requireTarget(form, currentPage, rule);
        log.debug(
            "Page {} -> page {} by rule on field {}",
            currentPage.id(),
            target,
            rule.sourceFieldId());
        return NavigationDecision.goTo(target, Reason.RULE_MATCH);
      }
    }

    var defaultRule = currentPage.defaultRule();
    if (defaultRule.isPresent()) {
      Long target = defaultRule.get().targetPageId();
      if (target == null) {
        log.debug("Page {} completes the form by default rule", currentPage.id());
        return NavigationDecision.complete(Reason.DEFAULT_RULE);
      }
      form.requirePage(target);
      log.debug("Page {} -> page {} by default rule", currentPage.id(), target);
      return NavigationDecision.goTo(target, Reason.DEFAULT_RULE);
    }

    return form.nextPageAfter(currentPage)
        .map(next -> NavigationDecision.goTo(next.id(), Reason.STRUCTURAL_ORDER))
        .orElseGet(() -> NavigationDecision.complete(Reason.LAST_PAGE));
  }

  private boolean matches(FormStructure form, NavigationRule rule, Map<String, Object> answers) {
    if (rule.sourceFieldId() == null) {
      throw new StructuralReferenceException(
          "field", null, "Conditioned navigation rule has no source field");
    }
    var source = form.requireField(rule.sourceFieldId());
    return operatorEvaluator.evaluate(rule.operator(), answers.get(source.name()), rule.value());
  }

  private long requireTarget(FormStructure form, FormPage currentPage, NavigationRule rule) {
    if (rule.targetPageId() == null) {
      throw new StructuralReferenceException(
          "page",
          null,
          "Navigation rule on page " + currentPage.id() + " matched but has no target page");
    }
    return form.requirePage(rule.targetPageId()).id();
  }
}
