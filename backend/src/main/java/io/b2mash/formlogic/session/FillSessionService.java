package io.b2mash.formlogic.session;

import io.b2mash.formlogic.condition.FieldState;
import io.b2mash.formlogic.condition.FieldStateProjector;
import io.b2mash.formlogic.condition.ValueNormalizer;
import io.b2mash.formlogic.config.FormLogicProperties;
import io.b2mash.formlogic.exception.InvalidStateException;
import io.b2mash.formlogic.form.FormRegistry;
import io.b2mash.formlogic.navigation.NavigationDecision;
import io.b2mash.formlogic.navigation.NavigationResolver;
import io.b2mash.formlogic.reference.ReferenceField;
import io.b2mash.formlogic.reference.ReferenceInterpolator;
import io.b2mash.formlogic.reference.ReferenceTokenCodec;
import io.b2mash.formlogic.session.dto.RenderedFieldResponse;
import io.b2mash.formlogic.session.dto.RenderedPageResponse;
import io.b2mash.formlogic.session.dto.SessionResponseEntry;
import io.b2mash.formlogic.session.dto.SessionStatusResponse;
import io.b2mash.formlogic.session.dto.SubmitPageResponse;
import io.b2mash.formlogic.structure.FormPage;
import io.b2mash.formlogic.structure.FormStructure;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a respondent through a registered form: tracks the current page, merges answers, checks
 * required answers on submit and moves to the page the navigation rules pick.
 */
@Service
public class FillSessionService {

  private static final Logger log = LoggerFactory.getLogger(FillSessionService.class);

  private final FormRegistry formRegistry;
  private final FillSessionStore sessionStore;
  private final FieldStateProjector fieldStateProjector;
  private final NavigationResolver navigationResolver;
  private final ReferenceTokenCodec referenceTokenCodec;
  private final ReferenceInterpolator referenceInterpolator;
  private final FormLogicProperties properties;

  public FillSessionService(
      FormRegistry formRegistry,
      FillSessionStore sessionStore,
      FieldStateProjector fieldStateProjector,
      NavigationResolver navigationResolver,
      ReferenceTokenCodec referenceTokenCodec,
      ReferenceInterpolator referenceInterpolator,
      FormLogicProperties properties) {
    this.formRegistry = formRegistry;
    this.sessionStore = sessionStore;
    this.fieldStateProjector = fieldStateProjector;
    this.navigationResolver = navigationResolver;
    this.referenceTokenCodec = referenceTokenCodec;
    this.referenceInterpolator = referenceInterpolator;
    this.properties = properties;
  }

  /**
   * Starts a session on the form's first page. Starting with the id of a live session for the same
   * form resumes it.
   */
  public SessionStatusResponse start(long formId, String requestedSessionId) {
    var form = formRegistry.require(formId);
    String sessionId =
        requestedSessionId != null && !requestedSessionId.isBlank()
            ? requestedSessionId
            : UUID.randomUUID().toString();
    var session = sessionStore.getOrCreate(sessionId, id -> open(form, id));
    if (session.getFormId() != formId) {
      throw new InvalidStateException(
          "Session belongs to another form",
          "Session " + sessionId + " is filling form " + session.getFormId());
    }
    return session.withLock(() -> toStatus(form, session));
  }

  private FillSession open(FormStructure form, String sessionId) {
    var firstPage =
        form.firstPage()
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Form has no pages", "Form " + form.id() + " has no pages"));
    var session = new FillSession(sessionId, form.id(), Instant.now());
    land(form, session, firstPage, new ArrayList<>());
    log.info("Started session {} for form {}", sessionId, form.id());
    return session;
  }

  public SessionStatusResponse getStatus(String sessionId) {
    var session = sessionStore.require(sessionId);
    var form = formRegistry.require(session.getFormId());
    return session.withLock(() -> toStatus(form, session));
  }

  public RenderedPageResponse renderCurrentPage(String sessionId) {
    var session = sessionStore.require(sessionId);
    var form = formRegistry.require(session.getFormId());
    return session.withLock(() -> render(form, session));
  }

  /** Merges edits made on the current page and returns the page's re-projected field states. */
  public List<FieldState> updateAnswers(String sessionId, Map<String, Object> answers) {
    var session = sessionStore.require(sessionId);
    var form = formRegistry.require(session.getFormId());
    return session.withLock(
        () -> {
          requireInProgress(session);
          merge(form, session, answers);
          var page = form.requirePage(session.getCurrentPageId());
          return fieldStateProjector.project(form, page, session.getAnswers().snapshot());
        });
  }

  /**
   * Merges the page's answers, rejects the submit when a visible required field is still empty,
   * then advances to the next page or completes the session. Pages on which every field is skipped
   * are passed over.
   */
  public SubmitPageResponse submitPage(String sessionId, Map<String, Object> answers) {
    var session = sessionStore.require(sessionId);
    var form = formRegistry.require(session.getFormId());
    return session.withLock(
        () -> {
          requireInProgress(session);
          merge(form, session, answers);
          var page = form.requirePage(session.getCurrentPageId());
          var snapshot = session.getAnswers().snapshot();

          var states = fieldStateProjector.project(form, page, snapshot);
          var missing = missingRequired(page, states, snapshot);
          if (!missing.isEmpty()) {
            throw new InvalidStateException(
                "Missing required answers",
                "Required fields have no answer: " + String.join(", ", missing));
          }

          var decision = navigationResolver.resolve(form, page, snapshot);
          var skipped = new ArrayList<Long>();
          if (decision.complete()) {
            session.complete(Instant.now());
          } else {
            land(form, session, form.requirePage(decision.nextPageId()), skipped);
          }
          if (session.isCompleted()) {
            log.info("Session {} completed form {}", session.getId(), form.id());
            return new SubmitPageResponse(
                session.getId(), null, true, List.copyOf(skipped), "Form completed");
          }
          return new SubmitPageResponse(
              session.getId(),
              session.getCurrentPageId(),
              false,
              List.copyOf(skipped),
              "Answers saved");
        });
  }

  /** Non-empty answers with their field's label and type, in structural order. */
  public List<SessionResponseEntry> getResponses(String sessionId) {
    var session = sessionStore.require(sessionId);
    var form = formRegistry.require(session.getFormId());
    return session.withLock(
        () -> {
          var entries = new ArrayList<SessionResponseEntry>();
          for (var field : form.allFields()) {
            Object value = session.getAnswers().get(field.name());
            if (!ValueNormalizer.isEmpty(value)) {
              entries.add(
                  new SessionResponseEntry(
                      field.id(), field.name(), field.label(), field.fieldType(), value));
            }
          }
          return entries;
        });
  }

  public SessionStatusResponse complete(String sessionId) {
    var session = sessionStore.require(sessionId);
    var form = formRegistry.require(session.getFormId());
    return session.withLock(
        () -> {
          if (!session.isCompleted()) {
            session.complete(Instant.now());
            log.info("Session {} marked complete", sessionId);
          }
          return toStatus(form, session);
        });
  }

  /**
   * Enters {@code page}; while every answer-collecting field on it is skipped, keeps navigating
   * from it, up to {@code formlogic.max-skip-chain} pages.
   */
  private void land(FormStructure form, FillSession session, FormPage page, List<Long> skipped) {
    var target = page;
    session.enterPage(target, Instant.now());
    while (isFullySkipped(form, target, session.getAnswers().snapshot())) {
      if (skipped.size() >= properties.maxSkipChain()) {
        log.warn(
            "Session {} stopped on page {} after passing {} skipped pages",
            session.getId(),
            target.id(),
            skipped.size());
        return;
      }
      skipped.add(target.id());
      NavigationDecision decision =
          navigationResolver.resolve(form, target, session.getAnswers().snapshot());
      if (decision.complete()) {
        session.complete(Instant.now());
        return;
      }
      target = form.requirePage(decision.nextPageId());
      session.enterPage(target, Instant.now());
    }
  }

  private boolean isFullySkipped(FormStructure form, FormPage page, Map<String, Object> answers) {
    var states = fieldStateProjector.project(form, page, answers);
    boolean anyAnswerField = false;
    for (int i = 0; i < states.size(); i++) {
      if (page.fields().get(i).isParagraph()) {
        continue;
      }
      anyAnswerField = true;
      if (!states.get(i).isSkipped()) {
        return false;
      }
    }
    return anyAnswerField;
  }

  private List<String> missingRequired(
      FormPage page, List<FieldState> states, Map<String, Object> answers) {
    var missing = new ArrayList<String>();
    for (int i = 0; i < states.size(); i++) {
      var field = page.fields().get(i);
      var state = states.get(i);
      if (field.isParagraph() || !state.isVisible() || !state.isRequired() || state.isSkipped()) {
        continue;
      }
      if (ValueNormalizer.isEmpty(answers.get(field.name()))) {
        missing.add(field.name());
      }
    }
    return missing;
  }

  private void merge(FormStructure form, FillSession session, Map<String, Object> answers) {
    var unknown = new ArrayList<String>();
    for (var entry : answers.entrySet()) {
      var field = form.findFieldByName(entry.getKey());
      if (field.isEmpty() || field.get().isParagraph()) {
        unknown.add(entry.getKey());
      }
    }
    if (!unknown.isEmpty()) {
      throw new InvalidStateException(
          "Unknown fields", "Form " + form.id() + " has no answerable fields: " + unknown);
    }
    session.getAnswers().putAll(answers);
    session.touch(Instant.now());
  }

  private RenderedPageResponse render(FormStructure form, FillSession session) {
    var page = form.requirePage(session.getCurrentPageId());
    var answers = session.getAnswers().snapshot();
    var states = fieldStateProjector.project(form, page, answers);
    var referenceFields = form.allFields().stream().map(ReferenceField::from).toList();

    var fields = new ArrayList<RenderedFieldResponse>();
    for (int i = 0; i < states.size(); i++) {
      var field = page.fields().get(i);
      var state = states.get(i);
      String content = null;
      if (field.isParagraph() && field.defaultValue() != null) {
        String editable = referenceTokenCodec.decode(field.defaultValue(), referenceFields);
        content = referenceInterpolator.interpolate(editable, referenceFields, answers);
      }
      fields.add(
          new RenderedFieldResponse(
              field.id(),
              field.name(),
              field.label(),
              field.fieldType(),
              field.placeholder(),
              field.helpText(),
              field.defaultValue(),
              field.options(),
              content,
              field.isParagraph() ? null : answers.get(field.name()),
              state.isVisible(),
              state.isRequired(),
              state.isEnabled(),
              state.isSkipped()));
    }

    var preview = navigationResolver.resolve(form, page, answers);
    return new RenderedPageResponse(
        session.getId(),
        form.id(),
        form.title(),
        session.getStatus(),
        page.id(),
        page.title(),
        page.description(),
        fields,
        preview.nextPageId(),
        preview.complete(),
        progress(form, session));
  }

  private SessionStatusResponse toStatus(FormStructure form, FillSession session) {
    return new SessionStatusResponse(
        session.getId(),
        session.getFormId(),
        session.getStatus(),
        session.getCurrentPageId(),
        progress(form, session),
        session.getVisited().pageIds(),
        session.getCreatedAt(),
        session.getUpdatedAt(),
        session.getCompletedAt());
  }

  /** Position of the current page in structural order as a percentage; 100 once completed. */
  static double progress(FormStructure form, FillSession session) {
    if (session.isCompleted()) {
      return 100.0;
    }
    int total = form.pages().size();
    if (total == 0) {
      return 0.0;
    }
    var page = form.findPage(session.getCurrentPageId());
    int index = page.map(form::indexOf).orElse(0);
    return BigDecimal.valueOf((index + 1) * 100.0 / total)
        .setScale(2, RoundingMode.HALF_UP)
        .doubleValue();
  }

  private void requireInProgress(FillSession session) {
    if (session.isCompleted()) {
      throw new InvalidStateException(
          "Session completed", "Session " + session.getId() + " is already completed");
    }
  }
}
