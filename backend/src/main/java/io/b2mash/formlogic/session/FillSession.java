package io.b2mash.formlogic.session;

import io.b2mash.formlogic.structure.FormPage;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One respondent's progress through a form. All reads and writes go through {@link
 * #withLock(Supplier)} so concurrent requests for the same session are applied one at a time.
 */
public class FillSession {

  private final String id;
  private final long formId;
  private final Instant createdAt;
  private final AnswerSet answers = new AnswerSet();
  private final VisitedFieldRegistry visited = new VisitedFieldRegistry();
  private final ReentrantLock lock = new ReentrantLock();

  private long currentPageId;
  private SessionStatus status = SessionStatus.IN_PROGRESS;
  private Instant updatedAt;
  private Instant completedAt;

  public FillSession(String id, long formId, Instant createdAt) {
    this.id = id;
    this.formId = formId;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public <T> T withLock(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /** Moves the session onto {@code page} and gives every newly reached field an answer slot. */
  public void enterPage(FormPage page, Instant now) {
    this.currentPageId = page.id();
    visited.recordPage(page).forEach(answers::ensurePresent);
    this.updatedAt = now;
  }

  public void complete(Instant now) {
    if (status == SessionStatus.COMPLETED) {
      return;
    }
    this.status = SessionStatus.COMPLETED;
    this.completedAt = now;
    this.updatedAt = now;
  }

  public void touch(Instant now) {
    this.updatedAt = now;
  }

  public boolean isCompleted() {
    return status == SessionStatus.COMPLETED;
  }

  public String getId() {
    return id;
  }

  public long getFormId() {
    return formId;
  }

  public long getCurrentPageId() {
    return currentPageId;
  }

  public SessionStatus getStatus() {
    return status;
  }

  public AnswerSet getAnswers() {
    return answers;
  }

  public VisitedFieldRegistry getVisited() {
    return visited;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }
}
