package io.b2mash.formlogic.session;

public enum SessionStatus {
  IN_PROGRESS,
  COMPLETED
}
