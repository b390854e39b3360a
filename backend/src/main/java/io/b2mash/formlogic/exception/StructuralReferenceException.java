package io.b2mash.formlogic.exception;

import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when the form structure handed to the engine is internally inconsistent: a condition names
 * a field the form does not contain, a navigation rule points at a missing page, and so on. Data
 * problems (odd answer values, unknown operators) never raise this; they evaluate to a non-match.
 */
public class StructuralReferenceException extends ErrorResponseException {

  private static final HttpStatusCode UNPROCESSABLE = HttpStatusCode.valueOf(422);

  private final String referenceKind;
  private final String reference;

  public StructuralReferenceException(String referenceKind, Object reference, String detail) {
    super(UNPROCESSABLE, createProblem(referenceKind, reference, detail), null);
    this.referenceKind = referenceKind;
    this.reference = String.valueOf(reference);
  }

  public String getReferenceKind() {
    return referenceKind;
  }

  public String getReference() {
    return reference;
  }

  private static ProblemDetail createProblem(
      String referenceKind, Object reference, String detail) {
    var problem = ProblemDetail.forStatus(UNPROCESSABLE);
    problem.setTitle("Inconsistent form structure");
    problem.setDetail(detail);
    problem.setProperty("referenceKind", referenceKind);
    problem.setProperty("reference", String.valueOf(reference));
    return problem;
  }
}
