package io.hosthub.backoffice.exception;

/**
 * Thrown when recurrence rule fields are malformed or a requested state change is not allowed.
 * Raised before anything is persisted.
 */
public class ValidationException extends RuntimeException {

  private final String title;
  private final String detail;

  public ValidationException(String title, String detail) {
    super(detail);
    this.title = title;
    this.detail = detail;
  }

  public String getTitle() {
    return title;
  }

  public String getDetail() {
    return detail;
  }
}
