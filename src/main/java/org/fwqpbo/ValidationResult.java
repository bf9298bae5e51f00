package org.fwqpbo;

/**
 * Outcome of a dataset validation: pass, or fail with a human-readable reason.
 */
public class ValidationResult {
  private static final ValidationResult PASSED = new ValidationResult(true, null);

  public final boolean valid;
  public final String reason;

  private ValidationResult(boolean valid, String reason) {
    this.valid = valid;
    this.reason = reason;
  }

  public static ValidationResult pass() {
    return PASSED;
  }

  public static ValidationResult fail(String reason) {
    return new ValidationResult(false, reason);
  }

  @Override
  public String toString() {
    return valid ? "valid" : "invalid: " + reason;
  }
}
