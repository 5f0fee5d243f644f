package io.hosthub.backoffice.exception;

/**
 * The generation run as a whole could not execute (e.g. the rule store is unreachable). This is
 * the only failure the invocation trigger should treat as a failed run.
 */
public class EngineFaultException extends RuntimeException {

  public EngineFaultException(String message, Throwable cause) {
    super(message, cause);
  }
}
