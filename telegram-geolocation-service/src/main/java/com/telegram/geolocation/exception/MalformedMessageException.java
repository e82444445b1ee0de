package com.telegram.geolocation.exception;

/** Exception thrown when an input line is not a usable message record. The line is skipped. */
public class MalformedMessageException extends RuntimeException {

  public MalformedMessageException(String message) {
    super(message);
  }

  public MalformedMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
