package com.telegram.geolocation.exception;

/** Exception thrown when a message file cannot be read or written during batch processing. */
public class GeolocationProcessingException extends RuntimeException {

  public GeolocationProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
