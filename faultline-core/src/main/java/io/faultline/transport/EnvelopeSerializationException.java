package io.faultline.transport;

/**
 * Thrown when an event cannot be serialized into an envelope.
 */
public class EnvelopeSerializationException extends RuntimeException {

  public EnvelopeSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
