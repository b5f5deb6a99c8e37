package io.faultline;

/**
 * Same contract as {@link BeforeSendCallback}, applied only to events whose type is
 * {@link Event#TYPE_TRANSACTION}.
 */
@FunctionalInterface
public interface BeforeSendTransactionCallback {

  Event beforeSendTransaction(Event event);
}
