/**
 * Internal helpers: JSON encoding, event ids and daemon thread naming.
 */
package io.faultline.util;
