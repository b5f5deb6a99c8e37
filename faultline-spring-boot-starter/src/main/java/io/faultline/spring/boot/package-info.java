/**
 * Spring Boot auto-configuration for the faultline client.
 *
 * <p>Setting {@code faultline.dsn} is enough to get a process-wide client; every other
 * {@code faultline.*} property has a default. See
 * {@link io.faultline.spring.boot.FaultlineProperties}.
 *
 * @see io.faultline.spring.boot.FaultlineAutoConfiguration
 * @see io.faultline.spring.boot.FaultlineMicrometerAutoConfiguration
 */
package io.faultline.spring.boot;
