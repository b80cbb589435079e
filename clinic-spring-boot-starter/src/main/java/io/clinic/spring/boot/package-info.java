/**
 * Spring Boot auto-configuration for the clinic core, bound to {@code clinic.*} properties.
 */
package io.clinic.spring.boot;
