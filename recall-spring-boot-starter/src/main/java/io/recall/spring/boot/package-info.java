/**
 * Spring Boot auto-configuration. Configure with {@code recall.*} properties.
 */
package io.recall.spring.boot;
