/**
 * Micrometer binding for {@link io.recall.spi.MetricsExporter}.
 */
package io.recall.micrometer;
