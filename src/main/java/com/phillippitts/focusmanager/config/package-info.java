/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.focusmanager.config.ArbitrationConfig} - audio and visual focus
 *       managers with their arbitration workers</li>
 *   <li>{@link com.phillippitts.focusmanager.config.ArbitrationMetricsConfig} - Micrometer gauges
 *       for queue depth, throughput and active channels</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - externalized {@code focus.*} properties</li>
 *   <li>{@code config.logging} - MDC propagation onto arbitration workers</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.focusmanager.config;
