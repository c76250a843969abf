/**
 * Service layer containing the channel focus arbitration and its Spring integration.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.focus} - channels, registry and the focus managers</li>
 *   <li>{@code service.arbitration} - the single-worker, two-lane arbitration executor</li>
 *   <li>{@code service.events} - bridge from focus callbacks to Spring application events</li>
 *   <li>{@code service.metrics} - Micrometer counters for focus transitions</li>
 *   <li>{@code service.health} - Actuator health for arbitration workers</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services use constructor injection (not field injection)</li>
 *   <li>Request-level failures are return values, not exceptions</li>
 *   <li>No lock is held while calling observers, trackers or event listeners</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.focusmanager.service;
