/**
 * Channel focus arbitration.
 *
 * <p>A {@link com.phillippitts.focusmanager.service.focus.FocusManager} owns a fixed
 * {@link com.phillippitts.focusmanager.service.focus.ChannelRegistry}. Interfaces acquire and
 * release {@link com.phillippitts.focusmanager.service.focus.Channel}s; the manager keeps the
 * highest-priority held channel in FOREGROUND and every other held channel in BACKGROUND.
 *
 * <p>Collaborators:
 * <ul>
 *   <li>{@link com.phillippitts.focusmanager.service.focus.ChannelObserver} - owner of one channel</li>
 *   <li>{@link com.phillippitts.focusmanager.service.focus.FocusManagerObserver} - sees every change</li>
 *   <li>{@link com.phillippitts.focusmanager.service.focus.ActivityTracker} - receives one batch of
 *       activity records per operation</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.focusmanager.service.focus;
