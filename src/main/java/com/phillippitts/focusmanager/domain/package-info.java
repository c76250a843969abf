/**
 * Immutable domain types shared by the focus managers and their collaborators.
 *
 * <ul>
 *   <li>{@link com.phillippitts.focusmanager.domain.FocusState} - NONE, BACKGROUND or FOREGROUND</li>
 *   <li>{@link com.phillippitts.focusmanager.domain.ChannelConfiguration} - name/priority entry
 *       used to build a registry</li>
 *   <li>{@link com.phillippitts.focusmanager.domain.ChannelState} - activity record captured on
 *       every real focus change</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.focusmanager.domain;
