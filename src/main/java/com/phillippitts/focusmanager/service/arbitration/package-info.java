/**
 * Serialized execution of arbitration requests.
 *
 * <p>{@link com.phillippitts.focusmanager.service.arbitration.SerialArbitrationExecutor} runs
 * every state-changing request of one focus manager on a single worker thread, with an urgent lane
 * for stop requests.
 *
 * @since 1.0
 */
package com.phillippitts.focusmanager.service.arbitration;
