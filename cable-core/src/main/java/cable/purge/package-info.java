/**
 * Scheduled retention of the message log.
 *
 * <p>{@link cable.purge.RetentionSweeper} periodically deletes messages older than the
 * retention window, using batch deletes to limit lock duration.
 *
 * @see cable.purge.RetentionSweeper
 */
package cable.purge;
