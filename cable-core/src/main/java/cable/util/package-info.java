/**
 * Internal helpers: metadata JSON codec and daemon thread naming.
 */
package cable.util;
