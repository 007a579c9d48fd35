/**
 * Persistence-facing row types shared by stores and the poller.
 */
package cable.model;
