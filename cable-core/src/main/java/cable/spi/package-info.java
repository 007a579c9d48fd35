/**
 * Extension points: the message log store, the connection source, and the metrics hook.
 *
 * @see cable.spi.MessageStore
 * @see cable.spi.ConnectionProvider
 * @see cable.spi.MetricsExporter
 */
package cable.spi;
