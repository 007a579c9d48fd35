/**
 * Root API for cable: a durable publish/subscribe bus embedded in the application, with a
 * JDBC table as its message log and polling as its only coordination mechanism.
 *
 * <h2>Core Design</h2>
 * <p>{@link cable.SolidCable#publish publish} appends a row to the message log and returns
 * its id once the insert is committed. A single {@linkplain cable.poller.MessagePoller poller}
 * reads rows past its cursor on a fixed delay, and the
 * {@linkplain cable.dispatch.MessageDispatcher dispatcher} copies each message into the bounded
 * queue of every matching {@link cable.Subscription}. Each subscription has its own worker
 * thread, so a slow handler only delays itself; when its queue is full, new messages for it
 * are dropped. A {@linkplain cable.purge.RetentionSweeper sweeper} deletes expired rows.
 *
 * <p>Routing is by exact channel name. The channel {@code "*"} is special in both directions:
 * a subscription on it receives everything, and a message published on it reaches everyone.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>cable-core</b>: bus, dispatcher, poller, sweeper and SPIs (zero external deps)</li>
 *   <li><b>cable-jdbc</b>: JDBC message stores (H2, MySQL, PostgreSQL)</li>
 *   <li><b>cable-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>cable-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * @see cable.SolidCable
 * @see cable.spi.MessageStore
 */
package cable;
