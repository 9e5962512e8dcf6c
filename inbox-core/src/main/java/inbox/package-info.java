/**
 * Root API for the inbox: crash-safe, exactly-once-effective consumption of updates from
 * a long-polling message source.
 *
 * <h2>Core Design</h2>
 * <p>A durable {@linkplain inbox.offset.OffsetStore cursor} records the highest update id
 * whose fate is settled, and an insert-only ledger records every settled update. The
 * {@linkplain inbox.backlog.BacklogProcessor backlog processor} pages through pending
 * updates in ascending id order, routes each to the handler registered for its
 * {@linkplain inbox.Update#kind() kind}, and commits the ledger entry together with the
 * cursor before moving on. A transient handler failure stops the drain in front of the
 * failing update; a permanent failure is recorded and skipped.
 *
 * <p>The {@linkplain inbox.reconnect.ReconnectionManager reconnection manager} probes
 * connectivity periodically and drains once after every outage. The
 * {@linkplain inbox.purge.RetentionSweeper retention sweeper} trims old ledger entries.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>inbox-core</b>: API, SPI, processor, schedulers (zero external deps)</li>
 *   <li><b>inbox-jdbc</b>: cursor/ledger stores for H2, MySQL and PostgreSQL</li>
 *   <li><b>inbox-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>inbox-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store        = JdbcInboxStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var registry     = new DefaultHandlerRegistry()
 *     .register(StandardUpdateKind.MESSAGE, update -> {
 *         System.out.println("Received: " + update.payload());
 *         return HandleResult.success();
 *     });
 *
 * try (Inbox inbox = Inbox.builder()
 *     .connectionProvider(connProvider)
 *     .inboxStore(store)
 *     .updateSource(botClient::getUpdates)
 *     .connectivityProbe(botClient::ping)
 *     .handlerRegistry(registry)
 *     .build()) {
 *   inbox.start();
 *   // ...
 * }
 * }</pre>
 *
 * @see inbox.Inbox
 * @see inbox.Update
 * @see inbox.UpdateHandler
 * @see inbox.HandleResult
 */
package inbox;
