/**
 * Spring Boot auto-configuration for the inbox.
 *
 * <p>Provide a {@link inbox.spi.UpdateSource} bean (and optionally a
 * {@link inbox.spi.ConnectivityProbe}), annotate handler beans with
 * {@link inbox.spring.boot.InboxHandler}, and tune behavior with {@code inbox.*} properties.
 */
package inbox.spring.boot;
