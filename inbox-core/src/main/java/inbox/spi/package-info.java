/**
 * Service-provider interfaces: persistence ({@link inbox.spi.InboxStore},
 * {@link inbox.spi.ConnectionProvider}), the external collaborators
 * ({@link inbox.spi.UpdateSource}, {@link inbox.spi.ConnectivityProbe}) and
 * observability ({@link inbox.spi.MetricsExporter}).
 */
package inbox.spi;
