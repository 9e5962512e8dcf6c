package inbox.reconnect;

/**
 * Connectivity state tracked by {@link ReconnectionManager}.
 */
public enum ConnectionState {
  /** Last probe succeeded and no recovery is pending. */
  CONNECTED,
  /** Last probe failed, or the last recovery drain failed. */
  DISCONNECTED,
  /** A recovery drain is running after connectivity came back. */
  RECOVERING
}
