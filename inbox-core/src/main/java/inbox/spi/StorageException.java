package inbox.spi;

/**
 * Unchecked exception for persistent-store failures: a connection that cannot be
 * obtained, a statement that fails, a lock that times out.
 *
 * <p>Thrown after the enclosing transaction has been rolled back, so the cursor and
 * ledger are left as they were before the failing operation.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
