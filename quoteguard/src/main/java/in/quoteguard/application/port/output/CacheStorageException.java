package in.quoteguard.application.port.output;

/**
 * Thrown when the balance cache store cannot be read or written.
 */
public class CacheStorageException extends RuntimeException {

    private final String tokenAddress;

    public CacheStorageException(String tokenAddress, String message, Throwable cause) {
        super(String.format("[%s] %s", tokenAddress, message), cause);
        this.tokenAddress = tokenAddress;
    }

    public String getTokenAddress() {
        return tokenAddress;
    }
}
