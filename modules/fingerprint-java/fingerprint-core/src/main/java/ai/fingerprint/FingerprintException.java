package ai.fingerprint;

/**
 * Pass-level failure: a value could not be interpreted by the profiling strategy it was streamed into.
 */
public class FingerprintException extends RuntimeException {

    public FingerprintException(String message) {
        super(message);
    }

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
