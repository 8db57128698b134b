package avatar.tools.graph;

/**
 * No eligible file was found under any configured source root.
 */
public final class EmptyDiscoveryException extends RuntimeException {

    public EmptyDiscoveryException(String message) {
        super(message);
    }
}
