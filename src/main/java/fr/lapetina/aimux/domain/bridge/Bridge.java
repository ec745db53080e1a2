package fr.lapetina.aimux.domain.bridge;

/**
 * Adapter to one upstream AI provider.
 *
 * <p>Implementations may block; the router runs {@link #send(Dispatch)} on its own dispatch
 * executor and enforces the attempt timeout itself. Implementations must be thread-safe.
 */
public interface Bridge {

    /**
     * Sends one request to the provider using the reserved credential.
     *
     * @param dispatch request, credential and the time the router will wait
     * @return provider response, never null
     * @throws BridgeException with a classified cause when the provider call fails
     */
    BridgeResponse send(Dispatch dispatch);

    /**
     * Cheap liveness check used by active probing.
     *
     * @return true if the provider looks reachable
     */
    boolean healthProbe();

    /**
     * Advertised capabilities and classes. Configuration values take precedence.
     */
    ProviderDescriptor describe();
}
