package io.privy.auth;

/**
 * One way of producing an authorization signature for a request. Implementations are immutable and may be shared by
 * concurrent requests.
 *
 * @author Privy Engineering
 */
public interface SigningStrategy {

   /**
    * Produces a signature over the given payload.
    *
    * @throws AuthorizationException if no signature can be produced
    */
   SignatureResult sign(SignablePayload payload);
}
