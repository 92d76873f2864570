package io.privy.auth;

/**
 * Thrown when a {@link CustomSignFunction} returns no result or a result without a signature.
 *
 * @author Privy Engineering
 */
public class InvalidSignerResultException extends AuthorizationException {

   public InvalidSignerResultException(String message) {
      super(message);
   }
}
