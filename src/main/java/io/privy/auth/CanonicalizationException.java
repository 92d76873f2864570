package io.privy.auth;

/**
 * Thrown when a request body cannot be represented in the canonical JSON form: it is not JSON, or it holds
 * non-finite numbers or values with no JSON representation.
 *
 * @author Privy Engineering
 */
public class CanonicalizationException extends AuthorizationException {

   public CanonicalizationException(String message) {
      super(message);
   }

   public CanonicalizationException(String message, Throwable cause) {
      super(message, cause);
   }
}
