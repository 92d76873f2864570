package io.privy.auth;

/**
 * Thrown when a signing strategy is configured but cannot produce signatures yet, such as user JWT based signing.
 *
 * @author Privy Engineering
 */
public class SigningNotImplementedException extends AuthorizationException {

   public SigningNotImplementedException(String message) {
      super(message);
   }
}
