package io.privy.auth;

/**
 * Thrown when the underlying cryptographic operation or a custom sign function fails.
 *
 * @author Privy Engineering
 */
public class SigningFailedException extends AuthorizationException {

   public SigningFailedException(String message, Throwable cause) {
      super(message, cause);
   }
}
