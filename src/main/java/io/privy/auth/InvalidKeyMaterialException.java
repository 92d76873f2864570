package io.privy.auth;

/**
 * Thrown when an authorization private key cannot be decoded into a P-256 private key.
 *
 * @author Privy Engineering
 */
public class InvalidKeyMaterialException extends AuthorizationException {

   public InvalidKeyMaterialException(String message) {
      super(message);
   }

   public InvalidKeyMaterialException(String message, Throwable cause) {
      super(message, cause);
   }
}
