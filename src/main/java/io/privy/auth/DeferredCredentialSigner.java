package io.privy.auth;

/**
 * Signs with a user signing key obtained by exchanging a user JWT.
 * <p>
 * The key exchange is not available yet, so every call to {@link #sign(SignablePayload)} fails.
 *
 * @author Privy Engineering
 */
public final class DeferredCredentialSigner implements SigningStrategy {
   static final String NOT_IMPLEMENTED_MESSAGE = "User JWT-based signing is not yet implemented. "
         + "Please use authorization private keys or a custom sign function instead.";

   private final String userJwt;

   public DeferredCredentialSigner(String userJwt) {
      if (userJwt == null || userJwt.isEmpty()) {
         throw new IllegalArgumentException("userJwt must not be empty");
      }
      this.userJwt = userJwt;
   }

   String getUserJwt() {
      return userJwt;
   }

   @Override
   public SignatureResult sign(SignablePayload payload) {
      throw new SigningNotImplementedException(NOT_IMPLEMENTED_MESSAGE);
   }

   @Override
   public String toString() {
      return "DeferredCredentialSigner";
   }
}
