package io.privy.auth;

/**
 * A signature computed out of band. It is returned as is for every payload; callers must supply a new one per
 * request.
 *
 * @author Privy Engineering
 */
public final class PrecomputedSignature implements SigningStrategy {
   private final SignatureResult result;

   public PrecomputedSignature(String signature, String signerPublicKey) {
      if (signature == null || signature.isEmpty()) {
         throw new IllegalArgumentException("signature must not be empty");
      }
      this.result = new SignatureResult(signature, signerPublicKey);
   }

   @Override
   public SignatureResult sign(SignablePayload payload) {
      return result;
   }

   @Override
   public String toString() {
      return "PrecomputedSignature";
   }
}
