package io.privy.auth;

import java.util.Objects;

/**
 * A base64 encoded signature, optionally with the public key of the signer.
 *
 * @author Privy Engineering
 */
public final class SignatureResult {
   private final String signature;
   private final String signerPublicKey;

   public SignatureResult(String signature, String signerPublicKey) {
      this.signature = signature;
      this.signerPublicKey = signerPublicKey;
   }

   public static SignatureResult of(String signature) {
      return new SignatureResult(signature, null);
   }

   public String getSignature() {
      return signature;
   }

   /**
    * @return the signer's public key, or null if it was not provided
    */
   public String getSignerPublicKey() {
      return signerPublicKey;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof SignatureResult)) {
         return false;
      }
      SignatureResult that = (SignatureResult) o;
      return Objects.equals(signature, that.signature) && Objects.equals(signerPublicKey, that.signerPublicKey);
   }

   @Override
   public int hashCode() {
      return Objects.hash(signature, signerPublicKey);
   }

   @Override
   public String toString() {
      return "SignatureResult{signerPublicKey=" + signerPublicKey + "}";
   }
}
