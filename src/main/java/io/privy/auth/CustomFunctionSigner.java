package io.privy.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates signing to a {@link CustomSignFunction}. The returned signature is not verified; only its shape is
 * checked.
 *
 * @author Privy Engineering
 */
public final class CustomFunctionSigner implements SigningStrategy {
   private static final Logger LOG = LoggerFactory.getLogger(CustomFunctionSigner.class);

   private final CustomSignFunction signFunction;

   public CustomFunctionSigner(CustomSignFunction signFunction) {
      if (signFunction == null) {
         throw new IllegalArgumentException("signFunction must not be null");
      }
      this.signFunction = signFunction;
   }

   @Override
   public SignatureResult sign(SignablePayload payload) {
      LOG.trace("Calling custom sign function for {} {}", payload.getMethod(), payload.getUrl());
      SignatureResult result;
      try {
         result = signFunction.sign(payload.getMethod(), payload.getUrl(), payload.getBody(), payload.getAppId());
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new SigningFailedException("Custom sign function was interrupted", e);
      } catch (Exception e) {
         throw new SigningFailedException("Custom sign function failed: " + e.getMessage(), e);
      }

      if (result == null) {
         throw new InvalidSignerResultException("Custom sign function returned no result");
      }
      if (result.getSignature() == null || result.getSignature().isEmpty()) {
         throw new InvalidSignerResultException("Custom sign function returned an empty signature");
      }
      return result;
   }

   @Override
   public String toString() {
      return "CustomFunctionSigner";
   }
}
