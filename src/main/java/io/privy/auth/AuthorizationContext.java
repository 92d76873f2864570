package io.privy.auth;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, immutable set of signing strategies used to authorize Privy API requests.
 * <p>
 * A context is created once with {@link #builder()} and may then be used by any number of concurrent requests.
 * Signatures are produced in the order the strategies were added. Generation is all-or-nothing: if one strategy
 * fails, no signatures are returned and the failure identifies the strategy by its index.
 *
 * <pre>
 * AuthorizationContext context = AuthorizationContext.builder()
 *       .addAuthorizationPrivateKey("wallet-auth:MIGHAgEAMBMGByqGSM49...")
 *       .addSignature(precomputedSignature)
 *       .build();
 * </pre>
 *
 * @author Privy Engineering
 */
public final class AuthorizationContext {
   private static final Logger LOG = LoggerFactory.getLogger(AuthorizationContext.class);

   public static final String SIGNATURE_DELIMITER = ",";

   private final List<SigningStrategy> strategies;

   private AuthorizationContext(List<SigningStrategy> strategies) {
      this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
   }

   public static Builder builder() {
      return new Builder();
   }

   /**
    * @return an empty context, for which no signatures are required
    */
   public static AuthorizationContext empty() {
      return new AuthorizationContext(Collections.<SigningStrategy>emptyList());
   }

   public boolean hasSigningMethods() {
      return !strategies.isEmpty();
   }

   public int size() {
      return strategies.size();
   }

   public List<SigningStrategy> getStrategies() {
      return strategies;
   }

   /**
    * Signs a request whose only Privy header is the app id.
    *
    * @return the base64 encoded signatures, one per strategy, in the order the strategies were added
    * @throws AuthorizationException if the body cannot be canonicalized or any strategy fails
    */
   public List<String> generateSignatures(String method, String url, JsonNode body, String appId) {
      return generateSignatures(SignablePayload.of(method, url, body, appId));
   }

   public List<String> generateSignatures(SignablePayload payload) {
      List<SignatureResult> results = generateSignatureResults(payload);
      List<String> signatures = new ArrayList<>(results.size());
      for (SignatureResult result : results) {
         signatures.add(result.getSignature());
      }
      return Collections.unmodifiableList(signatures);
   }

   /**
    * Like {@link #generateSignatures(SignablePayload)}, keeping the signer public keys the strategies reported.
    */
   public List<SignatureResult> generateSignatureResults(SignablePayload payload) {
      if (strategies.isEmpty()) {
         return Collections.emptyList();
      }
      LOG.debug("Generating {} signature(s) for {} {}", strategies.size(), payload.getMethod(), payload.getUrl());

      // fail on a bad body before any strategy, in particular a remote one, is invoked
      payload.canonicalBytes();

      List<SignatureResult> results = new ArrayList<>(strategies.size());
      for (int i = 0; i < strategies.size(); i++) {
         results.add(sign(i, payload));
      }
      return Collections.unmodifiableList(results);
   }

   private SignatureResult sign(int index, SignablePayload payload) {
      SigningStrategy strategy = strategies.get(index);
      try {
         SignatureResult result = strategy.sign(payload);
         if (result == null || result.getSignature() == null || result.getSignature().isEmpty()) {
            throw new InvalidSignerResultException(strategy + " produced no signature");
         }
         return result;
      } catch (AuthorizationException e) {
         LOG.debug("{} at index {} failed: {}", strategy, index, e.getMessage());
         throw e.atStrategy(index);
      } catch (RuntimeException e) {
         throw new SigningFailedException(strategy + " failed unexpectedly", e).atStrategy(index);
      }
   }

   /**
    * Joins signatures into the value of the {@value SignablePayload#SIGNATURE_HEADER} header.
    */
   public static String authorizationHeaderValue(List<String> signatures) {
      return String.join(SIGNATURE_DELIMITER, signatures);
   }

   @Override
   public String toString() {
      return "AuthorizationContext" + strategies;
   }

   /**
    * Collects signing strategies for an {@link AuthorizationContext}. Not thread safe; intended for configuration at
    * startup.
    */
   public static final class Builder {
      private final List<SigningStrategy> strategies = new ArrayList<>();

      Builder() {
      }

      /**
       * Adds a base64 encoded P-256 private key, with or without the {@value PrivateKeySigner#KEY_PREFIX} prefix.
       */
      public Builder addAuthorizationPrivateKey(String privateKey) {
         return addStrategy(new PrivateKeySigner(privateKey));
      }

      /**
       * Adds a user JWT. Signing with user JWTs is not available yet; generating signatures with a context that holds
       * one fails with {@link SigningNotImplementedException}.
       */
      public Builder addUserJwt(String userJwt) {
         return addStrategy(new DeferredCredentialSigner(userJwt));
      }

      public Builder addCustomSignFunction(CustomSignFunction signFunction) {
         return addStrategy(new CustomFunctionSigner(signFunction));
      }

      /**
       * Same as {@link #addCustomSignFunction(CustomSignFunction)}.
       */
      public Builder setCustomSignFunction(CustomSignFunction signFunction) {
         return addCustomSignFunction(signFunction);
      }

      public Builder addSignature(String signature) {
         return addSignature(signature, null);
      }

      public Builder addSignature(String signature, String signerPublicKey) {
         return addStrategy(new PrecomputedSignature(signature, signerPublicKey));
      }

      public Builder addStrategy(SigningStrategy strategy) {
         if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
         }
         strategies.add(strategy);
         return this;
      }

      public AuthorizationContext build() {
         return new AuthorizationContext(strategies);
      }
   }
}
