package io.privy.auth;

/**
 * Base class of all failures raised while computing authorization signatures.
 * <p>
 * When the failure comes from a signing strategy inside an {@link AuthorizationContext}, that strategy is identified
 * both by its zero-based {@link #getStrategyIndex() index} and its one-based {@link #getStrategyPosition() position}.
 * Messages name the position, so the second of three strategies reads "Signing strategy 2: ...".
 *
 * @author Privy Engineering
 */
public class AuthorizationException extends RuntimeException {
   public static final int NO_STRATEGY = -1;

   private int strategyIndex = NO_STRATEGY;

   public AuthorizationException(String message) {
      super(message);
   }

   public AuthorizationException(String message, Throwable cause) {
      super(message, cause);
   }

   /**
    * @return the index of the strategy that failed, or {@link #NO_STRATEGY} if the failure did not come from a
    * strategy (for example, canonicalization of the payload)
    */
   public int getStrategyIndex() {
      return strategyIndex;
   }

   /**
    * @return the one-based position of the strategy that failed in the order strategies were added, or
    * {@link #NO_STRATEGY}
    */
   public int getStrategyPosition() {
      return strategyIndex == NO_STRATEGY ? NO_STRATEGY : strategyIndex + 1;
   }

   AuthorizationException atStrategy(int index) {
      this.strategyIndex = index;
      return this;
   }

   @Override
   public String getMessage() {
      String message = super.getMessage();
      return strategyIndex == NO_STRATEGY ? message : "Signing strategy " + getStrategyPosition() + ": " + message;
   }
}
