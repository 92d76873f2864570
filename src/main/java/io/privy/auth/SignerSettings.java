package io.privy.auth;

import java.util.function.Function;

/**
 * App id and authorization key, looked up first in system properties, then in environment variables:
 * <ul>
 *    <li>{@value #APP_ID_PROPERTY} or {@value #APP_ID_ENV}</li>
 *    <li>{@value #AUTHORIZATION_KEY_PROPERTY} or {@value #AUTHORIZATION_KEY_ENV} (optional)</li>
 * </ul>
 *
 * @author Privy Engineering
 */
public final class SignerSettings {
   public static final String APP_ID_PROPERTY = "privy.appId";
   public static final String APP_ID_ENV = "PRIVY_APP_ID";
   public static final String AUTHORIZATION_KEY_PROPERTY = "privy.authorizationKey";
   public static final String AUTHORIZATION_KEY_ENV = "PRIVY_AUTHORIZATION_KEY";

   private final String appId;
   private final String authorizationKey;

   public SignerSettings(String appId, String authorizationKey) {
      if (appId == null || appId.trim().isEmpty()) {
         throw new IllegalArgumentException("Privy app id is not configured; set " + APP_ID_PROPERTY + " or "
               + APP_ID_ENV);
      }
      this.appId = appId.trim();
      this.authorizationKey = authorizationKey == null || authorizationKey.trim().isEmpty()
            ? null
            : authorizationKey.trim();
   }

   public static SignerSettings fromEnvironment() {
      return resolve(System::getProperty, System::getenv);
   }

   static SignerSettings resolve(Function<String, String> properties, Function<String, String> environment) {
      return new SignerSettings(
            lookup(properties, environment, APP_ID_PROPERTY, APP_ID_ENV),
            lookup(properties, environment, AUTHORIZATION_KEY_PROPERTY, AUTHORIZATION_KEY_ENV));
   }

   private static String lookup(Function<String, String> properties, Function<String, String> environment,
                                String property, String variable) {
      String value = properties.apply(property);
      return value != null ? value : environment.apply(variable);
   }

   public String getAppId() {
      return appId;
   }

   /**
    * @return the authorization private key, or null if requests should not be signed
    */
   public String getAuthorizationKey() {
      return authorizationKey;
   }

   /**
    * @return a context signing with the authorization key, or an empty context if there is none
    */
   public AuthorizationContext toAuthorizationContext() {
      return authorizationKey == null
            ? AuthorizationContext.empty()
            : AuthorizationContext.builder().addAuthorizationPrivateKey(authorizationKey).build();
   }

   @Override
   public String toString() {
      return "SignerSettings{appId=" + appId + ", authorizationKey=" + (authorizationKey == null ? "none" : "***")
            + "}";
   }
}
