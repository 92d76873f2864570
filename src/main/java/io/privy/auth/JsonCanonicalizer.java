package io.privy.auth;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Serializes JSON trees following the JSON Canonicalization Scheme (RFC 8785), so that a verifier computing the same
 * serialization over the same logical document gets the same bytes.
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc8785">RFC 8785</a>
 *
 * @author Privy Engineering
 */
public final class JsonCanonicalizer {
   private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

   private JsonCanonicalizer() {
   }

   public static String canonicalize(JsonNode node) {
      return appendValue(node, new StringBuilder()).toString();
   }

   public static byte[] canonicalBytes(JsonNode node) {
      return canonicalize(node).getBytes(StandardCharsets.UTF_8);
   }

   static StringBuilder appendValue(JsonNode node, StringBuilder builder) {
      if (node == null) {
         throw new CanonicalizationException("Cannot canonicalize a missing value");
      }
      switch (node.getNodeType()) {
         case OBJECT:
            return appendObject(node, builder);
         case ARRAY:
            return appendArray(node, builder);
         case STRING:
            return appendString(node.textValue(), builder);
         case NUMBER:
            return appendNumber(node, builder);
         case BOOLEAN:
            return builder.append(node.booleanValue() ? "true" : "false");
         case NULL:
            return builder.append("null");
         default:
            throw new CanonicalizationException("Value of type " + node.getNodeType() + " has no JSON representation");
      }
   }

   static StringBuilder appendObject(JsonNode node, StringBuilder builder) {
      // String.compareTo orders by UTF-16 code units, which is the ordering RFC 8785 prescribes
      SortedMap<String, JsonNode> sortedMembers = new TreeMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
         Map.Entry<String, JsonNode> field = fields.next();
         sortedMembers.put(field.getKey(), field.getValue());
      }

      builder.append('{');
      boolean first = true;
      for (Map.Entry<String, JsonNode> member : sortedMembers.entrySet()) {
         if (!first) {
            builder.append(',');
         }
         first = false;
         appendString(member.getKey(), builder).append(':');
         appendValue(member.getValue(), builder);
      }
      return builder.append('}');
   }

   static StringBuilder appendArray(JsonNode node, StringBuilder builder) {
      builder.append('[');
      for (int i = 0; i < node.size(); i++) {
         if (i > 0) {
            builder.append(',');
         }
         appendValue(node.get(i), builder);
      }
      return builder.append(']');
   }

   static StringBuilder appendString(String value, StringBuilder builder) {
      builder.append('"');
      for (int i = 0; i < value.length(); i++) {
         char c = value.charAt(i);
         switch (c) {
            case '"':
               builder.append("\\\"");
               break;
            case '\\':
               builder.append("\\\\");
               break;
            case '\b':
               builder.append("\\b");
               break;
            case '\f':
               builder.append("\\f");
               break;
            case '\n':
               builder.append("\\n");
               break;
            case '\r':
               builder.append("\\r");
               break;
            case '\t':
               builder.append("\\t");
               break;
            default:
               if (c < 0x20) {
                  builder.append("\\u00").append(HEX_CHARS[c >>> 4]).append(HEX_CHARS[c & 0x0F]);
               } else if (Character.isHighSurrogate(c)) {
                  if (i + 1 >= value.length() || !Character.isLowSurrogate(value.charAt(i + 1))) {
                     throw new CanonicalizationException("String contains an unpaired surrogate at index " + i);
                  }
                  builder.append(c).append(value.charAt(++i));
               } else if (Character.isLowSurrogate(c)) {
                  throw new CanonicalizationException("String contains an unpaired surrogate at index " + i);
               } else {
                  builder.append(c);
               }
         }
      }
      return builder.append('"');
   }

   static StringBuilder appendNumber(JsonNode node, StringBuilder builder) {
      if (node.isIntegralNumber()) {
         return builder.append(node.bigIntegerValue().toString());
      }
      return builder.append(formatDouble(node.doubleValue()));
   }

   /**
    * Formats a double the way ECMAScript's Number.prototype.toString does, which is what RFC 8785 requires.
    */
   static String formatDouble(double value) {
      if (Double.isNaN(value) || Double.isInfinite(value)) {
         throw new CanonicalizationException("Non-finite number " + value + " cannot be canonicalized");
      }
      if (value == 0.0d) {
         // covers -0.0 as well
         return "0";
      }

      BigDecimal decimal = shortestDecimal(Math.abs(value));
      String digits = decimal.unscaledValue().toString();
      int k = digits.length();
      int n = k - decimal.scale();

      StringBuilder result = new StringBuilder();
      if (value < 0) {
         result.append('-');
      }
      if (k <= n && n <= 21) {
         result.append(digits);
         for (int i = 0; i < n - k; i++) {
            result.append('0');
         }
      } else if (0 < n && n <= 21) {
         result.append(digits, 0, n).append('.').append(digits, n, k);
      } else if (-6 < n && n <= 0) {
         result.append("0.");
         for (int i = 0; i < -n; i++) {
            result.append('0');
         }
         result.append(digits);
      } else {
         int exponent = n - 1;
         result.append(digits.charAt(0));
         if (k > 1) {
            result.append('.').append(digits, 1, k);
         }
         result.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
      }
      return result.toString();
   }

   /**
    * Finds the decimal with the fewest significant digits that reads back as {@code value}. Rounding the exact binary
    * value to nearest picks, among candidates of that length, the one closest to it.
    */
   static BigDecimal shortestDecimal(double value) {
      BigDecimal exact = new BigDecimal(value);
      for (int precision = 1; precision < 17; precision++) {
         BigDecimal candidate = exact.round(new MathContext(precision));
         if (candidate.doubleValue() == value) {
            return candidate.stripTrailingZeros();
         }
      }
      // 17 significant digits always round-trip
      return exact.round(new MathContext(17)).stripTrailingZeros();
   }
}
