package ca.gc.cra.metawriter.domain.dataset;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * <strong>What:</strong> Element types supported by metadata datasets.
 * <p><strong>Why:</strong> Every dataset declares a fixed element type so cached values, fill values, and the
 * persistent array agree on representation.</p>
 * <p><strong>Role:</strong> Domain value shared by {@link DatasetDefinition}, cached datasets, and store adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Provide the default fill value for each type.</li>
 *   <li>Coerce decoded message values ({@link Number}, {@link String}, {@code byte[]}) into the canonical Java
 *       representation ({@link Integer}, {@link Long}, {@link Double}, {@link String}, {@code byte[]}).</li>
 *   <li>Expose the stable wire code used by the store journal.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ElementType {
  /** Fixed-width 32-bit signed integer; fill {@code -1}. */
  INT32((byte) 1, -1),
  /** Fixed-width 64-bit signed integer; fill {@code -1}. */
  INT64((byte) 2, -1L),
  /** UTF-8 string, optionally bounded in bytes; fill {@code ""}. */
  STRING((byte) 3, ""),
  /** Opaque byte payload for datasets whose shape is unknown until first occurrence. */
  BLOB((byte) 4, new byte[0]),
  /** IEEE 754 double; fill {@code NaN}. */
  FLOAT64((byte) 5, Double.NaN);

  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private final byte code;
  private final Object defaultFill;

  ElementType(byte code, Object defaultFill) {
    this.code = code;
    this.defaultFill = defaultFill;
  }

  /**
   * Returns the journal code identifying this type.
   *
   * @return single-byte type code
   */
  public byte code() {
    return code;
  }

  /**
   * Returns the default fill value; byte arrays are copied.
   *
   * @return fill value matching this type
   */
  public Object defaultFill() {
    return defaultFill instanceof byte[] bytes ? bytes.clone() : defaultFill;
  }

  /**
   * Resolves a type from its journal code.
   *
   * @param code journal code
   * @return matching type
   * @throws IllegalArgumentException when the code is unknown
   */
  public static ElementType fromCode(byte code) {
    for (ElementType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown element type code: " + code);
  }

  /**
   * Infers the element type of a decoded value.
   *
   * @param value sample value
   * @return {@link #INT64} for integers that fit 64 bits, {@link #FLOAT64} for other numbers, {@link #STRING} for
   *     text, {@link #BLOB} otherwise
   */
  public static ElementType infer(Object value) {
    if (isFixedWidthIntegral(value)
        || (value instanceof BigInteger big && big.bitLength() < Long.SIZE)) {
      return INT64;
    }
    if (value instanceof Number) {
      return FLOAT64;
    }
    if (value instanceof CharSequence) {
      return STRING;
    }
    return BLOB;
  }

  /**
   * Infers one element type that holds every value of a seed.
   *
   * <p>Integers mixed with other numbers widen to {@link #FLOAT64}; any other disagreement widens to
   * {@link #BLOB}, which stores each element's text. {@code null} elements take the fill value and do not vote.</p>
   *
   * @param values seed values; {@code null} or empty yields {@link #BLOB}
   * @return common element type
   */
  public static ElementType inferAll(List<?> values) {
    ElementType common = null;
    if (values != null) {
      for (Object value : values) {
        if (value == null) {
          continue;
        }
        ElementType next = infer(value);
        if (common == null || common == next) {
          common = next;
        } else if (isNumeric(common) && isNumeric(next)) {
          common = FLOAT64;
        } else {
          return BLOB;
        }
      }
    }
    return common == null ? BLOB : common;
  }

  /**
   * Coerces every value of a seed, failing before any value is kept.
   *
   * @param values seed values
   * @param maxLength byte bound applied to {@link #STRING} values
   * @return coerced values in order
   * @throws IllegalArgumentException when any value cannot represent this type
   */
  public Object[] coerceAll(List<?> values, int maxLength) {
    Object[] coerced = new Object[values.size()];
    for (int i = 0; i < coerced.length; i++) {
      coerced[i] = coerce(values.get(i), maxLength);
    }
    return coerced;
  }

  /**
   * Coerces a decoded value into this type's canonical representation.
   *
   * @param value candidate value; {@code null} maps to the fill value
   * @param maxLength byte bound applied to {@link #STRING} values; non-positive means unbounded
   * @return coerced value
   * @throws IllegalArgumentException when the value cannot represent this type
   */
  public Object coerce(Object value, int maxLength) {
    if (value == null) {
      return defaultFill();
    }
    return switch (this) {
      case INT32 -> {
        long wide = integral(value);
        if (wide < Integer.MIN_VALUE || wide > Integer.MAX_VALUE) {
          throw new IllegalArgumentException("value " + wide + " overflows INT32");
        }
        yield (int) wide;
      }
      case INT64 -> integral(value);
      case STRING -> bound(value instanceof byte[] bytes
          ? new String(bytes, StandardCharsets.UTF_8)
          : value.toString(), maxLength);
      case BLOB -> {
        if (value instanceof byte[] bytes) {
          yield bytes.clone();
        }
        yield value.toString().getBytes(StandardCharsets.UTF_8);
      }
      case FLOAT64 -> floating(value);
    };
  }

  /**
   * Compares two values of this type, treating byte arrays by content.
   *
   * @param left first value
   * @param right second value
   * @return {@code true} when equal
   */
  public boolean same(Object left, Object right) {
    if (left instanceof byte[] a && right instanceof byte[] b) {
      return Arrays.equals(a, b);
    }
    return left == null ? right == null : left.equals(right);
  }

  private static boolean isFixedWidthIntegral(Object value) {
    return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
  }

  private static boolean isNumeric(ElementType type) {
    return type == INT64 || type == FLOAT64;
  }

  private static long integral(Object value) {
    if (isFixedWidthIntegral(value)) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      if (big.compareTo(LONG_MIN) < 0 || big.compareTo(LONG_MAX) > 0) {
        throw new IllegalArgumentException("value " + big + " overflows INT64");
      }
      return big.longValue();
    }
    if (value instanceof BigDecimal decimal) {
      try {
        return decimal.longValueExact();
      } catch (ArithmeticException ex) {
        throw new IllegalArgumentException("value " + decimal + " is not a 64-bit integer", ex);
      }
    }
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (d != Math.rint(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("value " + value + " is not integral");
      }
      // 2^63 itself is out of range; the lower bound -2^63 is exact
      if (d >= 0x1p63 || d < -0x1p63) {
        throw new IllegalArgumentException("value " + value + " overflows INT64");
      }
      return (long) d;
    }
    if (value instanceof CharSequence text) {
      try {
        return Long.parseLong(text.toString().trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("value '" + text + "' is not an integer", ex);
      }
    }
    throw new IllegalArgumentException(
        "value of type " + value.getClass().getSimpleName() + " is not an integer");
  }

  private static double floating(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof CharSequence text) {
      try {
        return Double.parseDouble(text.toString().trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("value '" + text + "' is not a number", ex);
      }
    }
    throw new IllegalArgumentException(
        "value of type " + value.getClass().getSimpleName() + " is not a number");
  }

  private static String bound(String text, int maxLength) {
    if (maxLength <= 0) {
      return text;
    }
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxLength) {
      return text;
    }
    // Drops a trailing partial code point.
    String cut = new String(bytes, 0, maxLength, StandardCharsets.UTF_8);
    if (!cut.isEmpty() && cut.charAt(cut.length() - 1) == '\uFFFD') {
      cut = cut.substring(0, cut.length() - 1);
    }
    return cut;
  }

  /**
   * Returns a lower-case label for logs and CLI output.
   *
   * @return label such as {@code int64}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
