package ca.gc.cra.rigging.validation;

import ca.gc.cra.rigging.hooks.Hook;
import ca.gc.cra.rigging.spi.IdentityService;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * <strong>What:</strong> The validator library used by setting declarations.
 * <p><strong>Why:</strong> CLI flags and configuration files deliver text while programmatic callers
 * pass typed values; every setting funnels both through one coercion rule.</p>
 * <p><strong>Thread-safety:</strong> Returned validators are stateless; the user and group validators
 * delegate to an {@link IdentityService} and may block on system lookups.</p>
 *
 * @since 0.1.0
 */
public final class Validators {
  private static final Validator<Boolean> BOOL = Validators::toBoolean;
  private static final Validator<Integer> POSITIVE_INT = Validators::toPositiveInt;
  private static final Validator<String> STRING = Validators::toStrippedString;

  private Validators() {
    // Utility
  }

  /**
   * Returns the boolean validator.
   *
   * <p>Booleans pass through; text is trimmed and compared case-insensitively against
   * {@code true} and {@code false}.</p>
   *
   * @return boolean validator
   */
  public static Validator<Boolean> bool() {
    return BOOL;
  }

  /**
   * Returns the non-negative integer validator.
   *
   * <p>Booleans count as {@code 0}/{@code 1}; integral numbers are taken by value; text is parsed
   * with {@link Numbers#parseAutoBase(String)}. Negative results are rejected.</p>
   *
   * @return integer validator
   */
  public static Validator<Integer> positiveInt() {
    return POSITIVE_INT;
  }

  /**
   * Returns the string validator: {@code null} passes through, text is stripped.
   *
   * @return string validator
   */
  public static Validator<String> string() {
    return STRING;
  }

  /**
   * Returns a validator accepting hooks whose signature takes exactly {@code arity} arguments.
   *
   * @param arity required parameter count
   * @return hook validator
   */
  public static Validator<Hook> callable(int arity) {
    return raw -> {
      if (!(raw instanceof Hook hook)) {
        throw new ValidationException("Value is not callable: " + raw);
      }
      if (hook.arity() != arity) {
        throw new ValidationException("Value must have an arity of: " + arity);
      }
      return hook;
    };
  }

  /**
   * Returns a validator resolving user ids.
   *
   * <p>{@code null} resolves to the effective uid, digits are taken literally, anything else is
   * looked up as a user name.</p>
   *
   * @param identities identity service used for resolution
   * @return user validator
   */
  public static Validator<Long> user(IdentityService identities) {
    Objects.requireNonNull(identities, "identities");
    return raw -> resolveId(raw, identities::currentEffectiveUid, identities::lookupUserByName,
        "user");
  }

  /**
   * Returns a validator resolving group ids, symmetric to {@link #user(IdentityService)}.
   *
   * @param identities identity service used for resolution
   * @return group validator
   */
  public static Validator<Long> group(IdentityService identities) {
    Objects.requireNonNull(identities, "identities");
    return raw -> resolveId(raw, identities::currentEffectiveGid, identities::lookupGroupByName,
        "group");
  }

  private static Boolean toBoolean(Object raw) {
    if (raw instanceof Boolean value) {
      return value;
    }
    if (!(raw instanceof CharSequence text)) {
      throw new ValidationException("Invalid type for casting: " + raw);
    }
    String normalized = text.toString().strip().toLowerCase(Locale.ROOT);
    if ("true".equals(normalized)) {
      return Boolean.TRUE;
    }
    if ("false".equals(normalized)) {
      return Boolean.FALSE;
    }
    throw new ValidationException("Invalid boolean: " + raw);
  }

  private static Integer toPositiveInt(Object raw) {
    long value;
    if (raw instanceof Boolean flag) {
      value = flag ? 1 : 0;
    } else if (isIntegral(raw)) {
      value = ((Number) raw).longValue();
    } else if (raw instanceof BigInteger big) {
      if (big.bitLength() >= Long.SIZE) {
        throw new ValidationException("Value out of range: " + raw);
      }
      value = big.longValue();
    } else if (raw instanceof CharSequence text) {
      value = Numbers.parseAutoBase(text.toString());
    } else {
      throw new ValidationException("Not an integer: " + raw);
    }
    if (value < 0) {
      throw new ValidationException("Value must be positive: " + value);
    }
    return (int) Numbers.requireRange("value", value, 0, Integer.MAX_VALUE);
  }

  private static boolean isIntegral(Object raw) {
    return raw instanceof Integer
        || raw instanceof Long
        || raw instanceof Short
        || raw instanceof Byte
        || raw instanceof AtomicInteger
        || raw instanceof AtomicLong;
  }

  private static String toStrippedString(Object raw) {
    if (raw == null) {
      return null;
    }
    if (!(raw instanceof CharSequence text)) {
      throw new ValidationException("Not a string: " + raw);
    }
    return text.toString().strip();
  }

  private static Long resolveId(
      Object raw, LongSupplier current, Function<String, OptionalLong> lookup, String kind) {
    if (raw == null) {
      return current.getAsLong();
    }
    if (isIntegral(raw)) {
      return ((Number) raw).longValue();
    }
    if (!(raw instanceof CharSequence)) {
      throw new ValidationException("Invalid " + kind + ": " + raw);
    }
    String name = raw.toString();
    if (Strings.isDigits(name)) {
      try {
        return Long.parseLong(name);
      } catch (NumberFormatException ex) {
        throw new ValidationException("Invalid " + kind + " id: " + name, ex);
      }
    }
    OptionalLong id = lookup.apply(name);
    if (id.isEmpty()) {
      throw new ConfigException(name, "No such " + kind + ": '" + name + "'");
    }
    return id.getAsLong();
  }
}
