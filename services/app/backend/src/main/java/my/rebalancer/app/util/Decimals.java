package my.rebalancer.app.util;

import my.rebalancer.app.domain.InvalidNumberException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts numeric input into {@link BigDecimal} without carrying binary floating point error.
 * Doubles and floats go through their shortest string form, so {@code 0.1d} becomes exactly {@code 0.1}.
 */
public final class Decimals {
	private Decimals() {
	}

	public static BigDecimal toDecimal(Object value) {
		if (value == null) {
			throw new InvalidNumberException("Cannot convert null to a decimal");
		}
		if (value instanceof BigDecimal decimal) {
			return decimal;
		}
		if (value instanceof BigInteger integer) {
			return new BigDecimal(integer);
		}
		if (value instanceof Double || value instanceof Float) {
			return parse(value.toString(), value);
		}
		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return BigDecimal.valueOf(((Number) value).longValue());
		}
		if (value instanceof CharSequence text) {
			return parse(text.toString().trim(), value);
		}
		if (value instanceof Number number) {
			return parse(number.toString(), value);
		}
		throw new InvalidNumberException("Cannot convert " + value.getClass().getSimpleName() + " to a decimal: " + value);
	}

	public static BigDecimal toDecimalOrDefault(Object value, BigDecimal fallback) {
		return value == null ? fallback : toDecimal(value);
	}

	private static BigDecimal parse(String text, Object source) {
		if (text.isEmpty()) {
			throw new InvalidNumberException("Cannot convert an empty value to a decimal");
		}
		try {
			return new BigDecimal(text);
		} catch (NumberFormatException ex) {
			throw new InvalidNumberException("Cannot convert '" + source + "' to a decimal", ex);
		}
	}
}
