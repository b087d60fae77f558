package org.entitybrowser.search.query;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;

/**
 * Compares record values against a query pattern by walking the JSON tree.
 *
 * <p>Strings match exactly by equality and inexactly by case-insensitive containment. Numbers are compared through
 * their canonical decimal text ({@link #numberText(JsonPrimitive)}), booleans as {@code true}/{@code false}, null
 * through {@code "null"}. Arrays and objects match when any element or field
 * value matches; field names never do.</p>
 */
public final class ValueMatcher {
	private static final String NULL_TEXT = "null";
	private static final BigInteger MIN_INTEGER = BigInteger.valueOf(Long.MIN_VALUE);
	private static final BigInteger MAX_INTEGER = new BigInteger("18446744073709551615");
	private static final int MAX_PLAIN_EXPONENT = 16;
	private static final int MIN_PLAIN_EXPONENT = -5;

	private ValueMatcher() {}

	/**
	 * @param pattern the raw pattern; lower-cased here when {@code exact} is false
	 */
	public static boolean matches(JsonElement value, String pattern, boolean exact) {
		return matchesValue(value, normalize(pattern, exact), exact);
	}

	/**
	 * Follows the dot-separated {@code path} from {@code root} and matches the value found at its end. When the walk
	 * reaches an array, the rest of the path is tried against every element.
	 */
	public static boolean matchesField(JsonElement root, String path, String pattern, boolean exact) {
		return matchesFieldParts(root, splitPath(path), 0, normalize(pattern, exact), exact);
	}

	public static String[] splitPath(String path) {
		return path.split("\\.", -1);
	}

	public static String normalize(String pattern, boolean exact) {
		return exact ? pattern : pattern.toLowerCase(Locale.ROOT);
	}

	/**
	 * Same as {@link #matches(JsonElement, String, boolean)} for a pattern already passed through
	 * {@link #normalize(String, boolean)}.
	 */
	public static boolean matchesValue(JsonElement value, String pattern, boolean exact) {
		if (value == null || value.isJsonNull()) {
			return exact ? NULL_TEXT.equals(pattern) : NULL_TEXT.contains(pattern);
		}
		if (value.isJsonArray()) {
			for (JsonElement element : value.getAsJsonArray()) {
				if (matchesValue(element, pattern, exact)) {
					return true;
				}
			}
			return false;
		}
		if (value.isJsonObject()) {
			for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
				if (matchesValue(entry.getValue(), pattern, exact)) {
					return true;
				}
			}
			return false;
		}
		return matchesPrimitive(value.getAsJsonPrimitive(), pattern, exact);
	}

	private static boolean matchesPrimitive(JsonPrimitive primitive, String pattern, boolean exact) {
		String text = primitive.isNumber() ? numberText(primitive) : primitive.getAsString();
		return exact ? text.equals(pattern) : text.toLowerCase(Locale.ROOT).contains(pattern);
	}

	/**
	 * Canonical text of a JSON number. Integer literals within the signed/unsigned 64-bit range print as integers;
	 * everything else prints as the shortest decimal that reads back to the same double, in plain notation with a
	 * trailing {@code .0} when integral ({@code 1.50 -> 1.5}, {@code 1e2 -> 100.0}), and in {@code 1e16} form once the
	 * exponent leaves {@code [-5, 16]}.
	 */
	public static String numberText(JsonPrimitive number) {
		String literal = number.getAsString();
		if (isIntegerLiteral(literal)) {
			BigInteger value = new BigInteger(literal);
			if (value.compareTo(MIN_INTEGER) >= 0 && value.compareTo(MAX_INTEGER) <= 0) {
				return value.toString();
			}
		}
		return doubleText(number.getAsDouble());
	}

	private static boolean isIntegerLiteral(String literal) {
		int start = literal.startsWith("-") ? 1 : 0;
		if (start == literal.length()) {
			return false;
		}
		for (int i = start; i < literal.length(); i++) {
			if (!Character.isDigit(literal.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	static String doubleText(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return Double.toString(value);
		}
		String sign = (value < 0 || (value == 0 && 1 / value < 0)) ? "-" : "";
		if (value == 0) {
			return sign + "0.0";
		}

		BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
		String digits = decimal.unscaledValue().toString();
		int exponent = -decimal.scale();
		// value = 0.digits * 10^position
		int position = digits.length() + exponent;

		StringBuilder out = new StringBuilder(sign);
		if (exponent >= 0 && position <= MAX_PLAIN_EXPONENT) {
			out.append(digits).append("0".repeat(exponent)).append(".0");
		} else if (position > 0 && position <= MAX_PLAIN_EXPONENT) {
			out.append(digits, 0, position).append('.').append(digits, position, digits.length());
		} else if (position > MIN_PLAIN_EXPONENT && position <= 0) {
			out.append("0.").append("0".repeat(-position)).append(digits);
		} else if (digits.length() == 1) {
			out.append(digits).append('e').append(position - 1);
		} else {
			out.append(digits.charAt(0)).append('.').append(digits, 1, digits.length()).append('e').append(position - 1);
		}
		return out.toString();
	}

	public static boolean matchesFieldParts(JsonElement node, String[] parts, int from, String pattern, boolean exact) {
		JsonElement current = node;

		for (int i = from; i < parts.length; i++) {
			if (current.isJsonObject()) {
				JsonObject object = current.getAsJsonObject();
				JsonElement field = object.get(parts[i]);
				if (field == null) {
					return false;
				}
				if (i == parts.length - 1) {
					return matchesValue(field, pattern, exact);
				}
				current = field;
			} else if (current.isJsonArray()) {
				for (JsonElement element : current.getAsJsonArray()) {
					if (matchesFieldParts(element, parts, i, pattern, exact)) {
						return true;
					}
				}
				return false;
			} else {
				return false;
			}
		}
		return false;
	}
}
