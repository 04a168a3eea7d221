package org.fairswap.utils;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Base58 encoding as used for account addresses.
 * <p>
 * Alphabet omits 0, O, I and l to avoid visual ambiguity.
 */
public abstract class Base58 {

	private static final char[] ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
	private static final BigInteger BASE = BigInteger.valueOf(58);
	private static final int[] INDEXES = new int[128];

	static {
		Arrays.fill(INDEXES, -1);

		for (int i = 0; i < ALPHABET.length; ++i)
			INDEXES[ALPHABET[i]] = i;
	}

	public static String encode(byte[] input) {
		if (input == null || input.length == 0)
			return "";

		// Leading zero bytes are encoded as leading '1's
		int leadingZeros = 0;
		while (leadingZeros < input.length && input[leadingZeros] == 0)
			++leadingZeros;

		StringBuilder output = new StringBuilder(input.length * 2);
		BigInteger value = new BigInteger(1, input);

		while (value.signum() > 0) {
			BigInteger[] quotientAndRemainder = value.divideAndRemainder(BASE);
			output.append(ALPHABET[quotientAndRemainder[1].intValue()]);
			value = quotientAndRemainder[0];
		}

		for (int i = 0; i < leadingZeros; ++i)
			output.append(ALPHABET[0]);

		return output.reverse().toString();
	}

	/**
	 * Decodes Base58 string.
	 *
	 * @return decoded bytes, or null if input contains non-Base58 characters
	 */
	public static byte[] decode(String input) {
		if (input == null)
			return null;

		if (input.isEmpty())
			return new byte[0];

		BigInteger value = BigInteger.ZERO;
		int leadingOnes = 0;
		boolean countingOnes = true;

		for (int i = 0; i < input.length(); ++i) {
			char c = input.charAt(i);
			int digit = c < 128 ? INDEXES[c] : -1;
			if (digit < 0)
				return null;

			if (countingOnes && digit == 0)
				++leadingOnes;
			else
				countingOnes = false;

			value = value.multiply(BASE).add(BigInteger.valueOf(digit));
		}

		byte[] valueBytes = value.signum() == 0 ? new byte[0] : value.toByteArray();

		// Strip sign byte added by BigInteger
		int stripSign = valueBytes.length > 1 && valueBytes[0] == 0 ? 1 : 0;

		byte[] output = new byte[leadingOnes + valueBytes.length - stripSign];
		System.arraycopy(valueBytes, stripSign, output, leadingOnes, valueBytes.length - stripSign);

		return output;
	}

}
