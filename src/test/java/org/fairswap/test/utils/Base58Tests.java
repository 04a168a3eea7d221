package org.fairswap.test.utils;

import static org.junit.Assert.*;

import org.junit.Test;
import org.fairswap.utils.Base58;

public class Base58Tests {

	@Test
	public void testKnownEncodings() {
		assertEquals("", Base58.encode(new byte[0]));
		assertEquals("1", Base58.encode(new byte[] { 0 }));
		assertEquals("2", Base58.encode(new byte[] { 1 }));
		assertEquals("z", Base58.encode(new byte[] { 57 }));
		assertEquals("21", Base58.encode(new byte[] { 58 }));
		assertEquals("5Q", Base58.encode(new byte[] { (byte) 0xff }));
	}

	@Test
	public void testLeadingZeros() {
		byte[] input = new byte[] { 0, 0, 1, 2, 3 };
		String encoded = Base58.encode(input);

		assertTrue(encoded.startsWith("11"));
		assertArrayEquals(input, Base58.decode(encoded));
	}

	@Test
	public void testHighBitBytes() {
		byte[] input = new byte[] { (byte) 0x80, 0, (byte) 0xff };
		assertArrayEquals(input, Base58.decode(Base58.encode(input)));
	}

	@Test
	public void testInvalidCharacters() {
		assertNull(Base58.decode(null));
		assertNull(Base58.decode("0"));
		assertNull(Base58.decode("O"));
		assertNull(Base58.decode("I"));
		assertNull(Base58.decode("l"));
		assertNull(Base58.decode("abcé"));
	}

}
