package org.fairswap.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import org.bouncycastle.crypto.digests.RIPEMD160Digest;
import org.fairswap.utils.Base58;

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Longs;

public abstract class Crypto {

	public static final byte ADDRESS_VERSION = 36; // F
	public static final byte ESCROW_ADDRESS_VERSION = 33; // E

	/** Version byte + RIPEMD160 hash + 4-byte checksum */
	public static final int ADDRESS_LENGTH = 1 + 20 + 4;

	/**
	 * Returns 32-byte SHA-256 digest of message passed in input.
	 *
	 * @param input
	 *            variable-length byte[] message
	 * @return byte[32] digest, or null if input is null
	 */
	public static byte[] digest(byte[] input) {
		if (input == null)
			return null;

		try {
			MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
			return sha256.digest(input);
		} catch (NoSuchAlgorithmException e) {
			throw new RuntimeException("SHA-256 message digest not available");
		}
	}

	public static byte[] doubleDigest(byte[] input) {
		return digest(digest(input));
	}

	/** Returns RMD160(SHA256(data)) */
	public static byte[] hash160(byte[] data) {
		byte[] interim = digest(data);

		RIPEMD160Digest md160 = new RIPEMD160Digest();
		md160.update(interim, 0, interim.length);

		byte[] output = new byte[md160.getDigestSize()];
		md160.doFinal(output, 0);
		return output;
	}

	private static String toAddress(byte addressVersion, byte[] input) {
		byte[] addressBytes = Bytes.concat(new byte[] { addressVersion }, hash160(input));

		byte[] checksum = Arrays.copyOf(doubleDigest(addressBytes), 4);

		return Base58.encode(Bytes.concat(addressBytes, checksum));
	}

	/** Returns party address derived from public key (or any identifying bytes). */
	public static String toAddress(byte[] publicKey) {
		return toAddress(ADDRESS_VERSION, publicKey);
	}

	/**
	 * Returns deterministic escrow address for swap.
	 * <p>
	 * <tt>label</tt> distinguishes different escrow accounts belonging to the same swap,
	 * e.g. collateral versus each party's deposit.
	 */
	public static String toEscrowAddress(long swapId, String label) {
		byte[] seed = Bytes.concat(Longs.toByteArray(swapId), label.getBytes(StandardCharsets.UTF_8));
		return toAddress(ESCROW_ADDRESS_VERSION, seed);
	}

	public static boolean isValidAddress(String address) {
		return isValidTypedAddress(address, ADDRESS_VERSION);
	}

	public static boolean isValidEscrowAddress(String address) {
		return isValidTypedAddress(address, ESCROW_ADDRESS_VERSION);
	}

	private static boolean isValidTypedAddress(String address, byte addressVersion) {
		if (address == null)
			return false;

		byte[] addressBytes = Base58.decode(address);
		if (addressBytes == null || addressBytes.length != ADDRESS_LENGTH)
			return false;

		if (addressBytes[0] != addressVersion)
			return false;

		byte[] addressWithoutChecksum = Arrays.copyOf(addressBytes, ADDRESS_LENGTH - 4);
		byte[] passedChecksum = Arrays.copyOfRange(addressBytes, ADDRESS_LENGTH - 4, ADDRESS_LENGTH);

		byte[] generatedChecksum = Arrays.copyOf(doubleDigest(addressWithoutChecksum), 4);
		return Arrays.equals(passedChecksum, generatedChecksum);
	}

}
