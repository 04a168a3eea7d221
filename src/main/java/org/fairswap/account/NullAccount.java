package org.fairswap.account;

import org.fairswap.crypto.Crypto;

/**
 * Sentinel account, returned where no real account applies,
 * e.g. asking for the counterparty of someone who isn't in the swap.
 */
public final class NullAccount extends Account {

	public static final byte[] PUBLIC_KEY = new byte[32];
	public static final String ADDRESS = Crypto.toAddress(PUBLIC_KEY);

	public static final NullAccount INSTANCE = new NullAccount();

	private NullAccount() {
		super(null, ADDRESS);
	}

	public static boolean isNull(Account account) {
		return account == null || account instanceof NullAccount;
	}

}
