package org.fairswap.asset;

/**
 * External ledger holding integer balances of a single asset.
 * <p>
 * Swap coordination only ever needs to move balances and read them.
 */
public interface AssetLedger {

	/** Returns name under which this ledger is registered. */
	public String getName();

	/**
	 * Moves <tt>amount</tt> from <tt>sender</tt> to <tt>recipient</tt>.
	 *
	 * @return true if transfer happened, false if ledger refused (e.g. insufficient balance)
	 */
	public boolean transfer(String sender, String recipient, long amount) throws AssetLedgerException;

	public long balanceOf(String holder) throws AssetLedgerException;

}
