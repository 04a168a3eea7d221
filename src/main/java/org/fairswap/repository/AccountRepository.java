package org.fairswap.repository;

import java.util.List;

import org.fairswap.data.account.AccountBalanceData;

public interface AccountRepository {

	/** Returns balance, or 0 if account has no entry for ledger. */
	public long getBalance(String address, String ledger) throws DataException;

	public List<AccountBalanceData> getBalances(String address) throws DataException;

	/**
	 * Adjusts balance by <tt>delta</tt>.
	 *
	 * @throws DataException if resulting balance would be negative
	 */
	public void modifyBalance(String address, String ledger, long delta) throws DataException;

}
