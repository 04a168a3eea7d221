package org.fairswap.account;

import static org.fairswap.utils.Amounts.prettyAmount;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;

/**
 * Account identified by address, with balances on ledgers hosted in our repository.
 */
public class Account {

	private static final Logger LOGGER = LogManager.getLogger(Account.class);

	protected Repository repository;
	protected String address;

	protected Account() {
	}

	/** Construct Account business object using account's address */
	public Account(Repository repository, String address) {
		this.repository = repository;
		this.address = address;
	}

	// Simple getters / setters

	public String getAddress() {
		return this.address;
	}

	// Balance manipulations

	public long getBalance(String ledger) throws DataException {
		return this.repository.getAccountRepository().getBalance(this.address, ledger);
	}

	public void modifyBalance(String ledger, long delta) throws DataException {
		this.repository.getAccountRepository().modifyBalance(this.address, ledger, delta);

		LOGGER.trace(() -> String.format("%s balance on %s adjusted by %s", this.address, ledger, prettyAmount(delta)));
	}

	// Utility methods

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof Account))
			return false;

		return this.address.equals(((Account) other).address);
	}

	@Override
	public int hashCode() {
		return this.address.hashCode();
	}

	@Override
	public String toString() {
		return this.address;
	}

}
