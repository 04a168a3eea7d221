package org.fairswap.asset;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fairswap.account.Account;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;
import org.fairswap.repository.RepositoryManager;

/**
 * Ledger whose balances live in this node's own repository.
 * <p>
 * Each call uses its own repository session, committed before returning.
 */
public class RepositoryAssetLedger implements AssetLedger {

	private static final Logger LOGGER = LogManager.getLogger(RepositoryAssetLedger.class);

	private final String name;

	public RepositoryAssetLedger(String name) {
		this.name = name;
	}

	@Override
	public String getName() {
		return this.name;
	}

	@Override
	public boolean transfer(String sender, String recipient, long amount) throws AssetLedgerException {
		if (amount <= 0)
			return false;

		try (final Repository repository = RepositoryManager.getRepository()) {
			Account senderAccount = new Account(repository, sender);
			Account recipientAccount = new Account(repository, recipient);

			if (senderAccount.getBalance(this.name) < amount) {
				LOGGER.debug(() -> String.format("%s refused transfer of %d from %s: insufficient balance", this.name, amount, sender));
				return false;
			}

			senderAccount.modifyBalance(this.name, -amount);
			recipientAccount.modifyBalance(this.name, amount);

			repository.saveChanges();
			return true;
		} catch (DataException e) {
			throw new AssetLedgerException.UnavailableException(String.format("Ledger %s failed transfer", this.name), e);
		}
	}

	@Override
	public long balanceOf(String holder) throws AssetLedgerException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return new Account(repository, holder).getBalance(this.name);
		} catch (DataException e) {
			throw new AssetLedgerException.UnavailableException(String.format("Ledger %s failed balance lookup", this.name), e);
		}
	}

	/**
	 * Adds newly created balance to <tt>address</tt>. For node operators funding accounts.
	 */
	public void credit(String address, long amount) throws AssetLedgerException {
		if (amount <= 0)
			throw new AssetLedgerException("Credit amount must be positive");

		try (final Repository repository = RepositoryManager.getRepository()) {
			new Account(repository, address).modifyBalance(this.name, amount);
			repository.saveChanges();
		} catch (DataException e) {
			throw new AssetLedgerException.UnavailableException(String.format("Ledger %s failed credit", this.name), e);
		}

		LOGGER.info(() -> String.format("Credited %d to %s on %s", amount, address, this.name));
	}

}
