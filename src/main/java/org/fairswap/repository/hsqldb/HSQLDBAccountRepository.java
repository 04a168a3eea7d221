package org.fairswap.repository.hsqldb;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.fairswap.data.account.AccountBalanceData;
import org.fairswap.repository.AccountRepository;
import org.fairswap.repository.DataException;
import org.fairswap.utils.Amounts;

public class HSQLDBAccountRepository implements AccountRepository {

	protected HSQLDBRepository repository;

	public HSQLDBAccountRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	@Override
	public long getBalance(String address, String ledger) throws DataException {
		String sql = "SELECT balance FROM AccountBalances WHERE account = ? AND ledger = ? LIMIT 1";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, address, ledger)) {
			if (resultSet == null)
				return 0L;

			return resultSet.getLong(1);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch account balance from repository", e);
		}
	}

	@Override
	public List<AccountBalanceData> getBalances(String address) throws DataException {
		String sql = "SELECT ledger, balance FROM AccountBalances WHERE account = ? ORDER BY ledger";

		List<AccountBalanceData> balances = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, address)) {
			if (resultSet == null)
				return balances;

			do {
				String ledger = resultSet.getString(1);
				long balance = resultSet.getLong(2);

				balances.add(new AccountBalanceData(address, ledger, balance));
			} while (resultSet.next());

			return balances;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch account balances from repository", e);
		}
	}

	@Override
	public void modifyBalance(String address, String ledger, long delta) throws DataException {
		long newBalance;
		try {
			newBalance = Amounts.add(this.getBalance(address, ledger), delta);
		} catch (ArithmeticException e) {
			throw new DataException(String.format("Balance overflow for %s on %s", address, ledger), e);
		}

		if (newBalance < 0)
			throw new DataException(String.format("Refusing to set negative balance for %s on %s", address, ledger));

		HSQLDBSaver saveHelper = new HSQLDBSaver("AccountBalances");

		saveHelper.bind("account", address)
				.bind("ledger", ledger)
				.bind("balance", newBalance);

		try {
			saveHelper.execute(this.repository);
		} catch (SQLException e) {
			throw new DataException("Unable to save account balance into repository", e);
		}
	}

}
