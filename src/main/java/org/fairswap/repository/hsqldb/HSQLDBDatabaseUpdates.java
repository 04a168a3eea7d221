package org.fairswap.repository.hsqldb;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class HSQLDBDatabaseUpdates {

	private static final Logger LOGGER = LogManager.getLogger(HSQLDBDatabaseUpdates.class);

	/**
	 * Apply any incremental changes to database schema.
	 *
	 * @return true if database was non-existent/empty, false otherwise
	 */
	public static boolean updateDatabase(Connection connection) throws SQLException {
		final boolean wasPristine = fetchDatabaseVersion(connection) == 0;

		while (databaseUpdating(connection))
			incrementDatabaseVersion(connection);

		return wasPristine;
	}

	private static void incrementDatabaseVersion(Connection connection) throws SQLException {
		try (Statement stmt = connection.createStatement()) {
			stmt.execute("UPDATE DatabaseInfo SET version = version + 1");
			connection.commit();
		}
	}

	/**
	 * Fetch current version of database schema.
	 *
	 * @return database version, or 0 if no schema yet
	 */
	private static int fetchDatabaseVersion(Connection connection) throws SQLException {
		try (Statement stmt = connection.createStatement()) {
			if (stmt.execute("SELECT version FROM DatabaseInfo"))
				try (ResultSet resultSet = stmt.getResultSet()) {
					if (resultSet.next())
						return resultSet.getInt(1);
				}
		} catch (SQLException e) {
			// empty database
			LOGGER.trace("No DatabaseInfo table yet");
		}

		return 0;
	}

	/**
	 * Incrementally update database schema, returning whether an update happened.
	 */
	private static boolean databaseUpdating(Connection connection) throws SQLException {
		int databaseVersion = fetchDatabaseVersion(connection);

		try (Statement stmt = connection.createStatement()) {
			switch (databaseVersion) {
				case 0:
					// create from new
					stmt.execute("SET DATABASE SQL NAMES TRUE"); // SQL keywords cannot be used as DB object names, e.g. table names
					stmt.execute("SET DATABASE SQL SYNTAX MYS TRUE"); // Required for INSERT ... ON DUPLICATE KEY UPDATE ... syntax
					stmt.execute("SET DATABASE SQL RESTRICT EXEC TRUE"); // No multiple-statement execute() or DDL/DML executeQuery()
					stmt.execute("SET DATABASE TRANSACTION CONTROL MVCC"); // Use MVCC over default two-phase locking, a-k-a "LOCKS"
					stmt.execute("SET DATABASE DEFAULT TABLE TYPE CACHED");
					stmt.execute("SET DATABASE COLLATION SQL_TEXT NO PAD"); // Do not pad strings to same length before comparison

					stmt.execute("CREATE TABLE DatabaseInfo ( version INTEGER NOT NULL )");
					stmt.execute("INSERT INTO DatabaseInfo VALUES ( 0 )");

					stmt.execute("CREATE TYPE FairSwapAddress AS VARCHAR(40)");
					stmt.execute("CREATE TYPE LedgerName AS VARCHAR(64)");
					stmt.execute("CREATE TYPE EpochMillis AS BIGINT");
					stmt.execute("CREATE TYPE Quantity AS BIGINT");
					break;

				case 1:
					// Swap instances, one row each
					stmt.execute("CREATE TABLE Swaps (swap_id BIGINT GENERATED BY DEFAULT AS IDENTITY, "
							+ "party_a FairSwapAddress NOT NULL, party_b FairSwapAddress NOT NULL, "
							+ "collateral_amount Quantity NOT NULL, stage TINYINT NOT NULL, "
							+ "completed_a BOOLEAN NOT NULL, completed_b BOOLEAN NOT NULL, "
							+ "asset_account_a LedgerName, quantity_a Quantity NOT NULL, "
							+ "asset_account_b LedgerName, quantity_b Quantity NOT NULL, "
							+ "started_when EpochMillis NOT NULL, collateral_when EpochMillis, "
							+ "outcome TINYINT NOT NULL, updated_when EpochMillis NOT NULL, "
							+ "PRIMARY KEY (swap_id))");
					stmt.execute("CREATE INDEX SwapsPartyAIndex ON Swaps (party_a, outcome)");
					stmt.execute("CREATE INDEX SwapsPartyBIndex ON Swaps (party_b, outcome)");
					stmt.execute("CREATE INDEX SwapsOutcomeIndex ON Swaps (outcome)");
					break;

				case 2:
					// Balances for ledgers hosted by this node
					stmt.execute("CREATE TABLE AccountBalances (account FairSwapAddress, ledger LedgerName, "
							+ "balance Quantity NOT NULL, PRIMARY KEY (account, ledger), CHECK (balance >= 0))");
					break;

				default:
					// nothing to do
					return false;
			}
		}

		// database was updated
		LOGGER.info(() -> String.format("HSQLDB repository updated to version %d", databaseVersion + 1));
		return true;
	}

}
