package org.fairswap.repository;

/**
 * A repository session, holding one underlying transaction.
 * <p>
 * Changes are invisible to other sessions until {@link #saveChanges()}.
 */
public interface Repository extends AutoCloseable {

	public SwapRepository getSwapRepository();

	public AccountRepository getAccountRepository();

	public void saveChanges() throws DataException;

	public void discardChanges() throws DataException;

	@Override
	public void close() throws DataException;

}
