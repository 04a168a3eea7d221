package org.fairswap.repository;

public interface RepositoryFactory {

	public boolean wasPristineAtOpen();

	public Repository getRepository() throws DataException;

	public void close() throws DataException;

}
