package org.fairswap.repository;

public abstract class RepositoryManager {

	private static RepositoryFactory repositoryFactory = null;

	public static RepositoryFactory getRepositoryFactory() {
		return repositoryFactory;
	}

	public static void setRepositoryFactory(RepositoryFactory newRepositoryFactory) {
		repositoryFactory = newRepositoryFactory;
	}

	public static boolean wasPristineAtOpen() throws DataException {
		if (repositoryFactory == null)
			throw new DataException("No repository available");

		return repositoryFactory.wasPristineAtOpen();
	}

	public static Repository getRepository() throws DataException {
		if (repositoryFactory == null)
			throw new DataException("No repository available");

		return repositoryFactory.getRepository();
	}

	public static void closeRepositoryFactory() throws DataException {
		if (repositoryFactory == null)
			return;

		repositoryFactory.close();
		repositoryFactory = null;
	}

}
