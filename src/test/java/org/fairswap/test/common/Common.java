package org.fairswap.test.common;

import static org.junit.Assert.*;

import java.net.URL;
import java.security.Security;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.fairswap.repository.DataException;
import org.fairswap.repository.RepositoryFactory;
import org.fairswap.repository.RepositoryManager;
import org.fairswap.repository.hsqldb.HSQLDBRepositoryFactory;
import org.fairswap.settings.Settings;
import org.fairswap.utils.NTP;

public class Common {

	static {
		// This must go before any calls to LogManager/Logger
		System.setProperty("java.util.logging.manager", "org.apache.logging.log4j.jul.LogManager");

		Security.insertProviderAt(new BouncyCastleProvider(), 0);
	}

	private static final Logger LOGGER = LogManager.getLogger(Common.class);

	public static final String testConnectionUrl = "jdbc:hsqldb:mem:testdb";
	// For debugging, use this instead to write DB to disk for examination:
	// public static final String testConnectionUrl = "jdbc:hsqldb:file:testdb/swaps;create=true";

	public static final String testSettingsFilename = "test-settings.json";

	static {
		// Load/check settings
		URL testSettingsUrl = Common.class.getClassLoader().getResource(testSettingsFilename);
		assertNotNull("Test settings JSON file not found", testSettingsUrl);
		Settings.fileInstance(testSettingsUrl.getPath());
	}

	private static Map<String, TestAccount> testAccountsByName = new HashMap<>();
	static {
		testAccountsByName.put("alice", new TestAccount(null, "alice"));
		testAccountsByName.put("bob", new TestAccount(null, "bob"));
		testAccountsByName.put("chloe", new TestAccount(null, "chloe"));
		testAccountsByName.put("dilbert", new TestAccount(null, "dilbert"));
	}

	public static TestAccount getTestAccount(String name) {
		TestAccount testAccount = testAccountsByName.get(name);
		assertNotNull(String.format("Unknown test account %s", name), testAccount);
		return testAccount;
	}

	public static List<TestAccount> getTestAccounts() {
		return new ArrayList<>(testAccountsByName.values());
	}

	public static void useSettings(String settingsFilename) throws DataException {
		closeRepository();

		LOGGER.debug(String.format("Using setting file: %s", settingsFilename));
		URL testSettingsUrl = Common.class.getClassLoader().getResource(settingsFilename);
		assertNotNull("Test settings JSON file not found", testSettingsUrl);
		Settings.fileInstance(testSettingsUrl.getPath());

		setRepository();
	}

	public static void useDefaultSettings() throws DataException {
		useSettings(testSettingsFilename);
		NTP.setFixedOffset(Settings.getInstance().getTestNtpOffset());
	}

	@BeforeClass
	public static void setRepository() throws DataException {
		RepositoryFactory repositoryFactory = new HSQLDBRepositoryFactory(testConnectionUrl);
		RepositoryManager.setRepositoryFactory(repositoryFactory);
	}

	@AfterClass
	public static void closeRepository() throws DataException {
		RepositoryManager.closeRepositoryFactory();
	}

}
