package org.fairswap.controller;

import java.io.File;
import java.security.Security;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.fairswap.api.ApiService;
import org.fairswap.asset.LedgerRegistry;
import org.fairswap.asset.RepositoryAssetLedger;
import org.fairswap.repository.DataException;
import org.fairswap.repository.RepositoryFactory;
import org.fairswap.repository.RepositoryManager;
import org.fairswap.repository.hsqldb.HSQLDBRepositoryFactory;
import org.fairswap.settings.Settings;
import org.fairswap.swap.SwapCoordinator;
import org.fairswap.utils.NTP;

/**
 * Node entry point: loads settings, then starts NTP, repository, swap coordinator and API.
 */
public class Controller {

	static {
		// This must go before any calls to LogManager/Logger
		System.setProperty("java.util.logging.manager", "org.apache.logging.log4j.jul.LogManager");
	}

	private static final Logger LOGGER = LogManager.getLogger(Controller.class);
	private static final Object shutdownLock = new Object();
	private static final String repositoryUrlTemplate = "jdbc:hsqldb:file:%s" + File.separator + "swaps;create=true;hsqldb.full_log_replay=true";

	private static Controller instance;

	private volatile boolean isStopping = false;

	private Controller() {
	}

	public static synchronized Controller getInstance() {
		if (instance == null)
			instance = new Controller();

		return instance;
	}

	public static String getRepositoryUrl() {
		return String.format(repositoryUrlTemplate, Settings.getInstance().getRepositoryPath());
	}

	/** Registers a repository-hosted ledger for each configured ledger name. */
	public static LedgerRegistry buildLedgerRegistry(Settings settings) {
		LedgerRegistry ledgers = new LedgerRegistry(settings.getCollateralLedger());

		for (String ledgerName : settings.getLedgers())
			ledgers.register(new RepositoryAssetLedger(ledgerName));

		return ledgers;
	}

	public static void main(String[] args) {
		LOGGER.info("Starting up...");

		Security.insertProviderAt(new BouncyCastleProvider(), 0);

		// Load/check settings
		try {
			if (args.length > 0)
				Settings.fileInstance(args[0]);
			else
				Settings.getInstance();
		} catch (Throwable t) {
			LOGGER.error("Unable to load settings", t);
			System.exit(1);
		}

		LOGGER.info("Starting NTP");
		Long ntpOffset = Settings.getInstance().getTestNtpOffset();
		if (ntpOffset != null)
			NTP.setFixedOffset(ntpOffset);
		else
			NTP.start(Settings.getInstance().getNtpServers());

		LOGGER.info("Starting repository");
		try {
			RepositoryFactory repositoryFactory = new HSQLDBRepositoryFactory(getRepositoryUrl());
			RepositoryManager.setRepositoryFactory(repositoryFactory);

			if (RepositoryManager.wasPristineAtOpen())
				LOGGER.info(() -> String.format("Created new repository at %s", Settings.getInstance().getRepositoryPath()));
		} catch (DataException e) {
			// If exception has no cause then repository is in use by some other process.
			if (e.getCause() == null)
				LOGGER.info("Repository in use by another process?");
			else
				LOGGER.error("Unable to start repository", e);

			NTP.shutdownNow();
			System.exit(1);
		}

		LOGGER.info("Starting swap coordinator");
		LedgerRegistry ledgers = buildLedgerRegistry(Settings.getInstance());
		SwapCoordinator.setInstance(SwapCoordinator.fromSettings(ledgers));

		Runtime.getRuntime().addShutdownHook(new Thread() {
			@Override
			public void run() {
				Thread.currentThread().setName("Shutdown hook");

				Controller.getInstance().shutdown();
			}
		});

		if (Settings.getInstance().isApiEnabled()) {
			LOGGER.info(String.format("Starting API on port %d", Settings.getInstance().getApiPort()));
			try {
				ApiService apiService = ApiService.getInstance();
				apiService.start();
			} catch (Exception e) {
				LOGGER.error("Unable to start API", e);
				System.exit(1);
			}
		}

		LOGGER.info("Started");
	}

	public void shutdown() {
		synchronized (shutdownLock) {
			if (!isStopping) {
				isStopping = true;

				LOGGER.info("Shutting down API");
				ApiService.getInstance().stop();

				try {
					LOGGER.info("Shutting down repository");
					RepositoryManager.closeRepositoryFactory();
				} catch (DataException e) {
					LOGGER.error("Error occurred while shutting down repository", e);
				}

				LOGGER.info("Shutting down NTP");
				NTP.shutdownNow();

				LOGGER.info("Shutdown complete!");
			}
		}
	}

}
