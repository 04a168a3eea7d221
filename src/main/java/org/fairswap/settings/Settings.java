package org.fairswap.settings;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.concurrent.TimeUnit;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.UnmarshalException;
import javax.xml.bind.Unmarshaller;
import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.transform.stream.StreamSource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.persistence.exceptions.XMLMarshalException;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.UnmarshallerProperties;
import org.fairswap.crypto.Crypto;
import org.fairswap.swap.LateCancelPolicy;
import org.fairswap.swap.OverridePolicyType;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class Settings {

	private static final Logger LOGGER = LogManager.getLogger(Settings.class);
	private static final String SETTINGS_FILENAME = "settings.json";

	// Properties
	private static Settings instance;

	// Settings, and other config files
	private String userPath;

	// Repository
	private String repositoryPath = "db";
	/** Queries that take longer than this are logged. (milliseconds) */
	private Long slowQueryThreshold = null;

	// API-related
	private String bindAddress = "::"; // Use IPv6 wildcard to listen on all local addresses
	private boolean apiEnabled = true;
	private int apiPort = 9191;
	private String[] apiWhitelist = new String[] {
		"::1", "127.0.0.1"
	};
	private String apiKey = null;
	private boolean apiLoggingEnabled = false;

	// Swap protocol
	/** Administrator allowed to invoke manual override, or null for none */
	private String adminAddress = null;
	/** Minimum period after swap start before either party may cancel. (milliseconds) */
	private long cancelDelay = TimeUnit.DAYS.toMillis(1);
	/** Minimum period after swap start before administrator may override. (milliseconds) */
	private long overrideDelay = TimeUnit.DAYS.toMillis(7);
	private LateCancelPolicy lateCancelPolicy = LateCancelPolicy.FORFEIT;
	private OverridePolicyType overridePolicy = OverridePolicyType.NONE;

	// Ledgers
	/** Ledger used for collateral. */
	private String collateralLedger = "native";
	/** Ledgers hosted in our own repository. */
	private String[] ledgers = new String[] {
		"native"
	};

	// NTP sources
	private String[] ntpServers = new String[] {
		"pool.ntp.org",
		"0.pool.ntp.org",
		"1.pool.ntp.org",
		"2.pool.ntp.org",
		"3.pool.ntp.org"
	};
	/** Fixed offset added to values returned by NTP.getTime(), disabling NTP polling */
	private Long testNtpOffset = null;

	// Constructors

	private Settings() {
	}

	// Other methods

	public static synchronized Settings getInstance() {
		if (instance == null)
			fileInstance(SETTINGS_FILENAME);

		return instance;
	}

	/**
	 * Parse settings from given file.
	 * <p>
	 * Throws <tt>RuntimeException</tt> with <tt>UnmarshalException</tt> as cause if settings file could not be parsed.
	 * <p>
	 * We use <tt>RuntimeException</tt> because it can be caught by first caller of {@link #getInstance()} above,
	 * but it's not necessary to surround later {@link #getInstance()} calls
	 * with <tt>try-catch</tt> as they should be read-only.
	 *
	 * @throws RuntimeException with UnmarshalException as cause if settings file could not be parsed
	 * @throws RuntimeException with FileNotFoundException as cause if settings file could not be found/opened
	 * @throws RuntimeException with JAXBException as cause if some unexpected JAXB-related error occurred
	 * @throws RuntimeException with IOException as cause if some unexpected I/O-related error occurred
	 */
	public static void fileInstance(String filename) {
		JAXBContext jc;
		Unmarshaller unmarshaller;

		try {
			// Create JAXB context aware of Settings
			jc = JAXBContextFactory.createContext(new Class[] {
				Settings.class
			}, null);

			unmarshaller = jc.createUnmarshaller();

			// Set the unmarshaller media type to JSON
			unmarshaller.setProperty(UnmarshallerProperties.MEDIA_TYPE, "application/json");

			// Tell unmarshaller that there's no JSON root element in the JSON input
			unmarshaller.setProperty(UnmarshallerProperties.JSON_INCLUDE_ROOT, false);
		} catch (JAXBException e) {
			String message = "Failed to setup unmarshaller to process settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		}

		Settings settings = null;
		String path = "";

		do {
			LOGGER.info(String.format("Using settings file: %s%s", path, filename));

			// Create the StreamSource by creating Reader to the JSON input
			try (Reader settingsReader = new FileReader(path + filename)) {
				StreamSource json = new StreamSource(settingsReader);

				// Attempt to unmarshal JSON stream to Settings
				settings = unmarshaller.unmarshal(json, Settings.class).getValue();
			} catch (FileNotFoundException e) {
				String message = "Settings file not found: " + path + filename;
				LOGGER.error(message, e);
				throw new RuntimeException(message, e);
			} catch (UnmarshalException e) {
				Throwable linkedException = e.getLinkedException();
				if (linkedException instanceof XMLMarshalException) {
					String message = ((XMLMarshalException) linkedException).getInternalException().getLocalizedMessage();
					LOGGER.error(message);
					throw new RuntimeException(message, e);
				}

				String message = "Failed to parse settings file";
				LOGGER.error(message, e);
				throw new RuntimeException(message, e);
			} catch (JAXBException e) {
				String message = "Unexpected JAXB issue while processing settings file";
				LOGGER.error(message, e);
				throw new RuntimeException(message, e);
			} catch (IOException e) {
				String message = "Unexpected I/O issue while processing settings file";
				LOGGER.error(message, e);
				throw new RuntimeException(message, e);
			}

			if (settings.userPath != null) {
				// Adjust filename and go round again
				path = settings.userPath;

				// Add trailing directory separator if needed
				if (!path.endsWith(File.separator))
					path += File.separator;
			}
		} while (settings.userPath != null);

		settings.validate();

		// Minor fix-up
		settings.userPath = path;

		// Successfully read settings now in effect
		instance = settings;
	}

	public static void throwValidationError(String message) {
		throw new RuntimeException(message, new UnmarshalException(message));
	}

	private void validate() {
		if (this.apiKey != null && this.apiKey.trim().length() < 8)
			throwValidationError("apiKey must be at least 8 characters");

		if (this.cancelDelay < 0)
			throwValidationError("cancelDelay must not be negative");

		if (this.overrideDelay <= this.cancelDelay)
			throwValidationError("overrideDelay must be longer than cancelDelay");

		if (this.adminAddress != null && !Crypto.isValidAddress(this.adminAddress))
			throwValidationError("adminAddress is not a valid address");

		if (this.lateCancelPolicy == null)
			throwValidationError("lateCancelPolicy must be FORFEIT or BLOCK");

		if (this.overridePolicy == null)
			throwValidationError("overridePolicy must be NONE or REFUND");

		if (this.collateralLedger == null || this.collateralLedger.isEmpty())
			throwValidationError("collateralLedger must be set");

		if (this.apiPort <= 0 || this.apiPort > 65535)
			throwValidationError("apiPort out of range");
	}

	// Getters / setters

	public String getRepositoryPath() {
		return this.repositoryPath;
	}

	public Long getSlowQueryThreshold() {
		return this.slowQueryThreshold;
	}

	public String getBindAddress() {
		return this.bindAddress;
	}

	public boolean isApiEnabled() {
		return this.apiEnabled;
	}

	public int getApiPort() {
		return this.apiPort;
	}

	public String[] getApiWhitelist() {
		return this.apiWhitelist;
	}

	public String getApiKey() {
		return this.apiKey;
	}

	public boolean isApiLoggingEnabled() {
		return this.apiLoggingEnabled;
	}

	public String getAdminAddress() {
		return this.adminAddress;
	}

	public long getCancelDelay() {
		return this.cancelDelay;
	}

	public long getOverrideDelay() {
		return this.overrideDelay;
	}

	public LateCancelPolicy getLateCancelPolicy() {
		return this.lateCancelPolicy;
	}

	public OverridePolicyType getOverridePolicy() {
		return this.overridePolicy;
	}

	public String getCollateralLedger() {
		return this.collateralLedger;
	}

	public String[] getLedgers() {
		return this.ledgers;
	}

	public String[] getNtpServers() {
		return this.ntpServers;
	}

	public Long getTestNtpOffset() {
		return this.testNtpOffset;
	}

}
