package org.fairswap.asset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves ledger names, as declared in swap terms, to ledgers.
 * <p>
 * One ledger is designated for collateral.
 */
public class LedgerRegistry {

	private static final Logger LOGGER = LogManager.getLogger(LedgerRegistry.class);

	private final Map<String, AssetLedger> ledgers = new LinkedHashMap<>();
	private final String collateralLedgerName;

	public LedgerRegistry(String collateralLedgerName) {
		this.collateralLedgerName = collateralLedgerName;
	}

	public synchronized void register(AssetLedger ledger) {
		AssetLedger previous = this.ledgers.put(ledger.getName(), ledger);

		if (previous != null)
			LOGGER.warn(() -> String.format("Ledger %s replaced", ledger.getName()));
		else
			LOGGER.debug(() -> String.format("Registered ledger %s", ledger.getName()));
	}

	public synchronized boolean isKnown(String ledgerName) {
		return ledgerName != null && this.ledgers.containsKey(ledgerName);
	}

	public synchronized AssetLedger getLedger(String ledgerName) throws AssetLedgerException {
		AssetLedger ledger = ledgerName == null ? null : this.ledgers.get(ledgerName);
		if (ledger == null)
			throw new AssetLedgerException.UnknownLedgerException(ledgerName);

		return ledger;
	}

	public String getCollateralLedgerName() {
		return this.collateralLedgerName;
	}

	public AssetLedger getCollateralLedger() throws AssetLedgerException {
		return this.getLedger(this.collateralLedgerName);
	}

	public synchronized Map<String, AssetLedger> getLedgers() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(this.ledgers));
	}

}
