package org.fairswap.asset;

@SuppressWarnings("serial")
public class AssetLedgerException extends Exception {

	public AssetLedgerException() {
		super();
	}

	public AssetLedgerException(String message) {
		super(message);
	}

	public AssetLedgerException(String message, Throwable cause) {
		super(message, cause);
	}

	/** Ledger could not be reached, or failed to answer. */
	public static class UnavailableException extends AssetLedgerException {
		public UnavailableException(String message) {
			super(message);
		}

		public UnavailableException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	/** Ledger name not registered. */
	public static class UnknownLedgerException extends AssetLedgerException {
		public UnknownLedgerException(String ledgerName) {
			super("Unknown ledger: " + ledgerName);
		}
	}

}
