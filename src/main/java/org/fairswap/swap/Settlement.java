package org.fairswap.swap;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fairswap.asset.AssetLedger;
import org.fairswap.asset.AssetLedgerException;
import org.fairswap.asset.LedgerRegistry;
import org.fairswap.event.EventBus;

/**
 * External effects of a swap transition.
 * <p>
 * Built while swap state is being changed. Collections into escrow must succeed before that state is committed,
 * other transfers are only executed once it has been committed.
 * Transfers run in the order added.
 */
public class Settlement {

	private static final Logger LOGGER = LogManager.getLogger(Settlement.class);

	private static class Transfer {
		private final String ledger;
		private final String sender;
		private final String recipient;
		/** null means sender's entire balance */
		private final Long amount;
		private final String reason;

		private Transfer(String ledger, String sender, String recipient, Long amount, String reason) {
			this.ledger = ledger;
			this.sender = sender;
			this.recipient = recipient;
			this.amount = amount;
			this.reason = reason;
		}

		@Override
		public String toString() {
			return String.format("%s: %s of %s from %s to %s", this.reason,
					(this.amount == null ? "all" : String.valueOf(this.amount)), this.ledger, this.sender, this.recipient);
		}
	}

	private final List<Transfer> collections = new ArrayList<>();
	private final List<Transfer> transfers = new ArrayList<>();
	private final List<SwapEvent> events = new ArrayList<>();

	public Settlement addTransfer(String ledger, String sender, String recipient, long amount, String reason) {
		if (amount > 0)
			this.transfers.add(new Transfer(ledger, sender, recipient, amount, reason));

		return this;
	}

	/** Adds payment into escrow, taken before swap state is committed. */
	public Settlement addCollection(String ledger, String sender, String escrow, long amount, String reason) {
		if (amount > 0)
			this.collections.add(new Transfer(ledger, sender, escrow, amount, reason));

		return this;
	}

	public boolean hasCollections() {
		return !this.collections.isEmpty();
	}

	/** Adds transfer of whatever <tt>sender</tt> holds at execution time. */
	public Settlement addSweep(String ledger, String sender, String recipient, String reason) {
		this.transfers.add(new Transfer(ledger, sender, recipient, null, reason));
		return this;
	}

	public Settlement addEvent(SwapEvent event) {
		this.events.add(event);
		return this;
	}

	/**
	 * Takes collections in order.
	 * <p>
	 * <b>Swap state must not yet be committed.</b> If a collection fails, any already taken are handed back.
	 *
	 * @throws SwapException {@link ValidationResult#NO_BALANCE} if a ledger refuses,
	 * or {@link ValidationResult#LEDGER_UNAVAILABLE} if a ledger fails
	 */
	public void executeCollections(LedgerRegistry ledgers) throws SwapException {
		List<Transfer> collected = new ArrayList<>();

		for (Transfer collection : this.collections) {
			boolean accepted;
			try {
				LOGGER.debug(() -> String.format("%s: collecting %d on %s from %s into %s", collection.reason, collection.amount, collection.ledger, collection.sender, collection.recipient));

				accepted = ledgers.getLedger(collection.ledger).transfer(collection.sender, collection.recipient, collection.amount);
			} catch (AssetLedgerException e) {
				// Outcome of this collection is unknown, so only earlier ones are handed back
				LOGGER.error(() -> String.format("Collection failed, swap state unchanged: %s", collection), e);
				returnTransfers(ledgers, collected);
				throw new SwapException(ValidationResult.LEDGER_UNAVAILABLE, e);
			}

			if (!accepted) {
				returnTransfers(ledgers, collected);
				throw new SwapException(ValidationResult.NO_BALANCE, String.format("ledger %s refused %s", collection.ledger, collection));
			}

			collected.add(collection);
		}
	}

	/** Hands back all collections, e.g. when swap state couldn't be committed after all. */
	public void returnCollections(LedgerRegistry ledgers) {
		returnTransfers(ledgers, this.collections);
	}

	private static void returnTransfers(LedgerRegistry ledgers, List<Transfer> transfers) {
		for (Transfer transfer : transfers) {
			try {
				LOGGER.info(() -> String.format("%s: returning %d on %s from %s to %s", transfer.reason, transfer.amount, transfer.ledger, transfer.recipient, transfer.sender));

				if (!ledgers.getLedger(transfer.ledger).transfer(transfer.recipient, transfer.sender, transfer.amount))
					LOGGER.error(() -> String.format("Ledger %s refused return of %s", transfer.ledger, transfer));
			} catch (AssetLedgerException e) {
				LOGGER.error(() -> String.format("Unable to return %s", transfer), e);
			}
		}
	}

	/**
	 * Performs transfers in order.
	 * <p>
	 * <b>Caller must have committed swap state beforehand.</b>
	 *
	 * @throws AssetLedgerException if a ledger fails or refuses; remaining transfers are not attempted
	 */
	public void executeTransfers(LedgerRegistry ledgers) throws AssetLedgerException {
		for (Transfer transfer : this.transfers) {
			try {
				AssetLedger ledger = ledgers.getLedger(transfer.ledger);

				long amount = transfer.amount == null ? ledger.balanceOf(transfer.sender) : transfer.amount;
				if (amount <= 0)
					continue;

				LOGGER.info(() -> String.format("%s: moving %d on %s from %s to %s", transfer.reason, amount, transfer.ledger, transfer.sender, transfer.recipient));

				if (!ledger.transfer(transfer.sender, transfer.recipient, amount))
					throw new AssetLedgerException(String.format("Ledger %s refused transfer (%s)", transfer.ledger, transfer));
			} catch (AssetLedgerException e) {
				LOGGER.error(() -> String.format("Settlement transfer failed after swap state committed: %s", transfer), e);
				throw e;
			}
		}
	}

	/** Publishes events in order. Call only after state committed and transfers done. */
	public void notifyEvents() {
		for (SwapEvent event : this.events)
			EventBus.INSTANCE.notify(event);
	}

}
