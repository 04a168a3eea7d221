package org.fairswap.swap;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fairswap.account.Account;
import org.fairswap.asset.AssetLedger;
import org.fairswap.asset.AssetLedgerException;
import org.fairswap.asset.LedgerRegistry;
import org.fairswap.data.swap.SwapData;
import org.fairswap.data.swap.TermsData;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;
import org.fairswap.settings.Settings;
import org.fairswap.utils.NTP;
import org.fairswap.utils.TimeSource;

import com.google.common.collect.Sets;
import com.google.common.util.concurrent.Striped;

/**
 * Runs the two-party swap protocol.
 * <p>
 * Every state-changing operation follows the same order:
 * <ol>
 * <li>all checks, rejecting with {@link SwapException} and no changes</li>
 * <li>payments into escrow, rejecting with no changes if a ledger refuses</li>
 * <li>swap state changes, saved and <b>committed</b></li>
 * <li>ledger transfers out</li>
 * <li>events</li>
 * </ol>
 * Any ledger call that re-enters the coordinator therefore sees the committed state,
 * and fails whichever check guards the operation it attempts.
 * While a payment into escrow is in progress, all state-changing operations on that swap
 * are rejected with {@link ValidationResult#PAYMENT_PENDING}.
 * <p>
 * Operations on the same swap are serialized.
 */
public class SwapCoordinator {

	private static final Logger LOGGER = LogManager.getLogger(SwapCoordinator.class);

	/** Largest collateral whose doubled payout still fits in a long. */
	public static final long MAX_COLLATERAL = Long.MAX_VALUE / 2;

	private static SwapCoordinator instance;

	private final LedgerRegistry ledgers;
	private final TimeSource timeSource;
	private final String adminAddress;
	private final long cancelDelay;
	private final long overrideDelay;
	private final LateCancelPolicy lateCancelPolicy;
	private final OverridePolicy overridePolicy;

	private final Striped<Lock> swapLocks = Striped.lock(64);
	/** Swaps with a payment into escrow in progress */
	private final Set<Long> collectingSwaps = Sets.newConcurrentHashSet();

	/** Swap state change, returning external effects to run once committed. */
	@FunctionalInterface
	private interface Transition {
		public Settlement apply(SwapData swapData, long now) throws SwapException;
	}

	public SwapCoordinator(LedgerRegistry ledgers, TimeSource timeSource, String adminAddress,
			long cancelDelay, long overrideDelay,
			LateCancelPolicy lateCancelPolicy, OverridePolicy overridePolicy) {
		if (overrideDelay <= cancelDelay)
			throw new IllegalArgumentException("Override delay must be longer than cancel delay");

		this.ledgers = ledgers;
		this.timeSource = timeSource;
		this.adminAddress = adminAddress;
		this.cancelDelay = cancelDelay;
		this.overrideDelay = overrideDelay;
		this.lateCancelPolicy = lateCancelPolicy;
		this.overridePolicy = overridePolicy;
	}

	/** Builds coordinator using current settings and network time. */
	public static SwapCoordinator fromSettings(LedgerRegistry ledgers) {
		Settings settings = Settings.getInstance();

		return new SwapCoordinator(ledgers, NTP.timeSource(), settings.getAdminAddress(),
				settings.getCancelDelay(), settings.getOverrideDelay(),
				settings.getLateCancelPolicy(), settings.getOverridePolicy().newPolicy());
	}

	public static synchronized SwapCoordinator getInstance() {
		if (instance == null)
			throw new IllegalStateException("Swap coordinator not yet started");

		return instance;
	}

	public static synchronized void setInstance(SwapCoordinator newInstance) {
		instance = newInstance;
	}

	public LedgerRegistry getLedgers() {
		return this.ledgers;
	}

	// Read-only operations

	public SwapData getSwap(Repository repository, long swapId) throws SwapException, DataException {
		SwapData swapData = repository.getSwapRepository().fromSwapId(swapId);
		if (swapData == null)
			throw new SwapException(ValidationResult.SWAP_UNKNOWN);

		return swapData;
	}

	public Stage getStage(Repository repository, long swapId) throws SwapException, DataException {
		return this.getSwap(repository, swapId).getStage();
	}

	public Map<SwapParty, TermsData> reviewTerms(Repository repository, long swapId) throws SwapException, DataException {
		return new TermsStore(this.getSwap(repository, swapId)).readTerms();
	}

	/**
	 * Returns counterpart of <tt>address</tt> in swap, or {@link org.fairswap.account.NullAccount} if not a party.
	 */
	public Account otherParty(Repository repository, long swapId, String address) throws SwapException, DataException {
		return new PartyRegistry(this.getSwap(repository, swapId)).otherParty(address);
	}

	public List<SwapData> listSwaps(Repository repository, String address, boolean activeOnly) throws DataException {
		if (address == null)
			return activeOnly ? repository.getSwapRepository().getActiveSwaps() : repository.getSwapRepository().getAllSwaps(null, null, true);

		return repository.getSwapRepository().getSwapsByParty(address, activeOnly);
	}

	// State-changing operations

	/**
	 * Starts new swap between <tt>initiator</tt> (party A) and <tt>counterparty</tt> (party B).
	 *
	 * @return newly saved swap, in {@link Stage#STARTED}
	 */
	public SwapData createSwap(Repository repository, String initiator, String counterparty, long collateralAmount) throws SwapException, DataException {
		ValidationResult partiesResult = PartyRegistry.validateParties(initiator, counterparty);
		if (partiesResult != ValidationResult.OK)
			throw new SwapException(partiesResult);

		if (collateralAmount < 0)
			throw new SwapException(ValidationResult.NEGATIVE_AMOUNT);

		if (collateralAmount > MAX_COLLATERAL)
			throw new SwapException(ValidationResult.AMOUNT_TOO_LARGE, String.format("collateral over %d", MAX_COLLATERAL));

		final long now = this.requireTime();

		SwapData swapData = new SwapData(initiator, counterparty, collateralAmount, now);
		repository.getSwapRepository().save(swapData);
		repository.saveChanges();

		LOGGER.debug(() -> String.format("Created %s with collateral %d", swapData, collateralAmount));

		new Settlement()
				.addEvent(new SwapEvent(SwapEvent.Type.SWAP_STARTED, swapData.getSwapId(), initiator, swapData.getStage(), now))
				.notifyEvents();

		return swapData;
	}

	/**
	 * Records caller's offer: <tt>quantity</tt> of the asset on ledger <tt>assetAccount</tt>.
	 */
	public SwapData setTerms(Repository repository, long swapId, String caller, String assetAccount, long quantity)
			throws SwapException, DataException, AssetLedgerException {
		return this.perform(repository, swapId, (swapData, now) -> {
			requireActive(swapData);
			requireStage(swapData, Stage.STARTED);
			SwapParty party = new PartyRegistry(swapData).requireParty(caller);

			TermsStore termsStore = new TermsStore(swapData);
			if (termsStore.getTerms(party).isSet())
				throw new SwapException(ValidationResult.TERMS_ALREADY_SET);

			if (!this.ledgers.isKnown(assetAccount))
				throw new SwapException(ValidationResult.INVALID_ASSET_ACCOUNT, String.valueOf(assetAccount));

			if (quantity < 0)
				throw new SwapException(ValidationResult.NEGATIVE_AMOUNT);

			termsStore.setTerms(party, assetAccount, quantity);
			new StageTracker(swapData).recordCompletion(party);

			return new Settlement()
					.addEvent(new SwapEvent(SwapEvent.Type.TERMS_SET, swapId, caller, swapData.getStage(), now));
		});
	}

	/**
	 * Caller accepts both sets of terms, posting <tt>payment</tt> as collateral.
	 * <p>
	 * <tt>payment</tt> must match the swap's collateral amount exactly.
	 * It is taken into escrow before caller's acceptance is recorded, so a refused payment leaves the swap unchanged.
	 */
	public SwapData acceptTerms(Repository repository, long swapId, String caller, long payment)
			throws SwapException, DataException, AssetLedgerException {
		return this.perform(repository, swapId, (swapData, now) -> {
			requireActive(swapData);
			requireStage(swapData, Stage.TERMS_SET);
			SwapParty party = new PartyRegistry(swapData).requireParty(caller);

			StageTracker stageTracker = new StageTracker(swapData);
			if (stageTracker.hasCompleted(party))
				throw new SwapException(ValidationResult.ALREADY_COMPLETED);

			if (payment < 0)
				throw new SwapException(ValidationResult.NEGATIVE_AMOUNT);

			if (payment != swapData.getCollateralAmount())
				throw new SwapException(ValidationResult.COLLATERAL_MISMATCH,
						String.format("expected %d, got %d", swapData.getCollateralAmount(), payment));

			if (this.balanceOf(this.ledgers.getCollateralLedgerName(), caller) < payment)
				throw new SwapException(ValidationResult.NO_BALANCE);

			if (stageTracker.recordCompletion(party))
				swapData.setCollateralTimestamp(now);

			return new Settlement()
					.addCollection(this.ledgers.getCollateralLedgerName(), caller, SwapEscrow.collateralAddress(swapId), payment, "collateral")
					.addEvent(new SwapEvent(SwapEvent.Type.TERMS_ACCEPTED, swapId, caller, swapData.getStage(), now));
		});
	}

	/**
	 * Caller asserts they have deposited their agreed quantity into their deposit escrow.
	 * <p>
	 * Any surplus in the escrow is returned to caller.
	 */
	public SwapData confirmDeposit(Repository repository, long swapId, String caller)
			throws SwapException, DataException, AssetLedgerException {
		return this.perform(repository, swapId, (swapData, now) -> {
			requireActive(swapData);
			requireStage(swapData, Stage.TERMS_ACCEPTED);
			SwapParty party = new PartyRegistry(swapData).requireParty(caller);

			StageTracker stageTracker = new StageTracker(swapData);
			if (stageTracker.hasCompleted(party))
				throw new SwapException(ValidationResult.ALREADY_COMPLETED);

			TermsData terms = swapData.getTerms(party);
			String depositEscrow = SwapEscrow.depositAddress(swapId, party);

			long deposited = this.balanceOf(terms.getAssetAccount(), depositEscrow);
			if (deposited < terms.getQuantity())
				throw new SwapException(ValidationResult.INSUFFICIENT_DEPOSIT,
						String.format("expected %d, found %d", terms.getQuantity(), deposited));

			// Completion committed before any surplus is handed back
			stageTracker.recordCompletion(party);

			return new Settlement()
					.addTransfer(terms.getAssetAccount(), depositEscrow, caller, deposited - terms.getQuantity(), "surplus deposit return")
					.addEvent(new SwapEvent(SwapEvent.Type.DEPOSIT_CONFIRMED, swapId, caller, swapData.getStage(), now));
		});
	}

	/**
	 * Releases counterparty's deposit, and caller's own collateral, to caller.
	 * <p>
	 * Once both parties have done this, the swap is complete and resets.
	 */
	public SwapData requestFinalTransfer(Repository repository, long swapId, String caller)
			throws SwapException, DataException, AssetLedgerException {
		return this.perform(repository, swapId, (swapData, now) -> {
			requireActive(swapData);
			requireStage(swapData, Stage.DEPOSIT_CONFIRMED);
			SwapParty party = new PartyRegistry(swapData).requireParty(caller);

			StageTracker stageTracker = new StageTracker(swapData);
			if (stageTracker.hasCompleted(party))
				throw new SwapException(ValidationResult.ALREADY_EXECUTED);

			SwapParty counterparty = party.other();
			TermsStore termsStore = new TermsStore(swapData);
			TermsData counterpartyTerms = termsStore.getTerms(counterparty);

			boolean complete = stageTracker.recordCompletion(party);

			Settlement settlement = new Settlement()
					.addTransfer(counterpartyTerms.getAssetAccount(), SwapEscrow.depositAddress(swapId, counterparty), caller, counterpartyTerms.getQuantity(), "counterparty deposit release")
					.addTransfer(this.ledgers.getCollateralLedgerName(), SwapEscrow.collateralAddress(swapId), caller, swapData.getCollateralAmount(), "collateral refund")
					.addEvent(new SwapEvent(SwapEvent.Type.EXECUTED, swapId, caller, swapData.getStage(), now));

			termsStore.clear(counterparty);

			if (complete) {
				stageTracker.reset(SwapOutcome.COMPLETED);
				termsStore.clearAll();

				settlement.addEvent(new SwapEvent(SwapEvent.Type.SWAP_COMPLETE, swapId, caller, swapData.getStage(), now));
			}

			return settlement;
		});
	}

	/**
	 * Either party abandons swap, once the cancellation delay has passed and before deposits are confirmed.
	 */
	public SwapData cancel(Repository repository, long swapId, String caller)
			throws SwapException, DataException, AssetLedgerException {
		return this.perform(repository, swapId, (swapData, now) -> {
			requireActive(swapData);
			SwapParty party = new PartyRegistry(swapData).requireParty(caller);

			Stage stage = swapData.getStage();
			if (stage == Stage.READY_TO_START)
				throw new SwapException(ValidationResult.SWAP_NOT_ACTIVE);

			// Once deposits are confirmed, only finalizing (or override) can settle
			if (!stage.isBefore(Stage.DEPOSIT_CONFIRMED))
				throw new SwapException(ValidationResult.CANCEL_BLOCKED, "deposits already confirmed");

			if (now - swapData.getStartTimestamp() < this.cancelDelay)
				throw new SwapException(ValidationResult.TOO_EARLY);

			final String collateralLedger = this.ledgers.getCollateralLedgerName();
			final String collateralEscrow = SwapEscrow.collateralAddress(swapId);
			final long collateral = swapData.getCollateralAmount();

			Settlement settlement = new Settlement();

			switch (stage) {
				case STARTED:
					break;

				case TERMS_SET:
					// Anyone who has already accepted has collateral in escrow
					for (SwapParty poster : SwapParty.values())
						if (SwapEscrow.holdsCollateral(swapData, poster))
							settlement.addTransfer(collateralLedger, collateralEscrow, swapData.getPartyAddress(poster), collateral, "cancel: collateral refund");
					break;

				case TERMS_ACCEPTED: {
					SwapParty other = party.other();
					boolean callerConfirmed = swapData.isCompleted(party);
					boolean otherConfirmed = swapData.isCompleted(other);

					if (callerConfirmed) {
						settlement.addTransfer(collateralLedger, collateralEscrow, caller, Math.multiplyExact(collateral, 2L), "cancel: both collaterals to committed canceller");
					} else if (otherConfirmed) {
						if (this.lateCancelPolicy == LateCancelPolicy.BLOCK)
							throw new SwapException(ValidationResult.CANCEL_BLOCKED, "counterparty already confirmed deposit");

						settlement.addTransfer(collateralLedger, collateralEscrow, swapData.getPartyAddress(other), Math.multiplyExact(collateral, 2L), "cancel: canceller forfeits collateral");
					} else {
						for (SwapParty poster : SwapParty.values())
							settlement.addTransfer(collateralLedger, collateralEscrow, swapData.getPartyAddress(poster), collateral, "cancel: collateral refund");
					}

					// Deposits always go back to their owners
					for (SwapParty depositor : SwapParty.values())
						settlement.addSweep(swapData.getTerms(depositor).getAssetAccount(), SwapEscrow.depositAddress(swapId, depositor),
								swapData.getPartyAddress(depositor), "cancel: deposit return");
					break;
				}

				default:
					throw new SwapException(ValidationResult.CANCEL_BLOCKED);
			}

			new StageTracker(swapData).reset(SwapOutcome.CANCELLED);
			new TermsStore(swapData).clearAll();

			return settlement.addEvent(new SwapEvent(SwapEvent.Type.CANCELLED, swapId, caller, swapData.getStage(), now));
		});
	}

	/**
	 * Administrator intervention in a long-stuck swap, settled according to configured {@link OverridePolicy}.
	 */
	public SwapData manualOverride(Repository repository, long swapId, String caller)
			throws SwapException, DataException, AssetLedgerException {
		return this.perform(repository, swapId, (swapData, now) -> {
			if (this.adminAddress == null || !this.adminAddress.equals(caller))
				throw new SwapException(ValidationResult.NOT_ADMIN);

			requireActive(swapData);

			if (swapData.getStage() == Stage.EXECUTED)
				throw new SwapException(ValidationResult.WRONG_STAGE);

			if (now - swapData.getStartTimestamp() < this.overrideDelay)
				throw new SwapException(ValidationResult.TOO_EARLY);

			Settlement settlement = new Settlement();
			boolean settled = this.overridePolicy.settle(swapData, this.ledgers.getCollateralLedgerName(), settlement);

			if (settled) {
				new StageTracker(swapData).reset(SwapOutcome.OVERRIDDEN);
				new TermsStore(swapData).clearAll();
			}

			LOGGER.info(() -> String.format("Manual override of swap %d by %s (%s)", swapId, caller, settled ? "settled" : "no action"));

			return settlement.addEvent(new SwapEvent(SwapEvent.Type.MANUAL_OVERRIDE, swapId, caller, swapData.getStage(), now));
		});
	}

	// Internals

	private SwapData perform(Repository repository, long swapId, Transition transition)
			throws SwapException, DataException, AssetLedgerException {
		Settlement settlement;
		SwapData swapData;

		Lock swapLock = this.swapLocks.get(swapId);
		swapLock.lock();
		try {
			final long now;

			try {
				// Only reachable from a ledger call made while collecting
				if (this.collectingSwaps.contains(swapId))
					throw new SwapException(ValidationResult.PAYMENT_PENDING);

				swapData = this.getSwap(repository, swapId);
				now = this.requireTime();

				settlement = transition.apply(swapData, now);

				if (settlement.hasCollections()) {
					// Nothing saved yet, so end our read transaction before calling out to ledgers
					repository.discardChanges();

					this.collectingSwaps.add(swapId);
					try {
						settlement.executeCollections(this.ledgers);
					} finally {
						this.collectingSwaps.remove(swapId);
					}
				}
			} catch (SwapException e) {
				repository.discardChanges();
				LOGGER.debug(() -> String.format("Swap %d operation rejected: %s", swapId, e.getMessage()));
				throw e;
			}

			swapData.setUpdatedTimestamp(now);
			try {
				repository.getSwapRepository().save(swapData);
				repository.saveChanges();
			} catch (DataException e) {
				settlement.returnCollections(this.ledgers);
				throw e;
			}

			// State is committed: only now touch ledgers
			settlement.executeTransfers(this.ledgers);
		} finally {
			swapLock.unlock();
		}

		settlement.notifyEvents();
		return swapData;
	}

	private long requireTime() throws SwapException {
		Long now = this.timeSource.getTime();
		if (now == null)
			throw new SwapException(ValidationResult.CLOCK_NOT_SYNCED);

		return now;
	}

	private long balanceOf(String ledgerName, String holder) throws SwapException {
		try {
			AssetLedger ledger = this.ledgers.getLedger(ledgerName);
			return ledger.balanceOf(holder);
		} catch (AssetLedgerException.UnknownLedgerException e) {
			throw new SwapException(ValidationResult.INVALID_ASSET_ACCOUNT, e);
		} catch (AssetLedgerException e) {
			throw new SwapException(ValidationResult.LEDGER_UNAVAILABLE, e);
		}
	}

	private static void requireActive(SwapData swapData) throws SwapException {
		if (!swapData.isActive())
			throw new SwapException(ValidationResult.SWAP_NOT_ACTIVE);
	}

	private static void requireStage(SwapData swapData, Stage expectedStage) throws SwapException {
		if (swapData.getStage() != expectedStage)
			throw new SwapException(ValidationResult.WRONG_STAGE,
					String.format("expected %s, but swap is at %s", expectedStage, swapData.getStage()));
	}

}
