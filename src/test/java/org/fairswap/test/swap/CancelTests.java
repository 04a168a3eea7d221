package org.fairswap.test.swap;

import static org.fairswap.test.common.SwapUtils.*;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.fairswap.asset.AssetLedgerException;
import org.fairswap.data.swap.SwapData;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;
import org.fairswap.repository.RepositoryManager;
import org.fairswap.swap.LateCancelPolicy;
import org.fairswap.swap.NoOpOverridePolicy;
import org.fairswap.swap.Stage;
import org.fairswap.swap.SwapEscrow;
import org.fairswap.swap.SwapEvent;
import org.fairswap.swap.SwapException;
import org.fairswap.swap.SwapOutcome;
import org.fairswap.swap.SwapParty;
import org.fairswap.swap.ValidationResult;
import org.fairswap.test.common.Common;
import org.fairswap.test.common.SwapUtils.EventRecorder;
import org.fairswap.test.common.SwapUtils.SwapFixture;

public class CancelTests extends Common {

	private SwapFixture fixture;
	private EventRecorder eventRecorder;

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();

		this.fixture = new SwapFixture();
		this.eventRecorder = new EventRecorder();
	}

	@After
	public void afterTest() {
		this.eventRecorder.close();
	}

	@Test
	public void testCancelTooEarly() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startSwap(repository);

			assertRejected(ValidationResult.TOO_EARLY, () -> fixture.coordinator.cancel(repository, swapId, alice));

			fixture.timeSource.advance(CANCEL_DELAY - 1);
			assertRejected(ValidationResult.TOO_EARLY, () -> fixture.coordinator.cancel(repository, swapId, alice));

			fixture.timeSource.advance(1);
			SwapData swapData = fixture.coordinator.cancel(repository, swapId, alice);

			assertEquals(Stage.READY_TO_START, swapData.getStage());
			assertEquals(SwapOutcome.CANCELLED, swapData.getOutcome());
		}
	}

	@Test
	public void testCancelWithoutClock() throws SwapException, DataException, AssetLedgerException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startSwap(repository);

			fixture.timeSource.unsync();
			assertRejected(ValidationResult.CLOCK_NOT_SYNCED, () -> fixture.coordinator.cancel(repository, swapId, fixture.alice.getAddress()));
		}
	}

	@Test
	public void testCancelByNonParty() throws SwapException, DataException, AssetLedgerException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startSwap(repository);
			fixture.timeSource.advance(CANCEL_DELAY);

			assertRejected(ValidationResult.NOT_A_PARTY, () -> fixture.coordinator.cancel(repository, swapId, fixture.chloe.getAddress()));
			assertRejected(ValidationResult.NOT_A_PARTY, () -> fixture.coordinator.cancel(repository, swapId, fixture.dilbert.getAddress()));
		}
	}

	@Test
	public void testCancelTwice() throws SwapException, DataException, AssetLedgerException {
		final String bob = fixture.bob.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startSwap(repository);
			fixture.timeSource.advance(CANCEL_DELAY);

			fixture.coordinator.cancel(repository, swapId, bob);
			assertRejected(ValidationResult.SWAP_NOT_ACTIVE, () -> fixture.coordinator.cancel(repository, swapId, bob));

			// Nothing else can happen to a cancelled swap either
			assertRejected(ValidationResult.SWAP_NOT_ACTIVE, () -> fixture.coordinator.setTerms(repository, swapId, bob, SILVER_LEDGER, 1L));
		}
	}

	@Test
	public void testCancelAfterTermsSetRefundsCollateral() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final String bob = fixture.bob.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToTermsSet(repository);

			// Only Alice has posted collateral
			fixture.coordinator.acceptTerms(repository, swapId, alice, COLLATERAL);
			assertEquals(INITIAL_BALANCE - COLLATERAL, fixture.balance(fixture.collateralLedger, alice));

			fixture.timeSource.advance(CANCEL_DELAY);
			SwapData swapData = fixture.coordinator.cancel(repository, swapId, bob);

			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.collateralLedger, alice));
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.collateralLedger, bob));
			assertEquals(0L, fixture.balance(fixture.collateralLedger, SwapEscrow.collateralAddress(swapId)));

			assertFalse(swapData.getTerms(SwapParty.A).isSet());
			assertFalse(swapData.getTerms(SwapParty.B).isSet());
		}
	}

	@Test
	public void testCancelBeforeAnyDepositConfirmed() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final String bob = fixture.bob.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToTermsAccepted(repository);

			// Alice deposits but doesn't confirm
			fixture.deposit(swapId, SwapParty.A);

			fixture.timeSource.advance(CANCEL_DELAY);
			fixture.coordinator.cancel(repository, swapId, bob);

			// Everyone made whole
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.collateralLedger, alice));
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.collateralLedger, bob));
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.goldLedger, alice));
			assertEquals(0L, fixture.balance(fixture.goldLedger, SwapEscrow.depositAddress(swapId, SwapParty.A)));
		}
	}

	@Test
	public void testCommittedCancellerTakesBothCollaterals() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final String bob = fixture.bob.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToTermsAccepted(repository);

			fixture.deposit(swapId, SwapParty.A);
			fixture.coordinator.confirmDeposit(repository, swapId, alice);

			// Bob never deposits, so Alice walks away
			fixture.timeSource.advance(CANCEL_DELAY);
			fixture.coordinator.cancel(repository, swapId, alice);

			assertEquals(INITIAL_BALANCE + COLLATERAL, fixture.balance(fixture.collateralLedger, alice));
			assertEquals(INITIAL_BALANCE - COLLATERAL, fixture.balance(fixture.collateralLedger, bob));

			// Alice's deposit returned
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.goldLedger, alice));
			assertEquals(0L, fixture.balance(fixture.collateralLedger, SwapEscrow.collateralAddress(swapId)));
		}

		List<SwapEvent> events = eventRecorder.getEvents();
		SwapEvent lastEvent = events.get(events.size() - 1);
		assertEquals(SwapEvent.Type.CANCELLED, lastEvent.getType());
		assertEquals(alice, lastEvent.getAccount());
	}

	@Test
	public void testLateCancellerForfeits() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final String bob = fixture.bob.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToTermsAccepted(repository);

			fixture.deposit(swapId, SwapParty.A);
			fixture.coordinator.confirmDeposit(repository, swapId, alice);

			// Bob cancels instead of depositing
			fixture.timeSource.advance(CANCEL_DELAY);
			fixture.coordinator.cancel(repository, swapId, bob);

			assertEquals(INITIAL_BALANCE + COLLATERAL, fixture.balance(fixture.collateralLedger, alice));
			assertEquals(INITIAL_BALANCE - COLLATERAL, fixture.balance(fixture.collateralLedger, bob));
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.goldLedger, alice));
		}
	}

	@Test
	public void testLateCancelBlocked() throws SwapException, DataException, AssetLedgerException {
		this.fixture = new SwapFixture(LateCancelPolicy.BLOCK, new NoOpOverridePolicy());

		final String alice = fixture.alice.getAddress();
		final String bob = fixture.bob.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToTermsAccepted(repository);

			fixture.deposit(swapId, SwapParty.A);
			fixture.coordinator.confirmDeposit(repository, swapId, alice);

			fixture.timeSource.advance(CANCEL_DELAY);
			assertRejected(ValidationResult.CANCEL_BLOCKED, () -> fixture.coordinator.cancel(repository, swapId, bob));

			// Swap still live, Bob can still complete it
			SwapData swapData = fixture.coordinator.getSwap(repository, swapId);
			assertEquals(Stage.TERMS_ACCEPTED, swapData.getStage());
			assertTrue(swapData.isActive());

			fixture.deposit(swapId, SwapParty.B);
			fixture.coordinator.confirmDeposit(repository, swapId, bob);
			assertEquals(Stage.DEPOSIT_CONFIRMED, fixture.coordinator.getStage(repository, swapId));
		}
	}

	@Test
	public void testCancelBlockedOnceDepositsConfirmed() throws SwapException, DataException, AssetLedgerException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToDepositConfirmed(repository);

			// Blocked regardless of timing
			assertRejected(ValidationResult.CANCEL_BLOCKED, () -> fixture.coordinator.cancel(repository, swapId, fixture.alice.getAddress()));

			fixture.timeSource.advance(CANCEL_DELAY);
			assertRejected(ValidationResult.CANCEL_BLOCKED, () -> fixture.coordinator.cancel(repository, swapId, fixture.bob.getAddress()));

			assertEquals(Stage.DEPOSIT_CONFIRMED, fixture.coordinator.getStage(repository, swapId));
		}
	}

}
