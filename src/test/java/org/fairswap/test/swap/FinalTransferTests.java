package org.fairswap.test.swap;

import static org.fairswap.test.common.SwapUtils.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.fairswap.asset.AssetLedgerException;
import org.fairswap.data.swap.SwapData;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;
import org.fairswap.repository.RepositoryManager;
import org.fairswap.swap.Stage;
import org.fairswap.swap.SwapEscrow;
import org.fairswap.swap.SwapEvent;
import org.fairswap.swap.SwapException;
import org.fairswap.swap.SwapParty;
import org.fairswap.swap.ValidationResult;
import org.fairswap.test.common.Common;
import org.fairswap.test.common.SwapUtils.EventRecorder;
import org.fairswap.test.common.SwapUtils.SwapFixture;

public class FinalTransferTests extends Common {

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
	public void testFinalizeTwice() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToDepositConfirmed(repository);

			fixture.coordinator.requestFinalTransfer(repository, swapId, alice);
			assertRejected(ValidationResult.ALREADY_EXECUTED, () -> fixture.coordinator.requestFinalTransfer(repository, swapId, alice));

			// Alice only received Bob's deposit once
			assertEquals(SILVER_QUANTITY, fixture.balance(fixture.silverLedger, alice));
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.collateralLedger, alice));
		}
	}

	@Test
	public void testFinalizeByNonParty() throws SwapException, DataException, AssetLedgerException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToDepositConfirmed(repository);

			assertRejected(ValidationResult.NOT_A_PARTY, () -> fixture.coordinator.requestFinalTransfer(repository, swapId, fixture.chloe.getAddress()));
		}
	}

	@Test
	public void testCounterpartyTermsClearedAfterFirstFinalize() throws SwapException, DataException, AssetLedgerException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToDepositConfirmed(repository);

			SwapData swapData = fixture.coordinator.requestFinalTransfer(repository, swapId, fixture.bob.getAddress());

			assertEquals(Stage.DEPOSIT_CONFIRMED, swapData.getStage());
			assertTrue(swapData.isCompleted(SwapParty.B));
			assertFalse(swapData.getTerms(SwapParty.A).isSet());
			assertTrue(swapData.getTerms(SwapParty.B).isSet());
		}

		List<SwapEvent.Type> types = eventRecorder.getTypes();
		assertEquals(SwapEvent.Type.EXECUTED, types.get(types.size() - 1));
		assertFalse(types.contains(SwapEvent.Type.SWAP_COMPLETE));
	}

	/**
	 * Recipient re-enters coordinator while receiving counterparty's deposit.
	 * Re-entrant calls must see committed state and be rejected.
	 */
	@Test
	public void testReentrantFinalize() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final List<ValidationResult> reentrantResults = Collections.synchronizedList(new ArrayList<>());

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToDepositConfirmed(repository);

			fixture.silverLedger.setTransferHook((sender, recipient, amount) -> {
				if (!recipient.equals(alice))
					return;

				try (final Repository reentrantRepository = RepositoryManager.getRepository()) {
					fixture.coordinator.requestFinalTransfer(reentrantRepository, swapId, alice);
					reentrantResults.add(ValidationResult.OK);
				} catch (SwapException e) {
					reentrantResults.add(e.getResult());
				}

				try (final Repository reentrantRepository = RepositoryManager.getRepository()) {
					fixture.coordinator.cancel(reentrantRepository, swapId, alice);
					reentrantResults.add(ValidationResult.OK);
				} catch (SwapException e) {
					reentrantResults.add(e.getResult());
				}
			});

			fixture.coordinator.requestFinalTransfer(repository, swapId, alice);

			assertEquals(2, reentrantResults.size());
			assertEquals(ValidationResult.ALREADY_EXECUTED, reentrantResults.get(0));
			assertEquals(ValidationResult.CANCEL_BLOCKED, reentrantResults.get(1));

			// Exactly one release
			assertEquals(SILVER_QUANTITY, fixture.balance(fixture.silverLedger, alice));
			assertEquals(0L, fixture.balance(fixture.silverLedger, SwapEscrow.depositAddress(swapId, SwapParty.B)));
		}
	}

	@Test
	public void testReentrantFinalizeCompletingSwap() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final String bob = fixture.bob.getAddress();
		final List<ValidationResult> reentrantResults = Collections.synchronizedList(new ArrayList<>());

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToDepositConfirmed(repository);

			fixture.coordinator.requestFinalTransfer(repository, swapId, alice);

			// Bob's receipt of gold tries to finalize again
			fixture.goldLedger.setTransferHook((sender, recipient, amount) -> {
				try (final Repository reentrantRepository = RepositoryManager.getRepository()) {
					fixture.coordinator.requestFinalTransfer(reentrantRepository, swapId, bob);
					reentrantResults.add(ValidationResult.OK);
				} catch (SwapException e) {
					reentrantResults.add(e.getResult());
				}
			});

			fixture.coordinator.requestFinalTransfer(repository, swapId, bob);

			// Swap had already reset when Bob's gold arrived
			assertEquals(Collections.singletonList(ValidationResult.SWAP_NOT_ACTIVE), reentrantResults);
			assertEquals(GOLD_QUANTITY, fixture.balance(fixture.goldLedger, bob));
		}
	}

	@Test
	public void testLedgerFailureAfterCommit() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToDepositConfirmed(repository);

			fixture.silverLedger.setUnavailable(true);

			try {
				fixture.coordinator.requestFinalTransfer(repository, swapId, alice);
				fail("Ledger failure should be reported");
			} catch (AssetLedgerException e) {
				// expected
			}

			fixture.silverLedger.setUnavailable(false);

			// Completion stands, so it can't be replayed
			assertTrue(fixture.coordinator.getSwap(repository, swapId).isCompleted(SwapParty.A));
			assertRejected(ValidationResult.ALREADY_EXECUTED, () -> fixture.coordinator.requestFinalTransfer(repository, swapId, alice));
		}

		// No events for failed settlement
		assertFalse(eventRecorder.getTypes().contains(SwapEvent.Type.EXECUTED));
	}

}
