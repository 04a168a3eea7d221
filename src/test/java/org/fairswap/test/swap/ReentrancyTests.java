package org.fairswap.test.swap;

import static org.fairswap.test.common.SwapUtils.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.fairswap.asset.AssetLedgerException;
import org.fairswap.data.swap.SwapData;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;
import org.fairswap.repository.RepositoryManager;
import org.fairswap.swap.Stage;
import org.fairswap.swap.SwapEscrow;
import org.fairswap.swap.SwapException;
import org.fairswap.swap.SwapParty;
import org.fairswap.swap.ValidationResult;
import org.fairswap.test.common.Common;
import org.fairswap.test.common.SwapUtils.SwapCall;
import org.fairswap.test.common.SwapUtils.SwapFixture;

/**
 * Ledgers that call back into the coordinator while a swap's transfers are under way.
 */
public class ReentrancyTests extends Common {

	private SwapFixture fixture;
	private List<ValidationResult> reentrantResults;

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();

		this.fixture = new SwapFixture();
		this.reentrantResults = Collections.synchronizedList(new ArrayList<>());
	}

	/** Runs <tt>swapCall</tt> from within a ledger hook, noting outcome. */
	private void reenter(SwapCall swapCall) throws DataException, AssetLedgerException {
		try {
			swapCall.call();
			this.reentrantResults.add(ValidationResult.OK);
		} catch (SwapException e) {
			this.reentrantResults.add(e.getResult());
		}
	}

	@Test
	public void testReentrantConfirmDuringSurplusReturn() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final long surplus = 5L;

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToTermsAccepted(repository);
			String depositEscrow = SwapEscrow.depositAddress(swapId, SwapParty.A);

			fixture.deposit(swapId, SwapParty.A);
			assertTrue(fixture.goldLedger.transfer(alice, depositEscrow, surplus));

			fixture.goldLedger.setTransferHook((sender, recipient, amount) -> {
				if (!recipient.equals(alice))
					return;

				try (final Repository reentrantRepository = RepositoryManager.getRepository()) {
					reenter(() -> fixture.coordinator.confirmDeposit(reentrantRepository, swapId, alice));
				}
			});

			fixture.coordinator.confirmDeposit(repository, swapId, alice);

			assertEquals(Collections.singletonList(ValidationResult.ALREADY_COMPLETED), reentrantResults);

			// Surplus handed back once only
			assertEquals(GOLD_QUANTITY, fixture.balance(fixture.goldLedger, depositEscrow));
			assertEquals(INITIAL_BALANCE - GOLD_QUANTITY, fixture.balance(fixture.goldLedger, alice));
			assertTrue(fixture.coordinator.getSwap(repository, swapId).isCompleted(SwapParty.A));
		}
	}

	@Test
	public void testReentrantCancelDuringRefunds() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final String bob = fixture.bob.getAddress();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToTermsAccepted(repository);
			String collateralEscrow = SwapEscrow.collateralAddress(swapId);

			fixture.timeSource.advance(CANCEL_DELAY);

			// Each refunded party tries to cancel again, then to accept again
			fixture.collateralLedger.setTransferHook((sender, recipient, amount) -> {
				if (!sender.equals(collateralEscrow))
					return;

				try (final Repository reentrantRepository = RepositoryManager.getRepository()) {
					reenter(() -> fixture.coordinator.cancel(reentrantRepository, swapId, recipient));
					reenter(() -> fixture.coordinator.acceptTerms(reentrantRepository, swapId, recipient, COLLATERAL));
				}
			});

			fixture.coordinator.cancel(repository, swapId, bob);

			assertEquals(Arrays.asList(ValidationResult.SWAP_NOT_ACTIVE, ValidationResult.SWAP_NOT_ACTIVE,
					ValidationResult.SWAP_NOT_ACTIVE, ValidationResult.SWAP_NOT_ACTIVE), reentrantResults);

			// Each collateral refunded exactly once
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.collateralLedger, alice));
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.collateralLedger, bob));
			assertEquals(0L, fixture.balance(fixture.collateralLedger, collateralEscrow));
		}
	}

	@Test
	public void testReentrantCallsDuringCollateralPayment() throws SwapException, DataException, AssetLedgerException {
		final String alice = fixture.alice.getAddress();
		final String bob = fixture.bob.getAddress();
		final List<Boolean> aliceCompletedDuringPayment = new ArrayList<>();

		try (final Repository repository = RepositoryManager.getRepository()) {
			long swapId = fixture.startToTermsSet(repository);
			String collateralEscrow = SwapEscrow.collateralAddress(swapId);

			fixture.collateralLedger.setTransferHook((sender, recipient, amount) -> {
				if (!recipient.equals(collateralEscrow))
					return;

				try (final Repository reentrantRepository = RepositoryManager.getRepository()) {
					aliceCompletedDuringPayment.add(fixture.coordinator.getSwap(reentrantRepository, swapId).isCompleted(SwapParty.A));

					reenter(() -> fixture.coordinator.acceptTerms(reentrantRepository, swapId, alice, COLLATERAL));
					reenter(() -> fixture.coordinator.acceptTerms(reentrantRepository, swapId, bob, COLLATERAL));
					reenter(() -> fixture.coordinator.cancel(reentrantRepository, swapId, alice));
				}
			});

			fixture.coordinator.acceptTerms(repository, swapId, alice, COLLATERAL);
			fixture.collateralLedger.setTransferHook(null);

			// Acceptance isn't recorded until payment has arrived
			assertEquals(Collections.singletonList(Boolean.FALSE), aliceCompletedDuringPayment);
			assertEquals(Arrays.asList(ValidationResult.PAYMENT_PENDING, ValidationResult.PAYMENT_PENDING, ValidationResult.PAYMENT_PENDING),
					reentrantResults);

			SwapData swapData = fixture.coordinator.getSwap(repository, swapId);
			assertTrue(swapData.isCompleted(SwapParty.A));
			assertFalse(swapData.isCompleted(SwapParty.B));
			assertEquals(Stage.TERMS_SET, swapData.getStage());

			// Single payment, from Alice only
			assertEquals(COLLATERAL, fixture.balance(fixture.collateralLedger, collateralEscrow));
			assertEquals(INITIAL_BALANCE - COLLATERAL, fixture.balance(fixture.collateralLedger, alice));
			assertEquals(INITIAL_BALANCE, fixture.balance(fixture.collateralLedger, bob));

			// Once payment is done, coordinator accepts calls again
			fixture.coordinator.acceptTerms(repository, swapId, bob, COLLATERAL);
			assertEquals(Stage.TERMS_ACCEPTED, fixture.coordinator.getStage(repository, swapId));
		}
	}

}
