package org.fairswap.test.common;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.fairswap.asset.AssetLedgerException;
import org.fairswap.asset.LedgerRegistry;
import org.fairswap.data.swap.SwapData;
import org.fairswap.event.Event;
import org.fairswap.event.EventBus;
import org.fairswap.event.Listener;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;
import org.fairswap.swap.LateCancelPolicy;
import org.fairswap.swap.OverridePolicy;
import org.fairswap.swap.RefundOverridePolicy;
import org.fairswap.swap.Stage;
import org.fairswap.swap.SwapCoordinator;
import org.fairswap.swap.SwapEscrow;
import org.fairswap.swap.SwapEvent;
import org.fairswap.swap.SwapException;
import org.fairswap.swap.SwapParty;
import org.fairswap.swap.ValidationResult;

public class SwapUtils {

	public static final String COLLATERAL_LEDGER = "native";
	public static final String GOLD_LEDGER = "gold";
	public static final String SILVER_LEDGER = "silver";

	public static final long CANCEL_DELAY = 60 * 60 * 1000L; // ms
	public static final long OVERRIDE_DELAY = 24 * 60 * 60 * 1000L; // ms

	public static final long COLLATERAL = 1_000L;
	public static final long GOLD_QUANTITY = 50L;
	public static final long SILVER_QUANTITY = 700L;
	public static final long INITIAL_BALANCE = 10_000L;

	@FunctionalInterface
	public interface SwapCall {
		void call() throws SwapException, DataException, AssetLedgerException;
	}

	/** Collects swap events published on the event bus. */
	public static class EventRecorder implements Listener, AutoCloseable {
		private final List<SwapEvent> events = Collections.synchronizedList(new ArrayList<>());

		public EventRecorder() {
			EventBus.INSTANCE.addListener(this);
		}

		@Override
		public void listen(Event event) {
			if (event instanceof SwapEvent)
				this.events.add((SwapEvent) event);
		}

		public List<SwapEvent> getEvents() {
			synchronized (this.events) {
				return new ArrayList<>(this.events);
			}
		}

		public List<SwapEvent.Type> getTypes() {
			List<SwapEvent.Type> types = new ArrayList<>();
			for (SwapEvent event : this.getEvents())
				types.add(event.getType());

			return types;
		}

		@Override
		public void close() {
			EventBus.INSTANCE.removeListener(this);
		}
	}

	/** Test fixture: coordinator over in-memory ledgers and a manual clock. */
	public static class SwapFixture {
		public final TestTimeSource timeSource = new TestTimeSource();
		public final TestLedger collateralLedger = new TestLedger(COLLATERAL_LEDGER);
		public final TestLedger goldLedger = new TestLedger(GOLD_LEDGER);
		public final TestLedger silverLedger = new TestLedger(SILVER_LEDGER);
		public final LedgerRegistry ledgers = new LedgerRegistry(COLLATERAL_LEDGER);

		public final TestAccount alice = Common.getTestAccount("alice");
		public final TestAccount bob = Common.getTestAccount("bob");
		public final TestAccount chloe = Common.getTestAccount("chloe");
		/** Administrator */
		public final TestAccount dilbert = Common.getTestAccount("dilbert");

		public SwapCoordinator coordinator;

		public SwapFixture() {
			this(LateCancelPolicy.FORFEIT, new RefundOverridePolicy());
		}

		public SwapFixture(LateCancelPolicy lateCancelPolicy, OverridePolicy overridePolicy) {
			this.ledgers.register(this.collateralLedger);
			this.ledgers.register(this.goldLedger);
			this.ledgers.register(this.silverLedger);

			// Alice deals in gold, Bob in silver
			for (TestAccount party : new TestAccount[] { alice, bob, chloe }) {
				this.collateralLedger.credit(party.getAddress(), INITIAL_BALANCE);
			}
			this.goldLedger.credit(alice.getAddress(), INITIAL_BALANCE);
			this.silverLedger.credit(bob.getAddress(), INITIAL_BALANCE);

			this.coordinator = new SwapCoordinator(this.ledgers, this.timeSource, this.dilbert.getAddress(),
					CANCEL_DELAY, OVERRIDE_DELAY, lateCancelPolicy, overridePolicy);
		}

		public long balance(TestLedger ledger, String holder) throws AssetLedgerException {
			return ledger.balanceOf(holder);
		}

		public long startSwap(Repository repository) throws SwapException, DataException {
			SwapData swapData = this.coordinator.createSwap(repository, alice.getAddress(), bob.getAddress(), COLLATERAL);
			assertNotNull(swapData.getSwapId());
			return swapData.getSwapId();
		}

		public long startToTermsSet(Repository repository) throws SwapException, DataException, AssetLedgerException {
			long swapId = this.startSwap(repository);

			this.coordinator.setTerms(repository, swapId, alice.getAddress(), GOLD_LEDGER, GOLD_QUANTITY);
			this.coordinator.setTerms(repository, swapId, bob.getAddress(), SILVER_LEDGER, SILVER_QUANTITY);
			assertEquals(Stage.TERMS_SET, this.coordinator.getStage(repository, swapId));

			return swapId;
		}

		public long startToTermsAccepted(Repository repository) throws SwapException, DataException, AssetLedgerException {
			long swapId = this.startToTermsSet(repository);

			this.coordinator.acceptTerms(repository, swapId, alice.getAddress(), COLLATERAL);
			this.coordinator.acceptTerms(repository, swapId, bob.getAddress(), COLLATERAL);
			assertEquals(Stage.TERMS_ACCEPTED, this.coordinator.getStage(repository, swapId));

			return swapId;
		}

		/** Moves each party's agreed quantity into their deposit escrow. */
		public void deposit(long swapId, SwapParty party) throws AssetLedgerException {
			if (party == SwapParty.A)
				assertTrue(this.goldLedger.transfer(alice.getAddress(), SwapEscrow.depositAddress(swapId, SwapParty.A), GOLD_QUANTITY));
			else
				assertTrue(this.silverLedger.transfer(bob.getAddress(), SwapEscrow.depositAddress(swapId, SwapParty.B), SILVER_QUANTITY));
		}

		public long startToDepositConfirmed(Repository repository) throws SwapException, DataException, AssetLedgerException {
			long swapId = this.startToTermsAccepted(repository);

			this.deposit(swapId, SwapParty.A);
			this.deposit(swapId, SwapParty.B);

			this.coordinator.confirmDeposit(repository, swapId, alice.getAddress());
			this.coordinator.confirmDeposit(repository, swapId, bob.getAddress());
			assertEquals(Stage.DEPOSIT_CONFIRMED, this.coordinator.getStage(repository, swapId));

			return swapId;
		}
	}

	/** Asserts that <tt>swapCall</tt> is rejected with <tt>expectedResult</tt>. */
	public static void assertRejected(ValidationResult expectedResult, SwapCall swapCall) throws DataException, AssetLedgerException {
		try {
			swapCall.call();
			fail(String.format("Expected rejection with %s", expectedResult.name()));
		} catch (SwapException e) {
			assertEquals(expectedResult, e.getResult());
			assertEquals(expectedResult.category, e.getCategory());
		}
	}

}
