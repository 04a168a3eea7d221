package org.fairswap.swap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fairswap.data.swap.SwapData;

/**
 * Per-swap stage machine.
 * <p>
 * Each stage needs both parties to complete it. The second completion clears
 * both flags and advances the stage by exactly one step.
 */
public class StageTracker {

	private static final Logger LOGGER = LogManager.getLogger(StageTracker.class);

	private final SwapData swapData;

	public StageTracker(SwapData swapData) {
		this.swapData = swapData;
	}

	public Stage getStage() {
		return this.swapData.getStage();
	}

	public boolean hasCompleted(SwapParty party) {
		return this.swapData.isCompleted(party);
	}

	/**
	 * Marks <tt>party</tt> as having completed current stage.
	 *
	 * @return true if this completion advanced the stage
	 */
	public boolean recordCompletion(SwapParty party) {
		this.swapData.setCompleted(party, true);

		if (!this.swapData.isCompleted(party.other()))
			return false;

		Stage previousStage = this.swapData.getStage();
		Stage nextStage = previousStage.next();

		this.swapData.setCompleted(SwapParty.A, false);
		this.swapData.setCompleted(SwapParty.B, false);
		this.swapData.setStage(nextStage);

		LOGGER.debug(() -> String.format("Swap %d advanced from %s to %s", this.swapData.getSwapId(), previousStage, nextStage));
		return true;
	}

	/** Returns swap to {@link Stage#READY_TO_START}, recording why. */
	public void reset(SwapOutcome outcome) {
		Stage previousStage = this.swapData.getStage();

		this.swapData.setCompleted(SwapParty.A, false);
		this.swapData.setCompleted(SwapParty.B, false);
		this.swapData.setStage(Stage.READY_TO_START);
		this.swapData.setOutcome(outcome);

		LOGGER.debug(() -> String.format("Swap %d reset from %s (%s)", this.swapData.getSwapId(), previousStage, outcome));
	}

}
