package org.fairswap.swap;

import org.fairswap.crypto.Crypto;
import org.fairswap.data.swap.SwapData;

/**
 * Escrow accounts belonging to a swap, and what they should hold.
 */
public abstract class SwapEscrow {

	/** Escrow holding both parties' collateral, on the collateral ledger. */
	public static String collateralAddress(long swapId) {
		return Crypto.toEscrowAddress(swapId, "collateral");
	}

	/** Escrow into which <tt>party</tt> deposits their agreed quantity, on their declared ledger. */
	public static String depositAddress(long swapId, SwapParty party) {
		return Crypto.toEscrowAddress(swapId, "deposit-" + party.name());
	}

	/**
	 * Returns whether <tt>party</tt>'s collateral currently sits in collateral escrow.
	 * <p>
	 * Collateral is posted by accepting terms, and handed back when finalizing.
	 */
	public static boolean holdsCollateral(SwapData swapData, SwapParty party) {
		switch (swapData.getStage()) {
			case TERMS_SET:
				return swapData.isCompleted(party);

			case TERMS_ACCEPTED:
				return true;

			case DEPOSIT_CONFIRMED:
				return !swapData.isCompleted(party);

			default:
				return false;
		}
	}

}
