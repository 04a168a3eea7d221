package org.fairswap.swap;

import org.fairswap.data.swap.SwapData;

/**
 * Administrator's settlement of a stuck swap.
 */
public interface OverridePolicy {

	/**
	 * Adds transfers needed to settle <tt>swapData</tt> to <tt>settlement</tt>.
	 * <p>
	 * Must not modify <tt>swapData</tt>.
	 *
	 * @return true if swap is now settled and should be reset, false if left as-is
	 */
	public boolean settle(SwapData swapData, String collateralLedger, Settlement settlement);

}
