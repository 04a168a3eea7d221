package org.fairswap.swap;

import org.fairswap.data.swap.SwapData;

/** Records override without moving anything. */
public class NoOpOverridePolicy implements OverridePolicy {

	@Override
	public boolean settle(SwapData swapData, String collateralLedger, Settlement settlement) {
		return false;
	}

}
