package org.fairswap.swap;

import org.fairswap.data.swap.SwapData;
import org.fairswap.data.swap.TermsData;

/**
 * Hands everything back to whoever it belongs to.
 * <p>
 * If one party has already finalized, the swap is completed for the other party instead,
 * because the first party already holds the other's deposit.
 */
public class RefundOverridePolicy implements OverridePolicy {

	@Override
	public boolean settle(SwapData swapData, String collateralLedger, Settlement settlement) {
		final long swapId = swapData.getSwapId();
		final String collateralEscrow = SwapEscrow.collateralAddress(swapId);

		if (swapData.getStage() == Stage.DEPOSIT_CONFIRMED) {
			for (SwapParty finalized : SwapParty.values()) {
				if (!swapData.isCompleted(finalized))
					continue;

				SwapParty remaining = finalized.other();
				String remainingAddress = swapData.getPartyAddress(remaining);
				TermsData finalizedTerms = swapData.getTerms(finalized);

				settlement.addSweep(finalizedTerms.getAssetAccount(), SwapEscrow.depositAddress(swapId, finalized), remainingAddress, "override: complete swap");
				settlement.addTransfer(collateralLedger, collateralEscrow, remainingAddress, swapData.getCollateralAmount(), "override: collateral refund");
				return true;
			}
		}

		for (SwapParty party : SwapParty.values()) {
			String partyAddress = swapData.getPartyAddress(party);

			if (SwapEscrow.holdsCollateral(swapData, party))
				settlement.addTransfer(collateralLedger, collateralEscrow, partyAddress, swapData.getCollateralAmount(), "override: collateral refund");

			TermsData terms = swapData.getTerms(party);
			if (terms.isSet())
				settlement.addSweep(terms.getAssetAccount(), SwapEscrow.depositAddress(swapId, party), partyAddress, "override: deposit refund");
		}

		return true;
	}

}
