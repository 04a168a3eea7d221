package org.fairswap.swap;

import java.util.EnumMap;
import java.util.Map;

import org.fairswap.data.swap.SwapData;
import org.fairswap.data.swap.TermsData;

/**
 * Per-party offer terms. Each party's terms can only be set once until reset.
 */
public class TermsStore {

	private final SwapData swapData;

	public TermsStore(SwapData swapData) {
		this.swapData = swapData;
	}

	public void setTerms(SwapParty party, String assetAccount, long quantity) throws SwapException {
		if (this.swapData.getTerms(party).isSet())
			throw new SwapException(ValidationResult.TERMS_ALREADY_SET);

		this.swapData.setTerms(party, new TermsData(assetAccount, quantity));
	}

	public TermsData getTerms(SwapParty party) {
		return this.swapData.getTerms(party);
	}

	public Map<SwapParty, TermsData> readTerms() {
		Map<SwapParty, TermsData> terms = new EnumMap<>(SwapParty.class);
		terms.put(SwapParty.A, this.swapData.getTerms(SwapParty.A));
		terms.put(SwapParty.B, this.swapData.getTerms(SwapParty.B));
		return terms;
	}

	public void clear(SwapParty party) {
		this.swapData.setTerms(party, TermsData.empty());
	}

	public void clearAll() {
		this.clear(SwapParty.A);
		this.clear(SwapParty.B);
	}

}
