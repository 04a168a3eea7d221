package org.fairswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import org.fairswap.data.swap.TermsData;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class SwapTermsSummary {

	private long swapId;

	private String partyA;
	@Schema(description = "party A's terms, or empty if not (or no longer) set")
	private TermsData termsA;

	private String partyB;
	@Schema(description = "party B's terms, or empty if not (or no longer) set")
	private TermsData termsB;

	protected SwapTermsSummary() {
		/* For JAXB */
	}

	public SwapTermsSummary(long swapId, String partyA, TermsData termsA, String partyB, TermsData termsB) {
		this.swapId = swapId;
		this.partyA = partyA;
		this.termsA = termsA;
		this.partyB = partyB;
		this.termsB = termsB;
	}

	public long getSwapId() {
		return this.swapId;
	}

	public String getPartyA() {
		return this.partyA;
	}

	public TermsData getTermsA() {
		return this.termsA;
	}

	public String getPartyB() {
		return this.partyB;
	}

	public TermsData getTermsB() {
		return this.termsB;
	}

}
