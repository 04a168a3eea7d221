package org.fairswap.data.swap;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import org.fairswap.swap.Stage;
import org.fairswap.swap.SwapOutcome;
import org.fairswap.swap.SwapParty;

import io.swagger.v3.oas.annotations.media.Schema;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class SwapData {

	// Properties

	@Schema(description = "unique swap identifier, assigned when first saved")
	private Long swapId;

	@Schema(description = "initiating party's address")
	private String partyA;

	@Schema(description = "counterparty's address")
	private String partyB;

	@Schema(description = "collateral each party must post, in base units of the collateral ledger")
	private long collateralAmount;

	private Stage stage;

	@Schema(description = "whether party A has completed the current stage")
	private boolean completedA;

	@Schema(description = "whether party B has completed the current stage")
	private boolean completedB;

	private TermsData termsA;
	private TermsData termsB;

	@Schema(description = "when swap was created (ms since epoch)")
	private long startTimestamp;

	@Schema(description = "when both collaterals were posted (ms since epoch), if reached")
	private Long collateralTimestamp;

	private SwapOutcome outcome;

	@Schema(description = "when swap was last modified (ms since epoch)")
	private long updatedTimestamp;

	// Constructors

	// necessary for JAXB
	protected SwapData() {
	}

	public SwapData(Long swapId, String partyA, String partyB, long collateralAmount,
			Stage stage, boolean completedA, boolean completedB,
			TermsData termsA, TermsData termsB,
			long startTimestamp, Long collateralTimestamp,
			SwapOutcome outcome, long updatedTimestamp) {
		this.swapId = swapId;
		this.partyA = partyA;
		this.partyB = partyB;
		this.collateralAmount = collateralAmount;
		this.stage = stage;
		this.completedA = completedA;
		this.completedB = completedB;
		this.termsA = termsA;
		this.termsB = termsB;
		this.startTimestamp = startTimestamp;
		this.collateralTimestamp = collateralTimestamp;
		this.outcome = outcome;
		this.updatedTimestamp = updatedTimestamp;
	}

	/** Constructs newly started, unsaved swap. */
	public SwapData(String partyA, String partyB, long collateralAmount, long startTimestamp) {
		this(null, partyA, partyB, collateralAmount,
				Stage.STARTED, false, false,
				TermsData.empty(), TermsData.empty(),
				startTimestamp, null,
				SwapOutcome.ACTIVE, startTimestamp);
	}

	// Getters / setters

	public Long getSwapId() {
		return this.swapId;
	}

	public void setSwapId(Long swapId) {
		this.swapId = swapId;
	}

	public String getPartyA() {
		return this.partyA;
	}

	public String getPartyB() {
		return this.partyB;
	}

	public String getPartyAddress(SwapParty party) {
		return party == SwapParty.A ? this.partyA : this.partyB;
	}

	public long getCollateralAmount() {
		return this.collateralAmount;
	}

	public Stage getStage() {
		return this.stage;
	}

	public void setStage(Stage stage) {
		this.stage = stage;
	}

	public boolean isCompleted(SwapParty party) {
		return party == SwapParty.A ? this.completedA : this.completedB;
	}

	public void setCompleted(SwapParty party, boolean completed) {
		if (party == SwapParty.A)
			this.completedA = completed;
		else
			this.completedB = completed;
	}

	public TermsData getTerms(SwapParty party) {
		return party == SwapParty.A ? this.termsA : this.termsB;
	}

	public void setTerms(SwapParty party, TermsData terms) {
		if (party == SwapParty.A)
			this.termsA = terms;
		else
			this.termsB = terms;
	}

	public long getStartTimestamp() {
		return this.startTimestamp;
	}

	public Long getCollateralTimestamp() {
		return this.collateralTimestamp;
	}

	public void setCollateralTimestamp(Long collateralTimestamp) {
		this.collateralTimestamp = collateralTimestamp;
	}

	public SwapOutcome getOutcome() {
		return this.outcome;
	}

	public void setOutcome(SwapOutcome outcome) {
		this.outcome = outcome;
	}

	public boolean isActive() {
		return this.outcome == SwapOutcome.ACTIVE;
	}

	public long getUpdatedTimestamp() {
		return this.updatedTimestamp;
	}

	public void setUpdatedTimestamp(long updatedTimestamp) {
		this.updatedTimestamp = updatedTimestamp;
	}

	@Override
	public String toString() {
		return String.format("swap %s [%s <-> %s] at %s (%s)", this.swapId, this.partyA, this.partyB, this.stage, this.outcome);
	}

}
