package org.fairswap.data.swap;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class TermsData {

	@Schema(description = "name of ledger holding the asset this party offers, or null if terms not yet set", example = "native")
	private String assetAccount;

	@Schema(description = "quantity of asset, in base units", example = "1000")
	private long quantity;

	// necessary for JAXB
	protected TermsData() {
	}

	public TermsData(String assetAccount, long quantity) {
		this.assetAccount = assetAccount;
		this.quantity = quantity;
	}

	public static TermsData empty() {
		return new TermsData(null, 0L);
	}

	public String getAssetAccount() {
		return this.assetAccount;
	}

	public long getQuantity() {
		return this.quantity;
	}

	public boolean isSet() {
		return this.assetAccount != null;
	}

	@Override
	public String toString() {
		return this.isSet() ? String.format("%d of %s", this.quantity, this.assetAccount) : "<unset>";
	}

}
