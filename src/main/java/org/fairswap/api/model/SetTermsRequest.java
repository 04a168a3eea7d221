package org.fairswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class SetTermsRequest {

	@Schema(description = "Calling party's address")
	public String caller;

	@Schema(description = "Ledger holding the asset this party will deliver", example = "native")
	public String assetAccount;

	@Schema(description = "Quantity to deliver, in base units of that ledger", example = "500")
	public Long quantity;

	public SetTermsRequest() {
	}

}
