package org.fairswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class CreateSwapRequest {

	@Schema(description = "Initiating party's address (becomes party A)", example = "QgV4s3xnzLhVBEJxcYui4u4q11yhUHsd9v")
	public String initiator;

	@Schema(description = "Counterparty's address (becomes party B)", example = "QixPbJUwsaHsVEofJdozU9zgVqkK6aYhrK")
	public String counterparty;

	@Schema(description = "Collateral each party must post, in base units of the collateral ledger", example = "1000")
	public Long collateralAmount;

	public CreateSwapRequest() {
	}

}
