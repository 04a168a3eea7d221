package org.fairswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class LedgerCreditRequest {

	@Schema(description = "Address to credit")
	public String address;

	@Schema(description = "Amount to mint into address, in base units", example = "10000")
	public Long amount;

	public LedgerCreditRequest() {
	}

}
