package org.fairswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class AcceptTermsRequest {

	@Schema(description = "Calling party's address")
	public String caller;

	@Schema(description = "Collateral payment, which must equal swap's collateral amount", example = "1000")
	public Long payment;

	public AcceptTermsRequest() {
	}

}
