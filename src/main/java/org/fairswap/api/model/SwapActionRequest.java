package org.fairswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

/** Request body for swap actions that only need to identify the caller. */
@XmlAccessorType(XmlAccessType.FIELD)
public class SwapActionRequest {

	@Schema(description = "Calling party's (or administrator's) address")
	public String caller;

	public SwapActionRequest() {
	}

}
