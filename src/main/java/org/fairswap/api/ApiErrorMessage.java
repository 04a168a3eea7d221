package org.fairswap.api;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

@XmlAccessorType(XmlAccessType.FIELD)
public class ApiErrorMessage {

	public int error;
	public String message;

	// For JAXB
	protected ApiErrorMessage() {
	}

	public ApiErrorMessage(int errorCode, String message) {
		this.error = errorCode;
		this.message = message;
	}

}
