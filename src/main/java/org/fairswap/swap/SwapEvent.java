package org.fairswap.swap;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import org.fairswap.event.Event;

/**
 * Notification of a swap state change, published on the event bus once committed.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class SwapEvent implements Event {

	public enum Type {
		SWAP_STARTED,
		TERMS_SET,
		TERMS_ACCEPTED,
		DEPOSIT_CONFIRMED,
		EXECUTED,
		CANCELLED,
		SWAP_COMPLETE,
		MANUAL_OVERRIDE
	}

	private Type type;
	private long swapId;
	/** Party (or administrator) whose action caused event, if any */
	private String account;
	private Stage stage;
	private long timestamp;

	// necessary for JAXB
	protected SwapEvent() {
	}

	public SwapEvent(Type type, long swapId, String account, Stage stage, long timestamp) {
		this.type = type;
		this.swapId = swapId;
		this.account = account;
		this.stage = stage;
		this.timestamp = timestamp;
	}

	public Type getType() {
		return this.type;
	}

	public long getSwapId() {
		return this.swapId;
	}

	public String getAccount() {
		return this.account;
	}

	public Stage getStage() {
		return this.stage;
	}

	public long getTimestamp() {
		return this.timestamp;
	}

	@Override
	public String toString() {
		return String.format("%s for swap %d by %s", this.type, this.swapId, this.account);
	}

}
