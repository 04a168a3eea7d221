package org.fairswap.swap;

/** The two roles in a swap: A is the initiator, B the counterparty. */
public enum SwapParty {
	A, B;

	public SwapParty other() {
		return this == A ? B : A;
	}
}
