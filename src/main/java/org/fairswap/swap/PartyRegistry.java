package org.fairswap.swap;

import org.fairswap.account.Account;
import org.fairswap.account.NullAccount;
import org.fairswap.crypto.Crypto;
import org.fairswap.data.swap.SwapData;

/**
 * The two parties bound to a swap.
 */
public class PartyRegistry {

	private final SwapData swapData;

	public PartyRegistry(SwapData swapData) {
		this.swapData = swapData;
	}

	/**
	 * Checks proposed pair of parties for a new swap.
	 *
	 * @return {@link ValidationResult#OK} or reason for rejection
	 */
	public static ValidationResult validateParties(String initiator, String counterparty) {
		if (!Crypto.isValidAddress(initiator) || !Crypto.isValidAddress(counterparty))
			return ValidationResult.INVALID_ADDRESS;

		if (initiator.equals(counterparty))
			return ValidationResult.INVALID_PARTY;

		// Reserved for "no such party"
		if (initiator.equals(NullAccount.ADDRESS) || counterparty.equals(NullAccount.ADDRESS))
			return ValidationResult.INVALID_PARTY;

		return ValidationResult.OK;
	}

	/** Returns role of <tt>address</tt> in this swap, or null if not a party. */
	public SwapParty partyOf(String address) {
		if (address == null)
			return null;

		if (address.equals(this.swapData.getPartyA()))
			return SwapParty.A;

		if (address.equals(this.swapData.getPartyB()))
			return SwapParty.B;

		return null;
	}

	public SwapParty requireParty(String address) throws SwapException {
		SwapParty party = this.partyOf(address);
		if (party == null)
			throw new SwapException(ValidationResult.NOT_A_PARTY, address);

		return party;
	}

	/**
	 * Returns counterpart of <tt>address</tt>, or {@link NullAccount} if <tt>address</tt> isn't a party.
	 */
	public Account otherParty(String address) {
		SwapParty party = this.partyOf(address);
		if (party == null)
			return NullAccount.INSTANCE;

		return new Account(null, this.swapData.getPartyAddress(party.other()));
	}

}
