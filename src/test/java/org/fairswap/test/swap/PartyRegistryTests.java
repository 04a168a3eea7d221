package org.fairswap.test.swap;

import static org.junit.Assert.*;

import org.junit.Test;
import org.fairswap.account.Account;
import org.fairswap.account.NullAccount;
import org.fairswap.crypto.Crypto;
import org.fairswap.data.swap.SwapData;
import org.fairswap.swap.PartyRegistry;
import org.fairswap.swap.SwapException;
import org.fairswap.swap.SwapParty;
import org.fairswap.swap.ValidationResult;
import org.fairswap.test.common.Common;

public class PartyRegistryTests {

	private final String aliceAddress = Common.getTestAccount("alice").getAddress();
	private final String bobAddress = Common.getTestAccount("bob").getAddress();
	private final String chloeAddress = Common.getTestAccount("chloe").getAddress();

	@Test
	public void testValidateParties() {
		assertEquals(ValidationResult.OK, PartyRegistry.validateParties(aliceAddress, bobAddress));

		assertEquals(ValidationResult.INVALID_PARTY, PartyRegistry.validateParties(aliceAddress, aliceAddress));

		assertEquals(ValidationResult.INVALID_ADDRESS, PartyRegistry.validateParties(null, bobAddress));
		assertEquals(ValidationResult.INVALID_ADDRESS, PartyRegistry.validateParties(aliceAddress, "not-an-address"));

		// Escrow addresses can't be parties
		assertEquals(ValidationResult.INVALID_ADDRESS, PartyRegistry.validateParties(aliceAddress, Crypto.toEscrowAddress(1L, "collateral")));

		// Nor can the null account
		assertEquals(ValidationResult.INVALID_PARTY, PartyRegistry.validateParties(aliceAddress, NullAccount.ADDRESS));
		assertEquals(ValidationResult.INVALID_PARTY, PartyRegistry.validateParties(NullAccount.ADDRESS, bobAddress));
	}

	@Test
	public void testPartyOf() {
		PartyRegistry partyRegistry = new PartyRegistry(new SwapData(aliceAddress, bobAddress, 0L, 0L));

		assertEquals(SwapParty.A, partyRegistry.partyOf(aliceAddress));
		assertEquals(SwapParty.B, partyRegistry.partyOf(bobAddress));
		assertNull(partyRegistry.partyOf(chloeAddress));
		assertNull(partyRegistry.partyOf(null));
	}

	@Test
	public void testRequireParty() throws SwapException {
		PartyRegistry partyRegistry = new PartyRegistry(new SwapData(aliceAddress, bobAddress, 0L, 0L));

		assertEquals(SwapParty.B, partyRegistry.requireParty(bobAddress));

		try {
			partyRegistry.requireParty(chloeAddress);
			fail("Non-party should be rejected");
		} catch (SwapException e) {
			assertEquals(ValidationResult.NOT_A_PARTY, e.getResult());
		}
	}

	@Test
	public void testOtherParty() {
		PartyRegistry partyRegistry = new PartyRegistry(new SwapData(aliceAddress, bobAddress, 0L, 0L));

		Account other = partyRegistry.otherParty(aliceAddress);
		assertEquals(bobAddress, other.getAddress());

		other = partyRegistry.otherParty(bobAddress);
		assertEquals(aliceAddress, other.getAddress());

		other = partyRegistry.otherParty(chloeAddress);
		assertTrue(NullAccount.isNull(other));
		assertEquals(NullAccount.ADDRESS, other.getAddress());
	}

}
