package org.fairswap.test.swap;

import static org.junit.Assert.*;

import java.util.Map;

import org.junit.Test;
import org.fairswap.data.swap.SwapData;
import org.fairswap.data.swap.TermsData;
import org.fairswap.swap.SwapException;
import org.fairswap.swap.SwapParty;
import org.fairswap.swap.TermsStore;
import org.fairswap.swap.ValidationResult;
import org.fairswap.test.common.Common;

public class TermsStoreTests {

	private static TermsStore newTermsStore() {
		return new TermsStore(new SwapData(Common.getTestAccount("alice").getAddress(), Common.getTestAccount("bob").getAddress(), 0L, 0L));
	}

	@Test
	public void testInitiallyEmpty() {
		TermsStore termsStore = newTermsStore();

		Map<SwapParty, TermsData> terms = termsStore.readTerms();
		assertEquals(2, terms.size());
		assertFalse(terms.get(SwapParty.A).isSet());
		assertFalse(terms.get(SwapParty.B).isSet());
		assertNull(terms.get(SwapParty.A).getAssetAccount());
		assertEquals(0L, terms.get(SwapParty.B).getQuantity());
	}

	@Test
	public void testSetOnce() throws SwapException {
		TermsStore termsStore = newTermsStore();

		termsStore.setTerms(SwapParty.A, "gold", 50L);

		try {
			termsStore.setTerms(SwapParty.A, "silver", 70L);
			fail("Terms should only be settable once");
		} catch (SwapException e) {
			assertEquals(ValidationResult.TERMS_ALREADY_SET, e.getResult());
		}

		// Unchanged
		assertEquals("gold", termsStore.getTerms(SwapParty.A).getAssetAccount());
		assertEquals(50L, termsStore.getTerms(SwapParty.A).getQuantity());

		// Other party unaffected
		assertFalse(termsStore.getTerms(SwapParty.B).isSet());
	}

	@Test
	public void testZeroQuantityCountsAsSet() throws SwapException {
		TermsStore termsStore = newTermsStore();

		termsStore.setTerms(SwapParty.B, "silver", 0L);
		assertTrue(termsStore.getTerms(SwapParty.B).isSet());
	}

	@Test
	public void testClear() throws SwapException {
		TermsStore termsStore = newTermsStore();

		termsStore.setTerms(SwapParty.A, "gold", 50L);
		termsStore.setTerms(SwapParty.B, "silver", 70L);

		termsStore.clear(SwapParty.B);
		assertTrue(termsStore.getTerms(SwapParty.A).isSet());
		assertFalse(termsStore.getTerms(SwapParty.B).isSet());

		// Cleared terms can be set again
		termsStore.setTerms(SwapParty.B, "gold", 1L);

		termsStore.clearAll();
		assertFalse(termsStore.getTerms(SwapParty.A).isSet());
		assertFalse(termsStore.getTerms(SwapParty.B).isSet());
	}

}
