package org.fairswap.swap;

import java.util.function.Supplier;

public enum OverridePolicyType {
	NONE(NoOpOverridePolicy::new),
	REFUND(RefundOverridePolicy::new);

	private final Supplier<OverridePolicy> supplier;

	OverridePolicyType(Supplier<OverridePolicy> supplier) {
		this.supplier = supplier;
	}

	public OverridePolicy newPolicy() {
		return this.supplier.get();
	}
}
