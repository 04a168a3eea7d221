package org.fairswap.data.account;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import org.fairswap.utils.Amounts;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class AccountBalanceData {

	// Properties
	private String address;
	private String ledger;
	private long balance;

	// Constructors

	// necessary for JAXB
	protected AccountBalanceData() {
	}

	public AccountBalanceData(String address, String ledger, long balance) {
		this.address = address;
		this.ledger = ledger;
		this.balance = balance;
	}

	// Getters/Setters

	public String getAddress() {
		return this.address;
	}

	public String getLedger() {
		return this.ledger;
	}

	public long getBalance() {
		return this.balance;
	}

	public void setBalance(long balance) {
		this.balance = balance;
	}

	public String toString() {
		return String.format("%s has %s on %s", this.address, Amounts.prettyAmount(this.balance), this.ledger);
	}

}
