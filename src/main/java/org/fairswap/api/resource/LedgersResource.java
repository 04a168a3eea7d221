package org.fairswap.api.resource;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

import java.util.ArrayList;
import java.util.List;

import javax.servlet.http.HttpServletRequest;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.MediaType;

import org.fairswap.api.ApiError;
import org.fairswap.api.ApiErrors;
import org.fairswap.api.ApiExceptionFactory;
import org.fairswap.api.Security;
import org.fairswap.api.model.LedgerCreditRequest;
import org.fairswap.asset.AssetLedger;
import org.fairswap.asset.AssetLedgerException;
import org.fairswap.asset.LedgerRegistry;
import org.fairswap.asset.RepositoryAssetLedger;
import org.fairswap.crypto.Crypto;
import org.fairswap.data.account.AccountBalanceData;
import org.fairswap.swap.SwapCoordinator;

@Path("/ledgers")
@Tag(name = "Ledgers")
public class LedgersResource {

	@Context
	HttpServletRequest request;

	@GET
	@Operation(
		summary = "List registered ledger names",
		responses = {
			@ApiResponse(
				content = @Content(
					array = @ArraySchema(
						schema = @Schema(
							type = "string"
						)
					)
				)
			)
		}
	)
	public List<String> getLedgerNames() {
		Security.checkApiCallAllowed(request);

		return new ArrayList<>(SwapCoordinator.getInstance().getLedgers().getLedgers().keySet());
	}

	@GET
	@Path("/{ledger}/balance/{address}")
	@Operation(
		summary = "Fetch balance held by address (or escrow address) on ledger",
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = AccountBalanceData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.INVALID_ADDRESS, ApiError.INVALID_ASSET_ACCOUNT, ApiError.LEDGER_ISSUE})
	public AccountBalanceData getBalance(@PathParam("ledger") String ledgerName, @PathParam("address") String address) {
		Security.checkApiCallAllowed(request);

		if (!Crypto.isValidAddress(address) && !Crypto.isValidEscrowAddress(address))
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_ADDRESS);

		AssetLedger ledger = this.lookupLedger(ledgerName);

		try {
			return new AccountBalanceData(address, ledgerName, ledger.balanceOf(address));
		} catch (AssetLedgerException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.LEDGER_ISSUE, e);
		}
	}

	@POST
	@Path("/{ledger}/credit")
	@Operation(
		summary = "Credit address with newly created balance on locally hosted ledger",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(
					implementation = LedgerCreditRequest.class
				)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = AccountBalanceData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.INVALID_ADDRESS, ApiError.INVALID_AMOUNT, ApiError.INVALID_ASSET_ACCOUNT, ApiError.INVALID_CRITERIA, ApiError.LEDGER_ISSUE})
	public AccountBalanceData credit(@PathParam("ledger") String ledgerName, LedgerCreditRequest creditRequest) {
		Security.checkApiCallAllowed(request);

		if (creditRequest == null || creditRequest.address == null || !Crypto.isValidAddress(creditRequest.address))
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_ADDRESS);

		if (creditRequest.amount == null || creditRequest.amount <= 0)
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_AMOUNT);

		AssetLedger ledger = this.lookupLedger(ledgerName);

		// Only ledgers hosted in our own repository can be credited
		if (!(ledger instanceof RepositoryAssetLedger))
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_CRITERIA);

		try {
			((RepositoryAssetLedger) ledger).credit(creditRequest.address, creditRequest.amount);

			return new AccountBalanceData(creditRequest.address, ledgerName, ledger.balanceOf(creditRequest.address));
		} catch (AssetLedgerException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.LEDGER_ISSUE, e);
		}
	}

	private AssetLedger lookupLedger(String ledgerName) {
		LedgerRegistry ledgers = SwapCoordinator.getInstance().getLedgers();

		try {
			return ledgers.getLedger(ledgerName);
		} catch (AssetLedgerException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_ASSET_ACCOUNT, e);
		}
	}

}
