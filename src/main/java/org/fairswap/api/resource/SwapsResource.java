package org.fairswap.api.resource;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

import java.util.List;
import java.util.Map;

import javax.servlet.http.HttpServletRequest;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.MediaType;

import org.fairswap.account.Account;
import org.fairswap.api.ApiError;
import org.fairswap.api.ApiErrors;
import org.fairswap.api.ApiExceptionFactory;
import org.fairswap.api.Security;
import org.fairswap.api.model.AcceptTermsRequest;
import org.fairswap.api.model.CreateSwapRequest;
import org.fairswap.api.model.SetTermsRequest;
import org.fairswap.api.model.SwapActionRequest;
import org.fairswap.api.model.SwapTermsSummary;
import org.fairswap.asset.AssetLedgerException;
import org.fairswap.crypto.Crypto;
import org.fairswap.data.swap.SwapData;
import org.fairswap.data.swap.TermsData;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;
import org.fairswap.repository.RepositoryManager;
import org.fairswap.swap.Stage;
import org.fairswap.swap.SwapCoordinator;
import org.fairswap.swap.SwapException;
import org.fairswap.swap.SwapParty;

@Path("/swaps")
@Tag(name = "Swaps")
public class SwapsResource {

	@Context
	HttpServletRequest request;

	/** Swap transition invoked by one of the POST endpoints below. */
	@FunctionalInterface
	private interface SwapAction {
		SwapData perform(SwapCoordinator coordinator, Repository repository) throws SwapException, DataException, AssetLedgerException;
	}

	@GET
	@Operation(
		summary = "List swaps",
		description = "Optionally limited to swaps involving given party, and/or only active swaps",
		responses = {
			@ApiResponse(
				content = @Content(
					array = @ArraySchema(
						schema = @Schema(
							implementation = SwapData.class
						)
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.INVALID_ADDRESS, ApiError.REPOSITORY_ISSUE})
	public List<SwapData> listSwaps(
			@Parameter(description = "Limit to swaps involving this address") @QueryParam("party") String party,
			@Parameter(description = "Only return active swaps") @QueryParam("activeOnly") Boolean activeOnly) {
		Security.checkApiCallAllowed(request);

		if (party != null && !Crypto.isValidAddress(party))
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_ADDRESS);

		try (final Repository repository = RepositoryManager.getRepository()) {
			return SwapCoordinator.getInstance().listSwaps(repository, party, Boolean.TRUE.equals(activeOnly));
		} catch (DataException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.REPOSITORY_ISSUE, e);
		}
	}

	@GET
	@Path("/{swapId}")
	@Operation(
		summary = "Fetch swap",
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.REPOSITORY_ISSUE})
	public SwapData getSwap(@PathParam("swapId") long swapId) {
		Security.checkApiCallAllowed(request);

		try (final Repository repository = RepositoryManager.getRepository()) {
			return SwapCoordinator.getInstance().getSwap(repository, swapId);
		} catch (SwapException e) {
			throw ApiExceptionFactory.INSTANCE.fromSwapException(request, e);
		} catch (DataException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.REPOSITORY_ISSUE, e);
		}
	}

	@GET
	@Path("/{swapId}/stage")
	@Operation(
		summary = "Fetch swap's current stage",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.TEXT_PLAIN, schema = @Schema(implementation = Stage.class))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.REPOSITORY_ISSUE})
	public String getStage(@PathParam("swapId") long swapId) {
		Security.checkApiCallAllowed(request);

		try (final Repository repository = RepositoryManager.getRepository()) {
			return SwapCoordinator.getInstance().getStage(repository, swapId).name();
		} catch (SwapException e) {
			throw ApiExceptionFactory.INSTANCE.fromSwapException(request, e);
		} catch (DataException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.REPOSITORY_ISSUE, e);
		}
	}

	@GET
	@Path("/{swapId}/terms")
	@Operation(
		summary = "Review both parties' terms",
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapTermsSummary.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.REPOSITORY_ISSUE})
	public SwapTermsSummary reviewTerms(@PathParam("swapId") long swapId) {
		Security.checkApiCallAllowed(request);

		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapCoordinator coordinator = SwapCoordinator.getInstance();
			SwapData swapData = coordinator.getSwap(repository, swapId);
			Map<SwapParty, TermsData> terms = coordinator.reviewTerms(repository, swapId);

			return new SwapTermsSummary(swapId, swapData.getPartyA(), terms.get(SwapParty.A), swapData.getPartyB(), terms.get(SwapParty.B));
		} catch (SwapException e) {
			throw ApiExceptionFactory.INSTANCE.fromSwapException(request, e);
		} catch (DataException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.REPOSITORY_ISSUE, e);
		}
	}

	@GET
	@Path("/{swapId}/otherparty/{address}")
	@Operation(
		summary = "Return counterpart of given address in swap",
		description = "Returns the null account's address if given address is not a party to this swap",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.TEXT_PLAIN, schema = @Schema(type = "string"))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.REPOSITORY_ISSUE})
	public String otherParty(@PathParam("swapId") long swapId, @PathParam("address") String address) {
		Security.checkApiCallAllowed(request);

		try (final Repository repository = RepositoryManager.getRepository()) {
			Account other = SwapCoordinator.getInstance().otherParty(repository, swapId, address);
			return other.getAddress();
		} catch (SwapException e) {
			throw ApiExceptionFactory.INSTANCE.fromSwapException(request, e);
		} catch (DataException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.REPOSITORY_ISSUE, e);
		}
	}

	@POST
	@Operation(
		summary = "Start a new swap",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(
					implementation = CreateSwapRequest.class
				)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.INVALID_ADDRESS, ApiError.INVALID_PARTY, ApiError.INVALID_AMOUNT, ApiError.INVALID_CRITERIA, ApiError.REPOSITORY_ISSUE})
	public SwapData createSwap(CreateSwapRequest createSwapRequest) {
		Security.checkApiCallAllowed(request);

		if (createSwapRequest == null || createSwapRequest.collateralAmount == null)
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_CRITERIA);

		return performSwapAction((coordinator, repository) ->
			coordinator.createSwap(repository, createSwapRequest.initiator, createSwapRequest.counterparty, createSwapRequest.collateralAmount));
	}

	@POST
	@Path("/{swapId}/terms")
	@Operation(
		summary = "Set calling party's terms",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(
					implementation = SetTermsRequest.class
				)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.SWAP_NOT_ACTIVE, ApiError.WRONG_STAGE, ApiError.NOT_A_PARTY, ApiError.TERMS_ALREADY_SET,
			ApiError.INVALID_ASSET_ACCOUNT, ApiError.INVALID_AMOUNT, ApiError.INVALID_CRITERIA, ApiError.REPOSITORY_ISSUE})
	public SwapData setTerms(@PathParam("swapId") long swapId, SetTermsRequest setTermsRequest) {
		Security.checkApiCallAllowed(request);

		if (setTermsRequest == null || setTermsRequest.quantity == null)
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_CRITERIA);

		return performSwapAction((coordinator, repository) ->
			coordinator.setTerms(repository, swapId, setTermsRequest.caller, setTermsRequest.assetAccount, setTermsRequest.quantity));
	}

	@POST
	@Path("/{swapId}/accept")
	@Operation(
		summary = "Accept terms and post collateral. NOTE: WILL SPEND FUNDS!",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(
					implementation = AcceptTermsRequest.class
				)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.SWAP_NOT_ACTIVE, ApiError.WRONG_STAGE, ApiError.NOT_A_PARTY, ApiError.ALREADY_COMPLETED,
			ApiError.PAYMENT_PENDING, ApiError.COLLATERAL_MISMATCH, ApiError.INSUFFICIENT_BALANCE, ApiError.INVALID_CRITERIA, ApiError.LEDGER_ISSUE, ApiError.REPOSITORY_ISSUE})
	public SwapData acceptTerms(@PathParam("swapId") long swapId, AcceptTermsRequest acceptTermsRequest) {
		Security.checkApiCallAllowed(request);

		if (acceptTermsRequest == null || acceptTermsRequest.payment == null)
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_CRITERIA);

		return performSwapAction((coordinator, repository) ->
			coordinator.acceptTerms(repository, swapId, acceptTermsRequest.caller, acceptTermsRequest.payment));
	}

	@POST
	@Path("/{swapId}/deposit")
	@Operation(
		summary = "Confirm calling party's deposit of agreed asset",
		description = "Caller must first have transferred agreed quantity to their deposit escrow address",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(
					implementation = SwapActionRequest.class
				)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.SWAP_NOT_ACTIVE, ApiError.WRONG_STAGE, ApiError.NOT_A_PARTY, ApiError.ALREADY_COMPLETED,
			ApiError.INSUFFICIENT_DEPOSIT, ApiError.LEDGER_ISSUE, ApiError.REPOSITORY_ISSUE})
	public SwapData confirmDeposit(@PathParam("swapId") long swapId, SwapActionRequest swapActionRequest) {
		Security.checkApiCallAllowed(request);

		String caller = callerOf(swapActionRequest);

		return performSwapAction((coordinator, repository) -> coordinator.confirmDeposit(repository, swapId, caller));
	}

	@POST
	@Path("/{swapId}/finalize")
	@Operation(
		summary = "Request final transfer of counterparty's deposit, and refund of own collateral",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(
					implementation = SwapActionRequest.class
				)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.SWAP_NOT_ACTIVE, ApiError.WRONG_STAGE, ApiError.NOT_A_PARTY, ApiError.ALREADY_EXECUTED,
			ApiError.LEDGER_ISSUE, ApiError.REPOSITORY_ISSUE})
	public SwapData requestFinalTransfer(@PathParam("swapId") long swapId, SwapActionRequest swapActionRequest) {
		Security.checkApiCallAllowed(request);

		String caller = callerOf(swapActionRequest);

		return performSwapAction((coordinator, repository) -> coordinator.requestFinalTransfer(repository, swapId, caller));
	}

	@POST
	@Path("/{swapId}/cancel")
	@Operation(
		summary = "Cancel swap",
		description = "Allowed before deposits are confirmed, once cancel delay has elapsed since swap start",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(
					implementation = SwapActionRequest.class
				)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.SWAP_NOT_ACTIVE, ApiError.NOT_A_PARTY, ApiError.CANCEL_BLOCKED, ApiError.TOO_EARLY,
			ApiError.CLOCK_NOT_SYNCED, ApiError.LEDGER_ISSUE, ApiError.REPOSITORY_ISSUE})
	public SwapData cancel(@PathParam("swapId") long swapId, SwapActionRequest swapActionRequest) {
		Security.checkApiCallAllowed(request);

		String caller = callerOf(swapActionRequest);

		return performSwapAction((coordinator, repository) -> coordinator.cancel(repository, swapId, caller));
	}

	@POST
	@Path("/{swapId}/override")
	@Operation(
		summary = "Administrator's manual override of stalled swap",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(
					implementation = SwapActionRequest.class
				)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(
					schema = @Schema(
						implementation = SwapData.class
					)
				)
			)
		}
	)
	@ApiErrors({ApiError.SWAP_UNKNOWN, ApiError.SWAP_NOT_ACTIVE, ApiError.WRONG_STAGE, ApiError.NOT_ADMIN, ApiError.TOO_EARLY,
			ApiError.CLOCK_NOT_SYNCED, ApiError.LEDGER_ISSUE, ApiError.REPOSITORY_ISSUE})
	public SwapData manualOverride(@PathParam("swapId") long swapId, SwapActionRequest swapActionRequest) {
		Security.checkApiCallAllowed(request);

		String caller = callerOf(swapActionRequest);

		return performSwapAction((coordinator, repository) -> coordinator.manualOverride(repository, swapId, caller));
	}

	private String callerOf(SwapActionRequest swapActionRequest) {
		if (swapActionRequest == null || swapActionRequest.caller == null)
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.INVALID_CRITERIA);

		return swapActionRequest.caller;
	}

	private SwapData performSwapAction(SwapAction action) {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return action.perform(SwapCoordinator.getInstance(), repository);
		} catch (SwapException e) {
			throw ApiExceptionFactory.INSTANCE.fromSwapException(request, e);
		} catch (AssetLedgerException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.LEDGER_ISSUE, e);
		} catch (DataException e) {
			throw ApiExceptionFactory.INSTANCE.createException(request, ApiError.REPOSITORY_ISSUE, e);
		}
	}

}
