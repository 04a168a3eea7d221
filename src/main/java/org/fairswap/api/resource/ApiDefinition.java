package org.fairswap.api.resource;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeIn;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.fairswap.api.Security;

@OpenAPIDefinition(
		info = @Info( title = "FairSwap API", description = "Two-party collateralised asset swaps. Amounts are in ledger base units." ),
		tags = {
			@Tag(name = "Ledgers"),
			@Tag(name = "Swaps")
		}
)
@SecurityScheme(name = "apiKey", type = SecuritySchemeType.APIKEY, in = SecuritySchemeIn.HEADER, paramName = Security.API_KEY_HEADER)
public class ApiDefinition {
}
