package com.flagship.token_ledger.config;

import com.flagship.token_ledger.ledger.Address;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;

/**
 * Construction-time token configuration ({@code token.*}).
 *
 * The initial supply is given in whole units; the ledger scales it by {@code 10^decimals}.
 */
@ConfigurationProperties(prefix = "token")
@Validated
@Getter
@Setter
public class TokenProperties {

    @NotBlank
    private String name = "Flagship Token";

    @NotBlank
    private String symbol = "FLAG";

    @Min(0)
    @Max(77)
    private int decimals = 18;

    @NotNull
    private BigInteger initialSupply = BigInteger.valueOf(1_000_000);

    @NotBlank
    @Pattern(regexp = Address.PATTERN, message = "Creator must be a 0x-prefixed 20-byte hex address")
    private String creator;
}
