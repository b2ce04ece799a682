package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.dto.AllowanceResponse;
import com.flagship.token_ledger.ledger.dto.AmountRequest;
import com.flagship.token_ledger.ledger.dto.ApprovalRequest;
import com.flagship.token_ledger.ledger.dto.BalanceResponse;
import com.flagship.token_ledger.ledger.dto.BurnFromRequest;
import com.flagship.token_ledger.ledger.dto.EventResponse;
import com.flagship.token_ledger.ledger.dto.MintAgentRequest;
import com.flagship.token_ledger.ledger.dto.MintAgentResponse;
import com.flagship.token_ledger.ledger.dto.OperationResponse;
import com.flagship.token_ledger.ledger.dto.OwnershipRequest;
import com.flagship.token_ledger.ledger.dto.TokenInfoResponse;
import com.flagship.token_ledger.ledger.dto.TransferFromRequest;
import com.flagship.token_ledger.ledger.dto.TransferRequest;
import com.flagship.token_ledger.outbox.OutboxService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * REST Controller for token operations.
 *
 * The authenticating layer in front of this service supplies the caller identity in the
 * {@value #CALLER_HEADER} header; every mutating endpoint requires it.
 * Amounts are exchanged as decimal strings.
 */
@RestController
@RequestMapping("/api/token")
@RequiredArgsConstructor
@Validated
public class TokenController {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private final TokenLedgerService tokenLedgerService;
    private final OutboxService outboxService;

    // ==================== Reads ====================

    @GetMapping
    public ResponseEntity<TokenInfoResponse> getTokenInfo() {
        TokenMetadata metadata = tokenLedgerService.getMetadata();
        return ResponseEntity.ok(TokenInfoResponse.builder()
            .name(metadata.getName())
            .symbol(metadata.getSymbol())
            .decimals(metadata.getDecimals())
            .totalSupply(tokenLedgerService.totalSupply())
            .owner(tokenLedgerService.owner().getValue())
            .build());
    }

    @GetMapping("/balances/{address}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("address") String address) {
        Address account = Address.of(address);
        return ResponseEntity.ok(new BalanceResponse(account.getValue(), tokenLedgerService.balanceOf(account)));
    }

    @GetMapping("/allowances/{owner}/{spender}")
    public ResponseEntity<AllowanceResponse> getAllowance(@PathVariable("owner") String owner,
                                                          @PathVariable("spender") String spender) {
        Address ownerAddress = Address.of(owner);
        Address spenderAddress = Address.of(spender);
        return ResponseEntity.ok(new AllowanceResponse(
            ownerAddress.getValue(),
            spenderAddress.getValue(),
            tokenLedgerService.allowance(ownerAddress, spenderAddress)));
    }

    @GetMapping("/mint-agents/{address}")
    public ResponseEntity<MintAgentResponse> getMintAgent(@PathVariable("address") String address) {
        Address account = Address.of(address);
        return ResponseEntity.ok(new MintAgentResponse(account.getValue(), tokenLedgerService.isMintAgent(account)));
    }

    /**
     * Pages through the notification journal in emission order.
     */
    @GetMapping("/events")
    public ResponseEntity<List<EventResponse>> getEvents(
            @RequestParam(name = "afterSequence", defaultValue = "0") @Min(0) long afterSequence,
            @RequestParam(name = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit) {
        List<EventResponse> events = outboxService.findEventsAfter(afterSequence, limit).stream()
            .map(EventResponse::from)
            .toList();
        return ResponseEntity.ok(events);
    }

    // ==================== Transfers ====================

    /**
     * Transfers from the caller's balance.
     * An insufficient balance or zero value answers 200 with {@code success=false}.
     */
    @PostMapping("/transfer")
    public ResponseEntity<OperationResponse> transfer(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody TransferRequest request) {
        boolean success = tokenLedgerService.transfer(
            Address.of(caller), Address.of(request.getTo()), new BigInteger(request.getValue()));
        return ResponseEntity.ok(new OperationResponse(success));
    }

    @PostMapping("/transfer-from")
    public ResponseEntity<OperationResponse> transferFrom(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody TransferFromRequest request) {
        boolean success = tokenLedgerService.transferFrom(
            Address.of(caller),
            Address.of(request.getFrom()),
            Address.of(request.getTo()),
            new BigInteger(request.getValue()));
        return ResponseEntity.ok(new OperationResponse(success));
    }

    // ==================== Allowances ====================

    @PostMapping("/approve")
    public ResponseEntity<OperationResponse> approve(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody ApprovalRequest request) {
        boolean success = tokenLedgerService.approve(
            Address.of(caller), Address.of(request.getSpender()), new BigInteger(request.getValue()));
        return ResponseEntity.ok(new OperationResponse(success));
    }

    @PostMapping("/approvals/increase")
    public ResponseEntity<OperationResponse> increaseApproval(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody ApprovalRequest request) {
        boolean success = tokenLedgerService.increaseApproval(
            Address.of(caller), Address.of(request.getSpender()), new BigInteger(request.getValue()));
        return ResponseEntity.ok(new OperationResponse(success));
    }

    @PostMapping("/approvals/decrease")
    public ResponseEntity<OperationResponse> decreaseApproval(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody ApprovalRequest request) {
        boolean success = tokenLedgerService.decreaseApproval(
            Address.of(caller), Address.of(request.getSpender()), new BigInteger(request.getValue()));
        return ResponseEntity.ok(new OperationResponse(success));
    }

    // ==================== Supply ====================

    @PostMapping("/mint")
    public ResponseEntity<OperationResponse> mint(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AmountRequest request) {
        tokenLedgerService.mint(Address.of(caller), new BigInteger(request.getAmount()));
        return ResponseEntity.ok(new OperationResponse(true));
    }

    /**
     * Burns from the caller's own balance (mint agents).
     */
    @PostMapping("/burn")
    public ResponseEntity<OperationResponse> burn(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AmountRequest request) {
        tokenLedgerService.burnSelf(Address.of(caller), new BigInteger(request.getAmount()));
        return ResponseEntity.ok(new OperationResponse(true));
    }

    /**
     * Burns from any account (owner only).
     */
    @PostMapping("/burn-from")
    public ResponseEntity<OperationResponse> burnFrom(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody BurnFromRequest request) {
        tokenLedgerService.burnFrom(
            Address.of(caller), Address.of(request.getFrom()), new BigInteger(request.getAmount()));
        return ResponseEntity.ok(new OperationResponse(true));
    }

    // ==================== Access control ====================

    @PutMapping("/owner")
    public ResponseEntity<OperationResponse> transferOwnership(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody OwnershipRequest request) {
        tokenLedgerService.transferOwnership(Address.of(caller), Address.of(request.getNewOwner()));
        return ResponseEntity.ok(new OperationResponse(true));
    }

    @PutMapping("/mint-agents/{address}")
    public ResponseEntity<OperationResponse> setMintAgent(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable("address") String address,
            @Valid @RequestBody MintAgentRequest request) {
        tokenLedgerService.setMintAgent(Address.of(caller), Address.of(address), request.getEnabled());
        return ResponseEntity.ok(new OperationResponse(true));
    }
}
