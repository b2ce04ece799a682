package com.flagship.token_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.TokenLedger;
import com.flagship.token_ledger.ledger.TokenMetadata;
import com.flagship.token_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the single ledger instance and its notification journal.
 */
@Configuration
@EnableConfigurationProperties(TokenProperties.class)
@Slf4j
public class LedgerConfig {

    @Bean
    public OutboxService outboxService(ObjectMapper objectMapper, TokenProperties properties) {
        return new OutboxService(objectMapper, properties.getSymbol());
    }

    @Bean
    public TokenLedger tokenLedger(TokenProperties properties, OutboxService outboxService) {
        TokenMetadata metadata = new TokenMetadata(
            properties.getName(), properties.getSymbol(), properties.getDecimals());
        Address creator = Address.of(properties.getCreator());

        TokenLedger ledger = TokenLedger.create(metadata, creator, properties.getInitialSupply(), outboxService);

        log.info("Token ledger created: name={}, symbol={}, decimals={}, totalSupply={}, owner={}",
            metadata.getName(), metadata.getSymbol(), metadata.getDecimals(), ledger.totalSupply(), creator);
        return ledger;
    }
}
