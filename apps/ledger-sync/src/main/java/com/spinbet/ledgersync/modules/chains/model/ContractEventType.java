package com.spinbet.ledgersync.modules.chains.model;

/**
 * Domain kinds a contract event can be classified into.
 */
public enum ContractEventType {
    STAKING("staking"),
    SPIN_REWARD("spin_reward"),
    NFT_MINT("nft_mint"),
    BET_SETTLEMENT("bet_settlement"),
    UNKNOWN("unknown");

    private final String value;

    ContractEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
