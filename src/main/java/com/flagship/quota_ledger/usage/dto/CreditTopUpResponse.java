package com.flagship.quota_ledger.usage.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.quota_ledger.usage.CreditResult;
import lombok.Value;

@Value
public class CreditTopUpResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("seconds_credited")
    long secondsCredited;

    @JsonProperty("new_topup_balance")
    long newTopupBalance;

    @JsonProperty("already_credited")
    boolean alreadyCredited;

    @JsonProperty("message")
    String message;

    public static CreditTopUpResponse from(CreditResult result) {
        String message = result.isAlreadyCredited()
            ? "Transaction already credited"
            : "Top-up credited";
        return new CreditTopUpResponse(true, result.getSecondsCredited(), result.getNewTopupBalance(),
            result.isAlreadyCredited(), message);
    }
}
