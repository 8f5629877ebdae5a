package com.flagship.quota_ledger.usage.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.quota_ledger.usage.BookingResult;
import lombok.Value;

@Value
public class BookUsageResponse {

    @JsonProperty("period")
    String period;

    @JsonProperty("booked")
    long booked;

    @JsonProperty("seconds_used")
    long secondsUsed;

    @JsonProperty("topup_used")
    long topupUsed;

    @JsonProperty("remaining_seconds")
    long remainingSeconds;

    public static BookUsageResponse from(BookingResult result) {
        return new BookUsageResponse(
            result.getPeriod().toString(),
            result.getSecondsBooked(),
            result.getSecondsUsed(),
            result.getTopupUsed(),
            result.getRemainingSeconds()
        );
    }
}
