package org.holdem.dto.poker;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateTableRequest {
    @Size(max = 20)
    private String name;
    @Min(2) @Max(10)
    private Integer maxSeats;
    @Positive
    private Long smallBlind;
    @Positive
    private Long bigBlind;
    private Long minBuyIn;
    private Long maxBuyIn;
    private Boolean autoContinue;
}
