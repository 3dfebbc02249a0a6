package org.holdem.dto.poker;

import lombok.Data;

@Data
public class AiSeatRequest {
    private String strategy;
    private Long buyIn;
}
