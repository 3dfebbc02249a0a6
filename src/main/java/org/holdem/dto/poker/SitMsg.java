package org.holdem.dto.poker;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SitMsg {
    @NotNull
    private Long tableId;
    @Size(max = 20)
    private String displayName;
    // null = table default
    private Long buyIn;
}
