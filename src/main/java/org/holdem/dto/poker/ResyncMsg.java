package org.holdem.dto.poker;

import lombok.Data;

@Data
public class ResyncMsg {
    private Long tableId;
    // last version the client applied, null for a plain snapshot request
    private Long knownVersion;
}
