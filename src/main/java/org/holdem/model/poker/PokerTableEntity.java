package org.holdem.model.poker;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "poker_table")
@Data
public class PokerTableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name")
    private String name;

    @Column(name = "max_seats")
    private Integer maxSeats;

    @Column(name = "small_blind", nullable = false)
    private long smallBlind;

    @Column(name = "big_blind", nullable = false)
    private long bigBlind;

    @Column(name = "min_buy_in")
    private Long minBuyIn;

    @Column(name = "max_buy_in")
    private Long maxBuyIn;

    @Column(name = "auto_continue", nullable = false)
    private boolean autoContinue = true;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;
}
