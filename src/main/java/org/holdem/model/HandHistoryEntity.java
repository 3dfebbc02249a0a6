package org.holdem.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "hand_history", indexes = @Index(name = "idx_hand_history_table", columnList = "table_id"))
@Data
public class HandHistoryEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "hand_id", nullable = false, length = 36, unique = true)
    private String handId;

    @Column(name = "hand_number", nullable = false)
    private long handNumber;

    @Lob
    @Column(name = "final_state_json")
    private String finalStateJson;

    @Lob
    @Column(name = "action_log_json")
    private String actionLogJson;

    @Lob
    @Column(name = "awards_json")
    private String awardsJson;

    @Lob
    @Column(name = "hole_cards_json")
    private String holeCardsJson;

    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;
}
