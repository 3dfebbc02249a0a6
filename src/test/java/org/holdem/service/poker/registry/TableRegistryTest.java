package org.holdem.service.poker.registry;

import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.PokerTableEntity;
import org.holdem.repo.PokerTableRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataRetrievalFailureException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TableRegistryTest {

    @Mock
    PokerTableRepository repo;

    @InjectMocks
    TableRegistry registry;

    @BeforeEach
    void init() {
        MockitoAnnotations.openMocks(this);
    }

    private PokerTableEntity entity(long id, Integer seats) {
        PokerTableEntity e = new PokerTableEntity();
        e.setId(id);
        e.setName("T" + id);
        e.setMaxSeats(seats);
        e.setSmallBlind(5);
        e.setBigBlind(10);
        e.setMinBuyIn(200L);
        e.setMaxBuyIn(2000L);
        e.setCreatedBy("owner");
        e.setCreatedAt(Instant.parse("2026-01-01T00:00:00Z"));
        return e;
    }

    private TableSummaryDTO summary(long id, int seated) {
        return new TableSummaryDTO(id, "T" + id, 6, seated, 5, 10, 200, 2000, "WAITING_FOR_PLAYERS", false);
    }

    // --------------------------------------------------------------
    // loadFromDb() / createAndPersist()
    // --------------------------------------------------------------
    @Test
    void loadFromDb_restoresConfiguration() {
        when(repo.findAll()).thenReturn(List.of(entity(1, 6), entity(2, null)));

        registry.loadFromDb();

        PokerTable t1 = registry.get(1L);
        assertThat(t1.getName()).isEqualTo("T1");
        assertThat(t1.getBigBlind()).isEqualTo(10);
        assertThat(t1.getMinBuyIn()).isEqualTo(200);
        assertThat(t1.getCreatedBy()).isEqualTo("owner");
        assertThat(registry.get(2L).getMaxSeats()).isEqualTo(6);
        assertThat(registry.all()).hasSize(2);
    }

    @Test
    void createAndPersist_savesThenRegisters() {
        PokerTableEntity unsaved = entity(0, 9);
        when(repo.save(any())).thenReturn(entity(7, 9));

        PokerTable t = registry.createAndPersist(unsaved);

        assertThat(t.getId()).isEqualTo(7L);
        assertThat(t.getMaxSeats()).isEqualTo(9);
        assertThat(registry.find(7L)).contains(t);
    }

    @Test
    void get_unknown_throws() {
        assertThatThrownBy(() -> registry.get(42L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown table");
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void deleteFromDb_failure_isLoggedNotThrown() {
        doThrow(new DataRetrievalFailureException("gone")).when(repo).deleteById(3L);
        assertThatCode(() -> registry.deleteFromDb(3L)).doesNotThrowAnyException();
    }

    // --------------------------------------------------------------
    // lobby summaries
    // --------------------------------------------------------------
    @Test
    void updateSummary_reportsOnlyChanges() {
        assertThat(registry.updateSummary(summary(1, 0))).isTrue();
        assertThat(registry.updateSummary(summary(1, 0))).isFalse();
        assertThat(registry.updateSummary(summary(1, 1))).isTrue();
    }

    @Test
    void summaries_sortedById() {
        registry.updateSummary(summary(3, 0));
        registry.updateSummary(summary(1, 0));

        assertThat(registry.summaries()).extracting(TableSummaryDTO::getId).containsExactly(1L, 3L);
    }

    // --------------------------------------------------------------
    // seating index
    // --------------------------------------------------------------
    @Test
    void bind_oneTableAtATime() {
        assertThat(registry.bind("alice", 1L)).isTrue();
        assertThat(registry.bind("alice", 1L)).isTrue();
        assertThat(registry.bind("alice", 2L)).isFalse();
        assertThat(registry.tableOf("alice")).contains(1L);

        registry.unbind("alice", 2L);
        assertThat(registry.tableOf("alice")).contains(1L);
        registry.unbind("alice", 1L);
        assertThat(registry.tableOf("alice")).isEmpty();
    }

    @Test
    void remove_dropsTableSummaryAndBindings() {
        when(repo.findAll()).thenReturn(List.of(entity(1, 6)));
        registry.loadFromDb();
        registry.updateSummary(summary(1, 1));
        registry.bind("alice", 1L);

        registry.remove(1L);

        assertThat(registry.find(1L)).isEmpty();
        assertThat(registry.summaries()).isEmpty();
        assertThat(registry.tableOf("alice")).isEmpty();
    }
}
