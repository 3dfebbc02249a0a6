package org.holdem.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.holdem.common.ActionRejectedException;
import org.holdem.common.StateConflictException;
import org.holdem.config.PokerSettings;
import org.holdem.dto.poker.CreateTableRequest;
import org.holdem.dto.poker.PlayerView;
import org.holdem.dto.poker.TableSnapshot;
import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.model.poker.*;
import org.holdem.repo.PokerTableRepository;
import org.holdem.service.poker.ai.CheckCallStrategy;
import org.holdem.service.poker.betting.BettingService;
import org.holdem.service.poker.engine.DeckFactory;
import org.holdem.service.poker.engine.HandEngine;
import org.holdem.service.poker.engine.PayoutService;
import org.holdem.service.poker.engine.TableHalter;
import org.holdem.service.poker.entry.EntryService;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.sync.BroadcastService;
import org.holdem.service.poker.sync.DeltaRecorder;
import org.holdem.service.poker.sync.TableWorkers;
import org.holdem.service.poker.util.Payloads;
import org.holdem.service.poker.util.Timeouts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * The facade over real engine components, with every table worker running
 * synchronously on the calling thread.
 */
class PokerTableServiceTest {

    @Mock PokerTableRepository repo;
    @Mock BroadcastService broadcast;
    @Mock TableHalter halter;
    @Mock Timeouts timeouts;
    @Mock ApplicationEventPublisher events;

    PokerTableService service;
    TableRegistry registry;
    Long tableId;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        when(repo.save(any())).thenAnswer(inv -> {
            PokerTableEntity e = inv.getArgument(0);
            e.setId(1L);
            return e;
        });

        ObjectMapper mapper = new ObjectMapper();
        Payloads payloads = new Payloads();
        PokerSettings settings = new PokerSettings();
        DeltaRecorder deltas = new DeltaRecorder(mapper, payloads);
        registry = new TableRegistry(repo);
        TableWorkers workers = new TableWorkers(Runnable::run, registry, broadcast, payloads, halter);
        HandEngine engine = new HandEngine(new BettingService(), new PayoutService(events, payloads), deltas,
                new DeckFactory(), timeouts, workers, registry, settings);
        EntryService entry = new EntryService(registry, engine, deltas, timeouts, workers, settings);
        service = new PokerTableService(registry, workers, engine, entry, broadcast, payloads, settings,
                Map.of(CheckCallStrategy.NAME, new CheckCallStrategy()));

        CreateTableRequest req = new CreateTableRequest();
        req.setSmallBlind(10L);
        req.setBigBlind(20L);
        tableId = service.createTable("owner", req).getId();
    }

    private TableSnapshot snapshot() {
        return service.snapshot(tableId).join();
    }

    private void seatTwo() {
        service.sit(tableId, "alice", "Alice", 1000L).join();
        service.sit(tableId, "bob", "Bob", 1000L).join();
    }

    // ---------------------------------------------------------
    // lobby
    // ---------------------------------------------------------
    @Test
    void createTable_defaultsAndLobbyUpdate() {
        TableSummaryDTO s = service.listTables().get(0);

        assertThat(s.getName()).isEqualTo("Hold'em 10/20");
        assertThat(s.getMaxSeats()).isEqualTo(6);
        assertThat(s.getMinBuyIn()).isEqualTo(400);
        assertThat(s.getMaxBuyIn()).isEqualTo(4000);
        verify(broadcast, atLeastOnce()).lobby(anyList());
    }

    @Test
    void createTable_invalidBlinds_refused() {
        CreateTableRequest req = new CreateTableRequest();
        req.setSmallBlind(50L);
        req.setBigBlind(20L);

        assertThatThrownBy(() -> service.createTable("owner", req)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingTableId_failsEveryCommandInsteadOfThrowing() {
        assertThatThrownBy(service.submitAction(null, "alice", PlayerAction.fold("alice"))::join)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(service.sit(null, "alice", "Alice", 500L)::join)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(service.leave(null, "alice")::join)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(service.playerView(null, "alice")::join)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closeTable_byOtherPlayer_refused() {
        CompletableFuture<Void> f = service.closeTable(tableId, "mallory");

        assertThatThrownBy(f::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(registry.find(tableId)).isPresent();
    }

    @Test
    void closeTable_byCreator_removesTable() {
        service.closeTable(tableId, "owner").join();

        assertThat(registry.find(tableId)).isEmpty();
        assertThat(service.listTables()).isEmpty();
        verify(repo).deleteById(tableId);
        verify(broadcast).dropTable(tableId);
    }

    // ---------------------------------------------------------
    // play
    // ---------------------------------------------------------
    @Test
    void sit_twoPlayers_startsHand() {
        seatTwo();

        TableSnapshot s = snapshot();
        assertThat(s.getPhase()).isEqualTo(TablePhase.PRE_FLOP);
        assertThat(s.getPotTotal()).isEqualTo(30);
        assertThat(s.getSeats().get(0).cardCount()).isEqualTo(2);
        assertThat(s.getSeats().get(0).holeCards()).isEmpty();
    }

    @Test
    void submitAction_outOfTurn_rejectedAndVersionUnchanged() {
        seatTwo();
        TableSnapshot before = snapshot();
        String waiting = before.getSeats().get(before.getBigBlindIndex()).playerId();

        CompletableFuture<Long> f = service.submitAction(tableId, waiting, PlayerAction.call(waiting));

        assertThatThrownBy(f::join).hasCauseInstanceOf(ActionRejectedException.class);
        assertThat(snapshot().getVersion()).isEqualTo(before.getVersion());
    }

    @Test
    void submitAction_usesCallerIdentity_notPayload() {
        seatTwo();
        TableSnapshot before = snapshot();
        String actor = before.getSeats().get(before.getCurrentActorIndex()).playerId();
        String other = actor.equals("alice") ? "bob" : "alice";

        CompletableFuture<Long> f = service.submitAction(tableId, other, PlayerAction.fold(actor));

        assertThatThrownBy(f::join).hasCauseInstanceOf(ActionRejectedException.class);
    }

    @Test
    void submitAction_accepted_returnsNewVersion() {
        seatTwo();
        TableSnapshot before = snapshot();
        String actor = before.getSeats().get(before.getCurrentActorIndex()).playerId();

        long version = service.submitAction(tableId, actor, PlayerAction.call(actor)).join();

        assertThat(version).isGreaterThan(before.getVersion());
        assertThat(snapshot().getVersion()).isEqualTo(version);
    }

    @Test
    void snapshot_staleVersion_conflict() {
        seatTwo();
        CompletableFuture<TableSnapshot> f = service.snapshot(tableId, 0);

        assertThatThrownBy(f::join).hasCauseInstanceOf(StateConflictException.class);
    }

    @Test
    void playerView_showsOwnCardsAndLegalActionsOnlyToActor() {
        seatTwo();
        TableSnapshot s = snapshot();
        String actor = s.getSeats().get(s.getCurrentActorIndex()).playerId();
        String other = actor.equals("alice") ? "bob" : "alice";

        PlayerView mine = service.playerView(tableId, actor).join();
        PlayerView theirs = service.playerView(tableId, other).join();

        assertThat(mine.holeCards()).hasSize(2);
        assertThat(mine.legal().allows(ActionType.CALL)).isTrue();
        assertThat(theirs.holeCards()).hasSize(2).doesNotContainAnyElementsOf(mine.holeCards());
        assertThat(theirs.legal()).isEqualTo(LegalActions.NONE);
    }

    @Test
    void playerView_spectator_noCards() {
        PlayerView v = service.playerView(tableId, "watcher").join();
        assertThat(v.seat()).isNull();
        assertThat(v.holeCards()).isEmpty();
    }

    @Test
    void hand_dealsPrivateViewsToSeatedHumans() {
        seatTwo();
        verify(broadcast, atLeastOnce()).sendPrivate(eq("alice"), eq(tableId), any(PlayerView.class));
        verify(broadcast, atLeastOnce()).sendPrivate(eq("bob"), eq(tableId), any(PlayerView.class));
    }

    // ---------------------------------------------------------
    // seating
    // ---------------------------------------------------------
    @Test
    void addAiPlayer_unknownStrategy_failsFast() {
        CompletableFuture<String> f = service.addAiPlayer(tableId, "bluffer", null);
        assertThatThrownBy(f::join).hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addAiPlayer_defaultStrategy_seatsBotWithDefaultBuyIn() {
        String botId = service.addAiPlayer(tableId, null, null).join();

        assertThat(botId).startsWith("bot-");
        TableSnapshot s = snapshot();
        assertThat(s.getSeats().get(0).ai()).isTrue();
        assertThat(s.getSeats().get(0).aiStrategy()).isEqualTo(CheckCallStrategy.NAME);
        assertThat(s.getSeats().get(0).stack()).isEqualTo(1000);
    }

    @Test
    void sit_atSecondTable_refused() {
        service.sit(tableId, "alice", null, 1000L).join();
        doAnswer(inv -> {
            PokerTableEntity e = inv.getArgument(0);
            e.setId(2L);
            return e;
        }).when(repo).save(any());
        Long second = service.createTable("owner", new CreateTableRequest()).getId();

        CompletableFuture<Integer> f = service.sit(second, "alice", null, 1000L);

        assertThatThrownBy(f::join).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void markDisconnected_findsTableThroughBinding() {
        service.sit(tableId, "alice", null, 1000L).join();

        service.markDisconnected("alice");

        assertThat(snapshot().getSeats().get(0).connected()).isFalse();
        verify(timeouts).schedule(eq(tableId), eq("grace:alice"), anyLong(), any(Runnable.class));

        service.markReconnected("alice");
        assertThat(snapshot().getSeats().get(0).connected()).isTrue();
    }

    @Test
    void leave_betweenHands_freesSeat() {
        service.sit(tableId, "alice", null, 1000L).join();

        service.leave(tableId, "alice").join();

        assertThat(snapshot().getSeats().get(0)).isNull();
        assertThat(registry.tableOf("alice")).isEmpty();
    }

    @Test
    void subscribe_unknownTable_refused() {
        assertThatThrownBy(() -> service.subscribe(99L, d -> { })).isInstanceOf(IllegalArgumentException.class);
    }
}
