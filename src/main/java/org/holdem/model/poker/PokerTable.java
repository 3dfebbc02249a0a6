package org.holdem.model.poker;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;

import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;

/**
 * All mutable state of one table. Only the table's worker touches it, see
 * {@link org.holdem.service.poker.sync.TableWorkers}.
 */
@Data
public class PokerTable {
    private final Long id;
    private final int maxSeats;
    private final long smallBlind;
    private final long bigBlind;

    private String name;
    private long minBuyIn;
    private long maxBuyIn;
    private boolean autoContinue = true;
    private String createdBy;

    private final List<Seat> seats;
    private Deck deck;
    private final List<Card> communityCards = new ArrayList<>();

    private TablePhase phase = TablePhase.WAITING_FOR_PLAYERS;
    private int dealerIndex = -1;
    private int smallBlindIndex = -1;
    private int bigBlindIndex = -1;
    private Integer currentActorIndex = null;
    private long betToCall;
    private long minRaise;
    private List<PotLayer> pots = new ArrayList<>();
    private boolean showdownReached;

    private long version;
    private long handNumber;
    private String handId;
    private long chipsAtHandStart;
    private final List<ActionLogEntry> actionLog = new ArrayList<>();
    private List<Award> lastAwards = new ArrayList<>();
    private long turnDeadlineEpochMs;
    // bumped on every actor change, stale turn timers compare against it
    private long turnToken;

    private boolean pendingClose;
    private boolean closed;
    private boolean halted;

    private final List<StateDelta> outbox = new ArrayList<>();
    private ObjectNode lastPublished;
    // players owed a fresh private view once the current task is flushed
    private final Set<String> privateDirty = new LinkedHashSet<>();

    private Instant createdAt = Instant.now();
    private Instant lastActiveAt = Instant.now();

    public PokerTable(Long id, int maxSeats, long smallBlind, long bigBlind) {
        if (maxSeats < 2 || maxSeats > 10) throw new IllegalArgumentException("maxSeats must be between 2 and 10");
        if (smallBlind <= 0 || bigBlind < smallBlind) throw new IllegalArgumentException("Invalid blinds");
        this.id = id;
        this.maxSeats = maxSeats;
        this.smallBlind = smallBlind;
        this.bigBlind = bigBlind;
        this.minBuyIn = bigBlind * 20;
        this.maxBuyIn = bigBlind * 200;
        this.seats = new ArrayList<>(Collections.nCopies(maxSeats, (Seat) null));
    }

    public Seat seatAt(int position) { return seats.get(position); }

    public Optional<Seat> seatOf(String playerId) {
        if (playerId == null) return Optional.empty();
        return occupied().filter(s -> playerId.equals(s.getPlayerId())).findFirst();
    }

    public java.util.stream.Stream<Seat> occupied() {
        return seats.stream().filter(Objects::nonNull);
    }

    public Optional<Integer> firstEmpty() {
        for (int i = 0; i < maxSeats; i++) if (seats.get(i) == null) return Optional.of(i);
        return Optional.empty();
    }

    public boolean isFull() { return firstEmpty().isEmpty(); }

    public Seat currentActor() {
        return currentActorIndex == null ? null : seats.get(currentActorIndex);
    }

    /** Seats still holding cards (active or all-in). */
    public List<Seat> inHand() {
        return occupied().filter(s -> s.getStatus().isInHand()).toList();
    }

    /**
     * First occupied seat strictly after {@code from} (clockwise, wrapping)
     * matching the predicate, or -1.
     */
    public int nextSeat(int from, Predicate<Seat> p) {
        for (int k = 1; k <= maxSeats; k++) {
            int i = Math.floorMod(from + k, maxSeats);
            Seat s = seats.get(i);
            if (s != null && p.test(s)) return i;
        }
        return -1;
    }

    /** Chips owned by the seats dealt into the current hand, stacked or committed. */
    public long chipsInPlay() {
        return occupied()
                .filter(s -> !s.getHoleCards().isEmpty())
                .mapToLong(s -> s.getStack() + s.getHandContribution())
                .sum();
    }

    public long potTotal() {
        return pots.stream().mapToLong(PotLayer::amount).sum();
    }

    public List<StateDelta> drainOutbox() {
        List<StateDelta> out = new ArrayList<>(outbox);
        outbox.clear();
        return out;
    }

    public List<String> drainPrivateDirty() {
        List<String> out = new ArrayList<>(privateDirty);
        privateDirty.clear();
        return out;
    }
}
