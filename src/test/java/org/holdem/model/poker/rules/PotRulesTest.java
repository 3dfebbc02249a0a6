package org.holdem.model.poker.rules;

import org.holdem.common.InvariantViolationException;
import org.holdem.model.poker.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PotRulesTest {

    PokerTable table;

    @BeforeEach
    void setup() {
        table = new PokerTable(1L, 6, 10, 20);
    }

    private Seat seat(int pos, String id, long contributed, PlayerStatus status) {
        Seat s = new Seat(pos, id, id, 1000);
        s.setHandContribution(contributed);
        s.setStatus(status);
        table.getSeats().set(pos, s);
        return s;
    }

    // ---------------------------------------------------------
    // layers()
    // ---------------------------------------------------------
    @Test
    void layers_shortAllIn_buildsMainAndSidePot() {
        seat(0, "A", 50, PlayerStatus.ALL_IN);
        seat(1, "B", 150, PlayerStatus.ACTIVE);
        seat(2, "C", 150, PlayerStatus.ACTIVE);

        List<PotLayer> pots = PotRules.layers(table.getSeats());

        assertThat(pots).hasSize(2);
        assertThat(pots.get(0).amount()).isEqualTo(150);
        assertThat(pots.get(0).eligiblePlayerIds()).containsExactly("A", "B", "C");
        assertThat(pots.get(1).amount()).isEqualTo(200);
        assertThat(pots.get(1).eligiblePlayerIds()).containsExactly("B", "C");
    }

    @Test
    void layers_foldedChipsStay_butFolderNeverEligible() {
        seat(0, "A", 100, PlayerStatus.FOLDED);
        seat(1, "B", 100, PlayerStatus.ACTIVE);
        seat(2, "C", 100, PlayerStatus.ACTIVE);

        List<PotLayer> pots = PotRules.layers(table.getSeats());

        assertThat(pots).hasSize(1);
        assertThat(pots.get(0).amount()).isEqualTo(300);
        assertThat(pots.get(0).eligiblePlayerIds()).containsExactly("B", "C");
    }

    @Test
    void layers_folderPutInMoreThanEveryoneLeft_joinsTopLayer() {
        seat(0, "A", 200, PlayerStatus.FOLDED);
        seat(1, "B", 80, PlayerStatus.ALL_IN);
        seat(2, "C", 80, PlayerStatus.ALL_IN);

        List<PotLayer> pots = PotRules.layers(table.getSeats());

        assertThat(pots).hasSize(1);
        assertThat(pots.get(0).amount()).isEqualTo(360);
        assertThat(pots.get(0).eligiblePlayerIds()).containsExactly("B", "C");
    }

    @Test
    void layers_uncalledTop_isOwnLayerForTheBettor() {
        seat(0, "A", 300, PlayerStatus.ACTIVE);
        seat(1, "B", 100, PlayerStatus.ALL_IN);

        List<PotLayer> pots = PotRules.layers(table.getSeats());

        assertThat(pots).extracting(PotLayer::amount).containsExactly(200L, 200L);
        assertThat(pots.get(1).eligiblePlayerIds()).containsExactly("A");
    }

    @Test
    void layers_noContribution_noPot() {
        seat(0, "A", 0, PlayerStatus.ACTIVE);
        seat(1, "B", 0, PlayerStatus.ACTIVE);
        assertThat(PotRules.layers(table.getSeats())).isEmpty();
    }

    // ---------------------------------------------------------
    // verify()
    // ---------------------------------------------------------
    @Test
    void verify_consistentTable_passes() {
        Seat a = seat(0, "A", 100, PlayerStatus.ACTIVE);
        Seat b = seat(1, "B", 100, PlayerStatus.ACTIVE);
        a.getHoleCards().addAll(Card.parse("As Kd"));
        b.getHoleCards().addAll(Card.parse("2c 3c"));
        table.setPots(PotRules.layers(table.getSeats()));
        table.setChipsAtHandStart(2200);

        assertThatCode(() -> PotRules.verify(table)).doesNotThrowAnyException();
    }

    @Test
    void verify_potDoesNotMatchContributions_throws() {
        seat(0, "A", 100, PlayerStatus.ACTIVE);
        table.setPots(List.of(new PotLayer(150, 100, List.of("A"))));

        assertThatThrownBy(() -> PotRules.verify(table)).isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void verify_chipsCreated_throws() {
        Seat a = seat(0, "A", 0, PlayerStatus.ACTIVE);
        a.getHoleCards().addAll(Card.parse("As Kd"));
        table.setChipsAtHandStart(999);

        assertThatThrownBy(() -> PotRules.verify(table))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("Chips in play");
    }

    // ---------------------------------------------------------
    // payOrder() / split()
    // ---------------------------------------------------------
    @Test
    void payOrder_startsLeftOfDealer() {
        Seat a = seat(0, "A", 0, PlayerStatus.ACTIVE);
        Seat b = seat(2, "B", 0, PlayerStatus.ACTIVE);
        Seat c = seat(4, "C", 0, PlayerStatus.ACTIVE);
        table.setDealerIndex(2);

        assertThat(PotRules.payOrder(table, List.of(a, b, c))).containsExactly(c, a, b);
    }

    @Test
    void split_oddChipGoesToFirstWinners() {
        assertThat(PotRules.split(101, 2)).containsExactly(51, 50);
        assertThat(PotRules.split(100, 3)).containsExactly(34, 33, 33);
        assertThat(PotRules.split(90, 3)).containsExactly(30, 30, 30);
    }
}
