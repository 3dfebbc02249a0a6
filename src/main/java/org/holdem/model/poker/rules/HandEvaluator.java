package org.holdem.model.poker.rules;

import org.holdem.model.poker.Card;

import java.util.*;

/**
 * Best-five-of-seven hand evaluator backed by lookup tables built once at class load:
 * flushes and five distinct ranks are indexed by their 13-bit rank mask, every
 * paired rank multiset by the product of one prime per rank. A 5-card hand is one
 * lookup, 6 and 7 cards iterate the 6 / 21 five-card subsets.
 */
public final class HandEvaluator {
    private HandEvaluator() {}

    private static final int[] PRIMES = {2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41};
    private static final int WHEEL = 0b1_0000_0000_1111;

    private static final int[] FLUSHES = new int[1 << 13];
    private static final int[] UNIQUE = new int[1 << 13];
    private static final Map<Integer, Integer> PAIRED = new HashMap<>(4096);

    private static final int[][] COMBOS_6 = combos(6);
    private static final int[][] COMBOS_7 = combos(7);

    static {
        for (int mask = 0; mask < (1 << 13); mask++) {
            if (Integer.bitCount(mask) != 5) continue;
            int[] ranks = ranksOf(mask);
            int straightHigh = straightHigh(mask);
            if (straightHigh > 0) {
                FLUSHES[mask] = HandRank.pack(HandCategory.STRAIGHT_FLUSH, straightHigh);
                UNIQUE[mask] = HandRank.pack(HandCategory.STRAIGHT, straightHigh);
            } else {
                FLUSHES[mask] = HandRank.pack(HandCategory.FLUSH, ranks);
                UNIQUE[mask] = HandRank.pack(HandCategory.HIGH_CARD, ranks);
            }
        }
        fillPaired(new int[13], 12, 5);
    }

    public static HandRank evaluate(List<Card> hole, List<Card> board) {
        List<Card> all = new ArrayList<>(hole.size() + board.size());
        all.addAll(hole);
        all.addAll(board);
        return evaluate(all);
    }

    /** Best rank achievable from 5, 6 or 7 distinct cards. */
    public static HandRank evaluate(Collection<Card> cards) {
        int n = cards.size();
        if (n < 5 || n > 7) throw new IllegalArgumentException("Need 5 to 7 cards, got " + n);
        if (new HashSet<>(cards).size() != n) throw new IllegalArgumentException("Duplicate cards: " + cards);

        int[] ranks = new int[n];
        int[] suits = new int[n];
        int i = 0;
        for (Card c : cards) {
            ranks[i] = c.value() - 2;
            suits[i] = c.getSuit().ordinal();
            i++;
        }
        if (n == 5) return new HandRank(eval5(ranks, suits, 0, 1, 2, 3, 4));

        int best = 0;
        for (int[] c : n == 6 ? COMBOS_6 : COMBOS_7) {
            best = Math.max(best, eval5(ranks, suits, c[0], c[1], c[2], c[3], c[4]));
        }
        return new HandRank(best);
    }

    private static int eval5(int[] r, int[] s, int a, int b, int c, int d, int e) {
        int mask = (1 << r[a]) | (1 << r[b]) | (1 << r[c]) | (1 << r[d]) | (1 << r[e]);
        boolean flush = s[a] == s[b] && s[a] == s[c] && s[a] == s[d] && s[a] == s[e];
        if (flush) return FLUSHES[mask];
        if (Integer.bitCount(mask) == 5) return UNIQUE[mask];
        int product = PRIMES[r[a]] * PRIMES[r[b]] * PRIMES[r[c]] * PRIMES[r[d]] * PRIMES[r[e]];
        return PAIRED.get(product);
    }

    // enumerates every rank multiset of size 5 with at most four of a rank
    private static void fillPaired(int[] counts, int rank, int left) {
        if (left == 0) {
            int product = 1;
            boolean paired = false;
            for (int r = 0; r < 13; r++) {
                for (int k = 0; k < counts[r]; k++) product *= PRIMES[r];
                if (counts[r] > 1) paired = true;
            }
            if (paired) PAIRED.put(product, classifyPaired(counts));
            return;
        }
        if (rank < 0) return;
        for (int k = Math.min(4, left); k >= 0; k--) {
            counts[rank] = k;
            fillPaired(counts, rank - 1, left - k);
        }
        counts[rank] = 0;
    }

    private static int classifyPaired(int[] counts) {
        // groups ordered by size then rank, both descending
        List<int[]> groups = new ArrayList<>();
        for (int r = 12; r >= 0; r--) if (counts[r] > 0) groups.add(new int[]{counts[r], r + 2});
        groups.sort((x, y) -> x[0] != y[0] ? Integer.compare(y[0], x[0]) : Integer.compare(y[1], x[1]));
        int[] k = groups.stream().mapToInt(g -> g[1]).toArray();

        int top = groups.get(0)[0];
        int second = groups.size() > 1 ? groups.get(1)[0] : 0;
        if (top == 4) return HandRank.pack(HandCategory.FOUR_OF_A_KIND, k);
        if (top == 3 && second == 2) return HandRank.pack(HandCategory.FULL_HOUSE, k);
        if (top == 3) return HandRank.pack(HandCategory.THREE_OF_A_KIND, k);
        if (second == 2) return HandRank.pack(HandCategory.TWO_PAIR, k);
        return HandRank.pack(HandCategory.ONE_PAIR, k);
    }

    private static int straightHigh(int mask) {
        if (mask == WHEEL) return 5;
        int low = Integer.numberOfTrailingZeros(mask);
        return (mask >>> low) == 0b11111 ? low + 6 : 0;
    }

    private static int[] ranksOf(int mask) {
        int[] out = new int[5];
        int i = 0;
        for (int r = 12; r >= 0; r--) if ((mask & (1 << r)) != 0) out[i++] = r + 2;
        return out;
    }

    private static int[][] combos(int n) {
        List<int[]> out = new ArrayList<>();
        for (int a = 0; a < n; a++)
            for (int b = a + 1; b < n; b++)
                for (int c = b + 1; c < n; c++)
                    for (int d = c + 1; d < n; d++)
                        for (int e = d + 1; e < n; e++)
                            out.add(new int[]{a, b, c, d, e});
        return out.toArray(new int[0][]);
    }
}
