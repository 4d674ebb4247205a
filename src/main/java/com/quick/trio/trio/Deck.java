package com.quick.trio.trio;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class Deck {

    public static final int COPIES_PER_NUMBER = 3;
    public static final int SIZE = COPIES_PER_NUMBER * Card.MAX_NUMBER;

    private Deck() {
    }

    /**
     * 36 cards, three of each number 1..12, in uniformly random order.
     */
    public static List<Card> shuffled(Random random) {
        List<Card> deck = new ArrayList<>(SIZE);
        int cardId = 0;
        for (int number = Card.MIN_NUMBER; number <= Card.MAX_NUMBER; number++) {
            for (int copy = 0; copy < COPIES_PER_NUMBER; copy++) {
                deck.add(new Card(cardId++, number));
            }
        }
        shuffle(deck, random);
        return deck;
    }

    // Fisher-Yates
    static <T> void shuffle(List<T> items, Random random) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            T temp = items.get(i);
            items.set(i, items.get(j));
            items.set(j, temp);
        }
    }
}
