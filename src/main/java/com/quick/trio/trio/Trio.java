package com.quick.trio.trio;

import java.util.List;

/**
 * Three captured cards of the same number.
 */
public record Trio(List<Card> cards) {

    public Trio {
        if (cards.size() != 3 || cards.stream().map(Card::number).distinct().count() != 1) {
            throw new IllegalArgumentException("A trio is exactly three cards of one number");
        }
        cards = List.copyOf(cards);
    }

    public int number() {
        return cards.get(0).number();
    }
}
