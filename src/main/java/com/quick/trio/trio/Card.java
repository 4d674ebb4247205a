package com.quick.trio.trio;

/**
 * A Trio card. Ids are unique within one deck, so the three copies of a number
 * are still distinct cards.
 */
public record Card(int id, int number) {

    public static final int MIN_NUMBER = 1;
    public static final int MAX_NUMBER = 12;

    public Card {
        if (number < MIN_NUMBER || number > MAX_NUMBER) {
            throw new IllegalArgumentException("Card number out of range: " + number);
        }
    }
}
