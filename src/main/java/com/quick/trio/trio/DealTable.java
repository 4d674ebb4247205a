package com.quick.trio.trio;

/**
 * Cards per hand and cards left in the middle for a seat count.
 */
public record DealTable(int handSize, int middleSize) {

    public static final int MIN_SEATS = 3;
    public static final int MAX_SEATS = 6;

    public static DealTable forSeats(int seats) {
        return switch (seats) {
            case 3 -> new DealTable(9, 9);
            case 4 -> new DealTable(7, 8);
            case 5 -> new DealTable(6, 6);
            case 6 -> new DealTable(5, 6);
            default -> new DealTable(5, 6);
        };
    }
}
