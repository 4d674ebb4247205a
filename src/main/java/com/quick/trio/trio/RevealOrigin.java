package com.quick.trio.trio;

/**
 * Where a revealed card came from. Each variant knows how to put its card back
 * after a failed sequence and what a capture does to its slot.
 */
public sealed interface RevealOrigin permits RevealOrigin.Middle, RevealOrigin.Hand {

    static RevealOrigin middle() {
        return Middle.INSTANCE;
    }

    static RevealOrigin hand(String playerId, HandPosition position) {
        return new Hand(playerId, position);
    }

    /**
     * Puts the card back where it was revealed from. Returns the id of the seat
     * whose hand changed, or null when no hand changed.
     */
    String restore(Room room, Card card);

    /**
     * Settles the origin once the card is captured into a trio. Returns the id of
     * the seat whose hand changed, or null.
     */
    String capture(Room room, Card card);

    String sourceId();

    HandPosition position();

    record Middle() implements RevealOrigin {

        private static final Middle INSTANCE = new Middle();

        @Override
        public String restore(Room room, Card card) {
            room.middleSlot(card.id()).flipDown();
            return null;
        }

        @Override
        public String capture(Room room, Card card) {
            room.middleSlot(card.id()).markTaken();
            return null;
        }

        @Override
        public String sourceId() {
            return null;
        }

        @Override
        public HandPosition position() {
            return null;
        }
    }

    record Hand(String playerId, HandPosition position) implements RevealOrigin {

        @Override
        public String restore(Room room, Card card) {
            room.requirePlayer(playerId).returnCard(card);
            return playerId;
        }

        // the card already left the hand when it was revealed
        @Override
        public String capture(Room room, Card card) {
            return playerId;
        }

        @Override
        public String sourceId() {
            return playerId;
        }
    }
}
