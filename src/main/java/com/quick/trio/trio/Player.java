package com.quick.trio.trio;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A seat in a room. The hand is always sorted ascending by number, so
 * "lowest" and "highest" are the first and last cards.
 */
@Getter
public class Player {

    private static final Comparator<Card> BY_NUMBER = Comparator.comparingInt(Card::number);

    private final String id;
    private final String name;
    private final String sessionId;
    private final List<Card> hand = new ArrayList<>();
    private final List<Trio> trios = new CopyOnWriteArrayList<>();
    private volatile boolean connected = true;

    public Player(String id, String name, String sessionId) {
        this.id = id;
        this.name = name;
        this.sessionId = sessionId;
    }

    public List<Card> getHand() {
        return Collections.unmodifiableList(hand);
    }

    public List<Trio> getTrios() {
        return Collections.unmodifiableList(trios);
    }

    public int handSize() {
        return hand.size();
    }

    public int trioCount() {
        return trios.size();
    }

    public Card lowest() {
        return hand.isEmpty() ? null : hand.get(0);
    }

    public Card highest() {
        return hand.isEmpty() ? null : hand.get(hand.size() - 1);
    }

    void setConnected(boolean connected) {
        this.connected = connected;
    }

    void receive(Collection<Card> cards) {
        hand.addAll(cards);
        hand.sort(BY_NUMBER);
    }

    /**
     * Removes the card at the requested end of the hand.
     */
    Card take(HandPosition position) {
        if (hand.isEmpty()) {
            throw new IllegalStateException(name + " has no cards");
        }
        return switch (position) {
            case LOWEST -> hand.remove(0);
            case HIGHEST -> hand.remove(hand.size() - 1);
        };
    }

    void returnCard(Card card) {
        hand.add(card);
        hand.sort(BY_NUMBER);
    }

    void addTrio(Trio trio) {
        trios.add(trio);
    }
}
