package com.quick.trio.trio;

/**
 * One exposed card of the current reveal sequence.
 *
 * @param sourceLabel "Middle" or the display name of the origin seat
 */
public record RevealEntry(Card card, RevealOrigin origin, String sourceLabel) {
}
