package com.quick.trio.trio;

import java.util.List;

/**
 * Decision taken after every reveal, looking only at the tail of the sequence.
 */
public enum RevealOutcome {
    UNDECIDED,  // fewer than two cards
    CONTINUE,   // last two match, keep revealing
    TRIO,       // last three match
    FAIL;       // last two differ

    public static RevealOutcome of(List<Integer> numbers) {
        int size = numbers.size();
        if (size < 2) {
            return UNDECIDED;
        }
        int last = numbers.get(size - 1);
        int previous = numbers.get(size - 2);
        if (size >= 3 && last == previous && previous == numbers.get(size - 3)) {
            return TRIO;
        }
        if (last != previous) {
            return FAIL;
        }
        return CONTINUE;
    }
}
