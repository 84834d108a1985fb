package com.edugen.core.generation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shuffles puzzle pieces so the answer is not shown in order.
 */
public final class ItemShuffler {
    
    private static final int MAX_ATTEMPTS = 100;
    
    private ItemShuffler() {
    }
    
    /**
     * Returns a permutation that differs from {@code original} whenever one exists.
     * Falls back to swapping the first two pieces.
     */
    public static <T> List<T> shuffleAwayFrom(List<T> original, Random random) {
        List<T> shuffled = new ArrayList<>(original);
        if (shuffled.size() < 2) {
            return shuffled;
        }
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            Collections.shuffle(shuffled, random);
            if (!shuffled.equals(original)) {
                return shuffled;
            }
        }
        shuffled = new ArrayList<>(original);
        Collections.swap(shuffled, 0, 1);
        return shuffled;
    }
    
    public static <T> List<T> shuffle(List<T> items, Random random) {
        List<T> shuffled = new ArrayList<>(items);
        Collections.shuffle(shuffled, random);
        return shuffled;
    }
}
