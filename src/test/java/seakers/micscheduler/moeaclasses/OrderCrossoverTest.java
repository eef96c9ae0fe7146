package seakers.micscheduler.moeaclasses;

import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moeaframework.core.Solution;
import org.moeaframework.core.variable.EncodingUtils;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class OrderCrossoverTest {

    private static Solution permutation(int... genes) {
        Solution solution = new Solution(1, 3, 1);
        solution.setVariable(0, EncodingUtils.newPermutation(genes.length));
        EncodingUtils.setPermutation(solution.getVariable(0), genes);
        return solution;
    }

    private static boolean isPermutation(int[] genes) {
        int[] sorted = genes.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] != i) {
                return false;
            }
        }
        return true;
    }

    @Test
    @DisplayName("the kept segment stays in place and the rest follows the other parent's order")
    void crossKeepsSegment() {
        int[] child = OrderCrossover.cross(new int[]{0, 1, 2, 3, 4, 5}, new int[]{5, 4, 3, 2, 1, 0}, 2, 3);
        assertArrayEquals(new int[]{5, 4, 2, 3, 1, 0}, child);

        int[] whole = OrderCrossover.cross(new int[]{3, 1, 0, 2}, new int[]{0, 1, 2, 3}, 0, 3);
        assertArrayEquals(new int[]{3, 1, 0, 2}, whole);
    }

    @Test
    @DisplayName("offspring are valid permutations and parents are untouched")
    void evolveProducesPermutations() {
        OrderCrossover crossover = new OrderCrossover(1.0, new MersenneTwister(7L));
        Solution first = permutation(0, 1, 2, 3, 4, 5, 6, 7);
        Solution second = permutation(7, 6, 5, 4, 3, 2, 1, 0);

        for (int i = 0; i < 50; i++) {
            Solution[] children = crossover.evolve(new Solution[]{first, second});
            assertEquals(2, children.length);
            assertTrue(isPermutation(EncodingUtils.getPermutation(children[0].getVariable(0))));
            assertTrue(isPermutation(EncodingUtils.getPermutation(children[1].getVariable(0))));
        }
        assertArrayEquals(new int[]{0, 1, 2, 3, 4, 5, 6, 7}, EncodingUtils.getPermutation(first.getVariable(0)));
        assertArrayEquals(new int[]{7, 6, 5, 4, 3, 2, 1, 0}, EncodingUtils.getPermutation(second.getVariable(0)));
    }

    @Test
    @DisplayName("with probability zero the children are copies of the parents")
    void noCrossover() {
        OrderCrossover crossover = new OrderCrossover(0.0, new MersenneTwister(7L));
        Solution[] children = crossover.evolve(new Solution[]{permutation(2, 0, 1), permutation(1, 2, 0)});
        assertArrayEquals(new int[]{2, 0, 1}, EncodingUtils.getPermutation(children[0].getVariable(0)));
        assertArrayEquals(new int[]{1, 2, 0}, EncodingUtils.getPermutation(children[1].getVariable(0)));
    }
}
