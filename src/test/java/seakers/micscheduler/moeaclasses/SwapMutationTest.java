package seakers.micscheduler.moeaclasses;

import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moeaframework.core.Solution;
import org.moeaframework.core.variable.EncodingUtils;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SwapMutationTest {

    private static Solution permutation(int... genes) {
        Solution solution = new Solution(1, 3, 1);
        solution.setVariable(0, EncodingUtils.newPermutation(genes.length));
        EncodingUtils.setPermutation(solution.getVariable(0), genes);
        return solution;
    }

    @Test
    @DisplayName("mutants stay permutations and the parent is untouched")
    void validPermutations() {
        SwapMutation mutation = new SwapMutation(0.5, new MersenneTwister(3L));
        Solution parent = permutation(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        boolean anyChange = false;
        for (int i = 0; i < 100; i++) {
            int[] genes = EncodingUtils.getPermutation(mutation.evolve(new Solution[]{parent})[0].getVariable(0));
            int[] sorted = genes.clone();
            Arrays.sort(sorted);
            assertArrayEquals(new int[]{0, 1, 2, 3, 4, 5, 6, 7, 8, 9}, sorted);
            if (!Arrays.equals(new int[]{0, 1, 2, 3, 4, 5, 6, 7, 8, 9}, genes)) {
                anyChange = true;
            }
        }
        assertTrue(anyChange);
        assertArrayEquals(new int[]{0, 1, 2, 3, 4, 5, 6, 7, 8, 9}, EncodingUtils.getPermutation(parent.getVariable(0)));
    }

    @Test
    @DisplayName("probability zero leaves the order unchanged, a single gene is never mutated")
    void noMutation() {
        SwapMutation never = new SwapMutation(0.0, new MersenneTwister(3L));
        int[] genes = EncodingUtils.getPermutation(never.evolve(new Solution[]{permutation(3, 1, 2, 0)})[0].getVariable(0));
        assertArrayEquals(new int[]{3, 1, 2, 0}, genes);

        SwapMutation defaultRate = new SwapMutation(Double.NaN, new MersenneTwister(3L));
        assertArrayEquals(new int[]{0}, EncodingUtils.getPermutation(defaultRate.evolve(new Solution[]{permutation(0)})[0].getVariable(0)));
    }
}
