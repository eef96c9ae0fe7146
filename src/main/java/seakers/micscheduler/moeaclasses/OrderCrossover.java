package seakers.micscheduler.moeaclasses;

import org.apache.commons.math3.random.RandomGenerator;
import org.moeaframework.core.Solution;
import org.moeaframework.core.Variation;
import org.moeaframework.core.variable.EncodingUtils;

public class OrderCrossover implements Variation {

    /**
     * Order crossover (OX) on the cluster permutation. A random slice of one parent is kept in place and the
     * remaining positions are filled, starting after the slice and wrapping around, with the other parent's genes
     * in their original order. Parents are never modified.
     */

    private final double probability;
    private final RandomGenerator random;

    public OrderCrossover(double probability, RandomGenerator random) {
        this.probability = probability;
        this.random = random;
    }

    @Override
    public int getArity() {
        return 2;
    }

    @Override
    public Solution[] evolve(Solution[] parents) {
        Solution child1 = parents[0].copy();
        Solution child2 = parents[1].copy();

        int[] first = EncodingUtils.getPermutation(parents[0].getVariable(0));
        int[] second = EncodingUtils.getPermutation(parents[1].getVariable(0));
        int n = first.length;

        if (n > 1 && this.random.nextDouble() <= this.probability) {
            int a = this.random.nextInt(n);
            int b = this.random.nextInt(n);
            int from = Math.min(a, b);
            int to = Math.max(a, b);

            EncodingUtils.setPermutation(child1.getVariable(0), cross(first, second, from, to));
            EncodingUtils.setPermutation(child2.getVariable(0), cross(second, first, from, to));
        }

        return new Solution[]{child1, child2};
    }

    static int[] cross(int[] keep, int[] fill, int from, int to) {
        int n = keep.length;
        int[] child = new int[n];
        boolean[] used = new boolean[n];
        for (int i = from; i <= to; i++) {
            child[i] = keep[i];
            used[keep[i]] = true;
        }

        int write = (to + 1) % n;
        for (int offset = 0; offset < n; offset++) {
            int gene = fill[(to + 1 + offset) % n];
            if (used[gene]) {
                continue;
            }
            child[write] = gene;
            used[gene] = true;
            write = (write + 1) % n;
        }
        return child;
    }
}
