package seakers.micscheduler.moeaclasses;

import org.apache.commons.math3.random.RandomGenerator;
import org.moeaframework.core.Solution;
import org.moeaframework.core.Variation;
import org.moeaframework.core.variable.EncodingUtils;

public class SwapMutation implements Variation {

    // Each position is swapped with a uniformly chosen partner with the given probability; NaN means 1/n

    private final double probability;
    private final RandomGenerator random;

    public SwapMutation(double probability, RandomGenerator random) {
        this.probability = probability;
        this.random = random;
    }

    @Override
    public int getArity() {
        return 1;
    }

    @Override
    public Solution[] evolve(Solution[] parents) {
        Solution child = parents[0].copy();
        int[] genes = EncodingUtils.getPermutation(child.getVariable(0));
        int n = genes.length;
        if (n < 2) {
            return new Solution[]{child};
        }

        double rate = Double.isNaN(this.probability) ? 1.0 / n : this.probability;
        boolean changed = false;
        for (int i = 0; i < n; i++) {
            if (this.random.nextDouble() < rate) {
                int j = this.random.nextInt(n - 1);
                if (j >= i) {
                    j++;
                }
                int swap = genes[i];
                genes[i] = genes[j];
                genes[j] = swap;
                changed = true;
            }
        }
        if (changed) {
            EncodingUtils.setPermutation(child.getVariable(0), genes);
        }
        return new Solution[]{child};
    }
}
