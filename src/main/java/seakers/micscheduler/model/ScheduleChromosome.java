package seakers.micscheduler.model;

import java.util.Arrays;

/**
 * Execution priority over clusters: a permutation of the cluster indices {@code 0..n-1} where each index appears exactly once.
 * Immutable; variation operators build new chromosomes instead of editing existing ones.
 */
public final class ScheduleChromosome {

    private final int[] order;

    private ScheduleChromosome(int[] order) {
        this.order = order;
    }

    public static ScheduleChromosome of(int... order) {
        if (order == null) {
            throw new IllegalArgumentException("Chromosome order is missing");
        }
        boolean[] seen = new boolean[order.length];
        for (int gene : order) {
            if (gene < 0 || gene >= order.length || seen[gene]) {
                throw new IllegalArgumentException("Not a permutation of 0.." + (order.length - 1) + ": " + Arrays.toString(order));
            }
            seen[gene] = true;
        }
        return new ScheduleChromosome(order.clone());
    }

    public static ScheduleChromosome identity(int size) {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        return new ScheduleChromosome(order);
    }

    public int size() {
        return this.order.length;
    }

    public int get(int position) {
        return this.order[position];
    }

    public int[] toArray() {
        return this.order.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ScheduleChromosome)) {
            return false;
        }
        return Arrays.equals(this.order, ((ScheduleChromosome) other).order);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(this.order);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < this.order.length; i++) {
            if (i > 0) {
                builder.append('-');
            }
            builder.append(this.order[i]);
        }
        return builder.toString();
    }
}
