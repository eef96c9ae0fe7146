package seakers.micscheduler.problems;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import seakers.micscheduler.model.CriticalityScale;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.SystemCategory;
import seakers.micscheduler.model.Task;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Random but valid MiC task sets for demos, batch runs and tests. Modules sit on a grid of floors; each task may
 * depend on up to {@code maxPredecessors} earlier tasks, so the dependency graph is always acyclic.
 */
public class SyntheticProjectGenerator {

    private final int floors;
    private final double floorHeight;
    private final double siteSize;
    private final int maxPredecessors;
    private final int maxDuration;

    public SyntheticProjectGenerator(int floors, double floorHeight, double siteSize, int maxPredecessors, int maxDuration) {
        this.floors = floors;
        this.floorHeight = floorHeight;
        this.siteSize = siteSize;
        this.maxPredecessors = maxPredecessors;
        this.maxDuration = maxDuration;
    }

    public SyntheticProjectGenerator() {
        this(10, 3.0, 50.0, 2, 16);
    }

    /**
     * Tasks with ids 1..count. Demands stay within the default capacities.
     */
    public List<Task> generate(int count, long seed) {
        RandomGenerator random = new MersenneTwister(seed);
        SystemCategory[] systems = SystemCategory.values();
        List<Task> tasks = new ArrayList<>();

        for (int id = 1; id <= count; id++) {
            SystemCategory system = systems[random.nextInt(systems.length)];
            int floor = random.nextInt(this.floors);
            double x = random.nextDouble() * this.siteSize;
            double y = random.nextDouble() * this.siteSize;
            double z = floor * this.floorHeight;

            int[] demand = new int[ResourceType.COUNT];
            demand[ResourceType.SKILLED.ordinal()] = 1 + random.nextInt(3);
            demand[ResourceType.SEMI_SKILLED.ordinal()] = random.nextInt(4);
            demand[ResourceType.UNSKILLED.ordinal()] = random.nextInt(5);
            if (system == SystemCategory.STRUCT || system == SystemCategory.FACADE) {
                demand[ResourceType.CRANE.ordinal()] = random.nextInt(2);
            }
            if (system == SystemCategory.ELEC || system == SystemCategory.PLUMB) {
                demand[ResourceType.TESTING.ordinal()] = random.nextInt(2);
            }
            demand[ResourceType.SPECIALIZED.ordinal()] = random.nextInt(2);

            int duration = 2 + random.nextInt(Math.max(1, this.maxDuration - 1));
            int criticality = CriticalityScale.fromRpn(1 + random.nextInt(10), 1 + random.nextInt(10), 1 + random.nextInt(10));

            Set<Integer> predecessors = new HashSet<>();
            if (id > 1) {
                int wanted = random.nextInt(this.maxPredecessors + 1);
                for (int p = 0; p < wanted; p++) {
                    predecessors.add(1 + random.nextInt(id - 1));
                }
            }
            tasks.add(new Task(id, system, x, y, z, demand, duration, predecessors, criticality));
        }
        return tasks;
    }
}
