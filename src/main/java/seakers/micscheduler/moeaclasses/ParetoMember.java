package seakers.micscheduler.moeaclasses;

import seakers.micscheduler.decoding.DecodedSchedule;
import seakers.micscheduler.model.ScheduleChromosome;

/**
 * One non-dominated schedule of a finished optimization
 */
public class ParetoMember {

    private final ScheduleChromosome chromosome;
    private final DecodedSchedule schedule;
    private final int rank;
    private final double crowding;

    public ParetoMember(ScheduleChromosome chromosome, DecodedSchedule schedule, int rank, double crowding) {
        this.chromosome = chromosome;
        this.schedule = schedule;
        this.rank = rank;
        this.crowding = crowding;
    }

    public ScheduleChromosome getChromosome() {
        return this.chromosome;
    }

    public DecodedSchedule getSchedule() {
        return this.schedule;
    }

    public double getCost() {
        return this.schedule.getCost();
    }

    public double getRisk() {
        return this.schedule.getRisk();
    }

    public double getDelay() {
        return this.schedule.getDelay();
    }

    public double[] getObjectives() {
        return this.schedule.getObjectives();
    }

    public int getRank() {
        return this.rank;
    }

    public double getCrowding() {
        return this.crowding;
    }

    @Override
    public String toString() {
        return "ParetoMember{" + this.chromosome + ", cost=" + getCost() + ", risk=" + getRisk() + ", delay=" + getDelay() + '}';
    }
}
