package seakers.micscheduler.rollinghorizon;

/**
 * Planning window [origin, origin + lookahead). Work starting before {@link #commitEnd()} gets committed.
 */
public class RollingWindow {

    private final int origin;
    private final int commitHours;
    private final int lookaheadHours;

    public RollingWindow(int origin, int commitHours, int lookaheadHours) {
        if (origin < 0 || commitHours < 0 || lookaheadHours <= 0) {
            throw new IllegalArgumentException("Invalid window: origin " + origin + ", commit " + commitHours + ", lookahead " + lookaheadHours);
        }
        this.origin = origin;
        this.commitHours = commitHours;
        this.lookaheadHours = lookaheadHours;
    }

    public RollingWindow advanceTo(int hour) {
        if (hour < this.origin) {
            throw new IllegalArgumentException("Window cannot move backward from hour " + this.origin + " to hour " + hour);
        }
        return new RollingWindow(hour, this.commitHours, this.lookaheadHours);
    }

    public int getOrigin() {
        return this.origin;
    }

    public int getCommitHours() {
        return this.commitHours;
    }

    public int getLookaheadHours() {
        return this.lookaheadHours;
    }

    public int commitEnd() {
        return this.origin + this.commitHours;
    }

    public int horizonEnd() {
        return this.origin + this.lookaheadHours;
    }

    @Override
    public String toString() {
        return "RollingWindow{origin=" + this.origin + ", commitEnd=" + commitEnd() + ", horizonEnd=" + horizonEnd() + '}';
    }
}
