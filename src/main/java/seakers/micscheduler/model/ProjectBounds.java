package seakers.micscheduler.model;

/**
 * Declared spatial extent of the project site; task coordinates outside it are rejected
 */
public class ProjectBounds {

    private final double[] min;
    private final double[] max;

    public ProjectBounds(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {
        if (minX > maxX || minY > maxY || minZ > maxZ) {
            throw new IllegalArgumentException("Project bounds have min greater than max");
        }
        this.min = new double[]{minX, minY, minZ};
        this.max = new double[]{maxX, maxY, maxZ};
    }

    public static ProjectBounds unbounded() {
        return new ProjectBounds(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY,
                Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public boolean contains(double x, double y, double z) {
        double[] point = {x, y, z};
        for (int i = 0; i < 3; i++) {
            if (Double.isNaN(point[i]) || point[i] < this.min[i] || point[i] > this.max[i]) {
                return false;
            }
        }
        return true;
    }
}
