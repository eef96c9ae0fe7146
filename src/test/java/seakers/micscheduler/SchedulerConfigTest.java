package seakers.micscheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import seakers.micscheduler.model.ResourceType;

import java.io.IOException;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    @DisplayName("the bundled properties match the built-in defaults")
    void bundledDefaults() throws IOException {
        SchedulerConfig config = SchedulerConfig.load("scheduler.properties");

        assertEquals(2, config.getMinClusters());
        assertEquals(10, config.getMaxClusters());
        assertEquals(0, config.getForcedClusters());
        assertEquals(50, config.getPopulationSize());
        assertEquals(100, config.getGenerations());
        assertTrue(Double.isNaN(config.getMutationProbability()));
        assertEquals(42L, config.getSeed());
        assertEquals(24, config.getCommitWindowHours());
        assertEquals(10_000L, config.getReoptimizationBudgetMillis());
        assertFalse(config.isOverflowAllowed());
        assertEquals(3000.0, config.getCostModel().getDailyRate(ResourceType.CRANE), 0.0);
        assertArrayEquals(new double[]{0.35, 0.45, 0.20}, config.getObjectiveWeights().toArray(), 1e-12);
    }

    @Test
    @DisplayName("properties override individual settings and leave the rest alone")
    void overrides() {
        Properties properties = new Properties();
        properties.setProperty("optimizer.populationSize", " 80 ");
        properties.setProperty("clustering.forcedK", "4");
        properties.setProperty("decoding.overflowAllowed", "true");
        properties.setProperty("cost.rate.semi_skilled", "900");
        properties.setProperty("objective.delay", "0.5");

        SchedulerConfig config = SchedulerConfig.fromProperties(properties);

        assertEquals(80, config.getPopulationSize());
        assertEquals(4, config.getForcedClusters());
        assertTrue(config.isOverflowAllowed());
        assertEquals(900.0, config.getCostModel().getDailyRate(ResourceType.SEMI_SKILLED), 0.0);
        assertEquals(1200.0, config.getCostModel().getDailyRate(ResourceType.SKILLED), 0.0);
        assertEquals(0.5, config.getObjectiveWeights().getDelay(), 0.0);
        assertEquals(100, config.getGenerations());
    }

    @Test
    @DisplayName("malformed numbers and missing resources are reported")
    void badInput() {
        Properties properties = new Properties();
        properties.setProperty("optimizer.generations", "many");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.fromProperties(properties));
        assertTrue(e.getMessage().contains("optimizer.generations"));

        assertThrows(IOException.class, () -> SchedulerConfig.load("no-such-file.properties"));
    }
}
