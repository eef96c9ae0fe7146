package seakers.micscheduler.gatewayclasses;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import seakers.micscheduler.model.CriticalityScale;
import seakers.micscheduler.validation.DataValidationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingOperationsTest {

    private SchedulingOperations operations;

    @BeforeEach
    void setUp() {
        operations = new SchedulingOperations();
        operations.setProjectStart("2024-01-01");
        operations.setSeed(1L);
        operations.setPopulationSize(8);
        operations.setGenerations(5);
        operations.setBudgetMillis(0L);
    }

    @AfterEach
    void tearDown() {
        operations.shutdown();
    }

    private static Map<String, Object> row(List<Map<String, Object>> rows, int id) {
        for (Map<String, Object> row : rows) {
            if (Integer.valueOf(id).equals(row.get("id"))) {
                return row;
            }
        }
        fail("no row for task " + id);
        return null;
    }

    @Test
    @DisplayName("tasks added before initialisation are planned and returned as plain rows")
    void initialize() throws DataValidationException {
        operations.addTask(1, "Struct", 1, 1, 0, Arrays.asList(2, 0, 0, 0, 0, 0), 8, Collections.emptyList(), 0);
        operations.addTaskWithRpn(2, "Elec", 2, 1, 0, Arrays.asList(1, 0, 0, 0, 0, 0), 4, Collections.singletonList(1), 8, 7, 6);

        List<Map<String, Object>> rows = operations.initialize();

        assertEquals(2, rows.size());
        Map<String, Object> first = row(rows, 1);
        Map<String, Object> second = row(rows, 2);
        assertEquals("Struct", first.get("system"));
        assertEquals("SCHEDULED", first.get("status"));
        assertEquals(0, first.get("start"));
        assertTrue((Integer) second.get("start") >= (Integer) first.get("end"));
        // the missing criticality falls back to the project mean
        assertEquals(CriticalityScale.fromRpn(8, 7, 6), first.get("criticality"));
        assertEquals(Boolean.FALSE, first.get("urgent"));

        List<List<Double>> front = operations.getParetoFront();
        assertFalse(front.isEmpty());
        assertEquals(3, front.get(0).size());
        assertEquals(0, operations.getWindowOrigin());
    }

    @Test
    @DisplayName("emergencies and window moves go through to the controller")
    void liveOperations() throws DataValidationException {
        operations.addTask(1, "Facade", 1, 1, 0, Arrays.asList(1, 0, 0, 1, 0, 0), 6, Collections.emptyList(), 4);
        operations.initialize();

        List<Map<String, Object>> rows = operations.injectEmergency(5, "Plumb", 3, 3, 0, Arrays.asList(1, 0, 0, 0, 0, 0), 2, Collections.emptyList(), 10, -1);
        assertEquals(Boolean.TRUE, row(rows, 5).get("urgent"));
        assertEquals("SCHEDULED", row(rows, 5).get("status"));

        operations.advanceTo(2);
        assertEquals(2, operations.getWindowOrigin());
        assertEquals("IN_PROGRESS", row(operations.getSchedule(), 1).get("status"));

        rows = operations.updateCapacity("crane", 0, 3);
        assertEquals("IN_PROGRESS", row(rows, 1).get("status"));
        assertFalse(operations.getDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("operations before initialisation and unknown names are rejected")
    void misuse() {
        assertThrows(IllegalStateException.class, () -> operations.replan());
        assertThrows(IllegalArgumentException.class, () -> operations.setResourceLimit("bulldozer", 2));
        assertThrows(IllegalArgumentException.class,
                () -> operations.addTask(1, "Roofing", 0, 0, 0, Arrays.asList(1, 0, 0, 0, 0, 0), 2, Collections.emptyList(), 5));
    }
}
