package seakers.micscheduler.problems;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import seakers.micscheduler.model.ProjectBounds;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.Task;
import seakers.micscheduler.validation.TaskValidator;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticProjectGeneratorTest {

    @Test
    @DisplayName("generated projects are valid, acyclic and within default capacity")
    void validProject() {
        List<Task> tasks = new SyntheticProjectGenerator().generate(40, 3L);

        assertEquals(40, tasks.size());
        assertDoesNotThrow(() -> new TaskValidator(ProjectBounds.unbounded()).validate(tasks, Collections.emptySet()));
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            assertEquals(i + 1, task.getId());
            for (int predecessor : task.getPredecessors()) {
                assertTrue(predecessor < task.getId());
            }
            for (ResourceType type : ResourceType.values()) {
                assertTrue(task.getDemand(type) <= type.getDefaultCapacity());
            }
            assertTrue(task.getDuration() >= 2 && task.getDuration() <= 16);
        }
    }

    @Test
    @DisplayName("the same seed gives the same project")
    void seeded() {
        List<Task> first = new SyntheticProjectGenerator().generate(15, 9L);
        List<Task> second = new SyntheticProjectGenerator().generate(15, 9L);
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).toString(), second.get(i).toString());
            assertEquals(first.get(i).getPredecessors(), second.get(i).getPredecessors());
        }
    }
}
