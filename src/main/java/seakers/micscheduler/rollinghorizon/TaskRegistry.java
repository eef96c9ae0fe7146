package seakers.micscheduler.rollinghorizon;

import seakers.micscheduler.model.Task;
import seakers.micscheduler.model.TaskStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Live tasks of the controller keyed by id, plus the finish hours of archived (completed and dropped) tasks.
 * Not thread-safe; the controller serialises access.
 */
class TaskRegistry {

    private final Map<Integer, Task> tasks = new TreeMap<>();
    private final Map<Integer, Integer> archivedFinish = new TreeMap<>();

    void register(Task task) {
        if (contains(task.getId())) {
            throw new IllegalArgumentException("Task id " + task.getId() + " is already registered");
        }
        this.tasks.put(task.getId(), task);
    }

    boolean contains(int taskId) {
        return this.tasks.containsKey(taskId) || this.archivedFinish.containsKey(taskId);
    }

    Task get(int taskId) {
        Task task = this.tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task id " + taskId);
        }
        return task;
    }

    List<Task> all() {
        return new ArrayList<>(this.tasks.values());
    }

    List<Task> withStatus(TaskStatus... statuses) {
        Set<TaskStatus> wanted = new HashSet<>();
        Collections.addAll(wanted, statuses);
        List<Task> matching = new ArrayList<>();
        for (Task task : this.tasks.values()) {
            if (wanted.contains(task.getStatus())) {
                matching.add(task);
            }
        }
        return matching;
    }

    List<Task> schedulable() {
        return withStatus(TaskStatus.PENDING, TaskStatus.SPLIT_REMAINDER);
    }

    List<Task> frozen() {
        return withStatus(TaskStatus.SCHEDULED, TaskStatus.IN_PROGRESS);
    }

    /**
     * Finish hours of every task that is done, archived or not
     */
    Map<Integer, Integer> finishedAt() {
        Map<Integer, Integer> finish = new TreeMap<>(this.archivedFinish);
        for (Task task : withStatus(TaskStatus.COMPLETED)) {
            finish.put(task.getId(), task.getActualEnd());
        }
        return finish;
    }

    /**
     * Drops completed tasks that ended at or before {@code hour}, keeping only their finish hour
     *
     * @return ids archived
     */
    List<Integer> archiveCompleted(int hour) {
        List<Integer> archived = new ArrayList<>();
        for (Task task : withStatus(TaskStatus.COMPLETED)) {
            if (task.getActualEnd() <= hour) {
                this.archivedFinish.put(task.getId(), task.getActualEnd());
                this.tasks.remove(task.getId());
                archived.add(task.getId());
            }
        }
        return archived;
    }

    Map<Integer, Integer> getArchivedFinish() {
        return Collections.unmodifiableMap(this.archivedFinish);
    }

    Set<Integer> knownIds() {
        Set<Integer> ids = new HashSet<>(this.tasks.keySet());
        ids.addAll(this.archivedFinish.keySet());
        return ids;
    }

    List<Task> successorsOf(int taskId) {
        List<Task> successors = new ArrayList<>();
        for (Task task : this.tasks.values()) {
            if (task.getPredecessors().contains(taskId)) {
                successors.add(task);
            }
        }
        return successors;
    }

    int nextFreeId() {
        int max = 0;
        for (int id : knownIds()) {
            max = Math.max(max, id);
        }
        return max + 1;
    }
}
