package seakers.micscheduler.validation;

import seakers.micscheduler.model.CriticalityScale;
import seakers.micscheduler.model.ProjectBounds;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rejects malformed task sets as a whole: every problem found is reported in a single {@link DataValidationException}
 */
public class TaskValidator {

    private final ProjectBounds bounds;

    public TaskValidator(ProjectBounds bounds) {
        this.bounds = bounds;
    }

    /**
     * @param tasks tasks to check
     * @param externalIds ids that predecessors may refer to without being part of {@code tasks} (archived completions)
     */
    public void validate(Collection<Task> tasks, Set<Integer> externalIds) throws DataValidationException {
        Set<Integer> offending = new LinkedHashSet<>();
        List<String> problems = new ArrayList<>();

        Map<Integer, Task> byId = new HashMap<>();
        for (Task task : tasks) {
            if (byId.put(task.getId(), task) != null) {
                offending.add(task.getId());
                problems.add("Duplicate task id " + task.getId());
            }
        }

        for (Task task : tasks) {
            int id = task.getId();
            if (task.getSystem() == null) {
                offending.add(id);
                problems.add("Task " + id + " has no system category");
            }
            int[] demand = task.getDemand();
            if (demand == null || demand.length != ResourceType.COUNT) {
                offending.add(id);
                problems.add("Task " + id + " needs a resource demand vector of length " + ResourceType.COUNT);
            } else {
                for (ResourceType type : ResourceType.values()) {
                    if (demand[type.ordinal()] < 0) {
                        offending.add(id);
                        problems.add("Task " + id + " has negative demand for " + type.getLabel());
                    }
                }
            }
            if (task.getDuration() <= 0) {
                offending.add(id);
                problems.add("Task " + id + " has non-positive duration " + task.getDuration());
            }
            if (task.getCriticality() < CriticalityScale.MIN || task.getCriticality() > CriticalityScale.MAX) {
                offending.add(id);
                problems.add("Task " + id + " has criticality " + task.getCriticality() + " outside [1,10]");
            }
            if (!this.bounds.contains(task.getX(), task.getY(), task.getZ())) {
                offending.add(id);
                problems.add("Task " + id + " lies outside the project bounds");
            }
            for (int predecessor : task.getPredecessors()) {
                if (predecessor == id) {
                    offending.add(id);
                    problems.add("Task " + id + " depends on itself");
                } else if (!byId.containsKey(predecessor) && !externalIds.contains(predecessor)) {
                    offending.add(id);
                    problems.add("Task " + id + " refers to unknown predecessor " + predecessor);
                }
            }
        }

        List<Integer> cycle = findCycle(byId);
        if (!cycle.isEmpty()) {
            offending.addAll(cycle);
            problems.add("Predecessor cycle among tasks " + cycle);
        }

        if (!problems.isEmpty()) {
            throw new DataValidationException(new ArrayList<>(offending), problems);
        }
    }

    /**
     * Depth-first walk along predecessor links with an explicit stack, so long chains cannot overflow the call stack
     *
     * @return the ids on one predecessor cycle, sorted, or an empty list if the precedence graph is a DAG
     */
    static List<Integer> findCycle(Map<Integer, Task> byId) {
        Set<Integer> visited = new HashSet<>();
        for (int start : new TreeSet<>(byId.keySet())) {
            if (visited.contains(start)) {
                continue;
            }
            // path holds the current chain; each entry's iterator yields the predecessors still to explore
            List<Integer> path = new ArrayList<>();
            Set<Integer> onPath = new HashSet<>();
            Deque<Iterator<Integer>> pending = new ArrayDeque<>();
            visited.add(start);
            onPath.add(start);
            path.add(start);
            pending.push(new TreeSet<>(byId.get(start).getPredecessors()).iterator());

            while (!pending.isEmpty()) {
                Iterator<Integer> predecessors = pending.peek();
                if (!predecessors.hasNext()) {
                    pending.pop();
                    onPath.remove(path.remove(path.size() - 1));
                    continue;
                }
                int next = predecessors.next();
                if (onPath.contains(next)) {
                    List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    Collections.sort(cycle);
                    return cycle;
                }
                if (visited.contains(next) || !byId.containsKey(next)) {
                    continue;
                }
                visited.add(next);
                onPath.add(next);
                path.add(next);
                pending.push(new TreeSet<>(byId.get(next).getPredecessors()).iterator());
            }
        }
        return Collections.emptyList();
    }
}
