package seakers.micscheduler.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input rejected before any clustering or optimization ran
 */
public class DataValidationException extends Exception {

    private final List<Integer> taskIds;
    private final List<String> problems;

    public DataValidationException(List<Integer> taskIds, List<String> problems) {
        super(buildMessage(problems));
        this.taskIds = Collections.unmodifiableList(new ArrayList<>(taskIds));
        this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
    }

    private static String buildMessage(List<String> problems) {
        if (problems.size() == 1) {
            return "Invalid task data: " + problems.get(0);
        }
        return "Invalid task data (" + problems.size() + " problems): " + String.join("; ", problems);
    }

    public List<Integer> getTaskIds() {
        return this.taskIds;
    }

    public List<String> getProblems() {
        return this.problems;
    }
}
