package taskline.coordinator.worker;

import taskline.coordinator.broker.TaskMessage;

/**
 * The unit of work a worker runs for each delivered task.
 * A returned value becomes the task result; a thrown exception fails the task
 * with the exception message as its error.
 */
@FunctionalInterface
public interface TaskExecutor {

    String execute(TaskMessage message) throws Exception;
}
