package dev.nishisan.monitor.execution;

/**
 * Number of retained executions per status.
 */
public record ExecutionCounts(long running, long completed, long error) {

    public static final ExecutionCounts EMPTY = new ExecutionCounts(0, 0, 0);

    public long total() {
        return running + completed + error;
    }
}
