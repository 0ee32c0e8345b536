package org.dandiarchive.archive.core.task;

record DefaultTaskContext(int taskId, String taskType, int attempt) implements TaskContext {

    static DefaultTaskContext of(TaskRecord record) {
        return new DefaultTaskContext(record.id(), record.type(), record.retryCount());
    }
}
