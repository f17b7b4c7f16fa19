package com.example.mltranslation.exception;

/**
 * 翻譯任務重試後仍無法送出至 broker
 */
public class TaskPublishException extends RuntimeException {

    private final String taskId;

    public TaskPublishException(String taskId, int attempts, Throwable cause) {
        super(String.format("Failed to publish task %s after %d attempts", taskId, attempts), cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
