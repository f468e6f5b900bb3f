package com.canihazhouze.agent.exception;

public class QueueFullException extends AgentException {

    public QueueFullException(int capacity) {
        super("Execution queue is full (capacity " + capacity + "), try again later");
    }
}
