package com.taskledger.core.model;

import java.security.SecureRandom;

/**
 * Generates prefixed random identifiers ({@code wf_}, {@code task_}, {@code step_}, {@code cp_}).
 */
public final class Ids {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {
    }

    public static String workflowId() {
        return "wf_" + random(10);
    }

    public static String taskId() {
        return "task_" + random(8);
    }

    public static String stepId() {
        return "step_" + random(6);
    }

    public static String checkpointId() {
        return "cp_" + random(8);
    }

    private static String random(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
