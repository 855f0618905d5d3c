package com.netcracker.core.access.client.prompt;

/**
 * Interactive questions asked to the operator.
 */
public interface OperatorPrompt {

    boolean askYesNo(String message);

    String readLine(String message);
}
