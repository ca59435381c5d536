package dk.cloudcreate.essentials.sessions.chat;

/**
 * Who authored a message
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM
}
