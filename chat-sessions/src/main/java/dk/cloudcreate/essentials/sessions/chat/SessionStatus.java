package dk.cloudcreate.essentials.sessions.chat;

public enum SessionStatus {
    ACTIVE,
    /**
     * Terminal. An archived session accepts no further commands
     */
    ARCHIVED
}
