package dk.cloudcreate.essentials.sessions.eventstore.persistence;

/**
 * The Postgresql column type used for the event payload and metadata columns.<br>
 * {@link #JSON} keeps the JSON text exactly as written, {@link #JSONB} normalizes it (key order and whitespace),
 * which means a {@link dk.cloudcreate.essentials.sessions.eventstore.eventstream.EventJSON} read back won't be
 * textually equal to the one written.
 */
public enum JSONColumnType {
    JSON,
    JSONB
}
