package dk.cloudcreate.essentials.sessions.common.transaction;

/**
 * Callback that can be registered with a {@link UnitOfWork}. When the {@link UnitOfWork} is committed
 * or rolled back the callback is notified.<br>
 * An exception thrown from {@link #beforeCommit(UnitOfWork)} rolls back the {@link UnitOfWork}, whereas exceptions
 * thrown from {@link #afterCommit(UnitOfWork)} and {@link #afterRollback(UnitOfWork, Exception)} are logged and ignored.
 */
public interface UnitOfWorkLifecycleCallback {
    default void beforeCommit(UnitOfWork unitOfWork) {
    }

    default void afterCommit(UnitOfWork unitOfWork) {
    }

    default void afterRollback(UnitOfWork unitOfWork, Exception causeOfTheRollback) {
    }
}
