package dk.cloudcreate.essentials.sessions.common.transaction;

/**
 * Thrown by {@link UnitOfWorkFactory#getRequiredUnitOfWork()} when no {@link UnitOfWork} is active
 */
public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
        super("No active UnitOfWork");
    }
}
