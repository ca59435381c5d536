package dk.cloudcreate.essentials.sessions.common.transaction;

import dk.cloudcreate.essentials.sessions.common.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * This interface creates and tracks the {@link UnitOfWork} associated with the current thread
 */
public interface UnitOfWorkFactory {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Get a required active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if the is no active {@link UnitOfWork}
     */
    UnitOfWork getRequiredUnitOfWork();

    /**
     * Get the current {@link UnitOfWork} or create a new {@link UnitOfWork}
     * if one is missing
     *
     * @return a {@link UnitOfWork}
     */
    UnitOfWork getOrCreateNewUnitOfWork();

    Optional<UnitOfWork> getCurrentUnitOfWork();

    /**
     * Run the consumer inside a {@link UnitOfWork}. An existing {@link UnitOfWork} is joined, otherwise a new one
     * is created and committed (or rolled back if the consumer fails).<br>
     * {@link RuntimeException}'s are rethrown unchanged, checked exceptions are wrapped in a {@link UnitOfWorkException}
     *
     * @param unitOfWorkConsumer the consumer
     */
    default void usingUnitOfWork(CheckedConsumer<UnitOfWork> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    /**
     * Run the function inside a {@link UnitOfWork} and return its result. An existing {@link UnitOfWork} is joined, otherwise a new one
     * is created and committed (or rolled back if the function fails).<br>
     * {@link RuntimeException}'s are rethrown unchanged, checked exceptions are wrapped in a {@link UnitOfWorkException}
     *
     * @param unitOfWorkFunction the function
     * @param <R>                the result type
     * @return the result of the function
     */
    default <R> R withUnitOfWork(CheckedFunction<UnitOfWork, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork = existingUnitOfWork.orElseGet(() -> {
            unitOfWorkLog.trace("Creating a new UnitOfWork for this withUnitOfWork(CheckedFunction) method call as there wasn't an existing UnitOfWork");
            return getOrCreateNewUnitOfWork();
        });
        existingUnitOfWork.ifPresent(uow -> unitOfWorkLog.trace("NestedUnitOfWork: Reusing existing UnitOfWork for this withUnitOfWork(CheckedFunction) method call"));
        R result;
        try {
            result = unitOfWorkFunction.apply(unitOfWork);
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.trace("Rolling back the UnitOfWork created by this withUnitOfWork(CheckedFunction) method call");
                unitOfWork.rollback(e);
            } else {
                unitOfWorkLog.trace("NestedUnitOfWork: Marking UnitOfWork as rollback only as it wasn't created by this withUnitOfWork(CheckedFunction) method call");
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }
        if (existingUnitOfWork.isEmpty()) {
            unitOfWorkLog.trace("Committing the UnitOfWork created by this withUnitOfWork(CheckedFunction) method call");
            unitOfWork.commit();
        }
        return result;
    }
}
