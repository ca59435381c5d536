package dk.cloudcreate.essentials.sessions.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * {@link UnitOfWorkFactory} that manages the {@link UnitOfWork} and the underlying database transaction
 * directly on top of {@link Jdbi}.<br>
 * The active {@link UnitOfWork} is bound to the current thread until it's committed or rolled back.
 */
public class JdbiUnitOfWorkFactory implements UnitOfWorkFactory {
    private static final Logger log = LoggerFactory.getLogger(JdbiUnitOfWorkFactory.class);

    private final Jdbi                         jdbi;
    private final ThreadLocal<JdbiUnitOfWork> unitOfWorks = new ThreadLocal<>();

    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public UnitOfWork getRequiredUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public UnitOfWork getOrCreateNewUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            unitOfWork = new JdbiUnitOfWork(this);
            unitOfWork.start();
            unitOfWorks.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<UnitOfWork> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    private void removeUnitOfWork(JdbiUnitOfWork unitOfWork) {
        if (unitOfWorks.get() == unitOfWork) {
            unitOfWorks.remove();
        }
    }

    private static class JdbiUnitOfWork implements UnitOfWork {
        private final JdbiUnitOfWorkFactory             unitOfWorkFactory;
        private final List<UnitOfWorkLifecycleCallback> lifecycleCallbacks = new ArrayList<>();
        private       UnitOfWorkStatus                  status;
        private       Exception                         causeOfRollback;
        private       Handle                            handle;

        private JdbiUnitOfWork(JdbiUnitOfWorkFactory unitOfWorkFactory) {
            this.unitOfWorkFactory = unitOfWorkFactory;
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
                return;
            }
            if (status != UnitOfWorkStatus.Ready) {
                throw new UnitOfWorkException(msg("Cannot start an UnitOfWork with status {}", status));
            }
            handle = unitOfWorkFactory.jdbi.open();
            try {
                handle.begin();
            } catch (RuntimeException e) {
                handle.close();
                handle = null;
                throw new UnitOfWorkException("Failed to begin the UnitOfWork transaction", e);
            }
            status = UnitOfWorkStatus.Started;
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                log.debug("UnitOfWork was marked for rollback only, rolling back instead of committing");
                rollback(causeOfRollback);
                if (causeOfRollback instanceof RuntimeException) {
                    throw (RuntimeException) causeOfRollback;
                }
                throw new UnitOfWorkException("UnitOfWork was marked for rollback only", causeOfRollback);
            }
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(msg("Cannot commit an UnitOfWork with status {}", status));
            }
            for (var callback : lifecycleCallbacks) {
                try {
                    callback.beforeCommit(this);
                } catch (RuntimeException e) {
                    rollback(e);
                    throw e;
                }
            }
            try {
                handle.commit();
            } catch (RuntimeException e) {
                rollback(e);
                throw new UnitOfWorkException("Failed to commit the UnitOfWork", e);
            }
            close(UnitOfWorkStatus.Committed);
            for (var callback : lifecycleCallbacks) {
                try {
                    callback.afterCommit(this);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterCommit", callback.getClass().getName()), e);
                }
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status.isCompleted()) {
                log.debug("Ignoring rollback of an UnitOfWork with status {}", status);
                return;
            }
            causeOfRollback = cause;
            try {
                handle.rollback();
            } catch (RuntimeException e) {
                log.error("Failed to rollback the UnitOfWork", e);
            }
            close(UnitOfWorkStatus.RolledBack);
            for (var callback : lifecycleCallbacks) {
                try {
                    callback.afterRollback(this, cause);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterRollback", callback.getClass().getName()), e);
                }
            }
        }

        private void close(UnitOfWorkStatus newStatus) {
            try {
                handle.close();
            } finally {
                handle = null;
                status = newStatus;
                unitOfWorkFactory.removeUnitOfWork(this);
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Handle handle() {
            if (handle == null) {
                throw new UnitOfWorkException(msg("No active transaction. UnitOfWork status is {}", status));
            }
            return handle;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status.isCompleted()) {
                throw new UnitOfWorkException(msg("Cannot mark an UnitOfWork with status {} as rollback only", status));
            }
            status = UnitOfWorkStatus.MarkedForRollbackOnly;
            causeOfRollback = cause;
        }

        @Override
        public void registerLifecycleCallback(UnitOfWorkLifecycleCallback callback) {
            lifecycleCallbacks.add(requireNonNull(callback, "No callback provided"));
        }
    }
}
