package fr.lapetina.apiruntime.infrastructure.state;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admits at most one runtime update at a time.
 *
 * Non-blocking: a caller that finds an update in progress is told so and
 * decides itself whether to skip or retry later.
 */
public final class UpdateCoordinator {

    private final AtomicBoolean inProgress = new AtomicBoolean(false);

    /**
     * @return true if the caller now owns the update and must call {@link #end()}
     */
    public boolean tryBegin() {
        return inProgress.compareAndSet(false, true);
    }

    public void end() {
        inProgress.set(false);
    }

    public boolean isUpdating() {
        return inProgress.get();
    }
}
