package io.buddy4j.maintenance;

/**
 * A periodic job over the task store. Passes are idempotent: running one twice in a row writes
 * nothing the second time.
 */
public interface MaintenancePass {

    String name();

    /**
     * Runs one pass.
     *
     * @return number of tasks written
     */
    int run();
}
