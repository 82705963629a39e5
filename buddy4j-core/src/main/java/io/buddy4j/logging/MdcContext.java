package io.buddy4j.logging;

import io.buddy4j.core.dispatch.WorkItem;
import org.slf4j.MDC;

/**
 * MDC keys set around one dispatch so handler and store logs can be correlated.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String HANDLER = "handler";
    public static final String WORK_ITEM = "workItem";

    private MdcContext() {
    }

    public static void setDispatch(WorkItem item, String handler) {
        if (item.taskId() != null) {
            MDC.put(TASK_ID, item.taskId());
        }
        if (handler != null) {
            MDC.put(HANDLER, handler);
        }
        MDC.put(WORK_ITEM, Integer.toHexString(System.identityHashCode(item)));
    }

    public static void setPass(String passName) {
        MDC.put(HANDLER, "pass:" + passName);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(HANDLER);
        MDC.remove(WORK_ITEM);
    }
}
