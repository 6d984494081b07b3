package com.platform.paas.error;

/**
 * A workload or dead task named by a request does not exist.
 */
public class ResourceNotFoundException extends ControlPlaneException {
    
    private final String resourceType;
    private final String resourceId;
    
    private ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    /**
     * No desired state is recorded for the workload.
     */
    public static ResourceNotFoundException workload(String tenantId, String appId, String name) {
        return new ResourceNotFoundException(ErrorCode.WORKLOAD_NOT_FOUND, "Workload",
            String.join("/", tenantId, appId, name));
    }
    
    /**
     * The task is not in the dead-task list, either because it never died or because it
     * was already retried.
     */
    public static ResourceNotFoundException deadTask(String taskId) {
        return new ResourceNotFoundException(ErrorCode.TASK_NOT_FOUND, "Dead task", taskId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
