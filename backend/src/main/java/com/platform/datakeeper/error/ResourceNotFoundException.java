package com.platform.datakeeper.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends DataKeeperException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(ErrorCode.RESOURCE_NOT_FOUND, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException policy(String policyId) {
        return new ResourceNotFoundException(ErrorCode.POLICY_NOT_FOUND, "Policy", policyId);
    }
    
    public static ResourceNotFoundException job(String jobId) {
        return new ResourceNotFoundException(ErrorCode.JOB_NOT_FOUND, "Job", jobId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
