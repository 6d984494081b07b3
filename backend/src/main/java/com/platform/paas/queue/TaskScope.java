package com.platform.paas.queue;

/**
 * Which tenants and apps a task covers. Null fields mean "all".
 */
public record TaskScope(String tenantId, String appId) {
    
    private static final TaskScope ALL = new TaskScope(null, null);
    
    public static TaskScope all() {
        return ALL;
    }
    
    public static TaskScope tenant(String tenantId) {
        return new TaskScope(tenantId, null);
    }
    
    public static TaskScope app(String tenantId, String appId) {
        return new TaskScope(tenantId, appId);
    }
    
    public boolean isAll() {
        return tenantId == null && appId == null;
    }
    
    public boolean includes(String tenant, String app) {
        return (tenantId == null || tenantId.equals(tenant))
            && (appId == null || appId.equals(app));
    }
    
    @Override
    public String toString() {
        if (isAll()) {
            return "*";
        }
        return (tenantId == null ? "*" : tenantId) + "/" + (appId == null ? "*" : appId);
    }
}
