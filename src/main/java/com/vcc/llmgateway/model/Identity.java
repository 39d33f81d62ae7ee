package com.vcc.llmgateway.model;

/**
 * Validated caller identity, passed down the admission pipeline.
 * Carries no budget snapshot; budget is only read and mutated through the store.
 */
public class Identity {

    private final String token;
    private final String tenantId;
    private final String userId;
    private final String group;

    public Identity(String token, Credential credential) {
        this.token = token;
        this.tenantId = credential.tenantId();
        this.userId = credential.userId();
        this.group = credential.group();
    }

    public String getToken() {
        return token;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getUserId() {
        return userId;
    }

    public String getGroup() {
        return group;
    }

    @Override
    public String toString() {
        return "Identity{" +
                "tenantId='" + tenantId + '\'' +
                ", userId='" + userId + '\'' +
                ", group='" + group + '\'' +
                '}';
    }
}
