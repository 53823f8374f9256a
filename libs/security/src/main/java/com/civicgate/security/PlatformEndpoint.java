package com.civicgate.security;

import java.util.Optional;

/**
 * Platform API paths, relative to an environment's base URL. Environments may override
 * any of them by key.
 */
public enum PlatformEndpoint {

    AUTH("/user/oauth/token"),
    USER_SEARCH("/user/_search"),
    USER_UPDATE("/user/users/_updatenovalidate"),

    MDMS_SEARCH("/egov-mdms-service/v2/_search"),
    MDMS_CREATE("/egov-mdms-service/v2/_create"),
    MDMS_UPDATE("/egov-mdms-service/v2/_update"),

    BOUNDARY_SEARCH("/boundary-service/boundary/_search"),
    BOUNDARY_HIERARCHY_SEARCH("/boundary-service/boundary-hierarchy-definition/_search"),

    HRMS_EMPLOYEES_SEARCH("/egov-hrms/employees/_search"),

    LOCALIZATION_SEARCH("/localization/messages/v1/_search"),
    LOCALIZATION_UPSERT("/localization/messages/v1/_upsert"),

    PGR_CREATE("/pgr-services/v2/request/_create"),
    PGR_SEARCH("/pgr-services/v2/request/_search"),
    PGR_UPDATE("/pgr-services/v2/request/_update"),

    WORKFLOW_BUSINESS_SERVICE_SEARCH("/egov-workflow-v2/egov-wf/businessservice/_search"),
    WORKFLOW_PROCESS_SEARCH("/egov-workflow-v2/egov-wf/process/_search"),

    FILESTORE_UPLOAD("/filestore/v1/files"),
    FILESTORE_URL("/filestore/v1/files/url"),

    ACCESS_ROLES_SEARCH("/access/v1/roles/_search"),
    ACCESS_ACTIONS_SEARCH("/access/v1/actions/_search");

    private final String defaultPath;

    PlatformEndpoint(String defaultPath) {
        this.defaultPath = defaultPath;
    }

    public String defaultPath() {
        return defaultPath;
    }

    public static Optional<PlatformEndpoint> fromKey(String key) {
        for (PlatformEndpoint endpoint : values()) {
            if (endpoint.name().equals(key)) {
                return Optional.of(endpoint);
            }
        }
        return Optional.empty();
    }
}
