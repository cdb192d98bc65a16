package org.kpa.tap.service.extraction;

import org.kpa.tap.models.dto.SchemaProperty;
import org.kpa.tap.models.dto.StreamSchema;
import org.kpa.tap.models.enums.SchemaType;

public enum AuxiliaryStream {

    ROLES("roles", "/roles.list", "roles", StreamSchema.of(
            new SchemaProperty("id", SchemaType.STRING),
            new SchemaProperty("name", SchemaType.STRING))),

    USERS("users", "/users.list", "users", StreamSchema.of(
            new SchemaProperty("created", SchemaType.INTEGER),
            new SchemaProperty("registered_on", SchemaType.INTEGER),
            new SchemaProperty("supervisor_id", SchemaType.STRING),
            new SchemaProperty("mentor_id", SchemaType.STRING),
            new SchemaProperty("hse_id", SchemaType.STRING),
            new SchemaProperty("manager_id", SchemaType.STRING),
            new SchemaProperty("clients_id", SchemaType.STRING_ARRAY),
            new SchemaProperty("firstname", SchemaType.STRING),
            new SchemaProperty("lastname", SchemaType.STRING),
            new SchemaProperty("employeeNumber", SchemaType.STRING),
            new SchemaProperty("email", SchemaType.EMAIL),
            new SchemaProperty("username", SchemaType.STRING),
            new SchemaProperty("cellPhone", SchemaType.STRING),
            new SchemaProperty("hireDate", SchemaType.INTEGER),
            new SchemaProperty("sseDate", SchemaType.INTEGER),
            new SchemaProperty("terminationDate", SchemaType.INTEGER),
            new SchemaProperty("emergencyContact", SchemaType.STRING),
            new SchemaProperty("isDriver", SchemaType.BOOLEAN),
            new SchemaProperty("isRegulatedDriver", SchemaType.BOOLEAN),
            new SchemaProperty("role_id", SchemaType.STRING),
            new SchemaProperty("metavalues", SchemaType.OBJECT),
            new SchemaProperty("creator_id", SchemaType.STRING_OBJECT),
            new SchemaProperty("fieldOffice_id", SchemaType.STRING_ARRAY),
            new SchemaProperty("lineOfBusiness_id", SchemaType.STRING_ARRAY),
            new SchemaProperty("lastWebAccess", SchemaType.INTEGER),
            new SchemaProperty("lastMobileAccess", SchemaType.INTEGER),
            new SchemaProperty("id", SchemaType.STRING))),

    LINES_OF_BUSINESS("lines_of_business", "/linesofbusiness.list", "linesofbusiness", StreamSchema.of(
            new SchemaProperty("name", SchemaType.STRING),
            new SchemaProperty("code", SchemaType.STRING),
            new SchemaProperty("created", SchemaType.INTEGER),
            new SchemaProperty("id", SchemaType.STRING)));

    private final String streamName;
    private final String path;
    private final String recordsKey;
    private final StreamSchema schema;

    AuxiliaryStream(String streamName, String path, String recordsKey, StreamSchema schema) {
        this.streamName = streamName;
        this.path = path;
        this.recordsKey = recordsKey;
        this.schema = schema;
    }

    public String streamName() {
        return streamName;
    }

    public String path() {
        return path;
    }

    public String recordsKey() {
        return recordsKey;
    }

    public StreamSchema schema() {
        return schema;
    }
}
