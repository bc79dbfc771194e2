package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Type and constraint attributes of a schema node. Every field is optional.
 * The setters fail once the owning {@link ParseResult} has been built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "range", "length", "pattern", "default", "units", "status"})
public class NodeProperties {
    private String type;
    private String range;
    private String length;
    private String pattern;
    private String defaultValue;
    private String units;
    private String status;
    private boolean frozen;

    public String getType() {
        return type;
    }

    public void setType(String type) {
        checkMutable();
        this.type = type;
    }

    public String getRange() {
        return range;
    }

    public void setRange(String range) {
        checkMutable();
        this.range = range;
    }

    public String getLength() {
        return length;
    }

    public void setLength(String length) {
        checkMutable();
        this.length = length;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        checkMutable();
        this.pattern = pattern;
    }

    @JsonProperty("default")
    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        checkMutable();
        this.defaultValue = defaultValue;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        checkMutable();
        this.units = units;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        checkMutable();
        this.status = status;
    }

    void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Node properties are read-only once the parse result is built");
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return type == null && range == null && length == null && pattern == null
            && defaultValue == null && units == null && status == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodeProperties)) {
            return false;
        }
        NodeProperties that = (NodeProperties) o;
        return Objects.equals(type, that.type) && Objects.equals(range, that.range)
            && Objects.equals(length, that.length) && Objects.equals(pattern, that.pattern)
            && Objects.equals(defaultValue, that.defaultValue) && Objects.equals(units, that.units)
            && Objects.equals(status, that.status);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, range, length, pattern, defaultValue, units, status);
    }

    @Override
    public String toString() {
        return "NodeProperties{type='" + type + "', range='" + range + "', length='" + length +
               "', pattern='" + pattern + "', default='" + defaultValue + "', units='" + units +
               "', status='" + status + "'}";
    }
}
