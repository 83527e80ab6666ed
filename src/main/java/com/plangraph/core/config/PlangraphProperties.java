package com.plangraph.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "plangraph")
public class PlangraphProperties {

    private Schema schema = new Schema();
    private Defaults defaults = new Defaults();

    // -- Defaults accessors (delegate to nested) --
    public boolean isIncludeInProgress() { return defaults.includeInProgress; }
    public boolean isIncludeStatus() { return defaults.includeStatus; }
    public boolean isIncludeDescriptions() { return defaults.includeDescriptions; }

    public Schema getSchema() { return schema; }
    public void setSchema(Schema schema) { this.schema = schema; }
    public Defaults getDefaults() { return defaults; }
    public void setDefaults(Defaults defaults) { this.defaults = defaults; }

    public static class Schema {
        /** Classpath location of the plan XSD. */
        private String location = "schema/plan.xsd";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    /**
     * Option values the CLI starts from when no flag is given.
     */
    public static class Defaults {
        private boolean includeInProgress = false;
        private boolean includeStatus = true;
        private boolean includeDescriptions = true;

        public boolean isIncludeInProgress() { return includeInProgress; }
        public void setIncludeInProgress(boolean includeInProgress) { this.includeInProgress = includeInProgress; }
        public boolean isIncludeStatus() { return includeStatus; }
        public void setIncludeStatus(boolean includeStatus) { this.includeStatus = includeStatus; }
        public boolean isIncludeDescriptions() { return includeDescriptions; }
        public void setIncludeDescriptions(boolean includeDescriptions) { this.includeDescriptions = includeDescriptions; }
    }
}
